package info.isaksson.erland.modelimport.apply;

import info.isaksson.erland.modelimport.domain.Element;
import info.isaksson.erland.modelimport.domain.ExternalIdRef;
import info.isaksson.erland.modelimport.domain.Folder;
import info.isaksson.erland.modelimport.domain.FolderKind;
import info.isaksson.erland.modelimport.domain.LayoutPoint;
import info.isaksson.erland.modelimport.domain.Model;
import info.isaksson.erland.modelimport.domain.ModelKind;
import info.isaksson.erland.modelimport.domain.ModelMetadata;
import info.isaksson.erland.modelimport.domain.Relationship;
import info.isaksson.erland.modelimport.domain.TaggedValue;
import info.isaksson.erland.modelimport.domain.UnknownType;
import info.isaksson.erland.modelimport.domain.View;
import info.isaksson.erland.modelimport.domain.ViewNodeLayout;
import info.isaksson.erland.modelimport.domain.ViewObject;
import info.isaksson.erland.modelimport.domain.ViewObjectType;
import info.isaksson.erland.modelimport.domain.ViewRelationshipLayout;
import info.isaksson.erland.modelimport.ir.IrBounds;
import info.isaksson.erland.modelimport.ir.IrElement;
import info.isaksson.erland.modelimport.ir.IrExternalId;
import info.isaksson.erland.modelimport.ir.IrFolder;
import info.isaksson.erland.modelimport.ir.IrMaps;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.ir.IrModel;
import info.isaksson.erland.modelimport.ir.IrPoint;
import info.isaksson.erland.modelimport.ir.IrRelationship;
import info.isaksson.erland.modelimport.ir.IrTaggedValue;
import info.isaksson.erland.modelimport.ir.IrView;
import info.isaksson.erland.modelimport.ir.IrViewConnection;
import info.isaksson.erland.modelimport.ir.IrViewNode;
import info.isaksson.erland.modelimport.report.ImportReport;
import info.isaksson.erland.modelimport.sink.ModelAllocationException;
import info.isaksson.erland.modelimport.sink.ModelSink;
import info.isaksson.erland.modelimport.types.ArchimatePalette;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Writes a normalized IR model into a {@link ModelSink} as a new model.
 *
 * <p>Every IR id is remapped to a fresh internal id; the tables are returned in {@link ApplyResult}.
 * The original IR id stays recoverable through an external id {@code {sourceSystem, irId}} on every
 * created folder, element, relationship and view.</p>
 *
 * <p>Failures are per item: a folder, element, relationship, view, node or connection that cannot be
 * created is skipped with an {@value #APPLY_CODE} warning and the run continues. Only failing to allocate
 * the model itself is fatal.</p>
 */
public final class ImportApplier {

    private static final Logger log = LoggerFactory.getLogger(ImportApplier.class);

    public static final String APPLY_CODE = "apply-import";

    private final ModelSink sink;

    public ImportApplier(ModelSink sink) {
        if (sink == null) throw new IllegalArgumentException("sink must not be null");
        this.sink = sink;
    }

    /**
     * @param report collects warnings; null starts a new report
     * @throws ModelAllocationException when the sink cannot create the model
     */
    public ApplyResult apply(IrModel ir, ApplyOptions options, ImportReport report) {
        if (ir == null) throw new IllegalArgumentException("ir must not be null");
        ApplyOptions o = options == null ? new ApplyOptions() : options;
        String sourceSystem = sourceSystem(ir, o);
        ImportReport r = report == null ? new ImportReport(sourceSystem) : report;

        Run run = new Run(ir, o, sourceSystem, r);
        run.allocate();
        run.applyFolders();
        run.applyElements();
        run.applyRelationships();
        run.applyViews();
        run.finish();

        log.debug("Applied {} into {}: {}", sourceSystem, run.modelId, run.mappings);
        return new ApplyResult(run.modelId, run.mappings, r);
    }

    static String sourceSystem(IrModel ir, ApplyOptions o) {
        if (o.sourceSystem != null && !o.sourceSystem.isBlank()) return o.sourceSystem.trim();
        String fromMeta = IrMaps.string(ir.meta, IrMeta.SOURCE_SYSTEM);
        if (fromMeta != null && !fromMeta.isBlank()) return fromMeta.trim();
        String format = ir.format();
        return format == null || format.isBlank() ? "import" : format;
    }

    /**
     * BPMN wins when the format, source system or any element type says so; then any known ArchiMate type
     * makes it ArchiMate (EA exports ArchiMate inside UML XMI); then UML; ArchiMate otherwise.
     */
    public static ModelKind inferModelKind(IrModel ir, String sourceSystem) {
        String fmt = ir.format() != null ? ir.format() : IrMaps.string(ir.meta, IrMeta.SOURCE_SYSTEM);
        fmt = fmt == null ? "" : fmt.toLowerCase(Locale.ROOT);
        String src = sourceSystem == null ? "" : sourceSystem.toLowerCase(Locale.ROOT);

        if (fmt.contains("bpmn") || src.contains("bpmn")) return ModelKind.BPMN;
        for (IrElement e : ir.elements) {
            if (e.type != null && e.type.startsWith(TypeResolver.BPMN_PREFIX)) return ModelKind.BPMN;
        }
        for (IrElement e : ir.elements) {
            if (ArchimatePalette.isElementType(e.type)) return ModelKind.ARCHIMATE;
        }
        for (IrRelationship rel : ir.relationships) {
            if (ArchimatePalette.isRelationshipType(rel.type)) return ModelKind.ARCHIMATE;
        }
        if (fmt.contains("uml") || src.contains("uml")) return ModelKind.UML;
        for (IrElement e : ir.elements) {
            if (e.type != null && e.type.startsWith(TypeResolver.UML_PREFIX)) return ModelKind.UML;
        }
        return ModelKind.ARCHIMATE;
    }

    /** State of one apply run. */
    private final class Run {
        final IrModel ir;
        final ApplyOptions options;
        final String sourceSystem;
        final ImportReport report;
        final IdAllocator ids;
        final IdMappings mappings = new IdMappings();

        final Map<String, String> plannedRelationships = new HashMap<>();
        final Map<String, ResolvedType> relationshipTypes = new HashMap<>();
        final Map<String, String> elementTypesByInternalId = new HashMap<>();

        ModelKind kind;
        String modelId;
        String rootFolderId;

        Run(IrModel ir, ApplyOptions options, String sourceSystem, ImportReport report) {
            this.ir = ir;
            this.options = options;
            this.sourceSystem = sourceSystem;
            this.report = report;
            this.ids = options.deterministicIdSeed != null ? IdAllocator.hashed(options.deterministicIdSeed) : IdAllocator.random();
        }

        void allocate() {
            kind = inferModelKind(ir, sourceSystem);
            ModelMetadata metadata = options.metadata;
            if (metadata == null) {
                String name = IrMaps.string(ir.meta, IrMeta.MODEL_NAME);
                metadata = ModelMetadata.named(name == null || name.isBlank() ? "Imported model" : name);
            }
            try {
                modelId = sink.allocateModel(kind, metadata);
                rootFolderId = sink.rootFolderId(modelId);
            } catch (ModelAllocationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ModelAllocationException("Could not allocate a model: " + e.getMessage(), e);
            }
            if (modelId == null || rootFolderId == null) {
                throw new ModelAllocationException("Sink returned no model id or root folder");
            }
        }

        // Folders

        void applyFolders() {
            Map<String, IrFolder> byId = new LinkedHashMap<>();
            for (IrFolder f : ir.folders) {
                if (f.id != null && !f.id.isBlank()) byId.putIfAbsent(f.id, f);
            }
            for (String id : byId.keySet()) {
                ensureFolder(id, byId, new HashSet<>());
            }
        }

        /** Internal id of the IR folder, creating it and its ancestors first. Null when creation failed. */
        private String ensureFolder(String irId, Map<String, IrFolder> byId, Set<String> visiting) {
            String existing = mappings.folders.get(irId);
            if (existing != null) return existing;

            IrFolder f = byId.get(irId);
            String parentInternal = rootFolderId;
            String name;
            if (f == null) {
                name = "Imported folder (" + irId + ")";
                warn("Folder \"" + irId + "\" is referenced but not defined (created placeholder at root)", "folderId", irId);
            } else {
                name = f.name == null || f.name.isBlank() ? "Folder" : f.name;
                if (f.parentId != null && !f.parentId.isBlank()) {
                    if (!visiting.add(irId) || visiting.contains(f.parentId)) {
                        warn("Folder \"" + name + "\" is part of a parent cycle (placed at root)", "folderId", irId);
                    } else {
                        String p = ensureFolder(f.parentId, byId, visiting);
                        if (p != null) parentInternal = p;
                    }
                }
            }

            String internalId = ids.next("folder", irId);
            Folder folder = new Folder(internalId, FolderKind.CUSTOM, name, parentInternal,
                    f == null ? null : f.documentation,
                    toExternalIds(f == null ? List.of() : f.externalIds, irId),
                    toTaggedValues(f == null ? List.of() : f.taggedValues));
            try {
                sink.addFolder(modelId, folder);
                mappings.folders.put(irId, internalId);
                return internalId;
            } catch (RuntimeException e) {
                warn("Failed to create folder \"" + name + "\": " + e.getMessage(), "folderId", irId);
                return null;
            }
        }

        // Elements

        void applyElements() {
            List<IrElement> planned = new ArrayList<>();
            Map<String, ResolvedType> types = new HashMap<>();
            for (IrElement e : ir.elements) {
                if (e.id == null || e.id.isBlank() || mappings.elements.containsKey(e.id)) continue;
                ResolvedType t = TypeResolver.resolveElementType(e.type, e.meta);
                if (t.isUnknown() && options.unknownTypePolicy == UnknownTypePolicy.SKIP) {
                    warn("Skipped element \"" + ElementAttrRewriter.label(e.id, e.name) + "\" of unknown type \""
                            + t.sourceToken + "\"", "elementId", e.id);
                    continue;
                }
                types.put(e.id, t);
                mappings.elements.put(e.id, ids.next("element", e.id));
                planned.add(e);
            }
            planRelationships();

            ElementAttrRewriter attrs = new ElementAttrRewriter(mappings.elements, plannedRelationships, report);
            List<String> failed = new ArrayList<>();
            for (IrElement e : planned) {
                String internalId = mappings.elements.get(e.id);
                ResolvedType t = types.get(e.id);
                try {
                    sink.addElement(modelId, toElement(e, internalId, t, attrs));
                    elementTypesByInternalId.put(internalId, t.type);
                } catch (RuntimeException ex) {
                    warn("Failed to create element \"" + ElementAttrRewriter.label(e.id, e.name) + "\": " + ex.getMessage(),
                            "elementId", e.id);
                    failed.add(e.id);
                }
            }
            for (String id : failed) mappings.elements.remove(id);
        }

        private Element toElement(IrElement e, String internalId, ResolvedType t, ElementAttrRewriter attrs) {
            String name = e.name == null || e.name.isBlank() ? "(unnamed)" : e.name;
            Map<String, Object> a = e.attrs;
            if (t.taxonomy == ResolvedType.Taxonomy.BPMN) a = attrs.rewriteBpmn(e.id, name, a);
            else if (t.taxonomy == ResolvedType.Taxonomy.UML) a = attrs.rewriteUml(e.id, name, a);

            return new Element(internalId, elementKind(t), t.type, t.layer, name, e.documentation,
                    folderFor(e.folderId, "Element \"" + name + "\""),
                    mapParentElementId(e.id, name, e.parentElementId),
                    t.isUnknown() ? new UnknownType(sourceSystem, t.sourceToken) : null,
                    toExternalIds(e.externalIds, e.id), toTaggedValues(e.taggedValues), a);
        }

        private String mapParentElementId(String ownerId, String ownerName, String parentRef) {
            if (parentRef == null) return null;
            String mapped = mappings.elements.get(parentRef);
            if (mapped == null) {
                warn("Element \"" + ownerName + "\" references missing parentElementId \"" + parentRef + "\" (cleared)",
                        "elementId", ownerId);
            }
            return mapped;
        }

        // Relationships

        /** Allocates ids up front so element attrs can point at relationships created later. */
        private void planRelationships() {
            for (IrRelationship rel : ir.relationships) {
                if (rel.id == null || rel.id.isBlank() || plannedRelationships.containsKey(rel.id)) continue;
                ResolvedType t = TypeResolver.resolveRelationshipType(rel.type, rel.meta);
                relationshipTypes.put(rel.id, t);
                if (t.isUnknown() && options.unknownTypePolicy == UnknownTypePolicy.SKIP) continue;
                if (!mappings.elements.containsKey(rel.sourceId) || !mappings.elements.containsKey(rel.targetId)) continue;
                plannedRelationships.put(rel.id, ids.next("relationship", rel.id));
            }
        }

        void applyRelationships() {
            ElementAttrRewriter attrs = new ElementAttrRewriter(mappings.elements, plannedRelationships, report);
            Set<String> seen = new HashSet<>();
            for (IrRelationship rel : ir.relationships) {
                if (rel.id == null || rel.id.isBlank() || !seen.add(rel.id)) continue;
                String label = ElementAttrRewriter.label(rel.id, rel.name);
                ResolvedType t = relationshipTypes.get(rel.id);
                if (t.isUnknown() && options.unknownTypePolicy == UnknownTypePolicy.SKIP) {
                    warn("Skipped relationship \"" + label + "\" of unknown type \"" + t.sourceToken + "\"", "relationshipId", rel.id);
                    continue;
                }
                String src = mappings.elements.get(rel.sourceId);
                String tgt = mappings.elements.get(rel.targetId);
                if (src == null || tgt == null) {
                    warn("Skipped relationship \"" + label + "\": missing " + (src == null ? "source \"" + rel.sourceId : "target \"" + rel.targetId) + "\"",
                            "relationshipId", rel.id);
                    continue;
                }
                String internalId = plannedRelationships.get(rel.id);
                if (internalId == null) internalId = ids.next("relationship", rel.id);

                Relationship out = new Relationship(internalId, elementKind(t), t.type, src, tgt, rel.name, rel.documentation,
                        t.isUnknown() ? new UnknownType(sourceSystem, t.sourceToken) : null,
                        toExternalIds(rel.externalIds, rel.id), toTaggedValues(rel.taggedValues),
                        attrs.rewriteRelationship(rel.id, rel.name, rel.attrs));
                try {
                    sink.addRelationship(modelId, out);
                    mappings.relationships.put(rel.id, internalId);
                } catch (RuntimeException ex) {
                    warn("Failed to create relationship \"" + label + "\": " + ex.getMessage(), "relationshipId", rel.id);
                }
            }
        }

        // Views

        void applyViews() {
            for (IrView v : ir.views) {
                if (v.id == null || v.id.isBlank() || mappings.views.containsKey(v.id)) continue;
                String name = v.name == null || v.name.isBlank() ? "View" : v.name;
                String internalId = ids.next("view", v.id);

                String ownerElementId = null;
                String owner = IrMaps.string(v.meta, IrMeta.OWNING_ELEMENT_ID);
                if (owner != null && !owner.isBlank()) ownerElementId = mappings.elements.get(owner.trim());

                View view = new View(internalId, kind, name, Viewpoints.resolve(v.viewpoint), v.documentation,
                        folderFor(v.folderId, "View \"" + name + "\""), ownerElementId,
                        toExternalIds(v.externalIds, v.id), toTaggedValues(v.taggedValues));
                try {
                    sink.addView(modelId, view);
                    mappings.views.put(v.id, internalId);
                } catch (RuntimeException e) {
                    warn("Failed to add view \"" + name + "\": " + e.getMessage(), "viewId", v.id);
                    continue;
                }

                List<ViewNodeLayout> added = new ArrayList<>();
                Map<String, ViewObjectType> objectTypes = new HashMap<>();
                for (IrViewNode n : v.nodes) {
                    if (n.id == null || n.id.isBlank()) continue;
                    if (n.elementId != null) {
                        addElementNode(v, name, internalId, n, added);
                    } else {
                        addObjectNode(v, name, internalId, n, added, objectTypes);
                    }
                }

                applyConnections(v, name, internalId);

                if (!added.isEmpty()) {
                    try {
                        sink.updateViewNodes(modelId, internalId, ViewZOrder.normalize(added, elementTypesByInternalId, objectTypes));
                    } catch (RuntimeException e) {
                        warn("Failed to normalize z-order in view \"" + name + "\": " + e.getMessage(), "viewId", v.id);
                    }
                }
            }
        }

        private void addElementNode(IrView v, String viewName, String viewId, IrViewNode n, List<ViewNodeLayout> added) {
            String element = mappings.elements.get(n.elementId);
            if (element == null) {
                warn("View \"" + viewName + "\" references missing element \"" + n.elementId + "\" (skipped node)",
                        "viewId", v.id, "nodeId", n.id);
                return;
            }
            ViewNodeLayout layout = layout(element, null, n);
            try {
                sink.addElementToView(modelId, viewId, layout);
                mappings.putViewNode(v.id, n.id, new ViewNodeRef(ViewNodeRef.Kind.ELEMENT, element));
                added.add(layout);
            } catch (RuntimeException e) {
                warn("Failed to add element node to view \"" + viewName + "\": " + e.getMessage(), "viewId", v.id, "nodeId", n.id);
            }
        }

        private void addObjectNode(IrView v, String viewName, String viewId, IrViewNode n,
                                   List<ViewNodeLayout> added, Map<String, ViewObjectType> objectTypes) {
            String label = n.label == null || n.label.isBlank() ? null : n.label.trim();
            ViewObjectType type = objectType(n, label);
            ViewObject obj = new ViewObject(ids.next("obj", v.id + "/" + n.id), type, label);
            ViewNodeLayout layout = layout(null, obj.id, n);
            try {
                sink.addViewObject(modelId, viewId, obj, layout);
                mappings.putViewNode(v.id, n.id, new ViewNodeRef(ViewNodeRef.Kind.OBJECT, obj.id));
                objectTypes.put(obj.id, type);
                added.add(layout);
            } catch (RuntimeException e) {
                warn("Failed to add view object node to view \"" + viewName + "\": " + e.getMessage(), "viewId", v.id, "nodeId", n.id);
            }
        }

        private void applyConnections(IrView v, String viewName, String viewId) {
            List<ViewRelationshipLayout> routing = new ArrayList<>();
            Set<String> routed = new HashSet<>();
            for (IrViewConnection c : v.connections) {
                if (c.id == null || c.relationshipId == null) continue;
                String rel = mappings.relationships.get(c.relationshipId);
                if (rel == null) {
                    warn("View \"" + viewName + "\" references missing relationship \"" + c.relationshipId + "\" (skipped connection)",
                            "viewId", v.id, "connectionId", c.id);
                    continue;
                }
                if (!routed.add(rel)) continue;
                List<LayoutPoint> points = new ArrayList<>(c.points.size());
                for (IrPoint p : c.points) points.add(new LayoutPoint(p.x, p.y));
                routing.add(new ViewRelationshipLayout(rel, points, zIndex(c.meta)));
            }
            if (routing.isEmpty()) return;
            try {
                sink.setViewRelationships(modelId, viewId, routing);
            } catch (RuntimeException e) {
                warn("Failed to apply relationship routing in view \"" + viewName + "\": " + e.getMessage(), "viewId", v.id);
            }
        }

        // Finalize

        void finish() {
            try {
                Model model = sink.snapshot(modelId);
                Map<String, Integer> elements = new TreeMap<>();
                Map<String, Integer> relationships = new TreeMap<>();
                for (Element e : model.elements.values()) {
                    if (e.isUnknown()) elements.merge(e.unknownType.key(), 1, Integer::sum);
                }
                for (Relationship rel : model.relationships.values()) {
                    if (rel.isUnknown()) relationships.merge(rel.unknownType.key(), 1, Integer::sum);
                }
                report.mergeUnknownTypeCounts(elements, relationships);
            } catch (RuntimeException e) {
                warn("Failed to summarize unknown types: " + e.getMessage(), "modelId", modelId);
            }
        }

        // Helpers

        private String folderFor(String irFolderId, String what) {
            if (irFolderId == null || irFolderId.isBlank()) return rootFolderId;
            String mapped = mappings.folders.get(irFolderId);
            if (mapped != null) return mapped;
            warn(what + " references missing folder \"" + irFolderId + "\" (placed at root)", "folderId", irFolderId);
            return rootFolderId;
        }

        private ModelKind elementKind(ResolvedType t) {
            switch (t.taxonomy) {
                case BPMN: return ModelKind.BPMN;
                case UML: return ModelKind.UML;
                default: return ModelKind.ARCHIMATE;
            }
        }

        private List<ExternalIdRef> toExternalIds(List<IrExternalId> irIds, String originalIrId) {
            List<ExternalIdRef> out = new ArrayList<>();
            for (IrExternalId ref : irIds) {
                if (ref.id == null || ref.id.isBlank()) continue;
                String system = ref.system == null || ref.system.isBlank() ? sourceSystem : ref.system.trim();
                ExternalIdRef x = new ExternalIdRef(system, ref.id);
                if (!out.contains(x)) out.add(x);
            }
            ExternalIdRef original = new ExternalIdRef(sourceSystem, originalIrId);
            if (!out.contains(original)) out.add(original);
            return out;
        }

        private List<TaggedValue> toTaggedValues(List<IrTaggedValue> tvs) {
            List<TaggedValue> out = new ArrayList<>();
            for (IrTaggedValue tv : tvs) {
                String key = tv.key == null ? "" : tv.key.trim();
                if (key.isEmpty()) continue;
                out.add(new TaggedValue(ids.next("tv", key), sourceSystem, key, tv.value == null ? "" : tv.value));
            }
            return out;
        }

        private void warn(String message, String k1, String v1) {
            report.warn(APPLY_CODE, message, k1, v1);
        }

        private void warn(String message, String k1, String v1, String k2, String v2) {
            report.warn(APPLY_CODE, message, k1, v1, k2, v2);
        }
    }

    private static ViewNodeLayout layout(String elementId, String objectId, IrViewNode n) {
        IrBounds b = n.bounds;
        if (b == null) return new ViewNodeLayout(elementId, objectId, null, null, null, null, zIndex(n.meta));
        return new ViewNodeLayout(elementId, objectId, b.x, b.y, b.width, b.height, zIndex(n.meta));
    }

    /** {@code meta.objectType} wins; otherwise derived from the node kind, or from whether there is a label. */
    static ViewObjectType objectType(IrViewNode n, String label) {
        String override = IrMaps.string(n.meta, IrMeta.OBJECT_TYPE);
        if (override != null) {
            switch (override.trim().toLowerCase(Locale.ROOT)) {
                case "label": return ViewObjectType.LABEL;
                case "note": return ViewObjectType.NOTE;
                case "groupbox":
                case "group": return ViewObjectType.GROUP_BOX;
                default: break;
            }
        }
        if (n.kind == null) return label != null ? ViewObjectType.LABEL : ViewObjectType.NOTE;
        switch (n.kind) {
            case GROUP: return ViewObjectType.GROUP_BOX;
            case NOTE: return ViewObjectType.NOTE;
            case LABEL:
            case SHAPE:
            case IMAGE: return ViewObjectType.LABEL;
            default: return label != null ? ViewObjectType.LABEL : ViewObjectType.NOTE;
        }
    }

    private static Integer zIndex(Map<String, Object> meta) {
        Object z = meta == null ? null : meta.get("zIndex");
        return z instanceof Number ? ((Number) z).intValue() : null;
    }
}
