package info.isaksson.erland.modelimport.normalize;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Format-agnostic repair pass run after the format-specific normalizer.
 *
 * <p>The result is structurally safe to apply: ids are unique and non-empty per collection, names are
 * non-empty, and every id referenced by a child entity resolves within the model or has been cleared.
 * Each repair records one warning. The pass makes no semantic decisions about types; an empty type
 * simply becomes {@code "Unknown"}.</p>
 *
 * <p>Running it on its own output returns an equal model and records nothing.</p>
 */
public final class ImportIrNormalizer {

    public static final String UNKNOWN_TYPE = "Unknown";

    private static final Logger log = LoggerFactory.getLogger(ImportIrNormalizer.class);

    private final ImportReport report;
    private final NormalizeOptions options;
    private final String prefix;

    private ImportIrNormalizer(ImportReport report, NormalizeOptions options) {
        this.report = report;
        this.options = options;
        this.prefix = (options.source == null || options.source.isBlank() ? "" : options.source + ": ") + "Normalize: ";
    }

    public static IrModel normalize(IrModel model, ImportReport report, NormalizeOptions options) {
        if (model == null) throw new IllegalArgumentException("model must not be null");
        return new ImportIrNormalizer(report, options == null ? new NormalizeOptions() : options).run(model);
    }

    private IrModel run(IrModel in) {
        // Folders
        List<IrFolder> folders = dedupeById(in.folders, f -> f.id, "folder");
        Set<String> folderIds = ids(folders, f -> f.id);
        Map<String, String> folderParents = new LinkedHashMap<>();
        for (IrFolder f : folders) {
            String id = f.id.trim();
            String parentId = ImportText.trimToNull(f.parentId);
            if (parentId != null && (!folderIds.contains(parentId) || parentId.equals(id))) {
                warn("Folder \"" + id + "\" had invalid parentId \"" + parentId + "\"; moved to root.");
                parentId = null;
            }
            folderParents.put(id, parentId);
        }
        for (String id : breakCycles(folderParents)) {
            warn("Folder \"" + id + "\" had cyclic parentId; moved to root.");
        }
        List<IrFolder> outFolders = new ArrayList<>(folders.size());
        for (IrFolder f : folders) {
            String id = f.id.trim();
            outFolders.add(new IrFolder(id, ensureName("folder", id, f.name, "Unnamed folder"),
                    folderParents.get(id), ImportText.cleanDocumentation(f.documentation),
                    taggedValues(f.taggedValues), externalIds(f.externalIds), f.meta));
        }

        // Elements
        List<IrElement> elements = dedupeById(in.elements, e -> e.id, "element");
        Set<String> elementIds = ids(elements, e -> e.id);
        Map<String, String> elementParents = new LinkedHashMap<>();
        for (IrElement e : elements) {
            String id = e.id.trim();
            String parentId = ImportText.trimToNull(e.parentElementId);
            if (parentId != null && (!elementIds.contains(parentId) || parentId.equals(id))) {
                warn("Element \"" + id + "\" had invalid parentElementId \"" + parentId + "\"; cleared.");
                parentId = null;
            }
            elementParents.put(id, parentId);
        }
        for (String id : breakCycles(elementParents)) {
            warn("Element \"" + id + "\" had cyclic parentElementId; cleared.");
        }
        List<IrElement> outElements = new ArrayList<>(elements.size());
        for (IrElement e : elements) {
            String id = e.id.trim();
            String type = ImportText.trimToNull(e.type);
            outElements.add(new IrElement(id, type == null ? UNKNOWN_TYPE : type,
                    ensureName("element", id, e.name, "Unnamed element"),
                    ImportText.cleanDocumentation(e.documentation),
                    folderRef("Element", id, e.folderId, folderIds),
                    elementParents.get(id),
                    taggedValues(e.taggedValues), externalIds(e.externalIds), e.attrs, e.meta));
        }

        // Relationships
        List<IrRelationship> outRelationships = new ArrayList<>();
        for (IrRelationship r : dedupeById(in.relationships, r -> r.id, "relationship")) {
            IrRelationship nr = relationship(r, elementIds);
            if (nr != null) outRelationships.add(nr);
        }
        Set<String> relationshipIds = ids(outRelationships, r -> r.id);

        // Views
        List<IrView> outViews = new ArrayList<>();
        for (IrView v : dedupeById(in.views, v -> v.id, "view")) {
            outViews.add(view(v, folderIds, elementIds, relationshipIds));
        }

        Map<String, Object> meta = in.meta;
        if (IrMaps.string(meta, IrMeta.IMPORTED_AT_ISO) == null) {
            meta = IrMaps.with(meta, IrMeta.IMPORTED_AT_ISO, Instant.now(options.clock).toString());
        }

        log.debug("{}normalized {} folder(s), {} element(s), {} relationship(s), {} view(s)",
                prefix, outFolders.size(), outElements.size(), outRelationships.size(), outViews.size());
        return new IrModel(outFolders, outElements, outRelationships, outViews, meta);
    }

    private IrRelationship relationship(IrRelationship r, Set<String> elementIds) {
        String id = r.id.trim();
        String sourceId = ImportText.trimToEmpty(r.sourceId);
        String targetId = ImportText.trimToEmpty(r.targetId);

        boolean dangling = !elementIds.contains(sourceId) || !elementIds.contains(targetId);
        if (dangling && options.dropDanglingRelationships) {
            warn("Dropped relationship \"" + id + "\" because it references missing element(s) (source: \""
                    + sourceId + "\", target: \"" + targetId + "\").");
            return null;
        }

        String type = ImportText.trimToNull(r.type);
        return new IrRelationship(id, type == null ? UNKNOWN_TYPE : type, sourceId, targetId,
                ImportText.trimToNull(r.name), ImportText.cleanDocumentation(r.documentation),
                taggedValues(r.taggedValues), externalIds(r.externalIds), r.attrs, r.meta);
    }

    private IrView view(IrView v, Set<String> folderIds, Set<String> elementIds, Set<String> relationshipIds) {
        String id = v.id.trim();

        List<IrViewNode> nodes = dedupeById(v.nodes, n -> n.id, "view node in view \"" + id + "\"");
        Set<String> nodeIds = ids(nodes, n -> n.id);
        Map<String, String> nodeParents = new LinkedHashMap<>();
        for (IrViewNode n : nodes) {
            String nid = n.id.trim();
            String parentId = ImportText.trimToNull(n.parentNodeId);
            if (parentId != null && (!nodeIds.contains(parentId) || parentId.equals(nid))) {
                warn("ViewNode \"" + nid + "\" had invalid parentNodeId \"" + parentId + "\"; cleared.");
                parentId = null;
            }
            nodeParents.put(nid, parentId);
        }
        for (String nid : breakCycles(nodeParents)) {
            warn("ViewNode \"" + nid + "\" had cyclic parentNodeId; cleared.");
        }

        List<IrViewNode> outNodes = new ArrayList<>(nodes.size());
        for (IrViewNode n : nodes) {
            String nid = n.id.trim();
            String elementId = ImportText.trimToNull(n.elementId);
            if (elementId != null && !elementIds.contains(elementId)) {
                warn("ViewNode \"" + nid + "\" referenced missing elementId \"" + elementId + "\"; cleared.");
                elementId = null;
            }
            IrBounds bounds = n.bounds;
            if (bounds != null && !bounds.isUsable()) {
                warn("ViewNode \"" + nid + "\" had unusable bounds " + bounds + "; cleared.");
                bounds = null;
            }
            outNodes.add(new IrViewNode(nid, n.kind, elementId, nodeParents.get(nid),
                    ImportText.trimToNull(n.label), bounds,
                    taggedValues(n.taggedValues), externalIds(n.externalIds), n.meta));
        }

        List<IrViewConnection> outConnections = new ArrayList<>();
        for (IrViewConnection c : dedupeById(v.connections, c -> c.id, "view connection in view \"" + id + "\"")) {
            outConnections.add(connection(c, relationshipIds, nodeIds, elementIds));
        }

        return new IrView(id, ensureName("view", id, v.name, "Unnamed view"),
                ImportText.cleanDocumentation(v.documentation),
                folderRef("View", id, v.folderId, folderIds),
                ImportText.trimToNull(v.viewpoint),
                outNodes, outConnections,
                taggedValues(v.taggedValues), externalIds(v.externalIds), v.meta);
    }

    private IrViewConnection connection(IrViewConnection c, Set<String> relationshipIds, Set<String> nodeIds, Set<String> elementIds) {
        String id = c.id.trim();
        String relationshipId = checkedRef(id, "relationshipId", c.relationshipId, relationshipIds, "referenced missing");
        String sourceNodeId = checkedRef(id, "sourceNodeId", c.sourceNodeId, nodeIds, "had invalid");
        String targetNodeId = checkedRef(id, "targetNodeId", c.targetNodeId, nodeIds, "had invalid");
        String sourceElementId = checkedRef(id, "sourceElementId", c.sourceElementId, elementIds, "had invalid");
        String targetElementId = checkedRef(id, "targetElementId", c.targetElementId, elementIds, "had invalid");

        List<IrPoint> points = new ArrayList<>(c.points.size());
        for (IrPoint p : c.points) {
            if (p.isFinite()) points.add(p);
        }
        if (points.size() != c.points.size()) {
            warn("ViewConnection \"" + id + "\" dropped " + (c.points.size() - points.size()) + " non-finite point(s).");
        }

        return new IrViewConnection(id, relationshipId, sourceNodeId, targetNodeId, sourceElementId, targetElementId,
                ImportText.trimToNull(c.label), points,
                taggedValues(c.taggedValues), externalIds(c.externalIds), c.meta);
    }

    private String checkedRef(String connectionId, String field, String raw, Set<String> valid, String verb) {
        String ref = ImportText.trimToNull(raw);
        if (ref != null && !valid.contains(ref)) {
            warn("ViewConnection \"" + connectionId + "\" " + verb + " " + field + " \"" + ref + "\"; cleared.");
            return null;
        }
        return ref;
    }

    private String folderRef(String kind, String id, String raw, Set<String> folderIds) {
        String folderId = ImportText.trimToNull(raw);
        if (folderId != null && !folderIds.contains(folderId)) {
            warn(kind + " \"" + id + "\" referenced missing folderId \"" + folderId + "\"; moved to root.");
            return null;
        }
        return folderId;
    }

    private String ensureName(String kind, String id, String name, String fallback) {
        String n = ImportText.trimToNull(name);
        if (n != null) return n;
        warn(kind.substring(0, 1).toUpperCase() + kind.substring(1) + " \"" + id + "\" missing name; using \"" + fallback + "\".");
        return fallback;
    }

    private <T> List<T> dedupeById(List<T> in, Function<T, String> id, String kind) {
        Set<String> seen = new HashSet<>();
        List<T> out = new ArrayList<>(in.size());
        for (T item : in) {
            String itemId = ImportText.trimToNull(id.apply(item));
            if (itemId == null) {
                warn("Dropped " + kind + " with empty id.");
                continue;
            }
            if (!seen.add(itemId)) {
                warn("Dropped duplicate " + kind + " id \"" + itemId + "\".");
                continue;
            }
            out.add(item);
        }
        return out;
    }

    private void warn(String message) {
        if (report != null) report.warn(prefix + message);
    }

    private static <T> Set<String> ids(List<T> items, Function<T, String> id) {
        Set<String> out = new HashSet<>();
        for (T item : items) out.add(id.apply(item).trim());
        return out;
    }

    /**
     * Cuts parent chains that loop back to their start. {@code parents} maps id to parent id (or null) and is
     * updated in place; returns the ids whose parent was cleared. Members are visited in map order, so the
     * first member of each cycle is the one moved to the root.
     */
    static List<String> breakCycles(Map<String, String> parents) {
        List<String> cut = new ArrayList<>();
        for (String start : parents.keySet()) {
            Set<String> seen = new HashSet<>();
            seen.add(start);
            String cur = parents.get(start);
            while (cur != null) {
                if (cur.equals(start)) {
                    parents.put(start, null);
                    cut.add(start);
                    break;
                }
                if (!seen.add(cur)) break;
                cur = parents.get(cur);
            }
        }
        return cut;
    }

    static List<IrTaggedValue> taggedValues(List<IrTaggedValue> in) {
        if (in.isEmpty()) return in;
        Set<IrTaggedValue> out = new LinkedHashSet<>();
        for (IrTaggedValue tv : in) {
            String key = ImportText.trimToNull(tv.key);
            if (key == null) continue;
            out.add(new IrTaggedValue(key, ImportText.trimToEmpty(tv.value)));
        }
        return new ArrayList<>(out);
    }

    static List<IrExternalId> externalIds(List<IrExternalId> in) {
        if (in.isEmpty()) return in;
        Set<IrExternalId> out = new LinkedHashSet<>();
        for (IrExternalId x : in) {
            String id = ImportText.trimToNull(x.id);
            if (id == null) continue;
            out.add(new IrExternalId(ImportText.trimToNull(x.system), id, ImportText.trimToNull(x.kind)));
        }
        return new ArrayList<>(out);
    }
}
