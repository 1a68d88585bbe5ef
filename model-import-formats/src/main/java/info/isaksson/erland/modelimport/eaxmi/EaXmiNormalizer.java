package info.isaksson.erland.modelimport.eaxmi;

import info.isaksson.erland.modelimport.framework.FormatNormalizeOptions;
import info.isaksson.erland.modelimport.framework.FormatNormalizer;
import info.isaksson.erland.modelimport.framework.FormatRepairs;
import info.isaksson.erland.modelimport.ir.IrBounds;
import info.isaksson.erland.modelimport.ir.IrElement;
import info.isaksson.erland.modelimport.ir.IrExternalId;
import info.isaksson.erland.modelimport.ir.IrFolder;
import info.isaksson.erland.modelimport.ir.IrMaps;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.ir.IrModel;
import info.isaksson.erland.modelimport.ir.IrRelationship;
import info.isaksson.erland.modelimport.ir.IrView;
import info.isaksson.erland.modelimport.ir.IrViewConnection;
import info.isaksson.erland.modelimport.ir.IrViewNode;
import info.isaksson.erland.modelimport.ir.IrViewNodeKind;
import info.isaksson.erland.modelimport.normalize.ImportText;
import info.isaksson.erland.modelimport.normalize.ViewConnectionRelationshipResolver;
import info.isaksson.erland.modelimport.report.ImportReport;
import info.isaksson.erland.modelimport.types.ArchimatePalette;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * EA XMI repair pass. Besides the usual cleanup it binds the raw diagram references left by the parser:
 * nodes to elements and connections to relationships, matching ids, external ids and GUID brace variants.
 */
public final class EaXmiNormalizer implements FormatNormalizer {

    static final String LABEL = "EA XMI";

    static final String VIEW_KIND = "viewKind";

    private static final String[] CONNECTION_REL_KEYS = {
            "subject", "connector", "connectorid", "connector_id", "relationship", "relationshipid", "relationship_id",
            "rel", "relid", "xmi:idref", "idref", "ref", "href", "ea_guid", "guid", "uuid"};

    @Override
    public String format() {
        return IrMeta.Formats.EA_XMI;
    }

    @Override
    public IrModel normalize(IrModel model, ImportReport report, FormatNormalizeOptions options) {
        if (model == null) throw new IllegalArgumentException("model must not be null");
        FormatNormalizeOptions opts = options != null ? options : FormatNormalizeOptions.forSource(null);

        Set<String> folderIds = new HashSet<>();
        for (IrFolder f : model.folders) folderIds.add(f.id);

        List<IrFolder> folders = new ArrayList<>();
        for (IrFolder f : FormatRepairs.sortedById(model.folders, f -> f.id)) {
            String name = ImportText.trimToNull(f.name);
            String parentId = ImportText.trimToNull(f.parentId);
            if (parentId != null && !folderIds.contains(parentId)) {
                FormatRepairs.warn(report, opts, LABEL, "Folder \"" + f.id + "\" referenced missing parent \""
                        + parentId + "\"; moved to root.");
                parentId = null;
            }
            folders.add(new IrFolder(f.id, name != null ? name : "Package", parentId,
                    ImportText.cleanDocumentation(f.documentation), f.taggedValues, f.externalIds, f.meta));
        }

        List<IrElement> elements = new ArrayList<>();
        for (IrElement e : model.elements) {
            String name = ImportText.trimToNull(e.name);
            String folderId = ImportText.trimToNull(e.folderId);
            if (folderId != null && !folderIds.contains(folderId)) {
                FormatRepairs.warn(report, opts, LABEL, "Element \"" + e.id + "\" referenced missing folderId \""
                        + folderId + "\"; moved to root.");
                folderId = null;
            }
            elements.add(new IrElement(e.id, e.type, name != null ? name : "Unnamed (" + e.type + ")",
                    ImportText.cleanDocumentation(e.documentation), folderId,
                    ImportText.trimToNull(e.parentElementId), e.taggedValues, e.externalIds, e.attrs, e.meta));
        }

        List<IrRelationship> relationships = new ArrayList<>();
        for (IrRelationship r : model.relationships) {
            relationships.add(new IrRelationship(r.id, r.type,
                    ImportText.trimToEmpty(r.sourceId), ImportText.trimToEmpty(r.targetId),
                    ImportText.trimToNull(r.name), ImportText.cleanDocumentation(r.documentation),
                    r.taggedValues, r.externalIds, r.attrs, r.meta));
        }
        linkAssociationClasses(elements, relationships, report);

        Set<String> elementIds = new HashSet<>();
        for (IrElement e : elements) elementIds.add(e.id);
        relationships = FormatRepairs.dropDanglingRelationships(relationships, elementIds, report, opts, LABEL);

        Map<String, String> elementLookup = lookup(elements, e -> e.id, e -> e.externalIds);
        Map<String, String> relationshipLookup = lookup(relationships, r -> r.id, r -> r.externalIds);
        Map<String, String> elementTypes = new HashMap<>();
        for (IrElement e : elements) elementTypes.put(e.id, e.type);
        Map<String, String> relationshipTypes = new HashMap<>();
        Map<String, IrRelationship> relationshipsById = new HashMap<>();
        for (IrRelationship r : relationships) {
            relationshipTypes.put(r.id, r.type);
            relationshipsById.put(r.id, r);
        }

        Set<String> relationshipIds = relationshipsById.keySet();
        List<IrView> views = new ArrayList<>();
        for (IrView raw : FormatRepairs.sortedById(model.views, v -> v.id)) {
            IrView v = resolveView(raw, folderIds, elementLookup, relationshipLookup, relationships, relationshipsById,
                    report, opts);
            v = FormatRepairs.dropMissingViewRefs(v, elementIds, relationshipIds, report, opts, LABEL);
            v = applyBpmnContainment(v, elementTypes);
            v = inferViewKind(v, elementTypes, relationshipTypes);
            String name = ImportText.trimToNull(v.name);
            views.add(new IrView(v.id, name != null ? name : "Diagram", ImportText.cleanDocumentation(v.documentation),
                    v.folderId, v.viewpoint, v.nodes, FormatRepairs.sortedById(v.connections, c -> c.id),
                    v.taggedValues, v.externalIds, v.meta));
        }

        IrModel out = new IrModel(folders, FormatRepairs.sortedById(elements, e -> e.id),
                FormatRepairs.sortedById(relationships, r -> r.id), views, model.meta);
        return ViewConnectionRelationshipResolver.resolve(out, report, LABEL);
    }

    // AssociationClass

    static void linkAssociationClasses(List<IrElement> elements, List<IrRelationship> relationships, ImportReport report) {
        Map<String, Integer> elementIndex = new HashMap<>();
        for (int i = 0; i < elements.size(); i++) elementIndex.put(elements.get(i).id, i);
        int linked = 0;
        for (int i = 0; i < relationships.size(); i++) {
            IrRelationship r = relationships.get(i);
            String elementId = IrMaps.string(r.meta, IrMeta.ASSOCIATION_CLASS_ELEMENT_ID);
            if (elementId == null && r.id.endsWith(EaAssociationParser.ASSOCIATION_CLASS_SUFFIX)) {
                elementId = r.id.substring(0, r.id.length() - EaAssociationParser.ASSOCIATION_CLASS_SUFFIX.length());
            }
            Integer idx = elementId == null ? null : elementIndex.get(elementId);
            if (idx == null) continue;
            IrElement e = elements.get(idx);
            if (!"uml.associationClass".equals(e.type)) continue;
            elements.set(idx, e.withAttrs(IrMaps.with(e.attrs, IrMeta.ASSOCIATION_RELATIONSHIP_ID, r.id)));
            relationships.set(i, r.withAttrs(IrMaps.with(r.attrs, IrMeta.ASSOCIATION_CLASS_ELEMENT_ID, elementId)));
            linked++;
        }
        if (linked > 0 && report != null) {
            report.info("uml-associationclass-link", "EA XMI Normalize: Linked " + linked
                    + " AssociationClass element(s) to their association relationship(s).");
        }
    }

    // Reference resolution

    private interface Ids<T> {
        String id(T item);
    }

    private interface ExternalIds<T> {
        List<IrExternalId> of(T item);
    }

    private static <T> Map<String, String> lookup(Collection<T> items, Ids<T> ids, ExternalIds<T> externalIds) {
        Map<String, String> m = new HashMap<>();
        for (T item : items) {
            String id = ids.id(item);
            for (String tok : EaXmi.refTokens(id)) m.putIfAbsent(tok, id);
        }
        for (T item : items) {
            String id = ids.id(item);
            for (IrExternalId x : externalIds.of(item)) {
                for (String tok : EaXmi.refTokens(x.id)) m.putIfAbsent(tok, id);
            }
        }
        return m;
    }

    private static String find(Map<String, String> lookup, String candidate) {
        for (String tok : EaXmi.refTokens(candidate)) {
            String hit = lookup.get(tok);
            if (hit != null) return hit;
        }
        return null;
    }

    private static Map<String, String> refRaw(Map<String, Object> meta) {
        Map<String, Object> raw = IrMaps.map(meta, IrMeta.REF_RAW);
        Map<String, String> out = new LinkedHashMap<>();
        if (raw == null) return out;
        for (Map.Entry<String, Object> e : raw.entrySet()) {
            if (e.getValue() instanceof String s && !s.isBlank()) out.put(e.getKey(), s.trim());
        }
        return out;
    }

    private static List<String> candidates(Map<String, String> refRaw, String[] keys, boolean includeRest) {
        List<String> out = new ArrayList<>();
        for (String k : keys) {
            String v = refRaw.get(k);
            if (v != null && !out.contains(v)) out.add(v);
        }
        if (includeRest) {
            for (String v : refRaw.values()) {
                if (!out.contains(v)) out.add(v);
            }
        }
        return out;
    }

    private IrView resolveView(IrView v, Set<String> folderIds, Map<String, String> elementLookup,
                               Map<String, String> relationshipLookup, List<IrRelationship> relationships,
                               Map<String, IrRelationship> relationshipsById, ImportReport report,
                               FormatNormalizeOptions opts) {
        String folderId = v.folderId;
        if (folderId != null && !folderIds.contains(folderId)) {
            if (report != null) {
                report.info("missing-folder", "EA XMI Normalize: View referenced missing folderId; moved to root.",
                        Map.of("viewId", v.id, "folderId", folderId));
            }
            folderId = null;
        }

        List<IrViewNode> nodes = new ArrayList<>();
        for (IrViewNode n : v.nodes) {
            if (n.elementId != null || n.kind != IrViewNodeKind.ELEMENT) {
                nodes.add(n);
                continue;
            }
            List<String> cands = candidates(refRaw(n.meta), EaDiagramParser.NODE_REF_KEYS, true);
            String resolved = null;
            String used = null;
            for (String c : cands) {
                resolved = find(elementLookup, c);
                if (resolved != null) {
                    used = c;
                    break;
                }
            }
            if (resolved == null) {
                if (looksLikeRelationship(cands, relationshipLookup)) continue;
                if (report != null) {
                    if (cands.isEmpty()) {
                        report.warn("ea-xmi:view-node-missing-ref",
                                "EA XMI Normalize: View node had no resolvable reference; skipped node.",
                                "viewId", v.id, "nodeId", n.id);
                    } else {
                        report.warn("ea-xmi:view-node-unresolved-element",
                                "EA XMI Normalize: Could not resolve referenced element for a view node; skipped node.",
                                Map.of("viewId", v.id, "nodeId", n.id,
                                        "refCandidates", String.join(" ", cands.subList(0, Math.min(5, cands.size())))));
                    }
                }
                continue;
            }
            IrViewNode bound = n.withElementId(resolved);
            nodes.add(new IrViewNode(bound.id, bound.kind, bound.elementId, bound.parentNodeId, bound.label,
                    bound.bounds, bound.taggedValues, bound.externalIds, IrMaps.with(bound.meta, "resolvedFrom", used)));
        }

        Map<String, String> nodeKeys = new HashMap<>();
        Map<String, String> nodeElements = new HashMap<>();
        Map<String, List<String>> nodesByElement = new HashMap<>();
        for (IrViewNode n : nodes) {
            for (String tok : EaXmi.refTokens(n.id)) nodeKeys.putIfAbsent(tok, n.id);
            for (IrExternalId x : n.externalIds) {
                for (String tok : EaXmi.refTokens(x.id)) nodeKeys.putIfAbsent(tok, n.id);
            }
            if (n.elementId != null) {
                nodeElements.put(n.id, n.elementId);
                nodesByElement.computeIfAbsent(n.elementId, k -> new ArrayList<>()).add(n.id);
            }
        }

        List<IrViewConnection> connections = new ArrayList<>();
        for (IrViewConnection c : v.connections) {
            if (c.relationshipId != null) {
                connections.add(c);
                continue;
            }
            Map<String, String> raw = refRaw(c.meta);
            Endpoint src = endpoint(candidates(raw, EaDiagramParser.LINK_SOURCE_KEYS, false), nodeKeys, nodeElements,
                    elementLookup);
            Endpoint tgt = endpoint(candidates(raw, EaDiagramParser.LINK_TARGET_KEYS, false), nodeKeys, nodeElements,
                    elementLookup);

            String relationshipId = null;
            String resolvedFrom = null;
            for (String cand : candidates(raw, CONNECTION_REL_KEYS, false)) {
                relationshipId = find(relationshipLookup, cand);
                if (relationshipId != null) {
                    resolvedFrom = cand;
                    break;
                }
            }
            if (relationshipId == null && src.elementId != null && tgt.elementId != null) {
                List<String> direct = between(relationships, src.elementId, tgt.elementId);
                List<String> reversed = direct.isEmpty() ? between(relationships, tgt.elementId, src.elementId) : List.of();
                List<String> hits = direct.isEmpty() ? reversed : direct;
                if (hits.size() > 1) {
                    if (report != null) {
                        report.warn("ea-xmi:view-connection-ambiguous-relationship",
                                "EA XMI Normalize: View connection matched multiple relationships; skipped.",
                                "viewId", v.id, "connectionId", c.id);
                    }
                    continue;
                }
                if (hits.size() == 1) {
                    relationshipId = hits.get(0);
                    resolvedFrom = "endpoints";
                }
            }
            if (relationshipId == null) {
                if (report != null) {
                    report.warn("ea-xmi:view-connection-unresolved-relationship",
                            "EA XMI Normalize: Could not resolve relationship for a view connection; skipped.",
                            "viewId", v.id, "connectionId", c.id);
                }
                continue;
            }

            IrRelationship rel = relationshipsById.get(relationshipId);
            String sourceNode = src.nodeId != null ? src.nodeId : rel == null ? null : onlyNode(nodesByElement, rel.sourceId);
            String targetNode = tgt.nodeId != null ? tgt.nodeId : rel == null ? null : onlyNode(nodesByElement, rel.targetId);
            String sourceElement = src.elementId != null ? src.elementId : nodeElements.get(sourceNode);
            String targetElement = tgt.elementId != null ? tgt.elementId : nodeElements.get(targetNode);

            Map<String, Object> meta = IrMaps.with(c.meta, "resolvedFrom", resolvedFrom);
            meta = IrMaps.with(meta, "resolvedSourceFrom", src.used);
            meta = IrMaps.with(meta, "resolvedTargetFrom", tgt.used);
            connections.add(new IrViewConnection(c.id, relationshipId, sourceNode, targetNode, sourceElement,
                    targetElement, c.label, c.points, c.taggedValues, c.externalIds, meta));
        }

        return new IrView(v.id, v.name, v.documentation, folderId, v.viewpoint, nodes, connections,
                v.taggedValues, v.externalIds, v.meta);
    }

    private record Endpoint(String elementId, String nodeId, String used) {}

    private static Endpoint endpoint(List<String> cands, Map<String, String> nodeKeys, Map<String, String> nodeElements,
                                     Map<String, String> elementLookup) {
        for (String cand : cands) {
            for (String tok : EaXmi.refTokens(cand)) {
                String nodeId = nodeKeys.get(tok);
                if (nodeId != null && nodeElements.containsKey(nodeId)) {
                    return new Endpoint(nodeElements.get(nodeId), nodeId, cand);
                }
                String el = elementLookup.get(tok);
                if (el != null) return new Endpoint(el, null, cand);
            }
        }
        return new Endpoint(null, null, null);
    }

    private static List<String> between(List<IrRelationship> relationships, String source, String target) {
        List<String> out = new ArrayList<>();
        for (IrRelationship r : relationships) {
            if (source.equals(r.sourceId) && target.equals(r.targetId)) out.add(r.id);
        }
        return out;
    }

    private static String onlyNode(Map<String, List<String>> nodesByElement, String elementId) {
        List<String> ids = nodesByElement.get(elementId);
        return ids != null && ids.size() == 1 ? ids.get(0) : null;
    }

    /** Diagram objects for connector lines carry the connector id; they are not element placements. */
    private static boolean looksLikeRelationship(List<String> cands, Map<String, String> relationshipLookup) {
        for (String c : cands) {
            if (find(relationshipLookup, c) != null) return true;
        }
        return false;
    }

    // View post-processing

    /**
     * EA draws BPMN pools and lanes as plain diagram objects; nesting comes from geometry. Each lane goes into
     * the smallest pool containing it, other BPMN nodes into the smallest containing lane, else pool.
     * Containers are moved to the front so parents precede children.
     */
    static IrView applyBpmnContainment(IrView v, Map<String, String> elementTypes) {
        List<IrViewNode> pools = new ArrayList<>();
        List<IrViewNode> lanes = new ArrayList<>();
        for (IrViewNode n : v.nodes) {
            String t = n.elementId == null || n.bounds == null ? null : elementTypes.get(n.elementId);
            if ("bpmn.pool".equals(t)) pools.add(n);
            if ("bpmn.lane".equals(t)) lanes.add(n);
        }
        if (pools.isEmpty() && lanes.isEmpty()) return v;

        List<List<IrViewNode>> ranked = List.of(new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), new ArrayList<>());
        for (IrViewNode n : v.nodes) {
            String t = n.elementId == null ? null : elementTypes.get(n.elementId);
            IrViewNode next = n;
            if (n.bounds != null && t != null && t.startsWith("bpmn.") && n.parentNodeId == null) {
                IrViewNode parent;
                if (t.equals("bpmn.pool")) {
                    parent = null;
                } else if (t.equals("bpmn.lane")) {
                    parent = smallestContainer(n, pools);
                } else {
                    parent = smallestContainer(n, lanes);
                    if (parent == null) parent = smallestContainer(n, pools);
                }
                if (parent != null) next = n.withParentNodeId(parent.id);
            }
            int rank = "bpmn.pool".equals(t) ? 0 : "bpmn.lane".equals(t) ? 1 : t != null && t.startsWith("bpmn.") ? 2 : 3;
            ranked.get(rank).add(next);
        }
        List<IrViewNode> nodes = new ArrayList<>();
        for (List<IrViewNode> r : ranked) nodes.addAll(r);
        return v.withContent(nodes, v.connections);
    }

    private static IrViewNode smallestContainer(IrViewNode child, List<IrViewNode> containers) {
        IrViewNode best = null;
        double bestArea = Double.MAX_VALUE;
        for (IrViewNode c : containers) {
            if (c.id.equals(child.id) || !contains(c.bounds, child.bounds)) continue;
            double area = c.bounds.width * c.bounds.height;
            if (area < bestArea) {
                best = c;
                bestArea = area;
            }
        }
        return best;
    }

    private static boolean contains(IrBounds outer, IrBounds inner) {
        return outer.x <= inner.x && outer.y <= inner.y
                && outer.x + outer.width >= inner.x + inner.width
                && outer.y + outer.height >= inner.y + inner.height;
    }

    /**
     * {@code meta.viewKind} ({@code archimate}, {@code uml} or {@code bpmn}) by majority of the placed elements and
     * bound relationships; the EA diagram type only breaks near-ties. Ties go to bpmn, then uml.
     */
    static IrView inferViewKind(IrView v, Map<String, String> elementTypes, Map<String, String> relationshipTypes) {
        double archimate = 0;
        double uml = 0;
        double bpmn = 0;
        int evidence = 0;
        List<String> types = new ArrayList<>();
        for (IrViewNode n : v.nodes) {
            if (n.elementId != null) types.add(elementTypes.get(n.elementId));
        }
        for (IrViewConnection c : v.connections) {
            if (c.relationshipId != null) types.add(relationshipTypes.get(c.relationshipId));
        }
        for (String t : types) {
            if (t == null) continue;
            if (t.startsWith("bpmn.")) bpmn++;
            else if (t.startsWith("uml.")) uml++;
            else if (ArchimatePalette.isElementType(t) || ArchimatePalette.isRelationshipType(t)) archimate++;
            else continue;
            evidence++;
        }
        if (evidence == 0) return v;
        String diagramType = v.viewpoint != null ? v.viewpoint : IrMaps.string(v.meta, "eaDiagramType");
        if (diagramType != null) {
            String d = diagramType.toLowerCase(Locale.ROOT);
            if (d.contains("bpmn")) bpmn += 0.5;
            if (d.contains("uml")) uml += 0.5;
            if (d.contains("archimate")) archimate += 0.25;
        }
        double max = Math.max(archimate, Math.max(uml, bpmn));
        String kind = bpmn == max ? "bpmn" : uml == max ? "uml" : "archimate";
        return new IrView(v.id, v.name, v.documentation, v.folderId, v.viewpoint, v.nodes, v.connections,
                v.taggedValues, v.externalIds, IrMaps.with(v.meta, VIEW_KIND, kind));
    }
}
