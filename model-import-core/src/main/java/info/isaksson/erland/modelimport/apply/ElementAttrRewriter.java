package info.isaksson.erland.modelimport.apply;

import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.report.ImportReport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites IR ids held in element and relationship {@code attrs} to internal ids.
 *
 * <p>References that cannot be mapped are removed from their field and collected under
 * {@code attrs.unresolvedRefs}, keyed by field path.</p>
 */
final class ElementAttrRewriter {

    private static final List<String> BPMN_REF_FIELDS = List.of("attachedToRef", "dataObjectRef", "dataStoreRef", "processRef");
    private static final List<String> EVENT_DEFINITION_REF_FIELDS = List.of("messageRef", "signalRef", "errorRef", "escalationRef");

    private final Map<String, String> elements;
    private final Map<String, String> relationships;
    private final ImportReport report;

    ElementAttrRewriter(Map<String, String> elements, Map<String, String> relationships, ImportReport report) {
        this.elements = elements;
        this.relationships = relationships;
        this.report = report;
    }

    /** BPMN element attrs; every unresolved reference is warned about. Gateway default flows are left alone. */
    Map<String, Object> rewriteBpmn(String ownerId, String ownerName, Map<String, Object> attrs) {
        if (attrs == null || attrs.isEmpty()) return attrs;
        Map<String, Object> a = new LinkedHashMap<>(attrs);
        Map<String, Object> unresolved = new LinkedHashMap<>();

        for (String field : BPMN_REF_FIELDS) {
            rewriteField(a, field, field, elements, unresolved, ownerId, ownerName, true);
        }
        rewriteList(a, "flowNodeRefs", unresolved, ownerId, ownerName, true);

        if (a.get("eventDefinition") instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> ed = new LinkedHashMap<>((Map<String, Object>) a.get("eventDefinition"));
            for (String field : EVENT_DEFINITION_REF_FIELDS) {
                rewriteField(ed, field, "eventDefinition." + field, elements, unresolved, ownerId, ownerName, true);
            }
            a.put("eventDefinition", ed);
        }

        putUnresolved(a, unresolved);
        return a;
    }

    /** UML element attrs; one summary warning per element with unresolved references. */
    Map<String, Object> rewriteUml(String ownerId, String ownerName, Map<String, Object> attrs) {
        if (attrs == null || attrs.isEmpty()) return attrs;
        Map<String, Object> a = new LinkedHashMap<>(attrs);
        Map<String, Object> unresolved = new LinkedHashMap<>();

        rewriteField(a, "activityId", "activityId", elements, unresolved, ownerId, ownerName, false);
        rewriteList(a, "ownedNodeRefs", unresolved, ownerId, ownerName, false);
        rewriteField(a, IrMeta.ASSOCIATION_RELATIONSHIP_ID, IrMeta.ASSOCIATION_RELATIONSHIP_ID, relationships,
                unresolved, ownerId, ownerName, false);

        if (!unresolved.isEmpty()) {
            putUnresolved(a, unresolved);
            report.warn(ImportApplier.APPLY_CODE,
                    "UML: element \"" + label(ownerId, ownerName) + "\" has unresolved references in attrs (some fields cleared)",
                    "elementId", ownerId);
        }
        return a;
    }

    /** Relationship attrs: the AssociationClass back reference. */
    Map<String, Object> rewriteRelationship(String ownerId, String ownerName, Map<String, Object> attrs) {
        if (attrs == null || !attrs.containsKey(IrMeta.ASSOCIATION_CLASS_ELEMENT_ID)) return attrs;
        Map<String, Object> a = new LinkedHashMap<>(attrs);
        Map<String, Object> unresolved = new LinkedHashMap<>();
        rewriteField(a, IrMeta.ASSOCIATION_CLASS_ELEMENT_ID, IrMeta.ASSOCIATION_CLASS_ELEMENT_ID, elements,
                unresolved, ownerId, ownerName, true);
        putUnresolved(a, unresolved);
        return a;
    }

    private void rewriteField(Map<String, Object> a, String field, String path, Map<String, String> table,
                              Map<String, Object> unresolved, String ownerId, String ownerName, boolean warnEach) {
        Object ref = a.get(field);
        if (!isId(ref)) return;
        String mapped = table.get((String) ref);
        if (mapped != null) {
            a.put(field, mapped);
            return;
        }
        a.remove(field);
        unresolved.put(path, ref);
        if (warnEach) warnUnresolved(ownerId, ownerName, path, (String) ref);
    }

    private void rewriteList(Map<String, Object> a, String field, Map<String, Object> unresolved,
                             String ownerId, String ownerName, boolean warnEach) {
        if (!(a.get(field) instanceof List)) return;
        List<String> kept = new ArrayList<>();
        List<String> dropped = new ArrayList<>();
        for (Object r : (List<?>) a.get(field)) {
            if (!isId(r)) continue;
            String mapped = elements.get((String) r);
            if (mapped != null) {
                kept.add(mapped);
            } else {
                dropped.add((String) r);
                if (warnEach) warnUnresolved(ownerId, ownerName, field, (String) r);
            }
        }
        if (kept.isEmpty()) a.remove(field);
        else a.put(field, kept);
        if (!dropped.isEmpty()) unresolved.put(field, dropped);
    }

    private void warnUnresolved(String ownerId, String ownerName, String field, String ref) {
        report.warn(ImportApplier.APPLY_CODE,
                "Element \"" + label(ownerId, ownerName) + "\" has unresolved reference " + field + "=\"" + ref + "\" (cleared)",
                "elementId", ownerId, "ref", ref);
    }

    @SuppressWarnings("unchecked")
    private static void putUnresolved(Map<String, Object> a, Map<String, Object> unresolved) {
        if (unresolved.isEmpty()) return;
        Map<String, Object> merged = new LinkedHashMap<>();
        if (a.get(IrMeta.UNRESOLVED_REFS) instanceof Map) {
            merged.putAll((Map<String, Object>) a.get(IrMeta.UNRESOLVED_REFS));
        }
        merged.putAll(unresolved);
        a.put(IrMeta.UNRESOLVED_REFS, merged);
    }

    private static boolean isId(Object o) {
        return o instanceof String && !((String) o).isBlank();
    }

    static String label(String id, String name) {
        return name == null || name.isBlank() ? id : name;
    }
}
