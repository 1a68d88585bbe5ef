package info.isaksson.erland.modelimport.bpmn2;

import info.isaksson.erland.modelimport.framework.StructuralParseException;
import info.isaksson.erland.modelimport.ir.IrElement;
import info.isaksson.erland.modelimport.ir.IrExternalId;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.ir.IrModel;
import info.isaksson.erland.modelimport.ir.IrRelationship;
import info.isaksson.erland.modelimport.ir.IrView;
import info.isaksson.erland.modelimport.report.ImportReport;
import info.isaksson.erland.modelimport.xml.Xml;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * BPMN 2.0 semantic model to IR: flow nodes, global definitions, flows and containment.
 * Diagram interchange is handled by {@link Bpmn2DiagramParser}.
 */
final class Bpmn2Parser {

    static final String SYSTEM = "bpmn2";

    private final Element defs;
    private final ImportReport report;

    private final List<IrElement> elements = new ArrayList<>();
    private final Map<String, IrElement> elementById = new LinkedHashMap<>();
    private final Map<String, Element> xmlById = new LinkedHashMap<>();
    private final List<IrRelationship> relationships = new ArrayList<>();

    private Bpmn2Parser(Element defs, ImportReport report) {
        this.defs = defs;
        this.report = report;
    }

    static IrModel parse(Document doc, ImportReport report) {
        Element root = doc.getDocumentElement();
        Element defs = Xml.is(root, "definitions") ? root : Xml.q(doc, "definitions");
        if (defs == null) {
            throw new StructuralParseException(SYSTEM, "Not a BPMN 2.0 XML document: missing <definitions> element.");
        }
        return new Bpmn2Parser(defs, report).run();
    }

    private IrModel run() {
        parseElements();
        warnUnsupported();
        parseRelationships();
        List<IrElement> contained = applyContainment();

        List<IrView> views = Bpmn2DiagramParser.parse(defs, elementById, relationships, report);
        if (views.isEmpty() && !contained.isEmpty()) {
            report.warn("bpmn2-no-diagram", "BPMN2: No BPMNDI diagram found; created an auto-layout view.");
            views = List.of(Bpmn2DiagramParser.autoLayoutView(contained, relationships));
        }

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(IrMeta.FORMAT, IrMeta.Formats.BPMN2);
        meta.put(IrMeta.TOOL, Xml.attrTrim(defs, "exporter"));
        meta.put("exporterVersion", Xml.attrTrim(defs, "exporterVersion"));
        meta.put("targetNamespace", Xml.attrTrim(defs, "targetNamespace"));
        return new IrModel(List.of(), contained, relationships, views, meta);
    }

    // ------------------------------------------------------------------
    // Elements
    // ------------------------------------------------------------------

    private void parseElements() {
        for (String ln : Bpmn2Types.NODE_TYPES.keySet()) {
            for (Element el : Xml.qa(defs, ln)) {
                String id = Xml.attrTrim(el, "id");
                if (id == null) {
                    report.warn("bpmn2-missing-id", "Skipping BPMN element without @id (<" + Xml.localName(el) + ">)");
                    continue;
                }
                if (elementById.containsKey(id)) continue;

                String type = Bpmn2Types.nodeType(Xml.localName(el));
                String name = Xml.attrTrim(el, "name");
                if (name == null && "bpmn.textAnnotation".equals(type)) name = Xml.childText(el, "text");

                Map<String, Object> meta = new LinkedHashMap<>();
                meta.put(IrMeta.SOURCE_TYPE, Xml.localName(el));
                Map<String, String> ext = ExtensionSummary.of(el);
                if (!ext.isEmpty()) meta.put(IrMeta.EXTENSION_TAGS, ext);

                IrElement element = new IrElement(id, type,
                        name == null ? Bpmn2Types.defaultName(type, id) : name,
                        Xml.childText(el, "documentation"),
                        null, null, null,
                        List.of(IrExternalId.of(SYSTEM, id, "element")),
                        elementAttrs(el, type), meta);
                elements.add(element);
                elementById.put(id, element);
                xmlById.put(id, el);
            }
        }
    }

    private void warnUnsupported() {
        for (String ln : Bpmn2Types.UNSUPPORTED) {
            if (Xml.q(defs, ln) != null) {
                report.warn("bpmn2-unsupported-node",
                        "BPMN node type <" + ln + "> is present but not supported yet (will be skipped).");
            }
        }
    }

    private Map<String, Object> elementAttrs(Element el, String type) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        switch (type) {
            case "bpmn.startEvent", "bpmn.endEvent", "bpmn.intermediateCatchEvent",
                    "bpmn.intermediateThrowEvent", "bpmn.boundaryEvent" -> eventAttrs(el, type, attrs);
            case "bpmn.error" -> {
                attrs.put("errorCode", Xml.attrTrim(el, "errorCode"));
                attrs.put("structureRef", Xml.attrTrim(el, "structureRef"));
            }
            case "bpmn.escalation" -> attrs.put("escalationCode", Xml.attrTrim(el, "escalationCode"));
            case "bpmn.message" -> attrs.put("itemRef", Xml.attrTrim(el, "itemRef"));
            case Bpmn2Types.POOL -> attrs.put("processRef", Xml.attrTrim(el, "processRef"));
            case Bpmn2Types.LANE -> {
                List<String> refs = new ArrayList<>();
                for (Element ref : Xml.children(el, "flowNodeRef")) {
                    String t = Xml.text(ref);
                    if (!t.isEmpty()) refs.add(t);
                }
                if (!refs.isEmpty()) attrs.put("flowNodeRefs", refs);
            }
            case Bpmn2Types.SUB_PROCESS -> {
                if ("true".equalsIgnoreCase(Xml.attrTrim(el, "triggeredByEvent"))) attrs.put("triggeredByEvent", Boolean.TRUE);
            }
            default -> {
                // no type specific attributes
            }
        }
        return attrs;
    }

    private static void eventAttrs(Element el, String type, Map<String, Object> attrs) {
        String eventKind = switch (type) {
            case "bpmn.startEvent" -> "start";
            case "bpmn.endEvent" -> "end";
            case "bpmn.intermediateCatchEvent" -> "intermediateCatch";
            case "bpmn.intermediateThrowEvent" -> "intermediateThrow";
            default -> "boundary";
        };
        attrs.put("eventKind", eventKind);
        attrs.put("eventDefinition", eventDefinition(el));
        if ("boundary".equals(eventKind)) {
            // BPMN default is interrupting
            attrs.put("cancelActivity", !"false".equalsIgnoreCase(Xml.attrTrim(el, "cancelActivity")));
            attrs.put("attachedToRef", Xml.attrTrim(el, "attachedToRef"));
        }
    }

    /** The first recognized event definition; multiple definitions are not modelled. */
    private static Map<String, Object> eventDefinition(Element el) {
        Map<String, Object> def = new LinkedHashMap<>();
        Element d;
        if ((d = Xml.child(el, "timerEventDefinition")) != null) {
            def.put("kind", "timer");
            putText(def, "timeDate", Xml.child(d, "timeDate"));
            putText(def, "timeDuration", Xml.child(d, "timeDuration"));
            putText(def, "timeCycle", Xml.child(d, "timeCycle"));
        } else if ((d = Xml.child(el, "messageEventDefinition")) != null) {
            def.put("kind", "message");
            putAttr(def, "messageRef", d);
        } else if ((d = Xml.child(el, "signalEventDefinition")) != null) {
            def.put("kind", "signal");
            putAttr(def, "signalRef", d);
        } else if ((d = Xml.child(el, "errorEventDefinition")) != null) {
            def.put("kind", "error");
            putAttr(def, "errorRef", d);
        } else if ((d = Xml.child(el, "escalationEventDefinition")) != null) {
            def.put("kind", "escalation");
            putAttr(def, "escalationRef", d);
        } else if ((d = Xml.child(el, "conditionalEventDefinition")) != null) {
            def.put("kind", "conditional");
            Element expr = Xml.child(d, "condition");
            putText(def, "conditionExpression", expr != null ? expr : Xml.child(d, "conditionExpression"));
        } else if ((d = Xml.child(el, "linkEventDefinition")) != null) {
            def.put("kind", "link");
            String linkName = Xml.attrTrim(d, "name");
            if (linkName != null) def.put("linkName", linkName);
        } else if (Xml.child(el, "terminateEventDefinition") != null) {
            def.put("kind", "terminate");
        } else {
            def.put("kind", "none");
        }
        return def;
    }

    private static void putText(Map<String, Object> m, String key, Element el) {
        String t = Xml.text(el);
        if (!t.isEmpty()) m.put(key, t);
    }

    private static void putAttr(Map<String, Object> m, String key, Element el) {
        String v = Xml.attrTrim(el, key);
        if (v != null) m.put(key, v);
    }

    // ------------------------------------------------------------------
    // Relationships
    // ------------------------------------------------------------------

    private void parseRelationships() {
        Set<String> seen = new HashSet<>();
        Set<String> endpointWarnings = new HashSet<>();
        for (String ln : Bpmn2Types.RELATIONSHIP_TYPES.keySet()) {
            for (Element relEl : Xml.qa(defs, ln)) {
                String type = Bpmn2Types.relationshipType(Xml.localName(relEl));
                String id = Xml.attrTrim(relEl, "id");
                if (id == null) {
                    report.warn("bpmn2-missing-id", "Skipping BPMN relationship without @id (<" + Xml.localName(relEl) + ">)");
                    continue;
                }
                if (!seen.add(id)) continue;

                String sourceRef = Xml.attrTrim(relEl, "sourceRef");
                String targetRef = Xml.attrTrim(relEl, "targetRef");
                boolean dataAssociation = type.startsWith("bpmn.data");
                if (dataAssociation && sourceRef == null) {
                    // Data associations carry nested <sourceRef>/<targetRef> elements
                    sourceRef = emptyToNull(Xml.text(Xml.child(relEl, "sourceRef")));
                    targetRef = emptyToNull(Xml.text(Xml.child(relEl, "targetRef")));
                }
                if (dataAssociation) {
                    // The activity side usually points at an ioSpecification entry; use the owning activity instead
                    String owner = owningActivityId(relEl);
                    if ("bpmn.dataInputAssociation".equals(type) && !elementById.containsKey(targetRef)) targetRef = owner;
                    if ("bpmn.dataOutputAssociation".equals(type) && !elementById.containsKey(sourceRef)) sourceRef = owner;
                }
                if (sourceRef == null || targetRef == null) {
                    report.warn("bpmn2-missing-endpoint", "Skipping " + type + " (" + id + ") because sourceRef/targetRef is missing.");
                    continue;
                }
                if (!elementById.containsKey(sourceRef) || !elementById.containsKey(targetRef)) {
                    if (endpointWarnings.add(type + ":" + sourceRef + "->" + targetRef)) {
                        report.warn("bpmn2-missing-endpoint", "Skipping " + type + " (" + id
                                + ") because endpoint(s) were not imported (source=" + sourceRef + ", target=" + targetRef + ").");
                    }
                    continue;
                }

                Map<String, Object> meta = new LinkedHashMap<>();
                meta.put(IrMeta.SOURCE_TYPE, Xml.localName(relEl));
                Map<String, String> ext = ExtensionSummary.of(relEl);
                if (!ext.isEmpty()) meta.put(IrMeta.EXTENSION_TAGS, ext);

                relationships.add(new IrRelationship(id, type, sourceRef, targetRef,
                        Xml.attrTrim(relEl, "name"), Xml.childText(relEl, "documentation"),
                        null, List.of(IrExternalId.of(SYSTEM, id, "relationship")),
                        relationshipAttrs(relEl, type, id, sourceRef), meta));
            }
        }
    }

    private Map<String, Object> relationshipAttrs(Element relEl, String type, String id, String sourceRef) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        if ("bpmn.sequenceFlow".equals(type)) {
            putText(attrs, "conditionExpression", Xml.child(relEl, "conditionExpression"));
            Element source = xmlById.get(sourceRef);
            if (source != null && id.equals(Xml.attrTrim(source, "default"))) attrs.put("isDefault", Boolean.TRUE);
        } else if ("bpmn.messageFlow".equals(type)) {
            putAttr(attrs, "messageRef", relEl);
        } else if ("bpmn.association".equals(type)) {
            putAttr(attrs, "associationDirection", relEl);
        }
        return attrs;
    }

    private String owningActivityId(Element association) {
        Element p = Xml.parent(association);
        String id = p == null ? null : Xml.attrTrim(p, "id");
        return id != null && elementById.containsKey(id) ? id : null;
    }

    // ------------------------------------------------------------------
    // Containment
    // ------------------------------------------------------------------

    /**
     * Projects source nesting onto {@code parentElementId}. Later rules win:
     * participant owning the process, then lane membership, then sub-process nesting.
     */
    private List<IrElement> applyContainment() {
        Map<String, String> parentOf = new LinkedHashMap<>();

        Map<String, String> poolByProcess = new LinkedHashMap<>();
        for (IrElement e : elements) {
            if (Bpmn2Types.POOL.equals(e.type)) {
                String processRef = Xml.attrTrim(xmlById.get(e.id), "processRef");
                if (processRef != null) poolByProcess.putIfAbsent(processRef, e.id);
            }
        }

        for (IrElement e : elements) {
            Element xml = xmlById.get(e.id);
            if (!Bpmn2Types.POOL.equals(e.type)) {
                Element process = nearestAncestor(xml, "process");
                String pool = process == null ? null : poolByProcess.get(Xml.attrTrim(process, "id"));
                if (pool != null) parentOf.put(e.id, pool);
            }
            if (Bpmn2Types.LANE.equals(e.type)) {
                Element outerLane = nearestAncestor(xml, "lane");
                String outerId = outerLane == null ? null : Xml.attrTrim(outerLane, "id");
                if (outerId != null && elementById.containsKey(outerId)) parentOf.put(e.id, outerId);
            }
        }

        for (IrElement e : elements) {
            if (!Bpmn2Types.LANE.equals(e.type)) continue;
            for (Element ref : Xml.children(xmlById.get(e.id), "flowNodeRef")) {
                String nodeId = Xml.text(ref);
                if (elementById.containsKey(nodeId) && !nodeId.equals(e.id)) parentOf.put(nodeId, e.id);
            }
        }

        for (IrElement e : elements) {
            Element sub = nearestAncestor(xmlById.get(e.id), "subProcess");
            String subId = sub == null ? null : Xml.attrTrim(sub, "id");
            if (subId != null && elementById.containsKey(subId)) parentOf.put(e.id, subId);
        }

        List<IrElement> out = new ArrayList<>(elements.size());
        for (IrElement e : elements) {
            String parent = parentOf.get(e.id);
            out.add(parent == null ? e : e.withParentElementId(parent));
        }
        return out;
    }

    private static Element nearestAncestor(Element el, String localName) {
        Element p = Xml.parent(el);
        while (p != null) {
            if (Xml.is(p, localName)) return p;
            p = Xml.parent(p);
        }
        return null;
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
