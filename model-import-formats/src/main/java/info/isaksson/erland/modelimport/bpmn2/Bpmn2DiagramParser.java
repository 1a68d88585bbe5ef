package info.isaksson.erland.modelimport.bpmn2;

import info.isaksson.erland.modelimport.ir.IrBounds;
import info.isaksson.erland.modelimport.ir.IrElement;
import info.isaksson.erland.modelimport.ir.IrExternalId;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.ir.IrPoint;
import info.isaksson.erland.modelimport.ir.IrRelationship;
import info.isaksson.erland.modelimport.ir.IrView;
import info.isaksson.erland.modelimport.ir.IrViewConnection;
import info.isaksson.erland.modelimport.ir.IrViewNode;
import info.isaksson.erland.modelimport.ir.IrViewNodeKind;
import info.isaksson.erland.modelimport.report.ImportReport;
import info.isaksson.erland.modelimport.xml.Xml;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** BPMNDI shapes and edges to IR views. */
final class Bpmn2DiagramParser {

    static final String VIEWPOINT = "bpmn-process";
    static final String AUTO_VIEW_ID = "bpmn2:auto";

    static final int AUTO_COLUMNS = 8;
    static final int AUTO_CELL_WIDTH = 220;
    static final int AUTO_CELL_HEIGHT = 140;
    static final int AUTO_NODE_WIDTH = 140;
    static final int AUTO_NODE_HEIGHT = 80;

    private Bpmn2DiagramParser() {}

    static List<IrView> parse(Element defs, Map<String, IrElement> elementById, List<IrRelationship> relationships,
                              ImportReport report) {
        Set<String> relationshipIds = new HashSet<>();
        for (IrRelationship r : relationships) relationshipIds.add(r.id);

        List<IrView> views = new ArrayList<>();
        int index = 0;
        for (Element diagram : Xml.qa(defs, "BPMNDiagram")) {
            index++;
            String diagramId = Xml.attrTrim(diagram, "id");
            Element plane = Xml.child(diagram, "BPMNPlane");
            if (plane == null) {
                report.warn("bpmn2-di", "BPMNDiagram " + (diagramId == null ? String.valueOf(index) : diagramId)
                        + " is missing BPMNPlane (skipped).");
                continue;
            }

            String planeRef = Xml.attrTrim(plane, "bpmnElement");
            String viewId = diagramId != null ? diagramId
                    : planeRef != null ? "bpmndi:" + planeRef : "bpmndi:diagram:" + index;

            String name = Xml.attrTrim(diagram, "name");
            if (name == null && planeRef != null && elementById.containsKey(planeRef)) name = elementById.get(planeRef).name;
            if (name == null) name = planeRef != null ? "Diagram (" + planeRef + ")" : "Diagram " + index;

            List<IrViewNode> nodes = new ArrayList<>();
            for (Element shape : Xml.qa(plane, "BPMNShape")) {
                String shapeId = Xml.attrTrim(shape, "id");
                String bpmnElement = Xml.attrTrim(shape, "bpmnElement");
                IrBounds bounds = bounds(Xml.q(shape, "Bounds"),
                        "BPMNShape " + firstNonNull(shapeId, bpmnElement, "(no-id)"), report);

                if (bpmnElement == null) {
                    // Free-standing shape; keep it as a note when it has geometry.
                    if (bounds != null) {
                        nodes.add(new IrViewNode(shapeId != null ? shapeId : "shape:" + index + ":" + (nodes.size() + 1),
                                IrViewNodeKind.NOTE, null, null, null, bounds, null, null, null));
                    }
                    continue;
                }
                if (!elementById.containsKey(bpmnElement)) {
                    report.warn("bpmn2-di", "BPMNShape references unknown element '" + bpmnElement + "' (skipped).");
                    continue;
                }
                Map<String, Object> meta = new LinkedHashMap<>();
                String expanded = Xml.attrTrim(shape, "isExpanded");
                if (expanded != null) meta.put("isExpanded", Boolean.parseBoolean(expanded));
                nodes.add(new IrViewNode(shapeId != null ? shapeId : "shape:" + bpmnElement,
                        IrViewNodeKind.ELEMENT, bpmnElement, null, null, bounds, null, null, meta));
            }

            List<IrViewConnection> connections = new ArrayList<>();
            for (Element edge : Xml.qa(plane, "BPMNEdge")) {
                String edgeId = Xml.attrTrim(edge, "id");
                String bpmnRel = Xml.attrTrim(edge, "bpmnElement");
                if (bpmnRel == null) continue;
                if (!relationshipIds.contains(bpmnRel)) {
                    report.warn("bpmn2-di", "BPMNEdge references unknown relationship '" + bpmnRel + "' (skipped).");
                    continue;
                }
                connections.add(new IrViewConnection(edgeId != null ? edgeId : "edge:" + bpmnRel, bpmnRel,
                        null, null, null, null, null,
                        waypoints(edge, "BPMNEdge " + firstNonNull(edgeId, bpmnRel, "(no-id)"), report),
                        null, null, null));
            }

            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put(IrMeta.SOURCE_TYPE, Xml.localName(diagram));
            meta.put("planeRef", planeRef);
            views.add(new IrView(viewId, name, null, null, VIEWPOINT,
                    zOrder(nodes, elementById), connections,
                    null, List.of(IrExternalId.of(Bpmn2Parser.SYSTEM, viewId, "diagram")), meta));
        }
        return views;
    }

    /** Grid view used when the file has no diagram interchange at all. */
    static IrView autoLayoutView(List<IrElement> elements, List<IrRelationship> relationships) {
        Map<String, IrElement> byId = new LinkedHashMap<>();
        List<IrViewNode> nodes = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            IrElement e = elements.get(i);
            byId.put(e.id, e);
            IrBounds b = new IrBounds(
                    (double) (i % AUTO_COLUMNS) * AUTO_CELL_WIDTH,
                    (double) (i / AUTO_COLUMNS) * AUTO_CELL_HEIGHT,
                    AUTO_NODE_WIDTH, AUTO_NODE_HEIGHT);
            nodes.add(new IrViewNode("auto:" + e.id, IrViewNodeKind.ELEMENT, e.id, null, null, b, null, null, null));
        }
        List<IrViewConnection> connections = new ArrayList<>(relationships.size());
        for (IrRelationship r : relationships) {
            connections.add(new IrViewConnection("auto:" + r.id, r.id, null, null, null, null, null, null, null, null, null));
        }
        return new IrView(AUTO_VIEW_ID, "BPMN (auto layout)", null, null, VIEWPOINT,
                zOrder(nodes, byId), connections,
                null, List.of(IrExternalId.of(Bpmn2Parser.SYSTEM, AUTO_VIEW_ID, "diagram")), null);
    }

    /**
     * Pools and lanes first so they render behind their content, larger area first among them;
     * everything else after, ordered by element id.
     */
    static List<IrViewNode> zOrder(List<IrViewNode> nodes, Map<String, IrElement> elementById) {
        List<IrViewNode> out = new ArrayList<>(nodes);
        out.sort(Comparator
                .comparing((IrViewNode n) -> !isContainer(n, elementById))
                .thenComparing((IrViewNode n) -> isContainer(n, elementById) ? -area(n) : 0.0)
                .thenComparing(n -> n.elementId != null ? n.elementId : n.id));
        return out;
    }

    private static boolean isContainer(IrViewNode n, Map<String, IrElement> elementById) {
        IrElement e = n.elementId == null ? null : elementById.get(n.elementId);
        return e != null && Bpmn2Types.isContainer(e.type);
    }

    private static double area(IrViewNode n) {
        return n.bounds == null ? 0.0 : Math.max(0, n.bounds.width) * Math.max(0, n.bounds.height);
    }

    private static IrBounds bounds(Element boundsEl, String context, ImportReport report) {
        if (boundsEl == null) return null;
        Double x = number(boundsEl, "x", context, report);
        Double y = number(boundsEl, "y", context, report);
        Double w = number(boundsEl, "width", context, report);
        Double h = number(boundsEl, "height", context, report);
        if (x == null || y == null || w == null || h == null) return null;
        return new IrBounds(x, y, w, h);
    }

    /** At least two waypoints, else an empty route. */
    private static List<IrPoint> waypoints(Element edge, String context, ImportReport report) {
        List<IrPoint> points = new ArrayList<>();
        List<Element> wps = Xml.children(edge, "waypoint");
        for (int i = 0; i < wps.size(); i++) {
            Double x = number(wps.get(i), "x", context + " waypoint[" + i + "]", report);
            Double y = number(wps.get(i), "y", context + " waypoint[" + i + "]", report);
            if (x != null && y != null) points.add(new IrPoint(x, y));
        }
        return points.size() >= 2 ? points : List.of();
    }

    private static Double number(Element el, String name, String context, ImportReport report) {
        String raw = Xml.attrTrim(el, name);
        if (raw == null) return null;
        Double v = Xml.number(el, name);
        if (v == null) {
            report.warn("bpmn2-di", "Invalid number in attribute '" + name + "': '" + raw + "' (" + context + ").");
        }
        return v;
    }

    private static String firstNonNull(String... values) {
        for (String v : values) {
            if (v != null) return v;
        }
        return null;
    }
}
