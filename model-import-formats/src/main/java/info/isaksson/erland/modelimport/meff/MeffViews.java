package info.isaksson.erland.modelimport.meff;

import info.isaksson.erland.modelimport.ir.IrBounds;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.ir.IrPoint;
import info.isaksson.erland.modelimport.ir.IrView;
import info.isaksson.erland.modelimport.ir.IrViewConnection;
import info.isaksson.erland.modelimport.ir.IrViewNode;
import info.isaksson.erland.modelimport.ir.IrViewNodeKind;
import info.isaksson.erland.modelimport.report.ImportReport;
import info.isaksson.erland.modelimport.xml.Xml;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** {@code <views><diagrams><view>} to IR views. */
final class MeffViews {

    private static final String[] ELEMENT_REF_ATTRS = {"elementRef", "conceptRef", "element", "ref"};
    private static final String[] GEOMETRY_TAGS = {"bounds", "geometry", "rect"};

    private final MeffProperties properties;
    private final MeffOrganizations organizations;
    private int autoViewId;

    private MeffViews(MeffProperties properties, MeffOrganizations organizations) {
        this.properties = properties;
        this.organizations = organizations;
    }

    static List<IrView> parse(Element root, MeffProperties properties, MeffOrganizations organizations, ImportReport report) {
        Element viewsRoot = Xml.child(root, "views");
        if (viewsRoot == null) viewsRoot = Xml.q(root, "views");
        if (viewsRoot == null) viewsRoot = Xml.q(root, "diagrams");
        if (viewsRoot == null) return List.of();

        MeffViews parser = new MeffViews(properties, organizations);
        List<IrView> views = new ArrayList<>();
        for (Element candidate : Xml.qa(viewsRoot, "view")) {
            if (hasContent(candidate)) views.add(parser.view(candidate));
        }
        for (Element candidate : Xml.qa(viewsRoot, "diagram")) {
            if (hasContent(candidate)) views.add(parser.view(candidate));
        }
        if (views.isEmpty()) {
            report.warn("meff-views", "MEFF: Found <views> section, but did not recognize any <view> / <diagram> entries.");
        }
        return views;
    }

    private static boolean hasContent(Element el) {
        return !Xml.qa(el, "node").isEmpty() || !Xml.qa(el, "connection").isEmpty() || !Xml.qa(el, "edge").isEmpty();
    }

    private IrView view(Element vEl) {
        String id = Xml.attrTrim(vEl, "identifier", "id");
        if (id == null) id = "view-auto-" + (++autoViewId);

        String name = Xml.attrTrim(vEl, "name", "label");
        if (name == null) name = Xml.childText(vEl, "name");
        if (name == null) name = Xml.childText(vEl, "label");
        if (name == null) name = "View";

        String documentation = Xml.childText(vEl, "documentation");
        String viewpoint = Xml.attrTrim(vEl, "viewpoint", "viewpointId", "viewpointRef");
        if (viewpoint == null) viewpoint = Xml.childText(vEl, "viewpoint");

        List<IrViewNode> nodes = new ArrayList<>();
        int[] autoNodeId = {0};
        for (Element c : Xml.children(vEl)) {
            if (Xml.is(c, "node")) {
                node(c, null, nodes, autoNodeId);
            } else if (Xml.is(c, "nodes")) {
                for (Element nn : Xml.children(c, "node")) node(nn, null, nodes, autoNodeId);
            }
        }

        List<IrViewConnection> connections = new ArrayList<>();
        int autoConnId = 0;
        List<Element> connEls = new ArrayList<>(Xml.qa(vEl, "connection"));
        connEls.addAll(Xml.qa(vEl, "edge"));
        for (Element cEl : connEls) {
            String relationshipId = Xml.attrTrim(cEl, "relationshipRef", "relationRef", "ref");
            if (relationshipId == null) relationshipId = Xml.childText(cEl, "relationshipRef");
            String sourceNodeId = Xml.attrTrim(cEl, "sourceNode", "sourceNodeRef", "sourceRef", "source");
            String targetNodeId = Xml.attrTrim(cEl, "targetNode", "targetNodeRef", "targetRef", "target");
            if (relationshipId == null && sourceNodeId == null && targetNodeId == null) continue;

            String connId = Xml.attrTrim(cEl, "identifier", "id");
            if (connId == null) {
                autoConnId++;
                connId = relationshipId != null ? relationshipId + "#" + autoConnId : "conn-auto-" + autoConnId;
            }
            String label = Xml.childText(cEl, "label");
            if (label == null) label = Xml.attrTrim(cEl, "label", "name");

            connections.add(new IrViewConnection(connId, relationshipId, sourceNodeId, targetNodeId,
                    Xml.attrTrim(cEl, "sourceElementRef"), Xml.attrTrim(cEl, "targetElementRef"),
                    label, points(cEl), properties.taggedValues(cEl), null, zIndexMeta(cEl, null)));
        }

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(IrMeta.OWNING_ELEMENT_ID, organizations.refToParentRef.get(id));
        return new IrView(id, name, documentation, organizations.refToFolder.get(id), viewpoint,
                nodes, connections, null, null, meta);
    }

    private void node(Element nodeEl, String parentNodeId, List<IrViewNode> out, int[] autoNodeId) {
        String elementId = Xml.attrTrim(nodeEl, ELEMENT_REF_ATTRS);
        if (elementId == null) elementId = Xml.childText(nodeEl, "elementRef");
        if (elementId == null) elementId = Xml.childText(nodeEl, "conceptRef");

        String nodeId = Xml.attrTrim(nodeEl, "identifier", "id");
        if (nodeId == null) nodeId = Xml.attrTrim(nodeEl, "elementRef", "conceptRef");
        if (nodeId == null) nodeId = "node-auto-" + (++autoNodeId[0]);

        String label = Xml.attrTrim(nodeEl, "label", "name");
        if (label == null) label = Xml.childText(nodeEl, "label");
        if (label == null) label = Xml.childText(nodeEl, "name");
        if (label == null) label = Xml.childText(nodeEl, "text");

        IrViewNodeKind kind;
        String objectType;
        if (elementId != null) {
            kind = IrViewNodeKind.ELEMENT;
            objectType = null;
        } else {
            String t = Xml.type(nodeEl);
            t = t == null ? "" : t.toLowerCase(Locale.ROOT);
            if (t.contains("note")) {
                kind = IrViewNodeKind.NOTE;
                objectType = "Note";
            } else if (t.contains("group") || t.contains("container")) {
                kind = IrViewNodeKind.GROUP;
                objectType = "GroupBox";
            } else if (t.contains("label")) {
                kind = IrViewNodeKind.LABEL;
                objectType = "Label";
            } else {
                kind = IrViewNodeKind.OTHER;
                objectType = "Label";
            }
        }

        out.add(new IrViewNode(nodeId, kind, elementId, parentNodeId, label, bounds(nodeEl),
                properties.taggedValues(nodeEl), null, zIndexMeta(nodeEl, objectType)));

        for (Element c : Xml.children(nodeEl, "node")) node(c, nodeId, out, autoNodeId);
    }

    /** Attributes on the node itself, else a direct geometry child, else any geometry descendant. */
    private static IrBounds bounds(Element el) {
        IrBounds direct = boundsFrom(el);
        if (direct != null) return direct;
        for (String tag : GEOMETRY_TAGS) {
            for (Element c : Xml.children(el, tag)) {
                IrBounds b = boundsFrom(c);
                if (b != null) return b;
            }
        }
        for (String tag : GEOMETRY_TAGS) {
            for (Element d : Xml.qa(el, tag)) {
                IrBounds b = boundsFrom(d);
                if (b != null) return b;
            }
        }
        return null;
    }

    private static IrBounds boundsFrom(Element el) {
        Double x = Xml.number(el, "x", "left", "posX");
        Double y = Xml.number(el, "y", "top", "posY");
        Double w = Xml.number(el, "w", "width");
        Double h = Xml.number(el, "h", "height");
        if (x == null || y == null || w == null || h == null) return null;
        return new IrBounds(x, y, w, h);
    }

    private static List<IrPoint> points(Element cEl) {
        List<IrPoint> out = new ArrayList<>();
        collectPoints(cEl, out);
        return out;
    }

    private static void collectPoints(Element el, List<IrPoint> out) {
        for (Element c : Xml.children(el)) {
            if (Xml.is(c, "bendpoint") || Xml.is(c, "point") || Xml.is(c, "waypoint")) {
                Double x = Xml.number(c, "x", "posX");
                Double y = Xml.number(c, "y", "posY");
                if (x != null && y != null) out.add(new IrPoint(x, y));
            }
            collectPoints(c, out);
        }
    }

    private static Map<String, Object> zIndexMeta(Element el, String objectType) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(IrMeta.OBJECT_TYPE, objectType);
        meta.put("zIndex", Xml.number(el, "z", "zIndex", "order"));
        return meta;
    }
}
