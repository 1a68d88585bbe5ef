package info.isaksson.erland.modelimport.eaxmi;

import info.isaksson.erland.modelimport.ir.IrBounds;
import info.isaksson.erland.modelimport.ir.IrExternalId;
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
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Diagrams recorded in the EA {@code xmi:Extension}. Each diagram becomes a view whose nodes and connections
 * still carry raw references ({@code meta.refRaw}); {@link EaXmiNormalizer} binds them to elements and relationships.
 */
final class EaDiagramParser {

    static final String REF_RAW = IrMeta.REF_RAW;

    static final String[] NODE_REF_KEYS = {
            "subject", "subjectid", "subject_id", "element", "elementid", "element_id",
            "classifier", "classifierid", "classifier_id", "instance", "instanceid", "instance_id",
            "xmi:idref", "idref", "ref", "href"};

    static final String[] LINK_REL_KEYS = {
            "connector", "connectorid", "connector_id", "relationship", "relationshipid", "relationship_id",
            "rel", "relid", "xmi:idref", "idref", "ref", "href"};
    static final String[] LINK_SOURCE_KEYS = {
            "source", "sourceid", "source_id", "src", "from", "start", "startid", "start_id", "object1", "client"};
    static final String[] LINK_TARGET_KEYS = {
            "target", "targetid", "target_id", "tgt", "to", "end", "endid", "end_id", "object2", "supplier"};

    private static final String[] POINTS_KEYS = {"points", "waypoints", "bendpoints", "path", "route"};
    private static final String[] BOUNDS_STRING_KEYS = {"geometry", "bounds", "rect", "rectangle", "position", "pos"};

    private static final Pattern KEY_VALUE = Pattern.compile("^([a-zA-Z]+)\\s*=\\s*(-?\\d+(?:\\.\\d+)?)$");
    private static final Pattern POINT = Pattern.compile("(-?\\d+(?:\\.\\d+)?)\\s*[: ,]\\s*(-?\\d+(?:\\.\\d+)?)");
    private static final int MAX_POINTS = 2000;

    private final ImportReport report;
    private int diagramSynth;
    private int objectSynth;
    private int linkSynth;

    private EaDiagramParser(ImportReport report) {
        this.report = report;
    }

    static List<IrView> parse(EaXmiDocument xmi, ImportReport report) {
        List<Element> extensions = xmi.eaExtensions();
        List<IrView> views = new ArrayList<>();
        if (extensions.isEmpty()) {
            report.warn("ea-xmi:no-ea-extension",
                    "EA XMI: No Enterprise Architect <xmi:Extension> element found; skipping diagram import.");
            return views;
        }
        EaDiagramParser p = new EaDiagramParser(report);
        Set<String> seen = new HashSet<>();
        for (Element ext : extensions) {
            for (Element d : descendants(ext)) {
                if (!isDiagram(d)) continue;
                IrView view = p.view(d, views.size() + 1);
                if (!seen.add(view.id)) {
                    report.warn("EA XMI: Duplicate diagram id \"" + view.id + "\" encountered; skipping subsequent occurrence.");
                    continue;
                }
                views.add(view);
            }
        }
        return views;
    }

    // Catalog

    static boolean isDiagram(Element el) {
        String ln = Xml.localName(el);
        return ln.equals("diagram") || (ln.endsWith("diagram") && !ln.contains("diagramobject") && !ln.contains("diagramlink"));
    }

    private IrView view(Element d, int ordinal) {
        Element props = Xml.child(d, "properties");
        String name = Xml.attrTrim(d, "name", "diagramname", "diagram_name", "title");
        if (name == null) name = Xml.childText(d, "name");
        if (name == null && props != null) name = Xml.attrTrim(props, "name");

        String guid = Xml.attrTrim(d, "ea_guid", "guid", "uuid");
        String xmiId = EaXmi.xmiId(d);
        String anyId = Xml.attrTrim(d, "xmi:idref", "diagramid", "diagram_id");
        List<IrExternalId> ext = new ArrayList<>();
        if (xmiId != null) ext.add(IrExternalId.of(EaXmi.SYSTEM_XMI, xmiId, "xmi-id"));
        if (guid != null) ext.add(IrExternalId.of(EaXmi.SYSTEM_EA, guid, "diagram-guid"));
        if (anyId != null && !anyId.equals(xmiId) && !anyId.equals(guid)) {
            ext.add(IrExternalId.of(EaXmi.SYSTEM_EA, anyId, "diagram-id"));
        }
        String id = guid != null ? guid : xmiId != null ? xmiId : anyId;
        if (id == null) {
            String base = name != null ? name : "diagram";
            id = "eaDiagram_synth_" + (++diagramSynth) + "_" + slug(base);
            report.warn("EA XMI: Diagram missing id/guid; generated synthetic diagram id \"" + id + "\" (name=\"" + base + "\").");
        }
        if (name == null) name = "Diagram " + ordinal;

        String type = diagramType(d, props);
        String packageRef = owningPackage(d);
        String notes = Xml.attrTrim(d, "notes", "documentation", "description");
        if (notes == null) notes = Xml.childText(d, "notes");
        if (notes == null && props != null) notes = Xml.attrTrim(props, "documentation", "notes");

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(IrMeta.SOURCE_SYSTEM, EaXmi.SYSTEM_EA);
        meta.put("eaDiagramType", type);
        meta.put("owningPackageId", packageRef);

        List<IrViewNode> nodes = new ArrayList<>();
        List<IrViewConnection> connections = new ArrayList<>();
        Set<String> nodeIds = new HashSet<>();
        Set<String> connIds = new HashSet<>();
        for (Element el : descendants(d)) {
            if (isLink(el)) {
                IrViewConnection c = connection(el, name, connIds);
                connections.add(c);
            } else if (isObject(el)) {
                nodes.add(node(el, name, nodeIds));
            }
        }
        return new IrView(id, name, notes, packageRef, type, nodes, connections, null, ext, meta);
    }

    private static String diagramType(Element d, Element props) {
        String direct = Xml.attrTrim(d, "diagramtype", "diagram_type");
        if (direct == null) direct = EaXmi.plainAttr(d, "type");
        if (direct != null) return direct;
        if (props == null) return null;
        String t = Xml.attrTrim(props, "diagramtype", "diagram_type");
        return t != null ? t : EaXmi.plainAttr(props, "type");
    }

    private static String owningPackage(Element d) {
        String direct = Xml.attrTrim(d, "package", "packageid", "package_id", "owner", "ownerid", "parent");
        if (direct != null) return direct;
        for (Element ch : Xml.children(d)) {
            String ln = Xml.localName(ch);
            if (ln.equals("model")) {
                String ref = Xml.attrTrim(ch, "package", "owner");
                if (ref != null) return ref;
            }
            if (ln.equals("package") || ln.equals("owner") || ln.equals("parent")) {
                String ref = EaXmi.refOf(ch);
                if (ref == null) ref = EaXmi.xmiId(ch);
                if (ref != null) return ref;
            }
        }
        return null;
    }

    private static String slug(String s) {
        String out = s.toLowerCase(Locale.ROOT).replaceAll("\\s+", "-").replaceAll("[^a-z0-9_-]", "");
        return out.length() > 40 ? out.substring(0, 40) : out;
    }

    // Objects

    static boolean isObject(Element el) {
        String ln = Xml.localName(el);
        if (ln.endsWith("diagramobject")) return true;
        if (ln.equals("element")) {
            return Xml.attrTrim(el, "geometry") != null || Xml.attrTrim(el, "subject") != null;
        }
        if (ln.endsWith("object")) {
            return Xml.attrTrim(el, "l", "left", "x", "geometry", "bounds", "rect", "position") != null
                    || Xml.attrTrim(el, NODE_REF_KEYS) != null;
        }
        return false;
    }

    private IrViewNode node(Element el, String viewName, Set<String> seen) {
        objectSynth++;
        String guid = Xml.attrTrim(el, "ea_guid", "guid", "uuid");
        String xmiId = EaXmi.xmiId(el);
        String anyId = Xml.attrTrim(el, "objectid", "object_id", "diagramobjectid");
        String duid = styleValue(Xml.attrTrim(el, "style"), "DUID");

        List<IrExternalId> ext = new ArrayList<>();
        if (xmiId != null) ext.add(IrExternalId.of(EaXmi.SYSTEM_XMI, xmiId, "diagram-object-xmi-id"));
        if (guid != null) ext.add(IrExternalId.of(EaXmi.SYSTEM_EA, guid, "diagram-object-guid"));
        if (anyId != null && !anyId.equals(xmiId) && !anyId.equals(guid)) {
            ext.add(IrExternalId.of(EaXmi.SYSTEM_EA, anyId, "diagram-object-id"));
        }
        if (duid != null) ext.add(IrExternalId.of(EaXmi.SYSTEM_EA, duid, "diagram-object-duid"));

        String id = guid != null ? guid : xmiId != null ? xmiId : anyId != null ? anyId
                : duid != null ? duid : "eaDiagramObject_synth_" + objectSynth;
        if (!seen.add(id)) {
            String dup = id + "__dup_" + objectSynth;
            report.warn("EA XMI: Duplicate diagram object id \"" + id + "\" in view \"" + viewName
                    + "\"; disambiguated to \"" + dup + "\".");
            seen.add(dup);
            id = dup;
        }

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(IrMeta.SOURCE_SYSTEM, EaXmi.SYSTEM_EA);
        meta.put(REF_RAW, refRaw(el, NODE_REF_KEYS));
        String seq = Xml.attrTrim(el, "seqno");
        if (seq != null) meta.put("zIndex", seq);
        return new IrViewNode(id, kind(el), null, null, null, bounds(el), null, ext, meta);
    }

    private static IrViewNodeKind kind(Element el) {
        String ln = Xml.localName(el);
        String t = Xml.attrTrim(el, "kind", "objecttype", "stereotype");
        if (t == null) t = EaXmi.plainAttr(el, "type");
        t = t == null ? "" : t.toLowerCase(Locale.ROOT);
        if (ln.contains("note") || t.contains("note")) return IrViewNodeKind.NOTE;
        if (t.contains("group") || t.contains("boundary") || t.contains("container")) return IrViewNodeKind.GROUP;
        if (t.contains("image") || t.contains("bitmap") || t.contains("icon")) return IrViewNodeKind.IMAGE;
        if (t.contains("shape") || t.contains("rectangle") || t.contains("line")) return IrViewNodeKind.SHAPE;
        return IrViewNodeKind.ELEMENT;
    }

    /** {@code l/t/r/b}, then {@code x/y/w/h}, then a geometry string; null when nothing usable is present. */
    static IrBounds bounds(Element el) {
        Double l = Xml.number(el, "l", "left");
        Double r = Xml.number(el, "r", "right");
        Double t = Xml.number(el, "t", "top");
        Double b = Xml.number(el, "b", "bottom");
        if (l != null && r != null && t != null && b != null) {
            IrBounds lr = fromEdges(l, t, r, b);
            if (lr != null) return lr;
        }
        Double x = Xml.number(el, "x");
        Double y = Xml.number(el, "y");
        Double w = Xml.number(el, "w", "width");
        Double h = Xml.number(el, "h", "height");
        if (x != null && y != null && w != null && h != null && w > 0 && h > 0) return new IrBounds(x, y, w, h);

        String raw = Xml.attrTrim(el, BOUNDS_STRING_KEYS);
        return raw == null ? null : parseBoundsString(raw);
    }

    private static IrBounds fromEdges(double l, double t, double r, double b) {
        double w = r - l;
        double h = b - t;
        return w > 0 && h > 0 ? new IrBounds(l, t, w, h) : null;
    }

    /** {@code "Left=10;Top=20;Right=110;Bottom=70;"}, {@code "x=..;y=..;w=..;h=.."} or four numbers. */
    static IrBounds parseBoundsString(String raw) {
        String s = raw.trim();
        if (s.isEmpty()) return null;
        if (s.contains("=")) {
            Map<String, Double> kv = new HashMap<>();
            for (String part : s.split("[;,\\s]+")) {
                Matcher m = KEY_VALUE.matcher(part.trim());
                if (m.matches()) kv.put(m.group(1).toLowerCase(Locale.ROOT), Double.parseDouble(m.group(2)));
            }
            Double l = first(kv, "l", "left");
            Double r = first(kv, "r", "right");
            Double t = first(kv, "t", "top");
            Double b = first(kv, "b", "bottom");
            if (l != null && r != null && t != null && b != null) return fromEdges(l, t, r, b);
            Double x = kv.get("x");
            Double y = kv.get("y");
            Double w = first(kv, "w", "width");
            Double h = first(kv, "h", "height");
            if (x != null && y != null && w != null && h != null && w > 0 && h > 0) return new IrBounds(x, y, w, h);
            return null;
        }
        List<Double> nums = numbers(s);
        if (nums.size() < 4) return null;
        double a = nums.get(0);
        double b = nums.get(1);
        double c = nums.get(2);
        double d = nums.get(3);
        if (c > a && d > b) return fromEdges(a, b, c, d);
        return c > 0 && d > 0 ? new IrBounds(a, b, c, d) : null;
    }

    private static Double first(Map<String, Double> kv, String a, String b) {
        Double v = kv.get(a);
        return v != null ? v : kv.get(b);
    }

    private static List<Double> numbers(String s) {
        List<Double> out = new ArrayList<>();
        for (String p : s.split("[^0-9.+-]+")) {
            if (p.isEmpty()) continue;
            try {
                double d = Double.parseDouble(p);
                if (Double.isFinite(d)) out.add(d);
            } catch (NumberFormatException e) {
                // separators like "+" or "." on their own
            }
        }
        return out;
    }

    // Links

    static boolean isLink(Element el) {
        String ln = Xml.localName(el);
        if (ln.endsWith("diagramlink") || ln.endsWith("diagramconnector")) return true;
        if (ln.equals("element")) {
            String style = Xml.attrTrim(el, "style");
            String geo = Xml.attrTrim(el, "geometry");
            String g = geo == null ? "" : geo.toLowerCase(Locale.ROOT);
            boolean edgeGeometry = g.contains("edge=") || g.contains("sx=") || g.contains("sy=");
            return Xml.attrTrim(el, "subject") != null && styleValue(style, "SOID") != null
                    && styleValue(style, "EOID") != null && edgeGeometry;
        }
        if (ln.endsWith("link")) {
            return Xml.attrTrim(el, LINK_REL_KEYS) != null || Xml.attrTrim(el, POINTS_KEYS) != null;
        }
        return false;
    }

    private IrViewConnection connection(Element el, String viewName, Set<String> seen) {
        linkSynth++;
        String guid = Xml.attrTrim(el, "ea_guid", "guid", "uuid");
        String xmiId = EaXmi.xmiId(el);
        String anyId = Xml.attrTrim(el, "linkid", "link_id", "diagramlinkid");
        List<IrExternalId> ext = new ArrayList<>();
        if (xmiId != null) ext.add(IrExternalId.of(EaXmi.SYSTEM_XMI, xmiId, "diagram-link-xmi-id"));
        if (guid != null) ext.add(IrExternalId.of(EaXmi.SYSTEM_EA, guid, "diagram-link-guid"));
        if (anyId != null && !anyId.equals(xmiId) && !anyId.equals(guid)) {
            ext.add(IrExternalId.of(EaXmi.SYSTEM_EA, anyId, "diagram-link-id"));
        }
        String id = guid != null ? guid : xmiId != null ? xmiId : anyId;
        if (id == null) {
            String subject = Xml.attrTrim(el, "subject");
            if (subject != null) {
                ext.add(IrExternalId.of(EaXmi.SYSTEM_EA, subject, "diagram-link-subject"));
                id = subject;
            } else {
                id = "eaDiagramLink_synth_" + linkSynth;
                report.warn("EA XMI: Diagram link missing id; generated synthetic link id \"" + id + "\".");
            }
        }
        if (!seen.add(id)) {
            String dup = id + "__dup_" + linkSynth;
            report.warn("EA XMI: Duplicate diagram link id \"" + id + "\" in view \"" + viewName
                    + "\"; disambiguated to \"" + dup + "\".");
            seen.add(dup);
            id = dup;
        }

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(IrMeta.SOURCE_SYSTEM, EaXmi.SYSTEM_EA);
        meta.put(REF_RAW, linkRefRaw(el));
        return new IrViewConnection(id, null, null, null, null, null, Xml.attrTrim(el, "name", "label"),
                points(el), null, ext, meta);
    }

    private static Map<String, Object> linkRefRaw(Element el) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.putAll(refRaw(el, LINK_REL_KEYS));
        out.putAll(refRaw(el, LINK_SOURCE_KEYS));
        out.putAll(refRaw(el, LINK_TARGET_KEYS));
        if (Xml.is(el, "element")) {
            String style = Xml.attrTrim(el, "style");
            out.put("connector", Xml.attrTrim(el, "subject"));
            out.put("source", styleValue(style, "SOID"));
            out.put("target", styleValue(style, "EOID"));
        }
        for (Element ch : Xml.children(el)) {
            String ln = Xml.localName(ch);
            String ref = EaXmi.refOf(ch);
            if (ref == null) ref = EaXmi.xmiId(ch);
            if (ref == null) continue;
            switch (ln) {
                case "source", "from", "start" -> out.put("source", ref);
                case "target", "to", "end" -> out.put("target", ref);
                case "connector", "relationship" -> out.put("connector", ref);
                default -> { }
            }
        }
        out.values().removeIf(v -> v == null);
        return out;
    }

    static List<IrPoint> points(Element link) {
        String explicit = Xml.attrTrim(link, POINTS_KEYS);
        if (explicit != null) return pointList(explicit);
        String geometry = Xml.attrTrim(link, "geometry");
        return geometry == null ? null : geometryPath(geometry);
    }

    private static List<IrPoint> pointList(String raw) {
        List<Double> nums = numbers(raw);
        if (nums.size() < 4) return null;
        List<IrPoint> pts = new ArrayList<>();
        for (int i = 0; i + 1 < nums.size(); i += 2) pts.add(new IrPoint(nums.get(i), nums.get(i + 1)));
        return pts;
    }

    /** Bend points from the {@code Path=} entry of an EA link geometry ({@code "Path=10:20$30:40$;"}). */
    static List<IrPoint> geometryPath(String geometry) {
        String[] tokens = geometry.split(";");
        StringBuilder path = null;
        for (String raw : tokens) {
            String tok = raw.trim();
            if (tok.isEmpty()) continue;
            if (path == null) {
                if (tok.toLowerCase(Locale.ROOT).startsWith("path") && tok.contains("=")) {
                    path = new StringBuilder(tok.substring(tok.indexOf('=') + 1).trim());
                }
            } else if (tok.contains("=")) {
                break;
            } else {
                path.append(';').append(tok);
            }
        }
        if (path == null || path.length() == 0) return null;
        List<IrPoint> pts = new ArrayList<>();
        Matcher m = POINT.matcher(path);
        while (m.find() && pts.size() <= MAX_POINTS) {
            pts.add(new IrPoint(Double.parseDouble(m.group(1)), Double.parseDouble(m.group(2))));
        }
        if (pts.size() >= 2) return pts;
        return pointList(path.toString());
    }

    // Shared

    private static Map<String, Object> refRaw(Element el, String[] keys) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String k : keys) {
            String v = k.contains(":") ? Xml.attrTrim(el, k) : EaXmi.plainAttr(el, k);
            if (v != null) out.put(k, v);
        }
        return out;
    }

    /** Value of {@code key} in an EA {@code "K1=v1;K2=v2;"} style string, case-insensitive. */
    static String styleValue(String style, String key) {
        if (style == null) return null;
        for (String part : style.split(";")) {
            int eq = part.indexOf('=');
            if (eq <= 0) continue;
            if (!part.substring(0, eq).trim().equalsIgnoreCase(key)) continue;
            String v = part.substring(eq + 1).trim();
            if (!v.isEmpty()) return v;
        }
        return null;
    }

    private static List<Element> descendants(Element root) {
        List<Element> out = new ArrayList<>();
        collect(root, out);
        return out;
    }

    private static void collect(Element el, List<Element> out) {
        for (Element ch : Xml.children(el)) {
            out.add(ch);
            collect(ch, out);
        }
    }
}
