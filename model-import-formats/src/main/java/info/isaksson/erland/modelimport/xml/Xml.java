package info.isaksson.erland.modelimport.xml;

import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Prefix tolerant DOM access.
 *
 * <p>Exporters disagree on namespace prefixes ({@code bpmn:}, {@code bpmn2:}, {@code ns0:}, none at all),
 * so elements are matched by lower-cased local name and attributes by name or by {@code :name} suffix.</p>
 */
public final class Xml {

    private Xml() {}

    /** Lower-cased local name, falling back to the part of the tag name after the prefix. */
    public static String localName(Element el) {
        String ln = el.getLocalName();
        if (ln == null) {
            ln = el.getTagName();
            int colon = ln.indexOf(':');
            if (colon >= 0) ln = ln.substring(colon + 1);
        }
        return ln.toLowerCase(Locale.ROOT);
    }

    public static boolean is(Element el, String name) {
        return el != null && localName(el).equals(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Attribute value by exact (qualified) name, else the first attribute whose name equals {@code name}
     * or ends with {@code ":" + name}, case-insensitively. Null when absent.
     */
    public static String attr(Element el, String name) {
        if (el == null) return null;
        if (el.hasAttribute(name)) return el.getAttribute(name);
        String needle = name.toLowerCase(Locale.ROOT);
        String suffix = ":" + needle;
        NamedNodeMap attrs = el.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr a = (Attr) attrs.item(i);
            String an = a.getName().toLowerCase(Locale.ROOT);
            if (an.equals(needle) || an.endsWith(suffix)) return a.getValue();
        }
        return null;
    }

    /** First non-null {@link #attr} among {@code names}. */
    public static String attrAny(Element el, String... names) {
        for (String n : names) {
            String v = attr(el, n);
            if (v != null) return v;
        }
        return null;
    }

    /** Trimmed attribute value; null when absent or blank. */
    public static String attrTrim(Element el, String... names) {
        String v = attrAny(el, names);
        if (v == null) return null;
        String t = v.trim();
        return t.isEmpty() ? null : t;
    }

    /** Parsed finite number or null. */
    public static Double number(Element el, String... names) {
        String v = attrTrim(el, names);
        if (v == null) return null;
        try {
            double d = Double.parseDouble(v);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** {@code xsi:type}, then {@code type}. */
    public static String type(Element el) {
        return attrAny(el, "xsi:type", "type");
    }

    /** Trimmed text content, empty string for null. */
    public static String text(Element el) {
        if (el == null) return "";
        String t = el.getTextContent();
        return t == null ? "" : t.trim();
    }

    public static List<Element> children(Node parent) {
        List<Element> out = new ArrayList<>();
        if (parent == null) return out;
        NodeList kids = parent.getChildNodes();
        for (int i = 0; i < kids.getLength(); i++) {
            if (kids.item(i) instanceof Element e) out.add(e);
        }
        return out;
    }

    public static List<Element> children(Node parent, String name) {
        String want = name.toLowerCase(Locale.ROOT);
        List<Element> out = new ArrayList<>();
        for (Element c : children(parent)) {
            if (localName(c).equals(want)) out.add(c);
        }
        return out;
    }

    public static Element child(Node parent, String name) {
        List<Element> all = children(parent, name);
        return all.isEmpty() ? null : all.get(0);
    }

    /** First descendant (depth-first, document order) with matching local name. */
    public static Element q(Node root, String name) {
        List<Element> all = qa(root, name);
        return all.isEmpty() ? null : all.get(0);
    }

    /** All descendants (depth-first, document order) with matching local name. */
    public static List<Element> qa(Node root, String name) {
        String want = name.toLowerCase(Locale.ROOT);
        List<Element> out = new ArrayList<>();
        walk(root, want, out);
        return out;
    }

    private static void walk(Node node, String want, List<Element> out) {
        for (Element c : children(node)) {
            if (localName(c).equals(want)) out.add(c);
            walk(c, want, out);
        }
    }

    /**
     * Text of the direct children named {@code name}, preferring one whose {@code xml:lang} starts with "en".
     * Null when there is no such child or its text is blank.
     */
    public static String childText(Element el, String name) {
        List<Element> matches = children(el, name);
        if (matches.isEmpty()) return null;
        String t = text(pickByLang(matches));
        return t.isEmpty() ? null : t;
    }

    static Element pickByLang(List<Element> nodes) {
        for (Element n : nodes) {
            String lang = n.getAttributeNS("http://www.w3.org/XML/1998/namespace", "lang");
            if (lang == null || lang.isEmpty()) lang = attrAny(n, "xml:lang", "lang");
            if (lang != null && lang.toLowerCase(Locale.ROOT).startsWith("en")) return n;
        }
        return nodes.get(0);
    }

    /** Nearest ancestor element, or null at the document element. */
    public static Element parent(Element el) {
        Node p = el.getParentNode();
        return p instanceof Element e ? e : null;
    }
}
