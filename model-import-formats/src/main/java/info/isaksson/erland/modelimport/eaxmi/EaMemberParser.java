package info.isaksson.erland.modelimport.eaxmi;

import info.isaksson.erland.modelimport.xml.Xml;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Attributes and operations of a UML classifier, recorded as {@code meta.umlMembers}:
 * {@code {attributes: [...], operations: [...]}} with plain string/boolean values.
 */
final class EaMemberParser {

    private static final Set<String> VISIBILITIES = Set.of("public", "private", "protected", "package");

    private EaMemberParser() {}

    static Map<String, Object> members(Element classifier, EaXmiDocument xmi) {
        List<Object> attributes = attributes(classifier, xmi);
        List<Object> operations = operations(classifier, xmi);
        if (attributes.isEmpty() && operations.isEmpty()) return null;
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("attributes", attributes);
        out.put("operations", operations);
        return out;
    }

    private static List<Object> attributes(Element classifier, EaXmiDocument xmi) {
        List<Object> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Element a : Xml.children(classifier, "ownedAttribute")) {
            String id = EaXmi.xmiId(a);
            if (id != null) seen.add(id);
            // Association ends are imported as relationships.
            if (Xml.attrTrim(a, "association") != null) continue;
            Map<String, Object> parsed = attribute(a, xmi);
            if (parsed != null) out.add(parsed);
        }
        for (Element wrapper : Xml.children(classifier, "attributes")) {
            for (Element ref : Xml.children(wrapper, "attribute")) {
                String idref = EaXmi.xmiIdRef(ref);
                if (idref == null || !seen.add(idref)) continue;
                Element resolved = xmi.byId(idref);
                if (resolved == null) continue;
                Map<String, Object> parsed = attribute(resolved, xmi);
                if (parsed != null) out.add(parsed);
            }
        }
        return out;
    }

    private static Map<String, Object> attribute(Element a, EaXmiDocument xmi) {
        String name = Xml.attrTrim(a, "name");
        if (name == null) return null;
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("name", name);
        out.put("type", typeName(xmi, typeRef(a)));
        out.put("visibility", visibility(Xml.attrTrim(a, "visibility")));
        if (bool(Xml.attrTrim(a, "isStatic", "static"))) out.put("isStatic", true);
        out.put("multiplicity", EaAssociationParser.multiplicity(a));
        out.put("defaultValue", defaultValue(a));
        out.values().removeIf(v -> v == null);
        return out;
    }

    private static List<Object> operations(Element classifier, EaXmiDocument xmi) {
        List<Object> out = new ArrayList<>();
        for (Element o : Xml.children(classifier, "ownedOperation")) {
            String name = Xml.attrTrim(o, "name");
            if (name == null) continue;
            String returnType = null;
            List<Object> params = new ArrayList<>();
            for (Element p : Xml.children(o, "ownedParameter")) {
                String type = typeName(xmi, typeRef(p));
                if ("return".equals(Xml.attrTrim(p, "direction"))) {
                    if (type != null) returnType = type;
                    continue;
                }
                String pn = Xml.attrTrim(p, "name");
                if (pn == null) continue;
                Map<String, Object> param = new LinkedHashMap<>();
                param.put("name", pn);
                if (type != null) param.put("type", type);
                params.add(param);
            }
            Map<String, Object> op = new LinkedHashMap<>();
            op.put("name", name);
            if (returnType != null) op.put("returnType", returnType);
            String vis = visibility(Xml.attrTrim(o, "visibility"));
            if (vis != null) op.put("visibility", vis);
            if (!params.isEmpty()) op.put("params", params);
            if (bool(Xml.attrTrim(o, "isStatic", "static"))) op.put("isStatic", true);
            if (bool(Xml.attrTrim(o, "isAbstract", "abstract"))) op.put("isAbstract", true);
            out.add(op);
        }
        return out;
    }

    private static String typeRef(Element el) {
        String direct = EaXmi.plainAttr(el, "type");
        if (direct != null) return direct;
        Element t = Xml.child(el, "type");
        return t == null ? null : EaXmi.refOf(t);
    }

    /** Name of the referenced classifier; primitive refs like {@code EAJava_int} are kept as given. */
    private static String typeName(EaXmiDocument xmi, String ref) {
        if (ref == null) return null;
        int hash = ref.lastIndexOf('#');
        String id = hash >= 0 ? ref.substring(hash + 1) : ref;
        Element target = xmi.byId(id);
        if (target != null) {
            String name = Xml.attrTrim(target, "name");
            if (name != null) return name;
        }
        if (id.startsWith("_") || id.startsWith("EAID_") || id.startsWith("EAPK_") || id.length() > 80) return null;
        return id.startsWith("EAJava_") ? id.substring("EAJava_".length()) : id;
    }

    private static String defaultValue(Element el) {
        Element dv = Xml.child(el, "defaultValue");
        if (dv == null) return null;
        String v = Xml.attrTrim(dv, "value", "body");
        if (v != null) return v;
        String t = Xml.text(dv);
        return t.isEmpty() ? null : t;
    }

    private static String visibility(String v) {
        return v != null && VISIBILITIES.contains(v) ? v : null;
    }

    static boolean bool(String v) {
        if (v == null) return false;
        String s = v.trim().toLowerCase(Locale.ROOT);
        return s.equals("true") || s.equals("1") || s.equals("yes");
    }
}
