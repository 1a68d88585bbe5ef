package info.isaksson.erland.modelimport.eaxmi;

import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.xml.Xml;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Attribute conventions shared by the Sparx EA XMI readers. */
final class EaXmi {

    static final String SOURCE = IrMeta.Formats.EA_XMI;
    static final String SYSTEM_XMI = "xmi";
    static final String SYSTEM_EA = "sparx-ea";

    static final String ARCHIMATE_PROFILE_MARKER = "sparxsystems.com/profiles/archimate";
    static final String BPMN_PROFILE_MARKER = "sparxsystems.com/profiles/bpmn";

    static final Map<String, String> UML_ELEMENT_TYPES = umlElementTypes();
    static final Map<String, String> UML_RELATIONSHIP_TYPES = umlRelationshipTypes();

    private static final Pattern HEX_ENTITY = Pattern.compile("&#x([0-9a-fA-F]+);");
    private static final Pattern DEC_ENTITY = Pattern.compile("&#(\\d+);");

    private EaXmi() {}

    static String xmiId(Element el) {
        return Xml.attrTrim(el, "xmi:id");
    }

    static String xmiIdRef(Element el) {
        return Xml.attrTrim(el, "xmi:idref", "idref");
    }

    static String xmiType(Element el) {
        return Xml.attrTrim(el, "xmi:type");
    }

    /** {@code uml:Class} gives {@code Class}; null without an {@code xmi:type}. */
    static String metaclass(Element el) {
        String t = xmiType(el);
        if (t == null) return null;
        int idx = t.indexOf(':');
        String mc = idx >= 0 ? t.substring(idx + 1).trim() : t;
        return mc.isEmpty() ? null : mc;
    }

    /** Unprefixed attribute only; {@code type} must not pick up {@code xmi:type}. */
    static String plainAttr(Element el, String name) {
        if (el == null || !el.hasAttribute(name)) return null;
        String v = el.getAttribute(name).trim();
        return v.isEmpty() ? null : v;
    }

    static String guid(Element el) {
        return Xml.attrTrim(el, "ea_guid", "ea:guid", "guid");
    }

    static String stereotype(Element el) {
        String direct = Xml.attrTrim(el, "stereotype", "stereotypes", "xmi:stereotype");
        if (direct != null) return direct;
        for (Element props : Xml.children(el, "properties")) {
            String st = Xml.attrTrim(props, "stereotype", "stereotypes", "xmi:stereotype");
            if (st != null) return st;
        }
        return null;
    }

    static boolean isPackage(Element el) {
        String ln = Xml.localName(el);
        if (ln.equals("package")) return true;
        if (!ln.equals("packagedelement")) return false;
        String t = xmiType(el);
        return t != null && t.toLowerCase(Locale.ROOT).endsWith("package");
    }

    static boolean isEaExtension(Element el) {
        if (!Xml.is(el, "extension")) return false;
        String extender = Xml.attrAny(el, "extender");
        return extender != null && extender.toLowerCase(Locale.ROOT).contains("enterprise architect");
    }

    /** True for anything nested under an {@code xmi:Extension}. */
    static boolean isInsideExtension(Element el) {
        for (Element p = Xml.parent(el); p != null; p = Xml.parent(p)) {
            if (Xml.is(p, "extension")) return true;
        }
        return false;
    }

    static boolean inNamespace(Element el, String marker) {
        String uri = el.getNamespaceURI();
        return uri != null && uri.toLowerCase(Locale.ROOT).contains(marker);
    }

    static String decodeNumericEntities(String input) {
        String s = replace(HEX_ENTITY, input, 16);
        return replace(DEC_ENTITY, s, 10);
    }

    private static String replace(Pattern p, String input, int radix) {
        Matcher m = p.matcher(input);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String repl;
            try {
                repl = new String(Character.toChars(Integer.parseInt(m.group(1), radix)));
            } catch (IllegalArgumentException e) {
                repl = m.group();
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(repl));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Ids an element refers to through {@code names}: a whitespace separated idref list in an attribute,
     * else children of that name carrying {@code xmi:idref} or an {@code href} fragment.
     */
    static List<String> refIds(Element el, String... names) {
        List<String> out = new ArrayList<>();
        for (String name : names) {
            String raw = Xml.attrTrim(el, name);
            if (raw != null) {
                for (String tok : raw.split("\\s+")) {
                    if (!tok.isEmpty() && !out.contains(tok)) out.add(tok);
                }
            }
            for (Element ch : Xml.children(el, name)) {
                String ref = refOf(ch);
                if (ref != null && !out.contains(ref)) out.add(ref);
            }
            if (!out.isEmpty()) return out;
        }
        return out;
    }

    /** {@code xmi:idref}, else the fragment of an {@code href}. */
    static String refOf(Element el) {
        String idref = xmiIdRef(el);
        if (idref != null) return idref;
        String href = Xml.attrTrim(el, "href");
        if (href == null) return null;
        int hash = href.lastIndexOf('#');
        String frag = hash >= 0 ? href.substring(hash + 1).trim() : href;
        return frag.isEmpty() ? null : frag;
    }

    /** Id variants used for lookups: as is, lower-cased, and without GUID braces. */
    static List<String> refTokens(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) return out;
        String s = raw.trim();
        if (s.isEmpty()) return out;
        addUnique(out, s);
        addUnique(out, s.toLowerCase(Locale.ROOT));
        if (s.startsWith("{") && s.endsWith("}") && s.length() > 2) {
            String inner = s.substring(1, s.length() - 1).trim();
            if (!inner.isEmpty()) {
                addUnique(out, inner);
                addUnique(out, inner.toLowerCase(Locale.ROOT));
            }
        }
        return out;
    }

    private static void addUnique(List<String> out, String s) {
        if (!out.contains(s)) out.add(s);
    }

    private static Map<String, String> umlElementTypes() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("Class", "uml.class");
        m.put("Interface", "uml.interface");
        m.put("Enumeration", "uml.enum");
        m.put("Enum", "uml.enum");
        m.put("DataType", "uml.datatype");
        m.put("PrimitiveType", "uml.primitiveType");
        m.put("Component", "uml.component");
        m.put("Artifact", "uml.artifact");
        m.put("Node", "uml.node");
        m.put("Device", "uml.device");
        m.put("ExecutionEnvironment", "uml.executionEnvironment");
        m.put("Actor", "uml.actor");
        m.put("UseCase", "uml.usecase");
        m.put("Comment", "uml.note");
        m.put("Note", "uml.note");
        m.put("AssociationClass", "uml.associationClass");
        return m;
    }

    private static Map<String, String> umlRelationshipTypes() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("Association", "uml.association");
        m.put("Dependency", "uml.dependency");
        m.put("Usage", "uml.dependency");
        m.put("Abstraction", "uml.dependency");
        m.put("Generalization", "uml.generalization");
        m.put("Realization", "uml.realization");
        m.put("InterfaceRealization", "uml.realization");
        m.put("Include", "uml.include");
        m.put("Extend", "uml.extend");
        m.put("Deployment", "uml.deployment");
        m.put("CommunicationPath", "uml.communicationPath");
        m.put("ControlFlow", "uml.controlFlow");
        m.put("ObjectFlow", "uml.objectFlow");
        return m;
    }

    /** UML relationship type for a metaclass, falling back to include/extend/deployment stereotypes. */
    static String umlRelationshipType(String metaclass, String stereotype) {
        if (metaclass != null) {
            String hit = UML_RELATIONSHIP_TYPES.get(metaclass.trim());
            if (hit != null && !hit.equals("uml.dependency")) return hit;
            if (hit != null && stereotype == null) return hit;
        }
        if (stereotype != null) {
            String byStereotype = switch (stereotype.trim().toLowerCase(Locale.ROOT)) {
                case "include" -> "uml.include";
                case "extend" -> "uml.extend";
                case "deployment" -> "uml.deployment";
                default -> null;
            };
            if (byStereotype != null) return byStereotype;
        }
        return metaclass == null ? null : UML_RELATIONSHIP_TYPES.get(metaclass.trim());
    }
}
