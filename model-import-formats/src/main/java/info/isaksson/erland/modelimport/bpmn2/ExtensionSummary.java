package info.isaksson.erland.modelimport.bpmn2;

import info.isaksson.erland.modelimport.xml.Xml;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens a BPMN {@code extensionElements} block into string key/values.
 *
 * <p>{@code <x:property name="k" value="v"/>} style entries become {@code k=v}; other leaf elements become
 * {@code localName=text}; attributes of non-leaf entries become {@code localName.attr=value}.
 * The first value for a key wins. Size limits are applied later by the normalizer.</p>
 */
final class ExtensionSummary {

    private ExtensionSummary() {}

    static Map<String, String> of(Element owner) {
        Element ext = Xml.child(owner, "extensionElements");
        if (ext == null) return Map.of();
        Map<String, String> out = new LinkedHashMap<>();
        collect(ext, out);
        return out;
    }

    private static void collect(Element parent, Map<String, String> out) {
        for (Element e : Xml.children(parent)) {
            String ln = e.getLocalName() == null ? Xml.localName(e) : e.getLocalName();
            String name = Xml.attrTrim(e, "name", "key");
            String value = Xml.attrAny(e, "value");
            List<Element> kids = Xml.children(e);

            if (name != null && value != null) {
                out.putIfAbsent(name, value.trim());
            } else if (kids.isEmpty()) {
                String text = Xml.text(e);
                if (!text.isEmpty()) out.putIfAbsent(ln, text);
                else putAttributes(e, ln, out);
            } else {
                putAttributes(e, ln, out);
            }
            collect(e, out);
        }
    }

    private static void putAttributes(Element e, String ln, Map<String, String> out) {
        NamedNodeMap attrs = e.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr a = (Attr) attrs.item(i);
            String an = a.getLocalName() == null ? a.getName() : a.getLocalName();
            if (a.getName().startsWith("xmlns")) continue;
            String v = a.getValue() == null ? "" : a.getValue().trim();
            if (!v.isEmpty()) out.putIfAbsent(ln + "." + an, v);
        }
    }
}
