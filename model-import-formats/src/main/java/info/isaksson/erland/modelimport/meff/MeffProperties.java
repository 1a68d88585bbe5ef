package info.isaksson.erland.modelimport.meff;

import info.isaksson.erland.modelimport.ir.IrTaggedValue;
import info.isaksson.erland.modelimport.xml.Xml;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Property values resolved against {@code <propertyDefinitions>}, plus loose
 * {@code <taggedValues>} some exporters write, as IR tagged values.
 */
final class MeffProperties {

    private final Map<String, String> definitionNames;

    private MeffProperties(Map<String, String> definitionNames) {
        this.definitionNames = definitionNames;
    }

    static MeffProperties index(Element root) {
        Map<String, String> names = new HashMap<>();
        for (Element def : Xml.qa(root, "propertyDefinition")) {
            String id = Xml.attrTrim(def, "identifier", "id");
            if (id == null) continue;
            String name = Xml.childText(def, "name");
            if (name == null) name = Xml.attrTrim(def, "name");
            if (name != null) names.put(id, name);
        }
        return new MeffProperties(names);
    }

    List<IrTaggedValue> taggedValues(Element el) {
        List<IrTaggedValue> out = new ArrayList<>();
        for (Element c : Xml.children(el)) {
            if (Xml.is(c, "properties")) {
                for (Element p : Xml.children(c, "property")) addProperty(p, out);
            } else if (Xml.is(c, "property")) {
                addProperty(c, out);
            } else if (Xml.is(c, "taggedValues")) {
                for (Element tv : Xml.children(c, "taggedValue")) addTaggedValue(tv, out);
            } else if (Xml.is(c, "taggedValue")) {
                addTaggedValue(c, out);
            }
        }
        return out;
    }

    private void addProperty(Element p, List<IrTaggedValue> out) {
        String key = Xml.attrTrim(p, "key", "name");
        if (key == null) {
            String ref = Xml.attrTrim(p, "propertyDefinitionRef", "ref", "identifierRef");
            if (ref != null) key = definitionNames.getOrDefault(ref, ref);
        }
        if (key == null) key = Xml.childText(p, "key");
        if (key == null) key = Xml.childText(p, "name");
        String value = Xml.attrTrim(p, "value");
        if (value == null) value = Xml.childText(p, "value");
        if (value == null && Xml.children(p).isEmpty()) value = emptyToNull(Xml.text(p));
        if (key != null && value != null) out.add(new IrTaggedValue(key, value));
    }

    private static void addTaggedValue(Element tv, List<IrTaggedValue> out) {
        String key = Xml.attrTrim(tv, "key", "name");
        String value = Xml.attrTrim(tv, "value");
        if (value == null) value = emptyToNull(Xml.text(tv));
        if (key != null && value != null) out.add(new IrTaggedValue(key, value));
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
