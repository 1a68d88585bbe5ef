package info.isaksson.erland.modelimport.eaxmi;

import info.isaksson.erland.modelimport.ir.IrElement;
import info.isaksson.erland.modelimport.ir.IrExternalId;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.ir.IrTaggedValue;
import info.isaksson.erland.modelimport.report.ImportReport;
import info.isaksson.erland.modelimport.xml.Xml;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** UML classifiers outside the EA extension to {@code uml.*} IR elements. */
final class EaElementParser {

    private static final int NOTE_NAME_MAX = 60;

    private EaElementParser() {}

    static List<IrElement> parse(EaXmiDocument xmi, ImportReport report) {
        List<IrElement> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int synthetic = 0;
        for (Element el : xmi.all) {
            String metaclass = EaXmi.metaclass(el);
            if (metaclass == null) continue;
            String type = EaXmi.UML_ELEMENT_TYPES.get(metaclass);
            if (type == null || EaXmi.isInsideExtension(el)) continue;
            // A comment owned by a classifier or relationship is that owner's documentation.
            if (type.equals("uml.note") && xmi.owningClassifierId(el) != null) continue;

            String id = EaXmi.xmiId(el);
            if (id == null) {
                id = "eaEl_synth_" + (++synthetic);
                report.warn("EA XMI: Element missing xmi:id; generated synthetic element id \"" + id
                        + "\" (metaclass=\"" + metaclass + "\", name=\"" + nullToEmpty(Xml.attrTrim(el, "name")) + "\").");
            }
            if (!seen.add(id)) {
                report.warn("EA XMI: Duplicate element id \"" + id + "\" encountered; skipping subsequent occurrence.");
                continue;
            }

            String documentation = xmi.documentation(el);
            if (documentation == null && type.equals("uml.note")) documentation = Xml.attrTrim(el, "body");
            String name = Xml.attrTrim(el, "name");
            if (name == null) name = defaultName(type, metaclass, documentation);

            List<IrExternalId> ext = new ArrayList<>();
            String xmiId = EaXmi.xmiId(el);
            if (xmiId != null) ext.add(IrExternalId.of(EaXmi.SYSTEM_XMI, xmiId, "xmi-id"));
            String guid = EaXmi.guid(el);
            if (guid != null) ext.add(IrExternalId.of(EaXmi.SYSTEM_EA, guid, "element-guid"));

            List<IrTaggedValue> tvs = new ArrayList<>();
            String stereotype = EaXmi.stereotype(el);
            if (stereotype != null) tvs.add(new IrTaggedValue("stereotype", stereotype));

            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("xmiType", EaXmi.xmiType(el));
            meta.put(IrMeta.METACLASS, metaclass);
            if (type.equals("uml.class") || type.equals("uml.interface") || type.equals("uml.datatype")
                    || type.equals("uml.associationClass")) {
                meta.put("umlMembers", EaMemberParser.members(el, xmi));
            }
            Map<String, Object> attrs = new LinkedHashMap<>();
            if (EaMemberParser.bool(Xml.attrTrim(el, "isAbstract"))) attrs.put("isAbstract", true);

            out.add(new IrElement(id, type, name, documentation, xmi.owningFolderId(el), null, tvs, ext, attrs, meta));
        }
        return out;
    }

    private static String defaultName(String type, String metaclass, String documentation) {
        if (type.equals("uml.note") && documentation != null) {
            String first = documentation.split("\\r?\\n", 2)[0];
            if (first.length() > NOTE_NAME_MAX) first = first.substring(0, NOTE_NAME_MAX);
            first = first.trim();
            return first.isEmpty() ? "Note" : first;
        }
        return metaclass;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
