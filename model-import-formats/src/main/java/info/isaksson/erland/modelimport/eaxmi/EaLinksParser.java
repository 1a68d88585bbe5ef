package info.isaksson.erland.modelimport.eaxmi;

import info.isaksson.erland.modelimport.ir.IrExternalId;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.ir.IrRelationship;
import info.isaksson.erland.modelimport.report.ImportReport;
import info.isaksson.erland.modelimport.xml.Xml;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Relationship records from EA {@code <links>} blocks, e.g. {@code <links><InformationFlow start=".." end=".."/></links>}.
 * Older exports keep connectors only there, and diagram links refer to them by id.
 */
final class EaLinksParser {

    private EaLinksParser() {}

    static List<IrRelationship> parse(EaXmiDocument xmi, ImportReport report) {
        Map<String, IrRelationship> byId = new LinkedHashMap<>();
        for (Element links : Xml.qa(xmi.root, "links")) {
            for (Element link : Xml.children(links)) {
                String ln = Xml.localName(link);
                String id = Xml.attrTrim(link, "xmi:id", "id", "ea_guid", "guid", "uuid");
                String start = Xml.attrTrim(link, "start", "startid", "source", "sourceid", "client", "from");
                String end = Xml.attrTrim(link, "end", "endid", "target", "targetid", "supplier", "to");
                if (id == null || start == null || end == null || byId.containsKey(id)) continue;

                List<IrExternalId> ext = new ArrayList<>();
                String xmiId = EaXmi.xmiId(link);
                if (xmiId != null && !xmiId.equals(id)) ext.add(IrExternalId.of(EaXmi.SYSTEM_XMI, xmiId, "xmi-id"));
                String guid = Xml.attrTrim(link, "ea_guid", "guid", "uuid");
                if (guid != null && !guid.equals(id)) ext.add(IrExternalId.of(EaXmi.SYSTEM_EA, guid, "guid"));

                Map<String, Object> meta = new LinkedHashMap<>();
                meta.put(IrMeta.SOURCE_SYSTEM, EaXmi.SYSTEM_EA);
                meta.put("source", "links");
                meta.put("eaLinkType", ln);
                byId.put(id, new IrRelationship(id, typeOf(ln), start, end,
                        Xml.attrTrim(link, "name", "label", "role"), null, null, ext, null, meta));
            }
        }
        if (!byId.isEmpty()) {
            report.info("ea-xmi:links-parsed", "EA XMI: Parsed " + byId.size() + " relationship(s) from <links> blocks.");
        }
        return new ArrayList<>(byId.values());
    }

    static String typeOf(String localName) {
        return switch (localName) {
            case "notelink" -> "uml.noteLink";
            case "informationflow" -> "uml.informationFlow";
            case "dependency" -> "uml.dependency";
            case "abstraction" -> "uml.abstraction";
            case "realization", "realisation" -> "uml.realization";
            case "association" -> "uml.association";
            case "aggregation" -> "uml.aggregation";
            case "composition" -> "uml.composition";
            case "generalization" -> "uml.generalization";
            default -> "uml." + localName;
        };
    }
}
