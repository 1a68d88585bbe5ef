package info.isaksson.erland.modelimport.eaxmi;

import info.isaksson.erland.modelimport.ir.IrExternalId;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.ir.IrRelationship;
import info.isaksson.erland.modelimport.ir.IrTaggedValue;
import info.isaksson.erland.modelimport.report.ImportReport;
import info.isaksson.erland.modelimport.types.ArchimateTypeMapping;
import info.isaksson.erland.modelimport.types.TypeMapping;
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
 * ArchiMate relationships recorded only as EA extension connectors:
 * {@code <connectors><connector xmi:idref=".."><source xmi:idref=".."/><target xmi:idref=".."/>
 * <properties stereotype="ArchiMate_Serving" direction="Source -> Destination"/></connector></connectors>}.
 */
final class EaConnectorParser {

    private EaConnectorParser() {}

    /**
     * @param elementTypes IR element type by id, used to tell ArchiMate realisations between UML elements
     *                     (imported as {@code uml.dependency}) from ArchiMate ones
     */
    static List<IrRelationship> parse(EaXmiDocument xmi, Map<String, String> elementTypes, ImportReport report) {
        List<IrRelationship> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int synthetic = 0;
        for (Element ext : xmi.eaExtensions()) {
            Element connectors = Xml.child(ext, "connectors");
            if (connectors == null) continue;
            for (Element connector : Xml.children(connectors, "connector")) {
                Element props = Xml.child(connector, "properties");
                String stereotype = props == null ? null : Xml.attrTrim(props, "stereotype", "stereotypes");
                if (stereotype == null || !stereotype.toLowerCase(Locale.ROOT).startsWith("archimate_")) continue;

                String directId = EaXmi.xmiIdRef(connector);
                if (directId == null) directId = EaXmi.xmiId(connector);
                String id = directId;
                if (id == null) {
                    id = "eaConnectorRel_synth_" + (++synthetic);
                    report.warn("EA XMI: Connector relationship missing id; generated synthetic relationship id \"" + id + "\".");
                }
                if (!seen.add(id)) {
                    report.warn("EA XMI: Duplicate connector relationship id \"" + id + "\" encountered; skipping subsequent occurrence.");
                    continue;
                }
                String sourceId = endpoint(Xml.child(connector, "source"));
                String targetId = endpoint(Xml.child(connector, "target"));
                if (sourceId == null || targetId == null) {
                    report.warn("EA XMI: Skipped connector relationship \"" + id + "\" because endpoints could not be resolved.");
                    continue;
                }
                String direction = Xml.attrTrim(props, "direction");
                if (reversed(direction)) {
                    String tmp = sourceId;
                    sourceId = targetId;
                    targetId = tmp;
                }

                String type;
                Map<String, Object> meta = new LinkedHashMap<>();
                meta.put("eaConnector", true);
                meta.put("eaStereotype", stereotype);
                meta.put("eaDirection", direction);
                if (isRealisation(stereotype) && umlEndpoints(elementTypes.get(sourceId), elementTypes.get(targetId))) {
                    type = "uml.dependency";
                    report.info("ea-xmi:archimate-realisation-as-uml",
                            "EA XMI: Interpreted ArchiMate_Realisation connector as UML dependency due to UML endpoints.",
                            Map.of("relationshipId", id));
                } else {
                    TypeMapping mapping = ArchimateTypeMapping.mapRelationshipType(
                            stereotype.substring("archimate_".length()), EaXmi.SOURCE);
                    if (mapping.known) {
                        type = mapping.type;
                    } else {
                        type = TypeMapping.UNKNOWN;
                        meta.put(IrMeta.SOURCE_TYPE, stereotype);
                        report.countUnknownRelationshipType(mapping.unknownNs, mapping.unknownName);
                        report.warn("ea-xmi:connector-unmapped-stereotype", "EA XMI: Connector relationship \"" + id
                                + "\" has unmapped stereotype \"" + stereotype + "\"; imported as type \"Unknown\".",
                                "relationshipId", id);
                    }
                }

                List<IrTaggedValue> tvs = new ArrayList<>();
                tvs.add(new IrTaggedValue("stereotype", stereotype));
                String eaType = Xml.attrTrim(props, "ea_type");
                if (eaType != null) tvs.add(new IrTaggedValue("ea_type", eaType));
                if (direction != null) tvs.add(new IrTaggedValue("direction", direction));
                List<IrExternalId> externalIds = directId == null ? null : List.of(IrExternalId.of(EaXmi.SYSTEM_XMI, directId, "xmi-id"));

                out.add(new IrRelationship(id, type, sourceId, targetId, Xml.attrTrim(connector, "name", "label"),
                        null, tvs, externalIds, null, meta));
            }
        }
        return out;
    }

    private static String endpoint(Element el) {
        if (el == null) return null;
        String ref = EaXmi.xmiIdRef(el);
        if (ref == null) ref = EaXmi.xmiId(el);
        return ref != null ? ref : Xml.attrTrim(el, "subject", "element", "classifier", "ref");
    }

    /** {@code "Destination -> Source"} means the connector was drawn against its semantic direction. */
    static boolean reversed(String direction) {
        if (direction == null) return false;
        String d = direction.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
        if (d.contains("unspecified")) return false;
        return d.contains("destination") && d.contains("source") && d.startsWith("destination");
    }

    private static boolean isRealisation(String stereotype) {
        String s = stereotype.toLowerCase(Locale.ROOT);
        return s.equals("archimate_realisation") || s.equals("archimate_realization");
    }

    private static boolean umlEndpoints(String sourceType, String targetType) {
        boolean anyUml = isUml(sourceType) || isUml(targetType);
        boolean bothArchimate = sourceType != null && targetType != null && !isUml(sourceType) && !isUml(targetType)
                && !sourceType.startsWith("bpmn.") && !targetType.startsWith("bpmn.");
        return anyUml && !bothArchimate;
    }

    private static boolean isUml(String type) {
        return type != null && type.startsWith("uml.");
    }
}
