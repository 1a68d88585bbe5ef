package info.isaksson.erland.modelimport.meff;

import info.isaksson.erland.modelimport.framework.StructuralParseException;
import info.isaksson.erland.modelimport.ir.IrElement;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.ir.IrModel;
import info.isaksson.erland.modelimport.ir.IrRelationship;
import info.isaksson.erland.modelimport.ir.IrView;
import info.isaksson.erland.modelimport.report.ImportReport;
import info.isaksson.erland.modelimport.types.ArchimateTypeMapping;
import info.isaksson.erland.modelimport.types.TypeMapping;
import info.isaksson.erland.modelimport.xml.Xml;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * ArchiMate Model Exchange File to IR. All lookups go by local name so that unprefixed
 * documents and documents under an arbitrary prefix ({@code ns0:model}) read the same.
 */
final class MeffParser {

    static final String SOURCE = IrMeta.Formats.MEFF;

    private MeffParser() {}

    static IrModel parse(Document doc, ImportReport report) {
        Element root = doc.getDocumentElement();
        if (root == null || !Xml.is(root, "model")) {
            throw new StructuralParseException(SOURCE, "MEFF: Expected <model> root element, but found <"
                    + (root == null ? "none" : root.getTagName()) + ">.");
        }

        MeffProperties properties = MeffProperties.index(root);
        MeffOrganizations orgs = MeffOrganizations.parse(root, properties);
        List<IrView> views = MeffViews.parse(root, properties, orgs, report);
        List<IrElement> elements = elements(root, properties, orgs, report);
        List<IrRelationship> relationships = relationships(root, properties, report);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(IrMeta.FORMAT, SOURCE);
        meta.put(IrMeta.MODEL_NAME, Xml.childText(root, "name"));
        meta.put("modelIdentifier", Xml.attrTrim(root, "identifier"));
        return new IrModel(orgs.folders, elements, relationships, views, meta);
    }

    private static List<IrElement> elements(Element root, MeffProperties properties, MeffOrganizations orgs,
                                            ImportReport report) {
        List<IrElement> out = new ArrayList<>();
        Element section = section(root, "elements");
        if (section == null) {
            report.warn("meff-no-elements", "MEFF: No <elements> section found.");
            return out;
        }
        for (Element el : Xml.children(section, "element")) {
            String id = Xml.attrTrim(el, "identifier", "id");
            if (id == null) {
                report.warn("meff-missing-id", "MEFF: Skipping an <element> without identifier.");
                continue;
            }
            TypeMapping type = ArchimateTypeMapping.mapElementType(Xml.type(el), SOURCE);
            if (!type.known) report.countUnknownElementType(type.unknownNs, type.unknownName);

            String name = Xml.childText(el, "name");
            if (name == null) name = Xml.attrTrim(el, "name");
            if (name == null) {
                report.warn("meff-missing-name", "MEFF: Element \"" + id + "\" is missing a name; using \"(unnamed)\".");
                name = "(unnamed)";
            }

            Map<String, Object> meta = new LinkedHashMap<>();
            if (!type.known) meta.put(IrMeta.SOURCE_TYPE, type.unknownName);
            out.add(new IrElement(id, type.known ? type.type : TypeMapping.UNKNOWN, name,
                    Xml.childText(el, "documentation"), orgs.refToFolder.get(id), orgs.refToParentRef.get(id),
                    properties.taggedValues(el), null, null, meta));
        }
        return out;
    }

    private static List<IrRelationship> relationships(Element root, MeffProperties properties, ImportReport report) {
        List<IrRelationship> out = new ArrayList<>();
        Element section = section(root, "relationships");
        if (section == null) {
            report.warn("meff-no-relationships", "MEFF: No <relationships> section found.");
            return out;
        }
        for (Element el : Xml.children(section, "relationship")) {
            String id = Xml.attrTrim(el, "identifier", "id");
            if (id == null) {
                report.warn("meff-missing-id", "MEFF: Skipping a <relationship> without identifier.");
                continue;
            }
            String rawType = Xml.type(el);
            boolean usedBy = isUsedBy(rawType);
            TypeMapping type = usedBy ? TypeMapping.known("Serving") : ArchimateTypeMapping.mapRelationshipType(rawType, SOURCE);
            if (!type.known) report.countUnknownRelationshipType(type.unknownNs, type.unknownName);

            String source = Xml.attrTrim(el, "source", "sourceRef", "from");
            if (source == null) source = Xml.childText(el, "source");
            String target = Xml.attrTrim(el, "target", "targetRef", "to");
            if (target == null) target = Xml.childText(el, "target");
            if (source == null || target == null) {
                report.warn("meff-missing-endpoint", "MEFF: Relationship \"" + id + "\" is missing source/target; skipped.");
                continue;
            }
            if (usedBy) {
                // A UsedBy B is B Serving A.
                String tmp = source;
                source = target;
                target = tmp;
                report.info("meff-usedby-compat", "MEFF: Imported UsedBy relationship as Serving with reversed direction.",
                        Map.of("relationshipId", id));
            }

            Map<String, Object> attrs = new LinkedHashMap<>();
            attrs.put("accessType", Xml.attrTrim(el, "accessType"));
            String directed = Xml.attrTrim(el, "isDirected");
            if (directed != null) attrs.put("isDirected", Boolean.parseBoolean(directed));
            attrs.put("modifier", Xml.attrTrim(el, "modifier"));

            Map<String, Object> meta = new LinkedHashMap<>();
            if (!type.known) meta.put(IrMeta.SOURCE_TYPE, type.unknownName);
            if (usedBy) meta.put("compat", "UsedBy->Serving(inverse)");

            String name = Xml.childText(el, "name");
            if (name == null) name = Xml.attrTrim(el, "name");
            out.add(new IrRelationship(id, type.known ? type.type : TypeMapping.UNKNOWN, source, target, name,
                    Xml.childText(el, "documentation"), properties.taggedValues(el), null, attrs, meta));
        }
        return out;
    }

    static boolean isUsedBy(String rawType) {
        if (rawType == null) return false;
        String s = rawType.trim();
        int cut = Math.max(s.lastIndexOf(':'), Math.max(s.lastIndexOf('.'), s.lastIndexOf('#')));
        String key = (cut >= 0 ? s.substring(cut + 1) : s).replaceAll("[^A-Za-z0-9]", "").toLowerCase(Locale.ROOT);
        return key.equals("usedbyrelationship") || key.equals("usedby");
    }

    private static Element section(Element root, String name) {
        Element direct = Xml.child(root, name);
        return direct != null ? direct : Xml.q(root, name);
    }
}
