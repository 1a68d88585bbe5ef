package info.isaksson.erland.modelimport.eaxmi;

import info.isaksson.erland.modelimport.framework.StructuralParseException;
import info.isaksson.erland.modelimport.ir.IrElement;
import info.isaksson.erland.modelimport.ir.IrExternalId;
import info.isaksson.erland.modelimport.ir.IrFolder;
import info.isaksson.erland.modelimport.ir.IrMaps;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.ir.IrModel;
import info.isaksson.erland.modelimport.ir.IrRelationship;
import info.isaksson.erland.modelimport.ir.IrView;
import info.isaksson.erland.modelimport.ir.IrViewNode;
import info.isaksson.erland.modelimport.report.ImportReport;
import info.isaksson.erland.modelimport.types.TypeMapping;
import info.isaksson.erland.modelimport.xml.Xml;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Sparx EA XMI to IR. Readers run per construct (packages, UML classifiers, profile stereotypes, relationships,
 * associations, legacy links, extension connectors, diagrams) and their results are merged here.
 *
 * <p>Merge precedence: on an id collision the non-UML (ArchiMate or BPMN) reading wins; otherwise the first
 * occurrence is kept. Raw UML relationships are left out of pure ArchiMate/BPMN exports, i.e. when profile
 * content is present and no diagram is a UML diagram.</p>
 */
final class EaXmiParser {

    static final String TOOL = "Sparx Enterprise Architect";

    private static final List<String> UML_DIAGRAM_TYPES = List.of(
            "class", "activity", "sequence", "use case", "usecase", "state", "component", "deployment",
            "package", "object", "communication", "composite", "interaction", "timing");

    private EaXmiParser() {}

    static IrModel parse(Document doc, ImportReport report) {
        Element root = doc.getDocumentElement();
        if (root == null || !Xml.localName(root).contains("xmi")) {
            throw new StructuralParseException(EaXmi.SOURCE, "EA XMI: Expected XMI root element (<xmi:XMI ...>), but found <"
                    + (root == null ? "none" : root.getTagName()) + ">.");
        }
        EaXmiDocument xmi = new EaXmiDocument(doc);

        List<IrFolder> folders = EaPackageParser.parse(xmi, report);
        EaProfileParser.Result archimate = EaProfileParser.parse(xmi, EaProfileParser.Profile.ARCHIMATE, report);
        EaProfileParser.Result bpmn = EaProfileParser.parse(xmi, EaProfileParser.Profile.BPMN, report);

        Map<String, IrElement> elements = new LinkedHashMap<>();
        for (IrElement e : EaElementParser.parse(xmi, report)) elements.putIfAbsent(e.id, e);
        mergeElements(elements, archimate.elements, report);
        mergeElements(elements, bpmn.elements, report);

        List<IrView> views = EaDiagramParser.parse(xmi, report);

        Map<String, String> elementTypes = new HashMap<>();
        for (IrElement e : elements.values()) elementTypes.put(e.id, e.type);
        List<IrRelationship> connectors = EaConnectorParser.parse(xmi, elementTypes, report);

        boolean profileContent = !connectors.isEmpty() || hasContent(archimate) || hasContent(bpmn);
        boolean suppressUml = profileContent && !hasUmlDiagram(views);
        if (suppressUml) {
            report.info("ea-xmi:uml-relationships-suppressed",
                    "EA XMI: ArchiMate/BPMN export without UML diagrams; raw UML relationships are not imported.");
        }

        RelationshipMerge rels = new RelationshipMerge(connectors, report);
        rels.addAll(connectors, "ea-connector");
        rels.addAll(archimate.relationships, "archimate-profile");
        rels.addAll(bpmn.relationships, "bpmn-profile");
        if (!suppressUml) {
            rels.addAll(EaLinksParser.parse(xmi, report), "uml-links");
            rels.addAll(EaRelationshipParser.parse(xmi, report), "uml");
            rels.addAll(EaAssociationParser.parse(xmi, report), "uml-association");
        }
        List<IrRelationship> relationships = new ArrayList<>(rels.byId.values());

        List<IrElement> elementList = new ArrayList<>(elements.values());
        elementList.addAll(referencedPackages(folders, elements.keySet(), relationships, views, report));

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(IrMeta.FORMAT, EaXmi.SOURCE);
        meta.put(IrMeta.TOOL, TOOL);
        meta.put(IrMeta.SOURCE_SYSTEM, EaXmi.SYSTEM_EA);
        Element model = EaPackageParser.findModel(xmi);
        meta.put(IrMeta.MODEL_NAME, model == null ? null : Xml.attrTrim(model, "name"));
        meta.put("exporterVersion", exporterVersion(root));
        return new IrModel(folders, elementList, relationships, views, meta);
    }

    private static void mergeElements(Map<String, IrElement> into, List<IrElement> incoming, ImportReport report) {
        for (IrElement e : incoming) {
            IrElement existing = into.get(e.id);
            if (existing == null) {
                into.put(e.id, e);
            } else if (isUml(existing.type) && !isUml(e.type)) {
                into.put(e.id, withUmlFallbacks(e, existing));
                report.info("ea-xmi:element-id-collision",
                        "EA XMI: Element id collision between UML and a profile; keeping the profile element.",
                        context("elementId", e.id, existing.type, e.type));
            } else {
                report.info("ea-xmi:duplicate-element-id",
                        "EA XMI: Duplicate element id encountered during merge; kept first occurrence.",
                        context("elementId", e.id, e.type, existing.type));
            }
        }
    }

    /** The profile element keeps its own values and borrows what only the UML reading has. */
    private static IrElement withUmlFallbacks(IrElement profile, IrElement uml) {
        List<IrExternalId> ext = new ArrayList<>(profile.externalIds);
        for (IrExternalId x : uml.externalIds) {
            if (!ext.contains(x)) ext.add(x);
        }
        return new IrElement(profile.id, profile.type, profile.name != null ? profile.name : uml.name,
                profile.documentation != null ? profile.documentation : uml.documentation,
                profile.folderId != null ? profile.folderId : uml.folderId,
                profile.parentElementId, profile.taggedValues, ext, profile.attrs, profile.meta);
    }

    private static boolean hasContent(EaProfileParser.Result result) {
        if (!result.relationships.isEmpty()) return true;
        for (IrElement e : result.elements) {
            if (!TypeMapping.UNKNOWN.equals(e.type)) return true;
        }
        return false;
    }

    static boolean hasUmlDiagram(List<IrView> views) {
        for (IrView v : views) {
            String t = v.viewpoint != null ? v.viewpoint : IrMaps.string(v.meta, "eaDiagramType");
            if (t == null || t.isBlank()) continue;
            t = t.trim().toLowerCase(Locale.ROOT);
            if (t.contains("archimate") || t.contains("bpmn")) continue;
            if (t.contains("uml")) return true;
            for (String k : UML_DIAGRAM_TYPES) {
                if (t.contains(k)) return true;
            }
        }
        return false;
    }

    private static boolean isUml(String type) {
        return type != null && type.startsWith("uml.");
    }

    private static Map<String, String> context(String idKey, String id, String kept, String dropped) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put(idKey, id);
        ctx.put("keptType", kept);
        ctx.put("droppedType", dropped);
        return ctx;
    }

    private static String exporterVersion(Element root) {
        for (Element doc : Xml.children(root, "Documentation")) {
            String v = Xml.attrTrim(doc, "exporterVersion");
            if (v != null) return v;
        }
        return null;
    }

    /**
     * Packages show up as diagram objects or relationship endpoints; those get a {@code uml.package} element
     * named after the folder so they stay addressable.
     */
    private static List<IrElement> referencedPackages(List<IrFolder> folders, Set<String> elementIds,
                                                      List<IrRelationship> relationships, List<IrView> views,
                                                      ImportReport report) {
        Map<String, IrFolder> folderById = new HashMap<>();
        for (IrFolder f : folders) folderById.put(f.id, f);
        Set<String> referenced = new HashSet<>();
        for (IrRelationship r : relationships) {
            referenced.add(r.sourceId);
            referenced.add(r.targetId);
        }
        for (IrView v : views) {
            for (IrViewNode n : v.nodes) {
                String subject = IrMaps.string(IrMaps.map(n.meta, IrMeta.REF_RAW), "subject");
                if (subject != null) referenced.add(subject);
            }
        }
        List<IrElement> out = new ArrayList<>();
        for (IrFolder f : folders) {
            if (!referenced.contains(f.id) || elementIds.contains(f.id)) continue;
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put(IrMeta.METACLASS, "Package");
            meta.put("materializedFromFolder", true);
            out.add(new IrElement(f.id, "uml.package", f.name, f.documentation, f.parentId, null,
                    null, f.externalIds, null, meta));
        }
        if (!out.isEmpty()) {
            report.info("ea-xmi:packages-materialized", "EA XMI: Materialized " + out.size()
                    + " referenced package(s) as uml.package elements.");
        }
        return out;
    }

    /** Relationship merge: connector readings are authoritative, then first occurrence, non-UML over UML. */
    private static final class RelationshipMerge {

        final Map<String, IrRelationship> byId = new LinkedHashMap<>();
        private final Set<String> connectorIds = new HashSet<>();
        private final Set<String> connectorSignatures = new HashSet<>();
        private final ImportReport report;

        RelationshipMerge(List<IrRelationship> connectors, ImportReport report) {
            this.report = report;
            for (IrRelationship r : connectors) {
                connectorIds.add(r.id);
                connectorSignatures.add(signature(r));
            }
        }

        void addAll(List<IrRelationship> rels, String source) {
            for (IrRelationship r : rels) add(r, source);
        }

        private void add(IrRelationship r, String source) {
            boolean fromConnector = source.equals("ea-connector");
            if (!fromConnector && connectorSignatures.contains(signature(r))) {
                report.info("ea-xmi:relationship-dropped-duplicate",
                        "EA XMI: Dropped relationship because an EA connector relationship provides the same semantics.",
                        dropContext(r, source));
                return;
            }
            if (!fromConnector && connectorIds.contains(r.id)) {
                report.info("ea-xmi:relationship-dropped-source-of-truth",
                        "EA XMI: Dropped relationship because the EA connector with the same id takes precedence.",
                        dropContext(r, source));
                return;
            }
            IrRelationship existing = byId.get(r.id);
            if (existing == null) {
                byId.put(r.id, r);
            } else if (isUml(existing.type) && !isUml(r.type)) {
                byId.put(r.id, r);
                report.info("ea-xmi:relationship-id-collision",
                        "EA XMI: Relationship id collision between UML and another source; kept the non-UML relationship.",
                        context("relationshipId", r.id, r.type, existing.type));
            } else {
                report.info("ea-xmi:duplicate-relationship-id",
                        "EA XMI: Duplicate relationship id encountered during merge; kept first occurrence.",
                        context("relationshipId", r.id, existing.type, r.type));
            }
        }

        private static Map<String, String> dropContext(IrRelationship r, String source) {
            Map<String, String> ctx = new LinkedHashMap<>();
            ctx.put("relationshipId", r.id);
            ctx.put("type", r.type);
            ctx.put("source", source);
            return ctx;
        }

        private static String signature(IrRelationship r) {
            String name = r.name == null ? "" : r.name.trim().toLowerCase(Locale.ROOT);
            return r.sourceId + "->" + r.targetId + "|" + r.type + "|" + name;
        }
    }
}
