package info.isaksson.erland.modelimport.eaxmi;

import info.isaksson.erland.modelimport.ir.IrElement;
import info.isaksson.erland.modelimport.ir.IrExternalId;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.ir.IrRelationship;
import info.isaksson.erland.modelimport.ir.IrTaggedValue;
import info.isaksson.erland.modelimport.report.ImportReport;
import info.isaksson.erland.modelimport.types.ArchimateTypeMapping;
import info.isaksson.erland.modelimport.types.TypeMapping;
import info.isaksson.erland.modelimport.xml.Xml;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Stereotype applications of the EA ArchiMate and BPMN profiles, e.g.
 * {@code <ArchiMate3:ArchiMate_BusinessActor base_Class="EAID_1"/>}. The tag names the type; the UML element
 * named by the {@code base_*} attribute supplies id, name, documentation, folder and relationship endpoints.
 */
final class EaProfileParser {

    enum Profile {
        ARCHIMATE(EaXmi.ARCHIMATE_PROFILE_MARKER, "ArchiMate", "eaArch"),
        BPMN(EaXmi.BPMN_PROFILE_MARKER, "BPMN", "eaBpmn");

        final String namespaceMarker;
        final String label;
        final String syntheticPrefix;

        Profile(String namespaceMarker, String label, String syntheticPrefix) {
            this.namespaceMarker = namespaceMarker;
            this.label = label;
            this.syntheticPrefix = syntheticPrefix;
        }
    }

    static final class Result {
        final List<IrElement> elements = new ArrayList<>();
        final List<IrRelationship> relationships = new ArrayList<>();
    }

    private static final String[] SOURCE_KEYS = {"source", "client", "from", "src", "start"};
    private static final String[] TARGET_KEYS = {"target", "supplier", "to", "tgt", "end"};

    private EaProfileParser() {}

    static Result parse(EaXmiDocument xmi, Profile profile, ImportReport report) {
        Result out = new Result();
        Set<String> seenElements = new HashSet<>();
        Set<String> seenRelationships = new HashSet<>();
        int elementSynth = 0;
        int relationshipSynth = 0;

        for (Element el : xmi.all) {
            if (!EaXmi.inNamespace(el, profile.namespaceMarker) || EaXmi.isInsideExtension(el)) continue;
            String token = sourceToken(el);
            String relType = relationshipType(profile, token);

            String xmiId = EaXmi.xmiId(el);
            String baseId = baseRef(el);
            Element base = xmi.byId(baseId);
            String id = baseId != null ? baseId : xmiId;

            if (relType != null) {
                if (id == null) {
                    id = profile.syntheticPrefix + "Rel_synth_" + (++relationshipSynth);
                    report.warn("EA XMI: " + profile.label + " relationship missing xmi:id; generated synthetic relationship id \""
                            + id + "\" (profileTag=\"" + el.getTagName() + "\").");
                }
                if (!seenRelationships.add(id)) {
                    report.warn("EA XMI: Duplicate " + profile.label + " relationship id \"" + id
                            + "\" encountered; skipping subsequent occurrence.");
                    continue;
                }
                IrRelationship rel = relationship(xmi, profile, el, base, id, xmiId, baseId, relType, token, report);
                if (rel != null) out.relationships.add(rel);
                continue;
            }

            if (id == null) {
                id = profile.syntheticPrefix + "El_synth_" + (++elementSynth);
                report.warn("EA XMI: " + profile.label + " element missing xmi:id; generated synthetic element id \"" + id
                        + "\" (profileTag=\"" + el.getTagName() + "\", name=\"" + nullToEmpty(Xml.attrTrim(el, "name")) + "\").");
            }
            if (!seenElements.add(id)) {
                report.warn("EA XMI: Duplicate " + profile.label + " element id \"" + id
                        + "\" encountered; skipping subsequent occurrence.");
                continue;
            }
            out.elements.add(element(xmi, profile, el, base, id, xmiId, baseId, token, report));
        }
        return out;
    }

    private static IrElement element(EaXmiDocument xmi, Profile profile, Element el, Element base, String id,
                                     String xmiId, String baseId, String token, ImportReport report) {
        String type = elementType(profile, token, base != null ? base : el, el);
        String name = Xml.attrTrim(el, "name");
        String documentation = xmi.documentation(el);
        String folderId = xmi.owningFolderId(el);
        if (base != null) {
            if (name == null) name = Xml.attrTrim(base, "name");
            if (documentation == null) documentation = xmi.documentation(base);
            if (folderId == null) folderId = xmi.owningFolderId(base);
        }
        if (name == null) name = token;

        Map<String, Object> meta = profileMeta(profile, el);
        if (type == null) {
            report.countUnknownElementType(EaXmi.SOURCE, token);
            meta.put(IrMeta.SOURCE_TYPE, token);
        }
        return new IrElement(id, type != null ? type : TypeMapping.UNKNOWN, name, documentation, folderId, null,
                taggedValues(el), externalIds(el, base, xmiId, baseId, "element-guid"), null, meta);
    }

    private static IrRelationship relationship(EaXmiDocument xmi, Profile profile, Element el, Element base, String id,
                                               String xmiId, String baseId, String type, String token, ImportReport report) {
        String sourceId = endpoint(el, SOURCE_KEYS);
        String targetId = endpoint(el, TARGET_KEYS);
        if (base != null) {
            if (sourceId == null) sourceId = endpoint(base, SOURCE_KEYS);
            if (targetId == null) targetId = endpoint(base, TARGET_KEYS);
            if (sourceId == null || targetId == null) {
                List<String> ends = EaAssociationParser.endClassifiers(xmi, base);
                if (ends.size() >= 2) {
                    if (sourceId == null) sourceId = ends.get(0);
                    if (targetId == null) targetId = ends.get(1);
                }
            }
        }
        if (sourceId == null || targetId == null) {
            report.warn("EA XMI: Skipped " + profile.label + " relationship \"" + id + "\" (" + type
                    + ") because endpoints could not be resolved (source=" + (sourceId == null ? "-" : sourceId)
                    + ", target=" + (targetId == null ? "-" : targetId) + ").");
            return null;
        }
        String name = Xml.attrTrim(el, "name");
        if (name == null && base != null) name = Xml.attrTrim(base, "name");
        String documentation = xmi.documentation(el);
        if (documentation == null && base != null) documentation = xmi.documentation(base);

        Map<String, Object> meta = profileMeta(profile, el);
        Map<String, Object> attrs = new LinkedHashMap<>();
        if (profile == Profile.ARCHIMATE) {
            attrs.put("accessType", Xml.attrTrim(el, "accessType"));
            attrs.put("isDirected", Xml.attrTrim(el, "isDirected"));
        }
        return new IrRelationship(id, type, sourceId, targetId, name, documentation, taggedValues(el),
                externalIds(el, base, xmiId, baseId, "relationship-guid"), attrs, meta);
    }

    /** Tag local name without the profile's {@code ArchiMate_} or {@code BPMN2.0_} style prefix. */
    static String sourceToken(Element el) {
        String ln = el.getLocalName() != null ? el.getLocalName() : Xml.localName(el);
        int us = ln.indexOf('_');
        if (us > 0) {
            String prefix = ln.substring(0, us).toLowerCase(Locale.ROOT);
            if (prefix.startsWith("archimate") || prefix.startsWith("bpmn")) ln = ln.substring(us + 1);
        }
        return ln;
    }

    static String relationshipType(Profile profile, String token) {
        if (profile == Profile.ARCHIMATE) {
            TypeMapping m = ArchimateTypeMapping.mapRelationshipType(token, EaXmi.SOURCE);
            return m.known ? m.type : null;
        }
        return EaBpmnProfileTypes.relationshipType(token);
    }

    private static String elementType(Profile profile, String token, Element typed, Element tag) {
        if (profile == Profile.ARCHIMATE) {
            TypeMapping m = ArchimateTypeMapping.mapElementType(token, EaXmi.SOURCE);
            return m.known ? m.type : null;
        }
        return EaBpmnProfileTypes.elementType(token, tag, typed);
    }

    /** The {@code base_*} attribute value (or {@code base}); null when the tag has none. */
    static String baseRef(Element el) {
        NamedNodeMap attrs = el.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr a = (Attr) attrs.item(i);
            String n = a.getName().toLowerCase(Locale.ROOT);
            if (n.equals("base") || n.startsWith("base_")) {
                String v = a.getValue().trim();
                if (!v.isEmpty()) return v;
            }
        }
        return null;
    }

    static String endpoint(Element el, String... keys) {
        for (String k : keys) {
            String v = EaXmi.plainAttr(el, k);
            if (v != null) return v;
        }
        for (String k : keys) {
            for (Element ch : Xml.children(el, k)) {
                String ref = EaXmi.refOf(ch);
                if (ref != null) return ref;
            }
        }
        return null;
    }

    private static Map<String, Object> profileMeta(Profile profile, Element el) {
        String key = profile == Profile.ARCHIMATE ? "archimateProfile" : "bpmnProfile";
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(key + "Uri", el.getNamespaceURI());
        meta.put(key + "Tag", el.getTagName());
        return meta;
    }

    private static List<IrTaggedValue> taggedValues(Element el) {
        List<IrTaggedValue> tvs = new ArrayList<>();
        tvs.add(new IrTaggedValue("profileTag", el.getTagName()));
        String stereotype = EaXmi.stereotype(el);
        if (stereotype != null) tvs.add(new IrTaggedValue("stereotype", stereotype));
        return tvs;
    }

    private static List<IrExternalId> externalIds(Element el, Element base, String xmiId, String baseId, String guidKind) {
        List<IrExternalId> ext = new ArrayList<>();
        if (xmiId != null) ext.add(IrExternalId.of(EaXmi.SYSTEM_XMI, xmiId, "xmi-id"));
        if (baseId != null) ext.add(IrExternalId.of(EaXmi.SYSTEM_XMI, baseId, "xmi-base-id"));
        String guid = EaXmi.guid(el);
        if (guid == null && base != null) guid = EaXmi.guid(base);
        if (guid != null) ext.add(IrExternalId.of(EaXmi.SYSTEM_EA, guid, guidKind));
        return ext;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
