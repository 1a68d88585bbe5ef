package info.isaksson.erland.modelimport.eaxmi;

import info.isaksson.erland.modelimport.ir.IrExternalId;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.ir.IrRelationship;
import info.isaksson.erland.modelimport.ir.IrTaggedValue;
import info.isaksson.erland.modelimport.report.ImportReport;
import info.isaksson.erland.modelimport.xml.Xml;
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
 * Binary UML associations. End metadata (role, multiplicity, navigability) goes to the relationship attrs;
 * a composite or shared end upgrades the type to composition or aggregation.
 */
final class EaAssociationParser {

    /** Suffix of the relationship id created for an AssociationClass, whose own id names the element. */
    static final String ASSOCIATION_CLASS_SUFFIX = "__association";

    private EaAssociationParser() {}

    private record End(String id, String classifierId, String role, String multiplicity, boolean navigable,
                       String aggregation) {}

    static List<IrRelationship> parse(EaXmiDocument xmi, ImportReport report) {
        List<IrRelationship> out = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        Map<String, List<Element>> propertiesByAssociation = propertiesByAssociation(xmi);
        int synthetic = 0;

        for (Element el : xmi.all) {
            String metaclass = EaXmi.metaclass(el);
            boolean isClass = "AssociationClass".equals(metaclass);
            if (!"Association".equals(metaclass) && !isClass) continue;
            if (EaXmi.isInsideExtension(el)) continue;

            String assocId = EaXmi.xmiId(el);
            List<Element> endEls = endElements(xmi, el, isClass && assocId != null
                    ? propertiesByAssociation.getOrDefault(assocId, List.of()) : List.of());
            if (endEls.size() < 2) {
                report.warn("EA XMI: Skipped Association" + label(assocId) + " because fewer than 2 ends could be resolved.");
                continue;
            }
            if (endEls.size() > 2) {
                report.warn("EA XMI: Association" + label(assocId) + " has " + endEls.size()
                        + " ends; only the first 2 will be imported as a binary association.");
            }
            Set<String> navigableOwned = new HashSet<>(EaXmi.refIds(el, "navigableOwnedEnd"));
            End a = end(endEls.get(0), navigableOwned);
            End b = end(endEls.get(1), navigableOwned);
            if (a.classifierId == null || b.classifierId == null) {
                report.warn("EA XMI: Skipped Association" + label(assocId)
                        + " because classifier endpoints could not be resolved (endA=" + dash(a.classifierId)
                        + ", endB=" + dash(b.classifierId) + ").");
                continue;
            }

            String id = assocId != null ? assocId : "eaAssoc_synth_" + (++synthetic);
            if (isClass) id = id + ASSOCIATION_CLASS_SUFFIX;
            if (!seenIds.add(id)) {
                report.warn("EA XMI: Duplicate association id \"" + id + "\" encountered; skipping.");
                continue;
            }

            String type = "uml.association";
            if ("composite".equals(a.aggregation) || "composite".equals(b.aggregation)) type = "uml.composition";
            else if ("shared".equals(a.aggregation) || "shared".equals(b.aggregation)) type = "uml.aggregation";

            String stereotype = EaXmi.stereotype(el);
            Map<String, Object> attrs = new LinkedHashMap<>();
            attrs.put("sourceRole", a.role);
            attrs.put("targetRole", b.role);
            attrs.put("sourceMultiplicity", a.multiplicity);
            attrs.put("targetMultiplicity", b.multiplicity);
            attrs.put("sourceNavigable", a.navigable);
            attrs.put("targetNavigable", b.navigable);
            attrs.put("stereotype", stereotype);

            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("xmiType", EaXmi.xmiType(el));
            meta.put(IrMeta.METACLASS, metaclass);
            if (isClass) meta.put(IrMeta.ASSOCIATION_CLASS_ELEMENT_ID, assocId);

            List<IrExternalId> ext = new ArrayList<>();
            if (assocId != null) ext.add(IrExternalId.of(EaXmi.SYSTEM_XMI, assocId, "xmi-id"));
            String guid = EaXmi.guid(el);
            if (guid != null) ext.add(IrExternalId.of(EaXmi.SYSTEM_EA, guid, "relationship-guid"));
            List<IrTaggedValue> tvs = stereotype == null ? null : List.of(new IrTaggedValue("stereotype", stereotype));

            out.add(new IrRelationship(id, type, a.classifierId, b.classifierId, Xml.attrTrim(el, "name"),
                    xmi.documentation(el, false), tvs, ext, attrs, meta));
        }
        return out;
    }

    /** Classifier ids at the ends of an association element, in end order. */
    static List<String> endClassifiers(EaXmiDocument xmi, Element association) {
        List<String> out = new ArrayList<>();
        for (Element endEl : endElements(xmi, association, List.of())) {
            String c = classifier(endEl);
            if (c != null) out.add(c);
        }
        return out;
    }

    private static List<Element> endElements(EaXmiDocument xmi, Element assoc, List<Element> extra) {
        List<Element> ends = new ArrayList<>();
        for (String endId : EaXmi.refIds(assoc, "memberEnd")) {
            Element endEl = xmi.byId(endId);
            if (endEl != null) ends.add(endEl);
        }
        ends.addAll(Xml.children(assoc, "ownedEnd"));
        ends.addAll(extra);

        Map<String, Element> unique = new LinkedHashMap<>();
        for (Element endEl : ends) {
            String id = EaXmi.xmiId(endEl);
            if (id == null) id = EaXmi.xmiIdRef(endEl);
            if (id != null) unique.putIfAbsent(id, endEl);
        }
        return new ArrayList<>(unique.values());
    }

    private static Map<String, List<Element>> propertiesByAssociation(EaXmiDocument xmi) {
        Map<String, List<Element>> out = new HashMap<>();
        for (Element e : xmi.all) {
            String assoc = EaXmi.plainAttr(e, "association");
            if (assoc == null) continue;
            String ln = Xml.localName(e);
            if ("Property".equals(EaXmi.metaclass(e)) || ln.equals("ownedattribute") || ln.equals("ownedend")) {
                out.computeIfAbsent(assoc, k -> new ArrayList<>()).add(e);
            }
        }
        return out;
    }

    private static End end(Element endEl, Set<String> navigableOwned) {
        String id = EaXmi.xmiId(endEl);
        if (id == null) id = EaXmi.xmiIdRef(endEl);
        String aggregation = Xml.attrTrim(endEl, "aggregation");
        aggregation = aggregation == null ? "none" : aggregation.toLowerCase(Locale.ROOT);
        String nav = Xml.attrTrim(endEl, "isNavigable");
        boolean navigable = nav != null ? nav.equalsIgnoreCase("true") : navigableOwned.contains(id);
        return new End(id, classifier(endEl), Xml.attrTrim(endEl, "name"), multiplicity(endEl), navigable, aggregation);
    }

    private static String classifier(Element endEl) {
        String direct = EaXmi.plainAttr(endEl, "type");
        if (direct != null) return direct.split("\\s+")[0];
        Element t = Xml.child(endEl, "type");
        if (t != null) {
            String ref = EaXmi.refOf(t);
            if (ref != null) return ref;
            String text = Xml.text(t);
            if (!text.isEmpty()) return text.split("\\s+")[0];
        }
        return null;
    }

    /** {@code "l..u"}, or a single value when both bounds agree; null without bounds. */
    static String multiplicity(Element el) {
        String lower = null;
        String upper = null;
        Element lv = Xml.child(el, "lowerValue");
        if (lv != null) lower = Xml.attrTrim(lv, "value");
        Element uv = Xml.child(el, "upperValue");
        if (uv != null) upper = Xml.attrTrim(uv, "value");
        if (lower == null) lower = Xml.attrTrim(el, "lower");
        if (upper == null) upper = Xml.attrTrim(el, "upper");
        if (lower == null && upper == null) return null;
        String l = lower != null ? lower : "0";
        String u = upper != null ? upper : l;
        return l.equals(u) ? l : l + ".." + u;
    }

    private static String label(String id) {
        return id == null ? "" : " \"" + id + "\"";
    }

    private static String dash(String s) {
        return s == null ? "-" : s;
    }
}
