package info.isaksson.erland.modelimport.eaxmi;

import info.isaksson.erland.modelimport.ir.IrExternalId;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.ir.IrRelationship;
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

/**
 * Directed UML relationships: generalization, realization, dependency, include, extend and activity flows.
 * Associations are handled by {@link EaAssociationParser}.
 */
final class EaRelationshipParser {

    private static final Set<String> METACLASSES = Set.of(
            "Generalization", "Realization", "InterfaceRealization", "Dependency", "Usage", "Abstraction",
            "Include", "Extend", "ControlFlow", "ObjectFlow");

    private EaRelationshipParser() {}

    static List<IrRelationship> parse(EaXmiDocument xmi, ImportReport report) {
        List<IrRelationship> out = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        Set<String> seenTriples = new HashSet<>();
        int synthetic = 0;

        for (Element el : xmi.all) {
            String metaclass = EaXmi.metaclass(el);
            String hint = typeHint(el);
            if ("ControlFlow".equals(hint) || "ObjectFlow".equals(hint)) metaclass = hint;
            if (metaclass == null || !METACLASSES.contains(metaclass) || EaXmi.isInsideExtension(el)) continue;

            String stereotype = EaXmi.stereotype(el);
            String type = EaXmi.umlRelationshipType(metaclass, stereotype);
            if (type == null) continue;

            List<String> sources = new ArrayList<>();
            List<String> targets = new ArrayList<>();
            endpoints(el, metaclass, sources, targets);
            if (sources.isEmpty()) {
                String owner = xmi.owningClassifierId(el);
                if (owner != null) sources.add(owner);
            }
            if (sources.isEmpty() || targets.isEmpty()) {
                report.warn("EA XMI: Skipped relationship (metaclass=" + metaclass
                        + ") because endpoints could not be resolved (sources=" + join(sources)
                        + ", targets=" + join(targets) + ").");
                continue;
            }

            String xmiId = EaXmi.xmiId(el);
            String baseId = xmiId != null ? xmiId : EaXmi.xmiIdRef(el);
            boolean multi = sources.size() > 1 || targets.size() > 1;
            String guard = metaclass.equals("ControlFlow") || metaclass.equals("ObjectFlow") ? guard(el) : null;

            int pair = 0;
            for (String src : sources) {
                for (String tgt : targets) {
                    pair++;
                    String id = baseId;
                    if (id != null && multi) id = id + "_" + pair;
                    if (id == null) id = "eaRel_synth_" + (++synthetic);
                    if (!seenIds.add(id)) {
                        report.warn("EA XMI: Duplicate relationship id \"" + id + "\" encountered; skipping subsequent occurrence.");
                        continue;
                    }
                    String triple = type + "|" + src + "|" + tgt;
                    if (!seenTriples.add(triple) && baseId == null) continue;

                    List<IrExternalId> ext = new ArrayList<>();
                    if (xmiId != null) ext.add(IrExternalId.of(EaXmi.SYSTEM_XMI, xmiId, "xmi-id"));
                    String guid = EaXmi.guid(el);
                    if (guid != null) ext.add(IrExternalId.of(EaXmi.SYSTEM_EA, guid, "relationship-guid"));
                    List<IrTaggedValue> tvs = stereotype == null ? null : List.of(new IrTaggedValue("stereotype", stereotype));

                    Map<String, Object> attrs = new LinkedHashMap<>();
                    attrs.put("guard", guard);
                    Map<String, Object> meta = new LinkedHashMap<>();
                    meta.put("xmiType", EaXmi.xmiType(el));
                    meta.put(IrMeta.METACLASS, metaclass);

                    out.add(new IrRelationship(id, type, src, tgt, Xml.attrTrim(el, "name"),
                            xmi.documentation(el, false), tvs, ext, attrs, meta));
                }
            }
        }
        return out;
    }

    private static void endpoints(Element el, String metaclass, List<String> sources, List<String> targets) {
        switch (metaclass) {
            case "Generalization" -> {
                sources.addAll(EaXmi.refIds(el, "specific"));
                targets.addAll(EaXmi.refIds(el, "general"));
            }
            case "Include" -> pairOrClientSupplier(el, "includingCase", "addition", sources, targets);
            case "Extend" -> pairOrClientSupplier(el, "extension", "extendedCase", sources, targets);
            case "ControlFlow", "ObjectFlow" -> {
                sources.addAll(EaXmi.refIds(el, "source"));
                targets.addAll(EaXmi.refIds(el, "target"));
            }
            default -> {
                sources.addAll(EaXmi.refIds(el, "client"));
                targets.addAll(EaXmi.refIds(el, "supplier", "contract"));
            }
        }
    }

    private static void pairOrClientSupplier(Element el, String from, String to, List<String> sources, List<String> targets) {
        sources.addAll(EaXmi.refIds(el, from));
        targets.addAll(EaXmi.refIds(el, to));
        if (!sources.isEmpty() || !targets.isEmpty()) return;
        sources.addAll(EaXmi.refIds(el, "client"));
        targets.addAll(EaXmi.refIds(el, "supplier"));
    }

    /** EA sometimes stores the connector kind as {@code ea_type}, directly or on a properties child. */
    private static String typeHint(Element el) {
        String direct = Xml.attrTrim(el, "ea_type");
        if (direct != null) return direct;
        for (Element props : Xml.children(el, "properties")) {
            String v = Xml.attrTrim(props, "ea_type");
            if (v != null) return v;
        }
        return null;
    }

    static String guard(Element edge) {
        String direct = Xml.attrTrim(edge, "guard");
        if (direct != null) return direct;
        for (Element props : Xml.children(edge, "properties")) {
            String g = Xml.attrTrim(props, "guard", "condition");
            if (g != null) return g;
        }
        for (Element guardEl : Xml.children(edge, "guard")) {
            for (String name : new String[] {"specification", "body"}) {
                for (Element spec : Xml.qa(guardEl, name)) {
                    String body = Xml.attrTrim(spec, "body");
                    if (body != null) return body;
                    if (name.equals("body") && !Xml.text(spec).isEmpty()) return Xml.text(spec);
                }
            }
        }
        return null;
    }

    private static String join(List<String> ids) {
        return ids.isEmpty() ? "-" : String.join(" ", ids);
    }
}
