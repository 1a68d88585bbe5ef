package info.isaksson.erland.modelimport.eaxmi;

import info.isaksson.erland.modelimport.ir.IrExternalId;
import info.isaksson.erland.modelimport.ir.IrFolder;
import info.isaksson.erland.modelimport.report.ImportReport;
import info.isaksson.erland.modelimport.xml.Xml;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** UML package hierarchy to IR folders. Packages never become elements. */
final class EaPackageParser {

    private final EaXmiDocument xmi;
    private final ImportReport report;
    private final List<IrFolder> folders = new ArrayList<>();
    private final Set<String> seen = new HashSet<>();
    private int synthetic;

    private EaPackageParser(EaXmiDocument xmi, ImportReport report) {
        this.xmi = xmi;
        this.report = report;
    }

    static List<IrFolder> parse(EaXmiDocument xmi, ImportReport report) {
        EaPackageParser p = new EaPackageParser(xmi, report);
        Element model = findModel(xmi);
        if (model != null) {
            p.visitChildren(model, null);
        } else {
            report.warn("EA XMI: Could not find a UML Model root; scanning document for top-level packages.");
            p.visitChildren(xmi.root, null);
        }
        if (p.folders.isEmpty()) {
            report.warn("ea-xmi:no-folders", "EA XMI: No UML packages found; elements are imported at model level.");
        }
        return p.folders;
    }

    static Element findModel(EaXmiDocument xmi) {
        for (Element el : xmi.all) {
            String t = EaXmi.xmiType(el);
            if (t != null && t.toLowerCase(Locale.ROOT).endsWith(":model")) return el;
        }
        for (Element el : xmi.all) {
            if (Xml.is(el, "model") && !EaXmi.isInsideExtension(el)) return el;
        }
        return null;
    }

    private void visitChildren(Element parent, String parentId) {
        for (Element ch : Xml.children(parent)) {
            if (EaXmi.isPackage(ch)) visit(ch, parentId);
        }
    }

    private void visit(Element pkg, String parentId) {
        String name = name(pkg);
        String id = EaXmi.xmiId(pkg);
        if (id == null) {
            id = "eaPkg_synth_" + (++synthetic);
            report.warn("EA XMI: Package missing xmi:id; generated synthetic folder id \"" + id + "\" (name=\"" + name + "\").");
        }
        if (!seen.add(id)) {
            report.warn("EA XMI: Duplicate package id \"" + id + "\" encountered; skipping subsequent occurrence.");
            return;
        }
        xmi.registerPackage(pkg, id);

        String guid = EaXmi.guid(pkg);
        List<IrExternalId> ext = guid == null ? null : List.of(IrExternalId.of(EaXmi.SYSTEM_EA, guid, "package-guid"));
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("xmiType", EaXmi.xmiType(pkg));
        folders.add(new IrFolder(id, name, parentId, xmi.documentation(pkg, false), null, ext, meta));

        visitChildren(pkg, id);
    }

    private static String name(Element pkg) {
        String n = Xml.attrTrim(pkg, "name");
        if (n == null) n = Xml.attrTrim(pkg, "xmi:label", "label");
        return n != null ? n : "Package";
    }
}
