package info.isaksson.erland.modelimport.eaxmi;

import info.isaksson.erland.modelimport.framework.ImportContext;
import info.isaksson.erland.modelimport.framework.ImportSource;
import info.isaksson.erland.modelimport.framework.Importer;
import info.isaksson.erland.modelimport.framework.StructuralParseException;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.ir.IrModel;
import info.isaksson.erland.modelimport.report.ImportReport;
import info.isaksson.erland.modelimport.xml.XmlDocuments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Sparx Enterprise Architect UML export via XMI, including the ArchiMate and BPMN profiles EA applies on top.
 * Sniffing requires an XMI root, a UML marker and an EA marker so generic UML XMI from other tools is left alone.
 */
public final class EaXmiImporter implements Importer {

    private static final Logger log = LoggerFactory.getLogger(EaXmiImporter.class);

    private static final Pattern XMI_ROOT = Pattern.compile("<\\s*(?:[\\w.-]+:)?xmi\\s*:\\s*xmi\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern XMI_ROOT_WITH_NS = Pattern.compile("<\\s*xmi\\b[^>]*xmlns", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> UML_MARKERS = List.of(
            Pattern.compile("xmlns\\s*:\\s*uml\\s*="),
            Pattern.compile("http://www\\.omg\\.org/spec/uml", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\buml\\s*:\\s*model\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bxmi\\s*:\\s*type\\s*=\\s*\"\\s*uml\\s*:\\s*(?:package|class)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bpackagedelement\\b", Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> EA_MARKERS = List.of(
            Pattern.compile("\\bea_guid\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\beaid[_:]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("enterprise architect", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<\\s*(?:[\\w.-]+:)?xmi\\s*:\\s*extension\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("xmlns\\s*:\\s*ea\\s*="));

    @Override
    public String id() {
        return IrMeta.Formats.EA_XMI;
    }

    @Override
    public String format() {
        return IrMeta.Formats.EA_XMI;
    }

    @Override
    public String displayName() {
        return "Sparx EA UML XMI";
    }

    @Override
    public int priority() {
        return 105;
    }

    @Override
    public List<String> extensions() {
        return List.of("xmi");
    }

    @Override
    public boolean sniff(ImportContext ctx) {
        if (ctx.hasExtension("xmi")) return true;
        return looksLikeEaXmi(ctx.sniffText) || looksLikeEaXmi(ctx.sniffAscii());
    }

    static boolean looksLikeEaXmi(String text) {
        if (text == null || text.indexOf('<') < 0) return false;
        if (!XMI_ROOT.matcher(text).find() && !XMI_ROOT_WITH_NS.matcher(text).find()) return false;
        String lower = text.toLowerCase(Locale.ROOT);
        if (!anyMatch(UML_MARKERS, lower)) return false;
        return anyMatch(EA_MARKERS, lower);
    }

    private static boolean anyMatch(List<Pattern> patterns, String text) {
        for (Pattern p : patterns) {
            if (p.matcher(text).find()) return true;
        }
        return false;
    }

    @Override
    public IrModel parse(ImportSource source, ImportContext ctx, ImportReport report) {
        try {
            IrModel ir = EaXmiParser.parse(XmlDocuments.parse(source.content), report);
            log.debug("EA XMI parsed {}: {} folders, {} elements, {} relationships, {} views", source.fileName,
                    ir.folders.size(), ir.elements.size(), ir.relationships.size(), ir.views.size());
            return ir;
        } catch (SAXException e) {
            throw new StructuralParseException(format(), "EA XMI: Failed to parse XML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new StructuralParseException(format(), "EA XMI: Failed to read XML: " + e.getMessage(), e);
        }
    }
}
