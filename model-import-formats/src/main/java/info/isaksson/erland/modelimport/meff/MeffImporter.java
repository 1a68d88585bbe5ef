package info.isaksson.erland.modelimport.meff;

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
import java.util.regex.Pattern;

/** The Open Group ArchiMate Model Exchange File Format. */
public final class MeffImporter implements Importer {

    private static final Logger log = LoggerFactory.getLogger(MeffImporter.class);

    public static final String NAMESPACE_MARKER = "www.opengroup.org/xsd/archimate";

    private static final Pattern MODEL_ROOT = Pattern.compile("<\\s*(?:[\\w.-]+:)?model\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public String id() {
        return IrMeta.Formats.MEFF;
    }

    @Override
    public String format() {
        return IrMeta.Formats.MEFF;
    }

    @Override
    public String displayName() {
        return "ArchiMate Model Exchange File";
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public List<String> extensions() {
        return List.of("xml");
    }

    @Override
    public boolean sniff(ImportContext ctx) {
        return looksLikeMeff(ctx.sniffText) || looksLikeMeff(ctx.sniffAscii());
    }

    static boolean looksLikeMeff(String text) {
        if (text == null || text.isEmpty()) return false;
        return MODEL_ROOT.matcher(text).find() && text.contains(NAMESPACE_MARKER);
    }

    @Override
    public IrModel parse(ImportSource source, ImportContext ctx, ImportReport report) {
        try {
            IrModel ir = MeffParser.parse(XmlDocuments.parse(source.content), report);
            log.debug("MEFF parsed {}: {} folders, {} elements, {} relationships, {} views", source.fileName,
                    ir.folders.size(), ir.elements.size(), ir.relationships.size(), ir.views.size());
            return ir;
        } catch (SAXException e) {
            throw new StructuralParseException(format(), "MEFF: Failed to parse XML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new StructuralParseException(format(), "MEFF: Failed to read XML: " + e.getMessage(), e);
        }
    }
}
