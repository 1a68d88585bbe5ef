package info.isaksson.erland.modelimport.bpmn2;

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

/** BPMN 2.0 XML (process model plus optional BPMNDI). */
public final class Bpmn2Importer implements Importer {

    private static final Logger log = LoggerFactory.getLogger(Bpmn2Importer.class);

    public static final String MODEL_NAMESPACE = "http://www.omg.org/spec/BPMN/20100524/MODEL";

    private static final Pattern DEFINITIONS_ROOT = Pattern.compile("<\\s*(?:[\\w.-]+:)?definitions\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern BPMN_PREFIX = Pattern.compile("<\\s*bpmn2?:definitions\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public String id() {
        return IrMeta.Formats.BPMN2;
    }

    @Override
    public String format() {
        return IrMeta.Formats.BPMN2;
    }

    @Override
    public String displayName() {
        return "BPMN 2.0 XML";
    }

    @Override
    public int priority() {
        return 110;
    }

    @Override
    public List<String> extensions() {
        return List.of("bpmn", "xml");
    }

    @Override
    public boolean sniff(ImportContext ctx) {
        return looksLikeBpmn(ctx.sniffText) || looksLikeBpmn(ctx.sniffAscii());
    }

    static boolean looksLikeBpmn(String text) {
        if (text == null || text.isEmpty()) return false;
        if (!DEFINITIONS_ROOT.matcher(text).find()) return false;
        return text.contains(MODEL_NAMESPACE) || BPMN_PREFIX.matcher(text).find();
    }

    @Override
    public IrModel parse(ImportSource source, ImportContext ctx, ImportReport report) {
        try {
            IrModel ir = Bpmn2Parser.parse(XmlDocuments.parse(source.content), report);
            log.debug("BPMN2 parsed {}: {} elements, {} relationships, {} views", source.fileName,
                    ir.elements.size(), ir.relationships.size(), ir.views.size());
            return ir;
        } catch (SAXException e) {
            throw new StructuralParseException(format(), "BPMN2: Failed to parse XML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new StructuralParseException(format(), "BPMN2: Failed to read XML: " + e.getMessage(), e);
        }
    }
}
