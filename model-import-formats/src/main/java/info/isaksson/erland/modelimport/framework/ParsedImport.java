package info.isaksson.erland.modelimport.framework;

import info.isaksson.erland.modelimport.ir.IrModel;
import info.isaksson.erland.modelimport.report.ImportReport;

/** A parsed and normalized input, ready to apply. */
public final class ParsedImport {
    public final String importerId;
    public final String format;
    public final IrModel ir;
    public final ImportReport report;

    ParsedImport(String importerId, String format, IrModel ir, ImportReport report) {
        this.importerId = importerId;
        this.format = format;
        this.ir = ir;
        this.report = report;
    }
}
