package info.isaksson.erland.modelimport.framework;

import info.isaksson.erland.modelimport.ir.IrModel;
import info.isaksson.erland.modelimport.report.ImportReport;

/** Dialect-specific repair pass run before the generic normalizer. Returns a new model. */
public interface FormatNormalizer {

    /** The {@code meta.format} value this normalizer handles. */
    String format();

    IrModel normalize(IrModel model, ImportReport report, FormatNormalizeOptions options);
}
