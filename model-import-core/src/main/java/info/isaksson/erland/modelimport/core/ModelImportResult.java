package info.isaksson.erland.modelimport.core;

import info.isaksson.erland.modelimport.apply.IdMappings;
import info.isaksson.erland.modelimport.domain.Model;
import info.isaksson.erland.modelimport.ir.IrModel;
import info.isaksson.erland.modelimport.report.ImportReport;

/** Result container for programmatic usage. */
public final class ModelImportResult {
    public final String importerId;
    public final String format;

    /** The normalized IR that was applied. */
    public final IrModel ir;

    public final String modelId;
    public final IdMappings mappings;

    /** Snapshot of the created model right after the import. */
    public final Model model;

    public final ImportReport report;

    ModelImportResult(String importerId, String format, IrModel ir, String modelId, IdMappings mappings,
                      Model model, ImportReport report) {
        this.importerId = importerId;
        this.format = format;
        this.ir = ir;
        this.modelId = modelId;
        this.mappings = mappings;
        this.model = model;
        this.report = report;
    }
}
