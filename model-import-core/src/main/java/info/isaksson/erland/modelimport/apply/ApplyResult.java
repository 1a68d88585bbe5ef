package info.isaksson.erland.modelimport.apply;

import info.isaksson.erland.modelimport.report.ImportReport;

/** Outcome of one apply run. */
public final class ApplyResult {
    public final String modelId;
    public final IdMappings mappings;
    public final ImportReport report;

    ApplyResult(String modelId, IdMappings mappings, ImportReport report) {
        this.modelId = modelId;
        this.mappings = mappings;
        this.report = report;
    }
}
