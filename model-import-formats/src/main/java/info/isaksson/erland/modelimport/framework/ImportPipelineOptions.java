package info.isaksson.erland.modelimport.framework;

import info.isaksson.erland.modelimport.report.ImportReport;

import java.time.Clock;

/** Options for {@link ImportPipeline}. */
public final class ImportPipelineOptions {

    /** How many leading bytes the sniffers see. */
    public int sniffBytes = ImportContext.DEFAULT_SNIFF_BYTES;

    public boolean dropDanglingRelationships = true;

    public int maxIssueSamples = ImportReport.DEFAULT_MAX_SAMPLES;

    public Clock clock = Clock.systemUTC();

    public int maxExtensionTags = FormatNormalizeOptions.DEFAULT_MAX_EXTENSION_TAGS;
    public int maxTagKeyLength = FormatNormalizeOptions.DEFAULT_MAX_TAG_KEY_LENGTH;
    public int maxTagValueLength = FormatNormalizeOptions.DEFAULT_MAX_TAG_VALUE_LENGTH;
}
