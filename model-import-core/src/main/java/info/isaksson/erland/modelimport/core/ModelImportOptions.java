package info.isaksson.erland.modelimport.core;

import info.isaksson.erland.modelimport.apply.UnknownTypePolicy;
import info.isaksson.erland.modelimport.domain.ModelMetadata;
import info.isaksson.erland.modelimport.framework.FormatNormalizeOptions;
import info.isaksson.erland.modelimport.framework.ImportContext;
import info.isaksson.erland.modelimport.report.ImportReport;

import java.time.Clock;

/**
 * Options for one import run.
 *
 * <p>This mirrors the CLI flags in a structured form.</p>
 */
public final class ModelImportOptions {
    /** Bytes of the file looked at when detecting the format. */
    public int sniffBytes = ImportContext.DEFAULT_SNIFF_BYTES;

    /** Namespace for external ids and tagged values. Null derives it from the detected format. */
    public String sourceSystem;

    public UnknownTypePolicy unknownTypePolicy = UnknownTypePolicy.IMPORT_AS_UNKNOWN;

    /** Drop relationships whose endpoints do not resolve during normalization. When off, Apply skips them instead. */
    public boolean dropDanglingRelationships = true;

    /** Model name and description; null names the model after the source. */
    public ModelMetadata metadata;

    public int maxIssueSamples = ImportReport.DEFAULT_MAX_SAMPLES;

    /** Limits for the {@code ext:} tagged values taken from format extension data. */
    public int maxExtensionTags = FormatNormalizeOptions.DEFAULT_MAX_EXTENSION_TAGS;
    public int maxTagKeyLength = FormatNormalizeOptions.DEFAULT_MAX_TAG_KEY_LENGTH;
    public int maxTagValueLength = FormatNormalizeOptions.DEFAULT_MAX_TAG_VALUE_LENGTH;

    /** See {@link info.isaksson.erland.modelimport.apply.ApplyOptions#deterministicIdSeed}. */
    public String deterministicIdSeed;

    /** Source of the import timestamp stamped into the IR. */
    public Clock clock = Clock.systemUTC();
}
