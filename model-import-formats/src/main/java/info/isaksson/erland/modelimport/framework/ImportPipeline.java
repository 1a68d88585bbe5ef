package info.isaksson.erland.modelimport.framework;

import info.isaksson.erland.modelimport.ir.IrMaps;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.ir.IrModel;
import info.isaksson.erland.modelimport.normalize.ImportIrNormalizer;
import info.isaksson.erland.modelimport.normalize.NormalizeOptions;
import info.isaksson.erland.modelimport.report.ImportReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sniff, parse, format-specific normalization, generic normalization.
 *
 * <p>The order of the normalization passes is fixed; which format normalizer runs is decided by
 * {@code meta.format} of the parsed model.</p>
 */
public final class ImportPipeline {

    private static final Logger log = LoggerFactory.getLogger(ImportPipeline.class);

    private final ImporterRegistry registry;

    public ImportPipeline(ImporterRegistry registry) {
        if (registry == null) throw new IllegalArgumentException("registry must not be null");
        this.registry = registry;
    }

    public ImporterRegistry registry() {
        return registry;
    }

    /**
     * @throws UnsupportedImportFormatException when no importer recognizes the input
     * @throws StructuralParseException when the recognized document is structurally broken
     */
    public ParsedImport run(ImportSource source, ImportPipelineOptions options) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        ImportPipelineOptions o = options == null ? new ImportPipelineOptions() : options;

        ImportContext ctx = ImportContext.of(source, o.sniffBytes);
        Importer importer = registry.pick(ctx);
        if (importer == null) throw new UnsupportedImportFormatException(ctx);
        log.info("Importing {} with {} ({})", source.fileName, importer.displayName(), importer.id());

        ImportReport report = new ImportReport(importer.format(), o.maxIssueSamples);
        IrModel parsed = importer.parse(source, ctx, report);
        if (parsed.format() == null) {
            parsed = parsed.withMeta(IrMaps.with(parsed.meta, IrMeta.FORMAT, importer.format()));
        }
        String format = parsed.format();
        log.debug("Parsed {}: {}", format, parsed);

        IrModel pre = parsed;
        FormatNormalizer formatNormalizer = registry.normalizerFor(format);
        if (formatNormalizer != null) {
            FormatNormalizeOptions fo = FormatNormalizeOptions.forSource(format);
            fo.dropDanglingRelationships = o.dropDanglingRelationships;
            fo.maxExtensionTags = o.maxExtensionTags;
            fo.maxTagKeyLength = o.maxTagKeyLength;
            fo.maxTagValueLength = o.maxTagValueLength;
            pre = formatNormalizer.normalize(parsed, report, fo);
        }

        NormalizeOptions no = NormalizeOptions.forSource(format);
        no.dropDanglingRelationships = o.dropDanglingRelationships;
        no.clock = o.clock;
        IrModel normalized = ImportIrNormalizer.normalize(pre, report, no);

        log.debug("Normalized {}: {} ({} warning(s))", format, normalized, report.getWarnings().size());
        return new ParsedImport(importer.id(), format, normalized, report);
    }
}
