package info.isaksson.erland.modelimport.core;

import info.isaksson.erland.modelimport.apply.ApplyOptions;
import info.isaksson.erland.modelimport.apply.ApplyResult;
import info.isaksson.erland.modelimport.apply.ImportApplier;
import info.isaksson.erland.modelimport.domain.Model;
import info.isaksson.erland.modelimport.domain.ModelMetadata;
import info.isaksson.erland.modelimport.framework.ImportPipeline;
import info.isaksson.erland.modelimport.framework.ImportPipelineOptions;
import info.isaksson.erland.modelimport.framework.ImportSource;
import info.isaksson.erland.modelimport.framework.ImporterRegistry;
import info.isaksson.erland.modelimport.framework.ParsedImport;
import info.isaksson.erland.modelimport.ir.IrMaps;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.sink.ModelSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Core API for importing a model file: detect the format, parse, normalize and apply into a {@link ModelSink}.
 *
 * <p>CLI and other wrappers should use this class instead of re-implementing the pipeline.</p>
 */
public final class ModelImportService {

    private static final Logger log = LoggerFactory.getLogger(ModelImportService.class);

    private final ImportPipeline pipeline;
    private final ImportApplier applier;
    private final ModelSink sink;

    /** Uses the importers registered through {@link java.util.ServiceLoader}. */
    public ModelImportService(ModelSink sink) {
        this(ImporterRegistry.load(), sink);
    }

    public ModelImportService(ImporterRegistry registry, ModelSink sink) {
        if (registry == null) throw new IllegalArgumentException("registry must not be null");
        if (sink == null) throw new IllegalArgumentException("sink must not be null");
        this.pipeline = new ImportPipeline(registry);
        this.applier = new ImportApplier(sink);
        this.sink = sink;
    }

    public ModelImportResult importFile(Path file, ModelImportOptions options) throws IOException {
        if (file == null) throw new IllegalArgumentException("file must not be null");
        return importSource(ImportSource.of(file), options);
    }

    /**
     * @throws info.isaksson.erland.modelimport.framework.UnsupportedImportFormatException when no importer recognizes the input
     * @throws info.isaksson.erland.modelimport.framework.StructuralParseException when the document is structurally broken
     * @throws info.isaksson.erland.modelimport.sink.ModelAllocationException when the sink cannot create a model
     */
    public ModelImportResult importSource(ImportSource source, ModelImportOptions options) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        ModelImportOptions o = options == null ? new ModelImportOptions() : options;

        ImportPipelineOptions po = new ImportPipelineOptions();
        po.sniffBytes = o.sniffBytes;
        po.dropDanglingRelationships = o.dropDanglingRelationships;
        po.maxIssueSamples = o.maxIssueSamples;
        po.clock = o.clock;
        po.maxExtensionTags = o.maxExtensionTags;
        po.maxTagKeyLength = o.maxTagKeyLength;
        po.maxTagValueLength = o.maxTagValueLength;
        ParsedImport parsed = pipeline.run(source, po);

        ApplyOptions ao = new ApplyOptions();
        ao.sourceSystem = o.sourceSystem;
        ao.unknownTypePolicy = o.unknownTypePolicy;
        ao.metadata = o.metadata != null ? o.metadata : ModelMetadata.named(modelName(parsed, source));
        ao.deterministicIdSeed = o.deterministicIdSeed;
        ApplyResult applied = applier.apply(parsed.ir, ao, parsed.report);

        Model model = sink.snapshot(applied.modelId);
        log.info("Imported {} as {} model {}: {} folder(s), {} element(s), {} relationship(s), {} view(s), {} warning(s)",
                source.fileName, model.kind.id(), applied.modelId,
                model.folders.size(), model.elements.size(), model.relationships.size(), model.views.size(),
                applied.report.getWarnings().size());
        if (!applied.report.getUnknownElementTypes().isEmpty() || !applied.report.getUnknownRelationshipTypes().isEmpty()) {
            log.info("Unknown types in {}: elements={} relationships={}", source.fileName,
                    applied.report.getUnknownElementTypes(), applied.report.getUnknownRelationshipTypes());
        }
        return new ModelImportResult(parsed.importerId, parsed.format, parsed.ir, applied.modelId, applied.mappings,
                model, applied.report);
    }

    private static String modelName(ParsedImport parsed, ImportSource source) {
        String name = IrMaps.string(parsed.ir.meta, IrMeta.MODEL_NAME);
        if (name != null) return name;
        String file = source.fileName == null ? "" : source.fileName;
        int dot = file.lastIndexOf('.');
        String stem = dot > 0 ? file.substring(0, dot) : file;
        return stem.isBlank() ? "Imported model" : stem;
    }
}
