package info.isaksson.erland.modelimport.framework;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;

/**
 * Importers ordered by priority (highest first, then id) plus the format normalizers keyed by format.
 *
 * <p>{@link #load()} discovers both through {@link ServiceLoader}; the built-in dialects are registered
 * in {@code META-INF/services}.</p>
 */
public final class ImporterRegistry {

    private static final Logger log = LoggerFactory.getLogger(ImporterRegistry.class);

    private final List<Importer> importers = new ArrayList<>();
    private final Map<String, FormatNormalizer> normalizers = new LinkedHashMap<>();

    public ImporterRegistry(List<? extends Importer> importers, List<? extends FormatNormalizer> normalizers) {
        if (importers != null) importers.forEach(this::register);
        if (normalizers != null) normalizers.forEach(this::register);
    }

    public static ImporterRegistry load() {
        List<Importer> importers = new ArrayList<>();
        ServiceLoader.load(Importer.class).forEach(importers::add);
        List<FormatNormalizer> normalizers = new ArrayList<>();
        ServiceLoader.load(FormatNormalizer.class).forEach(normalizers::add);
        log.debug("Discovered {} importer(s) and {} format normalizer(s)", importers.size(), normalizers.size());
        return new ImporterRegistry(importers, normalizers);
    }

    public void register(Importer importer) {
        if (importer == null) throw new IllegalArgumentException("importer must not be null");
        importers.removeIf(i -> i.id().equals(importer.id()));
        importers.add(importer);
        importers.sort(Comparator.comparingInt(Importer::priority).reversed().thenComparing(Importer::id));
    }

    public void register(FormatNormalizer normalizer) {
        if (normalizer == null) throw new IllegalArgumentException("normalizer must not be null");
        normalizers.put(normalizer.format(), normalizer);
    }

    public List<Importer> importers() {
        return List.copyOf(importers);
    }

    /** First importer (in priority order) whose sniffer accepts {@code ctx}; null when none does. */
    public Importer pick(ImportContext ctx) {
        for (Importer importer : importers) {
            boolean hit;
            try {
                hit = importer.sniff(ctx);
            } catch (RuntimeException e) {
                log.warn("Sniffer of importer '{}' failed on {}; treating as no match", importer.id(), ctx.fileName, e);
                hit = false;
            }
            if (hit) return importer;
        }
        return null;
    }

    /** Normalizer for {@code format}, or null when the format has none. */
    public FormatNormalizer normalizerFor(String format) {
        return format == null ? null : normalizers.get(format);
    }
}
