package info.isaksson.erland.modelimport.apply;

import info.isaksson.erland.modelimport.domain.ModelMetadata;

/** Options for {@link ImportApplier}. */
public final class ApplyOptions {
    /** Namespace for external ids and tagged values; null uses the IR's source system or format. */
    public String sourceSystem;

    public UnknownTypePolicy unknownTypePolicy = UnknownTypePolicy.IMPORT_AS_UNKNOWN;

    /** Null names the model after the IR's model name, or "Imported model". */
    public ModelMetadata metadata;

    /**
     * When set, internal ids are derived from this seed and the source ids instead of being random,
     * so re-importing the same file yields the same ids.
     */
    public String deterministicIdSeed;
}
