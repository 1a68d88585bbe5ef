package info.isaksson.erland.modelimport.apply;

/**
 * Source of internal ids for the objects an apply run creates.
 *
 * <p>{@code prefix} is the object kind ({@code folder}, {@code element}...), {@code sourceKey} the id
 * the object had in the IR, unique per kind within one run.</p>
 */
public interface IdAllocator {

    String next(String prefix, String sourceKey);

    /** {@code <prefix>_<uuid>}. */
    static IdAllocator random() {
        return new RandomIdAllocator();
    }

    /**
     * Ids hashed from the seed, prefix and source key. Instances remember what they issued and are
     * meant for a single run.
     */
    static IdAllocator hashed(String seed) {
        return new HashedIdAllocator(seed);
    }
}
