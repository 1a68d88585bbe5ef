package info.isaksson.erland.modelimport.normalize;

import java.time.Clock;

/**
 * Options for {@link ImportIrNormalizer}.
 *
 * <p>Kept intentionally small; callers set fields directly.</p>
 */
public final class NormalizeOptions {

    /** Label prefixed to warning texts, e.g. {@code "MEFF"}; null for none. */
    public String source;

    /** Drop relationships whose source or target element is missing. */
    public boolean dropDanglingRelationships = true;

    /** Clock used to stamp {@code meta.importedAtIso} when the model has no timestamp yet. */
    public Clock clock = Clock.systemUTC();

    public static NormalizeOptions forSource(String source) {
        NormalizeOptions o = new NormalizeOptions();
        o.source = source;
        return o;
    }
}
