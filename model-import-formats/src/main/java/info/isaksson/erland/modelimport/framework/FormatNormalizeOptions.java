package info.isaksson.erland.modelimport.framework;

/** Options shared by the format-specific normalizers. */
public final class FormatNormalizeOptions {

    public static final int DEFAULT_MAX_EXTENSION_TAGS = 50;
    public static final int DEFAULT_MAX_TAG_KEY_LENGTH = 80;
    public static final int DEFAULT_MAX_TAG_VALUE_LENGTH = 500;

    /** Prefix for warning texts; typically the format id. */
    public String source;

    /** When false, relationships with unresolved endpoints are kept for later stages to deal with. */
    public boolean dropDanglingRelationships = true;

    public int maxExtensionTags = DEFAULT_MAX_EXTENSION_TAGS;
    public int maxTagKeyLength = DEFAULT_MAX_TAG_KEY_LENGTH;
    public int maxTagValueLength = DEFAULT_MAX_TAG_VALUE_LENGTH;

    public static FormatNormalizeOptions forSource(String source) {
        FormatNormalizeOptions o = new FormatNormalizeOptions();
        o.source = source;
        return o;
    }

    public String prefix() {
        return source == null || source.isBlank() ? "" : source + ": ";
    }
}
