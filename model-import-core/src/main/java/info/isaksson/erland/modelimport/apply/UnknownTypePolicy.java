package info.isaksson.erland.modelimport.apply;

/** What the apply stage does with elements and relationships whose type could not be resolved. */
public enum UnknownTypePolicy {
    /** Create them with type {@code Unknown}, keeping the source token. */
    IMPORT_AS_UNKNOWN,
    /** Leave them out, with one warning each. */
    SKIP;

    /** Parses {@code import}, {@code import-as-unknown} or {@code skip}. */
    public static UnknownTypePolicy parse(String value) {
        if (value == null) throw new IllegalArgumentException("unknown type policy must not be null");
        switch (value.trim().toLowerCase(java.util.Locale.ROOT)) {
            case "import":
            case "import-as-unknown":
                return IMPORT_AS_UNKNOWN;
            case "skip":
                return SKIP;
            default:
                throw new IllegalArgumentException("Unsupported unknown type policy: " + value + " (expected import|skip)");
        }
    }
}
