package info.isaksson.erland.modelimport.types;

import java.util.Objects;

/**
 * Outcome of mapping a raw type token: either a known canonical type, or {@code Unknown}
 * with the original token preserved.
 */
public final class TypeMapping {

    public static final String UNKNOWN = "Unknown";

    public final boolean known;
    public final String type;
    /** Namespace of the unknown token (source system); null when known. */
    public final String unknownNs;
    /** Original token verbatim; null when known. */
    public final String unknownName;

    private TypeMapping(boolean known, String type, String unknownNs, String unknownName) {
        this.known = known;
        this.type = type;
        this.unknownNs = unknownNs;
        this.unknownName = unknownName;
    }

    public static TypeMapping known(String type) {
        return new TypeMapping(true, Objects.requireNonNull(type, "type must not be null"), null, null);
    }

    public static TypeMapping unknown(String ns, String name) {
        return new TypeMapping(false, UNKNOWN, ns, name);
    }

    @Override public String toString() {
        return known ? type : UNKNOWN + "(" + unknownNs + ":" + unknownName + ")";
    }
}
