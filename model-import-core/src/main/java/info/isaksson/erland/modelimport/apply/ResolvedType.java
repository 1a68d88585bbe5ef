package info.isaksson.erland.modelimport.apply;

import info.isaksson.erland.modelimport.types.ArchimateLayer;
import info.isaksson.erland.modelimport.types.TypeMapping;

/**
 * Outcome of resolving a source type token against the supported taxonomies.
 *
 * <p>{@code layer} is set for ArchiMate elements and, as a best guess, for unknown element types.
 * {@code sourceToken} is the token that was resolved, kept for unknown types.</p>
 */
public final class ResolvedType {

    public enum Taxonomy {
        ARCHIMATE,
        BPMN,
        UML,
        UNKNOWN
    }

    public final Taxonomy taxonomy;
    public final String type;
    public final ArchimateLayer layer;
    public final String sourceToken;

    private ResolvedType(Taxonomy taxonomy, String type, ArchimateLayer layer, String sourceToken) {
        this.taxonomy = taxonomy;
        this.type = type;
        this.layer = layer;
        this.sourceToken = sourceToken;
    }

    static ResolvedType archimate(String type, ArchimateLayer layer) {
        return new ResolvedType(Taxonomy.ARCHIMATE, type, layer, type);
    }

    static ResolvedType qualified(Taxonomy taxonomy, String type) {
        return new ResolvedType(taxonomy, type, null, type);
    }

    static ResolvedType unknown(String sourceToken, ArchimateLayer guessedLayer) {
        return new ResolvedType(Taxonomy.UNKNOWN, TypeMapping.UNKNOWN, guessedLayer, sourceToken);
    }

    public boolean isUnknown() {
        return taxonomy == Taxonomy.UNKNOWN;
    }

    @Override public String toString() {
        return taxonomy + ":" + (isUnknown() ? sourceToken : type);
    }
}
