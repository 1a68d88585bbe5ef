package info.isaksson.erland.modelimport.apply;

import info.isaksson.erland.modelimport.ir.IrMaps;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.types.ArchimateLayer;
import info.isaksson.erland.modelimport.types.ArchimatePalette;
import info.isaksson.erland.modelimport.types.TypeMapping;

import java.util.Locale;
import java.util.Map;

/**
 * Single place where IR type tokens are classified as ArchiMate, BPMN, UML or unknown.
 *
 * <p>Order: qualified {@code bpmn.*} / {@code uml.*} tokens are kept verbatim, then the ArchiMate palette
 * is consulted, everything else is unknown. When an IR item already carries {@code Unknown} with
 * {@code meta.sourceType}, the source token is what gets reported.</p>
 */
public final class TypeResolver {

    public static final String BPMN_PREFIX = "bpmn.";
    public static final String UML_PREFIX = "uml.";

    private TypeResolver() {}

    public static ResolvedType resolveElementType(String type, Map<String, Object> meta) {
        String token = effectiveToken(type, meta);
        ResolvedType qualified = qualified(token);
        if (qualified != null) return qualified;
        ArchimateLayer layer = ArchimatePalette.layerOf(token);
        if (layer != null) return ResolvedType.archimate(token, layer);
        return ResolvedType.unknown(token, guessLayer(token));
    }

    public static ResolvedType resolveRelationshipType(String type, Map<String, Object> meta) {
        String token = effectiveToken(type, meta);
        ResolvedType qualified = qualified(token);
        if (qualified != null) return qualified;
        if (ArchimatePalette.isRelationshipType(token)) return ResolvedType.archimate(token, null);
        return ResolvedType.unknown(token, null);
    }

    /** Keyword based layer guess for element types outside the palette. */
    public static ArchimateLayer guessLayer(String type) {
        String t = type == null ? "" : type.toLowerCase(Locale.ROOT);
        if (t.contains("strategy")) return ArchimateLayer.STRATEGY;
        if (t.contains("business")) return ArchimateLayer.BUSINESS;
        if (t.contains("application")) return ArchimateLayer.APPLICATION;
        if (t.contains("technology")) return ArchimateLayer.TECHNOLOGY;
        if (t.contains("physical")) return ArchimateLayer.PHYSICAL;
        if (t.contains("implementation") || t.contains("migration")) return ArchimateLayer.IMPLEMENTATION_MIGRATION;
        if (t.contains("motivation")) return ArchimateLayer.MOTIVATION;
        return ArchimateLayer.BUSINESS;
    }

    private static ResolvedType qualified(String token) {
        if (token.startsWith(BPMN_PREFIX) && token.length() > BPMN_PREFIX.length()) {
            return ResolvedType.qualified(ResolvedType.Taxonomy.BPMN, token);
        }
        if (token.startsWith(UML_PREFIX) && token.length() > UML_PREFIX.length()) {
            return ResolvedType.qualified(ResolvedType.Taxonomy.UML, token);
        }
        return null;
    }

    private static String effectiveToken(String type, Map<String, Object> meta) {
        String t = type == null ? "" : type.trim();
        if (t.isEmpty() || TypeMapping.UNKNOWN.equals(t)) {
            String source = IrMaps.string(meta, IrMeta.SOURCE_TYPE);
            if (source != null && !source.isBlank()) return source.trim();
        }
        return t.isEmpty() ? TypeMapping.UNKNOWN : t;
    }
}
