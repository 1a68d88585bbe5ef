package info.isaksson.erland.modelimport.types;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps raw ArchiMate type tokens from exchange files, XMI profiles etc. to canonical palette types.
 *
 * <p>Tokens are compared after stripping a namespace ({@code archimate:BusinessActor},
 * {@code x.y.BusinessActor}, {@code uri#BusinessActor}), dropping a trailing {@code Relationship}/{@code Element}
 * suffix and removing everything that is not a letter or digit, case-insensitively.
 * So {@code "Business Actor"}, {@code "business-actor"} and {@code "AssignmentRelationship"} all match.</p>
 */
public final class ArchimateTypeMapping {

    /** Name recorded for an element/relationship whose type token is empty. */
    public static final String MISSING_TYPE = "MissingType";

    private static final Map<String, String> ELEMENT_LOOKUP = buildLookup(true);
    private static final Map<String, String> RELATIONSHIP_LOOKUP = buildLookup(false);

    private ArchimateTypeMapping() {}

    public static TypeMapping mapElementType(String rawType, String source) {
        String raw = rawType == null ? "" : rawType.trim();
        if (raw.isEmpty()) return TypeMapping.unknown(source, MISSING_TYPE);
        if (ArchimatePalette.isElementType(raw)) return TypeMapping.known(raw);
        String mapped = ELEMENT_LOOKUP.get(normalizeToken(raw));
        return mapped != null ? TypeMapping.known(mapped) : TypeMapping.unknown(source, raw);
    }

    public static TypeMapping mapRelationshipType(String rawType, String source) {
        String raw = rawType == null ? "" : rawType.trim();
        if (raw.isEmpty()) return TypeMapping.unknown(source, MISSING_TYPE);
        if (ArchimatePalette.isRelationshipType(raw)) return TypeMapping.known(raw);
        String mapped = RELATIONSHIP_LOOKUP.get(normalizeToken(raw));
        return mapped != null ? TypeMapping.known(mapped) : TypeMapping.unknown(source, raw);
    }

    static String normalizeToken(String raw) {
        String s = stripNamespace(raw);
        String lower = s.toLowerCase(Locale.ROOT);
        if (lower.endsWith("relationship")) s = s.substring(0, s.length() - "relationship".length());
        else if (lower.endsWith("element")) s = s.substring(0, s.length() - "element".length());
        return normalizeKey(s);
    }

    private static String stripNamespace(String raw) {
        String s = raw.trim();
        int cut = Math.max(s.lastIndexOf(':'), Math.max(s.lastIndexOf('.'), s.lastIndexOf('#')));
        return cut >= 0 ? s.substring(cut + 1) : s;
    }

    private static String normalizeKey(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')) {
                sb.append(Character.toLowerCase(c));
            }
        }
        return sb.toString();
    }

    private static Map<String, String> buildLookup(boolean elements) {
        Map<String, String> m = new HashMap<>();
        if (elements) {
            for (String t : ArchimatePalette.elementTypes()) m.put(normalizeToken(t), t);
            // ArchiMate 2 / tool aliases.
            m.put("infrastructureservice", "TechnologyService");
            m.put("infrastructureinterface", "TechnologyInterface");
            m.put("infrastructurefunction", "TechnologyFunction");
            m.put("network", "CommunicationNetwork");
            m.put("group", "Grouping");
        } else {
            for (String t : ArchimatePalette.RELATIONSHIP_TYPES) m.put(normalizeToken(t), t);
            m.put("realisation", "Realization");
            m.put("specialisation", "Specialization");
        }
        return m;
    }
}
