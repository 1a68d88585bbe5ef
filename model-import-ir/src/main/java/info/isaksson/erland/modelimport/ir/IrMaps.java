package info.isaksson.erland.modelimport.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the open-ended {@code meta}/{@code attrs} maps carried by IR entities.
 *
 * <p>Maps are copied into unmodifiable insertion-ordered maps; {@code null} values are dropped
 * so "absent" and "null" are the same thing.</p>
 */
public final class IrMaps {

    private IrMaps() {}

    public static Map<String, Object> copyOf(Map<String, ?> in) {
        if (in == null || in.isEmpty()) return Map.of();
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : in.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            out.put(e.getKey(), e.getValue());
        }
        return out.isEmpty() ? Map.of() : Collections.unmodifiableMap(out);
    }

    /** Returns a copy of {@code in} with {@code key} set (or removed when {@code value} is null). */
    public static Map<String, Object> with(Map<String, ?> in, String key, Object value) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (in != null) out.putAll(in);
        if (value == null) out.remove(key);
        else out.put(key, value);
        return copyOf(out);
    }

    public static String string(Map<String, ?> in, String key) {
        if (in == null) return null;
        Object v = in.get(key);
        if (v == null) return null;
        String s = v.toString().trim();
        return s.isEmpty() ? null : s;
    }

    public static boolean isTrue(Map<String, ?> in, String key) {
        if (in == null) return false;
        Object v = in.get(key);
        if (v instanceof Boolean) return (Boolean) v;
        return v != null && "true".equalsIgnoreCase(v.toString().trim());
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> map(Map<String, ?> in, String key) {
        if (in == null) return Map.of();
        Object v = in.get(key);
        return v instanceof Map ? (Map<String, Object>) v : Map.of();
    }

    @SuppressWarnings("unchecked")
    public static List<Object> list(Map<String, ?> in, String key) {
        if (in == null) return List.of();
        Object v = in.get(key);
        return v instanceof List ? (List<Object>) v : List.of();
    }
}
