package info.isaksson.erland.modelimport.apply;

import info.isaksson.erland.modelimport.types.ArchimatePalette;

import java.util.Locale;

/** Maps a source viewpoint name onto a built-in viewpoint id. */
public final class Viewpoints {

    public static final String DEFAULT = "layered";

    private Viewpoints() {}

    /**
     * Accepts a built-in id as is, then tries the name in kebab case ({@code "Service Realization"} becomes
     * {@code service-realization}); anything else is {@value #DEFAULT}.
     */
    public static String resolve(String viewpoint) {
        String raw = viewpoint == null ? "" : viewpoint.trim();
        if (raw.isEmpty()) return DEFAULT;
        if (ArchimatePalette.VIEWPOINT_IDS.contains(raw)) return raw;

        String kebab = raw
                .replaceAll("([a-z])([A-Z])", "$1-$2")
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (kebab.endsWith("-viewpoint")) kebab = kebab.substring(0, kebab.length() - "-viewpoint".length());
        if (ArchimatePalette.VIEWPOINT_IDS.contains(kebab)) return kebab;
        return DEFAULT;
    }
}
