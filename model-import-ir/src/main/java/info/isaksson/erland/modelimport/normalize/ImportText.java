package info.isaksson.erland.modelimport.normalize;

/** String cleanup shared by the format-specific and generic normalizers. */
public final class ImportText {

    private ImportText() {}

    public static String trimToEmpty(String s) {
        return s == null ? "" : s.trim();
    }

    public static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    /** CRLF and CR become LF, then trimmed; blank text becomes null. */
    public static String cleanDocumentation(String s) {
        if (s == null) return null;
        return trimToNull(s.replace("\r\n", "\n").replace('\r', '\n'));
    }

    /** Cuts {@code s} to at most {@code max} characters. */
    public static String truncate(String s, int max) {
        if (s == null || s.length() <= max) return s;
        return s.substring(0, Math.max(0, max));
    }
}
