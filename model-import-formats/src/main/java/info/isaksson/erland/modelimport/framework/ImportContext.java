package info.isaksson.erland.modelimport.framework;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;

/**
 * What a sniffer gets to look at: a bounded prefix of the input (raw and lossily decoded as UTF-8)
 * plus the lower-cased file name, its extension and the mime type.
 */
public final class ImportContext {

    public static final int DEFAULT_SNIFF_BYTES = 256 * 1024;

    public final String sniffText;
    public final byte[] sniffBytes;
    public final String fileName;
    /** Lower-cased extension without the dot; null when the name has none. */
    public final String extension;
    public final String mimeType;

    public ImportContext(String sniffText, byte[] sniffBytes, String fileName, String extension, String mimeType) {
        this.sniffText = sniffText == null ? "" : sniffText;
        this.sniffBytes = sniffBytes == null ? new byte[0] : sniffBytes;
        this.fileName = fileName == null ? "" : fileName;
        this.extension = extension;
        this.mimeType = mimeType == null ? "" : mimeType;
    }

    public static ImportContext of(ImportSource source) {
        return of(source, DEFAULT_SNIFF_BYTES);
    }

    public static ImportContext of(ImportSource source, int maxSniffBytes) {
        int n = Math.min(source.content.length, Math.max(0, maxSniffBytes));
        byte[] prefix = Arrays.copyOf(source.content, n);
        // Malformed or truncated sequences become U+FFFD.
        String text = new String(prefix, StandardCharsets.UTF_8);
        String fileName = source.fileName.toLowerCase(Locale.ROOT);
        return new ImportContext(text, prefix, fileName, extensionOf(fileName), source.mimeType);
    }

    static String extensionOf(String fileName) {
        int idx = fileName.lastIndexOf('.');
        if (idx <= 0) return null;
        String ext = fileName.substring(idx + 1).trim().toLowerCase(Locale.ROOT);
        return ext.isEmpty() ? null : ext;
    }

    public boolean hasExtension(String... candidates) {
        if (extension == null) return false;
        for (String c : candidates) {
            if (extension.equals(c)) return true;
        }
        return false;
    }

    /** The byte prefix interpreted as ISO-8859-1, for ASCII markers when UTF-8 decoding is garbled. */
    public String sniffAscii() {
        return new String(sniffBytes, StandardCharsets.ISO_8859_1);
    }
}
