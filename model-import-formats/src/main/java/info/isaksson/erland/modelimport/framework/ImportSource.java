package info.isaksson.erland.modelimport.framework;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** The raw input of one import: file name, complete content and an optional mime type. */
public final class ImportSource {
    public final String fileName;
    public final byte[] content;
    public final String mimeType;

    public ImportSource(String fileName, byte[] content, String mimeType) {
        if (content == null) throw new IllegalArgumentException("content must not be null");
        this.fileName = fileName == null ? "" : fileName;
        this.content = content;
        this.mimeType = mimeType == null ? "" : mimeType;
    }

    public static ImportSource of(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path must not be null");
        byte[] bytes = Files.readAllBytes(path);
        String mime = Files.probeContentType(path);
        Path name = path.getFileName();
        return new ImportSource(name == null ? path.toString() : name.toString(), bytes, mime);
    }
}
