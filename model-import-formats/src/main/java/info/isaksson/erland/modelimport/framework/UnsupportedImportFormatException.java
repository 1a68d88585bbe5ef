package info.isaksson.erland.modelimport.framework;

/** No registered importer recognized the input. */
public class UnsupportedImportFormatException extends RuntimeException {

    private final String fileName;
    private final String extension;
    private final String mimeType;

    public UnsupportedImportFormatException(ImportContext ctx) {
        super("No importer matched \"" + ctx.fileName + "\" (ext: " + (ctx.extension == null ? "none" : ctx.extension)
                + ", type: " + (ctx.mimeType.isEmpty() ? "unknown" : ctx.mimeType) + ")");
        this.fileName = ctx.fileName;
        this.extension = ctx.extension;
        this.mimeType = ctx.mimeType;
    }

    public String getFileName() { return fileName; }

    public String getExtension() { return extension; }

    public String getMimeType() { return mimeType; }
}
