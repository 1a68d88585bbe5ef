package info.isaksson.erland.modelimport.framework;

/**
 * A document fails a structural precondition of its format (missing root element, not well-formed XML).
 * Fatal for the file; nothing downstream can repair it.
 */
public class StructuralParseException extends RuntimeException {

    private final String format;

    public StructuralParseException(String format, String message) {
        super(message);
        this.format = format;
    }

    public StructuralParseException(String format, String message, Throwable cause) {
        super(message, cause);
        this.format = format;
    }

    public String getFormat() {
        return format;
    }
}
