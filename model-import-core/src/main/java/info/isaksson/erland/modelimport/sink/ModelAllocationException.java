package info.isaksson.erland.modelimport.sink;

/** The sink could not create a model; nothing was imported. */
public class ModelAllocationException extends RuntimeException {

    public ModelAllocationException(String message) {
        super(message);
    }

    public ModelAllocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
