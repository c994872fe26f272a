package ai.canopy.exception;

/** Base class of the recoverable failures raised while building or querying syntax trees. */
public class CanopyException extends Exception {

    public CanopyException(String message) {
        super(message);
    }

    public CanopyException(String message, Throwable cause) {
        super(message, cause);
    }
}
