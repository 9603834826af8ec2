package turnstile.core.port.out;

/**
 * The key-value store could not answer.
 *
 * <p>Distinct from "not found": callers must fail closed when they see this.
 */
public class StoreUnavailableException extends RuntimeException {

    private final String operation;

    public StoreUnavailableException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public StoreUnavailableException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    /** Returns the store operation that failed. */
    public String getOperation() {
        return operation;
    }
}
