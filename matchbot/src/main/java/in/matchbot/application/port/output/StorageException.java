package in.matchbot.application.port.output;

/**
 * Storage I/O failure. Fatal for the current request only; the operation
 * that threw it has been rolled back.
 */
public class StorageException extends RuntimeException {

    private final String operation;

    public StorageException(String operation, String message, Throwable cause) {
        super(String.format("[%s] %s", operation, message), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
