package in.matchbot.application.port.output;

/**
 * Transport refused or failed to deliver a message to one user.
 */
public class DeliveryException extends RuntimeException {

    private final long userId;

    public DeliveryException(long userId, String message) {
        super(String.format("Delivery to %d failed: %s", userId, message));
        this.userId = userId;
    }

    public DeliveryException(long userId, String message, Throwable cause) {
        super(String.format("Delivery to %d failed: %s", userId, message), cause);
        this.userId = userId;
    }

    public long getUserId() {
        return userId;
    }
}
