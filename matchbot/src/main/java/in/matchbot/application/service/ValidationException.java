package in.matchbot.application.service;

/**
 * A user-supplied profile field failed its rule. The message is safe to show
 * to the user.
 */
public class ValidationException extends RuntimeException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
