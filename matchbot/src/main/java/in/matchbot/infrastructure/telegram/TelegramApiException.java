package in.matchbot.infrastructure.telegram;

import java.time.Duration;

/**
 * Bot API call failed: transport error, non-200 status or {@code "ok": false}.
 */
public class TelegramApiException extends RuntimeException {

    private final String method;
    private final int errorCode;
    private final int retryAfterSeconds;

    public TelegramApiException(String method, int errorCode, String description) {
        this(method, errorCode, description, 0);
    }

    public TelegramApiException(String method, int errorCode, String description, int retryAfterSeconds) {
        super(String.format("%s failed (%d): %s", method, errorCode, description));
        this.method = method;
        this.errorCode = errorCode;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public TelegramApiException(String method, String description, Throwable cause) {
        super(String.format("%s failed: %s", method, description), cause);
        this.method = method;
        this.errorCode = -1;
        this.retryAfterSeconds = 0;
    }

    public String getMethod() {
        return method;
    }

    /**
     * HTTP/API error code, -1 when the request never got a response.
     */
    public int getErrorCode() {
        return errorCode;
    }

    /**
     * Flood-control wait from {@code parameters.retry_after} on a 429, zero otherwise.
     */
    public Duration getRetryAfter() {
        return Duration.ofSeconds(retryAfterSeconds);
    }
}
