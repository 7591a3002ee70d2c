package in.matchbot.application.port.output;

import in.matchbot.domain.conversation.InputKind;
import in.matchbot.domain.like.LikeResultType;

import java.time.Duration;

/**
 * Bot metrics interface for monitoring and alerting.
 *
 * Key metrics:
 * - Inbound events by input kind
 * - Like outcomes and matches formed
 * - Delivery success/failure
 * - Storage errors by operation
 * - Event handling latency
 */
public interface BotMetrics {

    void recordEvent(InputKind kind);

    /**
     * Record the outcome of a like action (MATCH_FORMED also counts a match).
     */
    void recordLike(LikeResultType outcome);

    /**
     * @param success whether the transport accepted the message
     */
    void recordDelivery(boolean success);

    /**
     * @param operation store operation that failed (e.g. "recordLike")
     */
    void recordStorageError(String operation);

    void recordHandlingLatency(Duration latency);

    void setActiveSessions(int count);

    void recordBroadcast(int delivered, int total);
}
