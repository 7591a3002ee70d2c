package in.matchbot.domain.conversation;

import java.time.Instant;

/**
 * Transport-agnostic inbound event: who sent what.
 */
public record InboundEvent(
    long userId,
    String username,
    UserInput input,
    Instant receivedAt
) {
    public static InboundEvent of(long userId, String username, UserInput input) {
        return new InboundEvent(userId, username, input, Instant.now());
    }
}
