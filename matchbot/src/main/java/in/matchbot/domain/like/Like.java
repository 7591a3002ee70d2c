package in.matchbot.domain.like;

import java.time.Instant;

/**
 * One-directional expression of interest. (likerId, likeeId) is unique.
 */
public record Like(
    long likerId,
    long likeeId,
    Instant createdAt
) {
    public Like {
        if (likerId == likeeId) {
            throw new IllegalArgumentException("Self-like is not allowed: " + likerId);
        }
    }
}
