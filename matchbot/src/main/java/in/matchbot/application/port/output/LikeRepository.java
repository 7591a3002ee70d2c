package in.matchbot.application.port.output;

import in.matchbot.domain.like.Like;
import in.matchbot.domain.like.LikeOutcome;

import java.util.List;
import java.util.Optional;

/**
 * Durable like storage.
 */
public interface LikeRepository {
    /**
     * Insert (liker, likee) unless present and, in the same atomic step, check
     * for (likee, liker). When both directions race, exactly one caller gets
     * {@code recorded && mutual}.
     */
    LikeOutcome recordLike(long likerId, long likeeId);

    /**
     * Idempotent delete.
     */
    void removeLike(long likerId, long likeeId);

    Optional<Like> findLike(long likerId, long likeeId);

    List<Like> findByLiker(long likerId);
}
