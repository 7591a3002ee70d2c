package in.matchbot.domain.like;

/**
 * What a "like" action produced. MATCH_FORMED is the only variant that makes
 * the dispatcher notify both users.
 */
public record LikeResult(
    LikeResultType type,
    long likerId,
    long likeeId,
    String reason
) {
    public static LikeResult liked(long likerId, long likeeId) {
        return new LikeResult(LikeResultType.LIKED, likerId, likeeId, null);
    }

    public static LikeResult matchFormed(long likerId, long likeeId) {
        return new LikeResult(LikeResultType.MATCH_FORMED, likerId, likeeId, null);
    }

    public static LikeResult noOp(long likerId, long likeeId) {
        return new LikeResult(LikeResultType.NO_OP, likerId, likeeId, null);
    }

    public static LikeResult invalidTarget(long likerId, long likeeId, String reason) {
        return new LikeResult(LikeResultType.INVALID_TARGET, likerId, likeeId, reason);
    }

    public boolean isMatch() {
        return type == LikeResultType.MATCH_FORMED;
    }
}
