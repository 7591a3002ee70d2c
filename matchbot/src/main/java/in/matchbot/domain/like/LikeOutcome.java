package in.matchbot.domain.like;

/**
 * Result of the store's atomic insert-and-check.
 *
 * @param recorded true if this call inserted the like, false if it already existed
 * @param mutual   true if the reverse like exists after this call
 */
public record LikeOutcome(boolean recorded, boolean mutual) {

    public static LikeOutcome recorded(boolean mutual) {
        return new LikeOutcome(true, mutual);
    }

    public static LikeOutcome alreadyLiked(boolean mutual) {
        return new LikeOutcome(false, mutual);
    }

    public boolean alreadyLiked() {
        return !recorded;
    }

    /**
     * A match is formed only by the call that inserted the second direction.
     */
    public boolean formsMatch() {
        return recorded && mutual;
    }
}
