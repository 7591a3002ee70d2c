package in.matchbot.domain.like;

public enum LikeResultType {
    LIKED,            // recorded, not (yet) mutual
    MATCH_FORMED,     // recorded and the reverse like exists
    NO_OP,            // already liked earlier
    INVALID_TARGET    // self-like or target not active
}
