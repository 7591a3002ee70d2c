package in.matchbot.application.service;

import in.matchbot.application.port.output.LikeRepository;
import in.matchbot.application.port.output.ProfileRepository;
import in.matchbot.domain.conversation.ConversationSession;
import in.matchbot.domain.like.LikeOutcome;
import in.matchbot.domain.like.LikeResult;
import in.matchbot.domain.profile.CandidateQuery;
import in.matchbot.domain.profile.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Matching engine: likes, passes and the browse cycle.
 *
 * Stateless apart from the ports; the only per-user state it touches is the
 * session handed in by the caller, which the dispatcher owns.
 */
public final class MatchingService {
    private static final Logger log = LoggerFactory.getLogger(MatchingService.class);

    private final ProfileRepository profiles;
    private final LikeRepository likes;

    public MatchingService(ProfileRepository profiles, LikeRepository likes) {
        this.profiles = profiles;
        this.likes = likes;
    }

    /**
     * Record a like and report whether it formed a match.
     *
     * INVALID_TARGET for self-likes and targets that are not active;
     * NO_OP when the like already existed (a match is reported once only).
     */
    public LikeResult like(long likerId, long likeeId) {
        if (likerId == likeeId) {
            return LikeResult.invalidTarget(likerId, likeeId, "self-like");
        }

        Optional<Profile> target = profiles.findById(likeeId);
        if (target.isEmpty() || !target.get().isActive()) {
            log.debug("[MATCH] {} -> {} rejected: target not active", likerId, likeeId);
            return LikeResult.invalidTarget(likerId, likeeId, "target not active");
        }

        LikeOutcome outcome = likes.recordLike(likerId, likeeId);
        if (outcome.alreadyLiked()) {
            return LikeResult.noOp(likerId, likeeId);
        }
        if (outcome.formsMatch()) {
            log.info("[MATCH] Match formed between {} and {}", likerId, likeeId);
            return LikeResult.matchFormed(likerId, likeeId);
        }
        return LikeResult.liked(likerId, likeeId);
    }

    /**
     * Skip the candidate for the rest of the current browsing cycle. Not durable.
     */
    public void pass(ConversationSession session, long candidateId) {
        session.markPassed(candidateId);
    }

    /**
     * Next candidate after the session cursor, honouring passes and the
     * viewer's filters. Moves the cursor past the returned profile.
     */
    public Optional<Profile> nextCandidate(ConversationSession session, Profile viewer) {
        CandidateQuery query = new CandidateQuery(
            session.userId(),
            session.browseCursor(),
            session.passedIds(),
            viewer != null ? viewer.gender() : null,
            viewer != null ? viewer.lookingFor() : null
        );

        Optional<Profile> candidate = profiles.nextCandidate(query);
        if (candidate.isPresent()) {
            session.presentCandidate(candidate.get().userId());
        } else {
            session.clearCurrentCandidate();
        }
        return candidate;
    }

    /**
     * Start the browse cycle over: everyone passed becomes visible again.
     */
    public void restartCycle(ConversationSession session) {
        session.resetBrowseCycle();
    }

    /**
     * Drop every like the user authored, revert the profile to draft and
     * forget the session's passes.
     */
    public void reset(ConversationSession session) {
        profiles.resetUser(session.userId());
        session.resetBrowseCycle();
        log.info("[MATCH] Reset user {}", session.userId());
    }
}
