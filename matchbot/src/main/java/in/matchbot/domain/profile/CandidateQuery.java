package in.matchbot.domain.profile;

import java.util.Set;

/**
 * Browse query for the next candidate of one viewer.
 *
 * Candidates are scanned in ascending user id order strictly after
 * {@code afterUserId} (null = start of the cycle). Users the viewer already
 * liked are always excluded by the store; {@code excludedIds} carries the
 * passes of the current cycle.
 */
public record CandidateQuery(
    long viewerId,
    Long afterUserId,
    Set<Long> excludedIds,
    Gender viewerGender,
    Gender lookingFor
) {
    public CandidateQuery {
        excludedIds = excludedIds == null ? Set.of() : Set.copyOf(excludedIds);
    }

    public static CandidateQuery of(long viewerId, Long afterUserId, Set<Long> excludedIds) {
        return new CandidateQuery(viewerId, afterUserId, excludedIds, null, null);
    }

    /**
     * Skip candidates of the wrong gender and
     * candidates whose own preference excludes the viewer. Unset values never filter.
     */
    public boolean accepts(Profile candidate) {
        if (lookingFor != null && candidate.gender() != null && candidate.gender() != lookingFor) {
            return false;
        }
        if (candidate.lookingFor() != null && viewerGender != null && candidate.lookingFor() != viewerGender) {
            return false;
        }
        return true;
    }
}
