package in.matchbot.application.port.output;

import in.matchbot.domain.profile.CandidateQuery;
import in.matchbot.domain.profile.Gender;
import in.matchbot.domain.profile.Profile;
import in.matchbot.domain.profile.ProfileStatus;
import in.matchbot.domain.profile.ProfileUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Durable profile storage. Every mutating call is atomic; failures surface as
 * {@link StorageException} and leave nothing half-written.
 */
public interface ProfileRepository {
    /**
     * Merge the non-null fields into the stored profile, creating a DRAFT row
     * when absent. Returns the merged profile.
     */
    Profile upsertProfile(long userId, ProfileUpdate update);

    Optional<Profile> findById(long userId);

    /**
     * Next ACTIVE profile in ascending user id order after the query cursor,
     * excluding the viewer, the query's excluded ids and everyone the viewer
     * already liked. Empty when the cycle is exhausted.
     */
    Optional<Profile> nextCandidate(CandidateQuery query);

    /**
     * Delete every like authored by the user and clear the profile back to DRAFT.
     * Likes received from others are untouched.
     */
    void resetUser(long userId);

    /**
     * Remove the profile and every like authored or received by the user.
     */
    void deleteUser(long userId);

    /**
     * Overwrite both filter fields (null clears).
     */
    Profile updateFilters(long userId, Gender gender, Gender lookingFor);

    Profile setStatus(long userId, ProfileStatus status);

    List<Long> listActiveUserIds();
}
