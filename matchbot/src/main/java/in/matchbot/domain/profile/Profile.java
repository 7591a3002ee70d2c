package in.matchbot.domain.profile;

import java.time.Instant;

/**
 * Profile entity. One row per user id; the id never changes after creation.
 *
 * Fields other than userId/status are nullable while the profile is a draft.
 */
public record Profile(
    long userId,
    String username,      // transport handle, used for contact links
    String name,
    Integer age,
    Gender gender,
    Gender lookingFor,
    String bio,
    String photoRef,      // opaque media reference from the transport
    ProfileStatus status,
    Instant createdAt,
    Instant updatedAt
) {
    public static Profile draft(long userId, String username, Instant now) {
        return new Profile(userId, username, null, null, null, null, null, null,
            ProfileStatus.DRAFT, now, now);
    }

    public boolean isActive() {
        return status == ProfileStatus.ACTIVE;
    }

    public boolean isHidden() {
        return status == ProfileStatus.HIDDEN;
    }

    /**
     * True once onboarding committed at least once (active or hidden).
     */
    public boolean isComplete() {
        return status == ProfileStatus.ACTIVE || status == ProfileStatus.HIDDEN;
    }

    public boolean hasFilters() {
        return gender != null || lookingFor != null;
    }

    /**
     * Merge a partial update; null fields in the update keep the current value.
     */
    public Profile merge(ProfileUpdate update, Instant now) {
        return new Profile(
            userId,
            update.username() != null ? update.username() : username,
            update.name() != null ? update.name() : name,
            update.age() != null ? update.age() : age,
            update.gender() != null ? update.gender() : gender,
            update.lookingFor() != null ? update.lookingFor() : lookingFor,
            update.bio() != null ? update.bio() : bio,
            update.photoRef() != null ? update.photoRef() : photoRef,
            update.status() != null ? update.status() : status,
            createdAt,
            now
        );
    }

    /**
     * Same profile with every editable field cleared and status back to DRAFT.
     */
    public Profile cleared(Instant now) {
        return new Profile(userId, username, null, null, null, null, null, null,
            ProfileStatus.DRAFT, createdAt, now);
    }

    public Profile withFilters(Gender gender, Gender lookingFor, Instant now) {
        return new Profile(userId, username, name, age, gender, lookingFor, bio, photoRef,
            status, createdAt, now);
    }

    public Profile withStatus(ProfileStatus status, Instant now) {
        return new Profile(userId, username, name, age, gender, lookingFor, bio, photoRef,
            status, createdAt, now);
    }
}
