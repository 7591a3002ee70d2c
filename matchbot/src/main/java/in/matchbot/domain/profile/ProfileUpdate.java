package in.matchbot.domain.profile;

/**
 * Partial profile update. Null means "leave as is".
 */
public record ProfileUpdate(
    String username,
    String name,
    Integer age,
    Gender gender,
    Gender lookingFor,
    String bio,
    String photoRef,
    ProfileStatus status
) {
    public static ProfileUpdate username(String username) {
        return new ProfileUpdate(username, null, null, null, null, null, null, null);
    }

    public static ProfileUpdate status(ProfileStatus status) {
        return new ProfileUpdate(null, null, null, null, null, null, null, status);
    }

    /**
     * Commit of a completed onboarding draft: every required field plus ACTIVE.
     */
    public static ProfileUpdate activate(String name, int age, String bio, String photoRef) {
        return new ProfileUpdate(null, name, age, null, null, bio, photoRef, ProfileStatus.ACTIVE);
    }

    public boolean isEmpty() {
        return username == null && name == null && age == null && gender == null
            && lookingFor == null && bio == null && photoRef == null && status == null;
    }
}
