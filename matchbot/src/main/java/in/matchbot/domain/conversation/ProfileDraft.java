package in.matchbot.domain.conversation;

import in.matchbot.domain.profile.Profile;

/**
 * In-progress copy of the profile fields while the user walks through the
 * onboarding/edit steps. Nothing here is persisted until CONFIRMING accepts.
 *
 * When editing, {@code previous} holds the stored profile so every step can
 * offer "Keep current".
 */
public final class ProfileDraft {
    private String name;
    private Integer age;
    private String bio;
    private String photoRef;
    private final Profile previous;

    private ProfileDraft(Profile previous) {
        this.previous = previous;
    }

    public static ProfileDraft empty() {
        return new ProfileDraft(null);
    }

    /**
     * Draft for editing an existing profile.
     */
    public static ProfileDraft editing(Profile stored) {
        return new ProfileDraft(stored);
    }

    public ProfileDraft copy() {
        ProfileDraft copy = new ProfileDraft(previous);
        copy.name = name;
        copy.age = age;
        copy.bio = bio;
        copy.photoRef = photoRef;
        return copy;
    }

    public boolean isComplete() {
        return name != null && age != null && bio != null && photoRef != null;
    }

    public Profile previous() {
        return previous;
    }

    public String previousName() {
        return previous != null ? previous.name() : null;
    }

    public Integer previousAge() {
        return previous != null ? previous.age() : null;
    }

    public String previousBio() {
        return previous != null ? previous.bio() : null;
    }

    public String previousPhotoRef() {
        return previous != null ? previous.photoRef() : null;
    }

    public String name() { return name; }
    public Integer age() { return age; }
    public String bio() { return bio; }
    public String photoRef() { return photoRef; }

    public void setName(String name) { this.name = name; }
    public void setAge(Integer age) { this.age = age; }
    public void setBio(String bio) { this.bio = bio; }
    public void setPhotoRef(String photoRef) { this.photoRef = photoRef; }
}
