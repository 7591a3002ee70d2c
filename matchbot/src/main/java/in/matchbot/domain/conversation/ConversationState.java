package in.matchbot.domain.conversation;

/**
 * Per-user dialogue states.
 *
 * Onboarding: NEW -> COLLECTING_NAME -> COLLECTING_AGE -> COLLECTING_BIO
 * -> COLLECTING_PHOTO -> CONFIRMING -> BROWSING.
 * RESETTING is transient (reachable from anywhere) and always lands on NEW's
 * first prompt. CHOOSING_* is the browse filter sub-dialogue.
 */
public enum ConversationState {
    NEW,
    COLLECTING_NAME,
    COLLECTING_AGE,
    COLLECTING_BIO,
    COLLECTING_PHOTO,
    CONFIRMING,
    BROWSING,
    RESETTING,
    CHOOSING_GENDER,
    CHOOSING_LOOKING_FOR;

    /**
     * States in which a profile draft is being filled or confirmed.
     */
    public boolean isEditingProfile() {
        return switch (this) {
            case COLLECTING_NAME, COLLECTING_AGE, COLLECTING_BIO, COLLECTING_PHOTO, CONFIRMING -> true;
            default -> false;
        };
    }

    public boolean isChoosingFilters() {
        return this == CHOOSING_GENDER || this == CHOOSING_LOOKING_FOR;
    }
}
