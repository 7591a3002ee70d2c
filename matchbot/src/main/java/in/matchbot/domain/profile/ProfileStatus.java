package in.matchbot.domain.profile;

/**
 * Lifecycle of a profile row.
 * Only ACTIVE profiles are ever offered as browsing candidates.
 */
public enum ProfileStatus {
    DRAFT,
    ACTIVE,
    HIDDEN;

    public static ProfileStatus fromCode(String code) {
        if (code == null) return DRAFT;
        return switch (code.toUpperCase()) {
            case "ACTIVE" -> ACTIVE;
            case "HIDDEN" -> HIDDEN;
            default -> DRAFT;
        };
    }
}
