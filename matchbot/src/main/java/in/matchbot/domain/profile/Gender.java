package in.matchbot.domain.profile;

/**
 * Gender as used by the browse filters. Absent (null) means "not specified"
 * and never filters anyone out.
 */
public enum Gender {
    MALE("Man"),
    FEMALE("Woman");

    private final String label;

    Gender(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Gender fromCode(String code) {
        if (code == null || code.isBlank()) return null;
        return switch (code.toUpperCase()) {
            case "MALE" -> MALE;
            case "FEMALE" -> FEMALE;
            default -> null;
        };
    }
}
