package in.matchbot.application.service;

import in.matchbot.config.BotSettings;

import java.util.regex.Pattern;

/**
 * Per-field rules for the onboarding steps.
 *
 * Every method returns the normalized value or throws
 * {@link ValidationException} with a user-facing explanation.
 *
 * Rules (bounds from {@link BotSettings}):
 * - Name: trimmed, length within bounds, no control characters
 * - Age: integer, within the inclusive age range
 * - Bio: trimmed, length within bounds
 * - Photo: non-blank opaque reference
 */
public class ProfileValidator {

    private static final Pattern INTEGER_PATTERN = Pattern.compile("^[+-]?\\d{1,9}$");
    private static final Pattern CONTROL_CHARS = Pattern.compile("\\p{Cntrl}");

    private final BotSettings settings;

    public ProfileValidator(BotSettings settings) {
        this.settings = settings;
    }

    public String validateName(String raw) {
        String name = raw == null ? "" : raw.trim();
        if (name.isEmpty()) {
            throw new ValidationException("name", "Name can't be empty.");
        }
        if (name.startsWith("/")) {
            throw new ValidationException("name", "Name can't start with \"/\".");
        }
        if (CONTROL_CHARS.matcher(name).find()) {
            throw new ValidationException("name", "Name must be a single line of text.");
        }
        if (name.length() < settings.nameMinLength() || name.length() > settings.nameMaxLength()) {
            throw new ValidationException("name", String.format(
                "Name must be %d to %d characters long.", settings.nameMinLength(), settings.nameMaxLength()));
        }
        return name;
    }

    public int validateAge(String raw) {
        String text = raw == null ? "" : raw.trim();
        if (!INTEGER_PATTERN.matcher(text).matches()) {
            throw new ValidationException("age", "Age must be a whole number, e.g. 27.");
        }
        int age = Integer.parseInt(text);
        if (age < settings.ageMin() || age > settings.ageMax()) {
            throw new ValidationException("age", String.format(
                "Age must be between %d and %d.", settings.ageMin(), settings.ageMax()));
        }
        return age;
    }

    public String validateBio(String raw) {
        String bio = raw == null ? "" : raw.trim();
        if (bio.length() < settings.bioMinLength() || bio.isEmpty()) {
            throw new ValidationException("bio", String.format(
                "Tell a bit more about yourself (at least %d characters).", Math.max(1, settings.bioMinLength())));
        }
        if (bio.length() > settings.bioMaxLength()) {
            throw new ValidationException("bio", String.format(
                "Bio is too long (max %d characters).", settings.bioMaxLength()));
        }
        return bio;
    }

    public String validatePhotoRef(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("photo", "Please send a photo.");
        }
        return raw.trim();
    }
}
