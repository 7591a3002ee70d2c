package in.matchbot.config;

import in.matchbot.util.Env;

import java.util.Set;

/**
 * Profile rules and bot behaviour knobs.
 *
 * Loaded once at startup; the conversation engine and validator only ever
 * see this record, never the environment.
 */
public record BotSettings(
    int ageMin,              // inclusive
    int ageMax,              // inclusive
    int nameMinLength,
    int nameMaxLength,
    int bioMinLength,
    int bioMaxLength,
    Set<Long> adminIds,      // users allowed to /broadcast
    String supportContact
) {
    public BotSettings {
        adminIds = adminIds == null ? Set.of() : Set.copyOf(adminIds);
    }

    /**
     * Age 16..100, name 2..64 characters, bio 1..1000 characters.
     */
    public static BotSettings defaults() {
        return new BotSettings(
            16,
            100,
            2,
            64,
            1,
            1000,
            Set.of(),
            "https://t.me/support"
        );
    }

    public static BotSettings fromEnv() {
        BotSettings d = defaults();
        return new BotSettings(
            Env.getInt("AGE_MIN", d.ageMin()),
            Env.getInt("AGE_MAX", d.ageMax()),
            Env.getInt("NAME_MIN_LENGTH", d.nameMinLength()),
            Env.getInt("NAME_MAX_LENGTH", d.nameMaxLength()),
            Env.getInt("BIO_MIN_LENGTH", d.bioMinLength()),
            Env.getInt("BIO_MAX_LENGTH", d.bioMaxLength()),
            Env.getLongSet("ADMIN_IDS"),
            Env.get("SUPPORT_CONTACT", d.supportContact())
        );
    }

    public boolean isAdmin(long userId) {
        return adminIds.contains(userId);
    }

    /**
     * Validate configuration values.
     */
    public boolean isValid() {
        return ageMin > 0 && ageMin <= ageMax && ageMax <= 150
            && nameMinLength > 0 && nameMinLength <= nameMaxLength
            && bioMinLength >= 0 && bioMinLength <= bioMaxLength
            && supportContact != null && !supportContact.isBlank();
    }
}
