package in.matchbot.config;

import in.matchbot.util.Env;

/**
 * Process-level configuration, read once at startup.
 */
public record AppConfig(
    String botToken,        // secret, never logged
    String store,           // postgres | memory
    String transport,       // polling | webhook
    int port,
    int pollTimeoutSeconds,
    String webhookUrl,      // public URL to register in webhook mode (optional)
    String webhookSecret,
    BotSettings settings
) {
    public static final String STORE_POSTGRES = "postgres";
    public static final String STORE_MEMORY = "memory";
    public static final String TRANSPORT_POLLING = "polling";
    public static final String TRANSPORT_WEBHOOK = "webhook";

    public static AppConfig fromEnv() {
        return new AppConfig(
            Env.get("BOT_TOKEN", null),
            Env.get("STORE", STORE_POSTGRES).trim().toLowerCase(),
            Env.get("TRANSPORT", TRANSPORT_POLLING).trim().toLowerCase(),
            Env.getInt("PORT", 8080),
            Env.getInt("POLL_TIMEOUT_SECONDS", 30),
            Env.get("WEBHOOK_URL", null),
            Env.get("WEBHOOK_SECRET", null),
            BotSettings.fromEnv()
        );
    }

    public boolean isMemoryStore() {
        return STORE_MEMORY.equals(store);
    }

    @Override
    public String toString() {
        return "AppConfig[store=" + store + ", transport=" + transport + ", port=" + port
            + ", pollTimeoutSeconds=" + pollTimeoutSeconds + ", webhookUrl=" + webhookUrl
            + ", admins=" + settings.adminIds().size() + "]";
    }
}
