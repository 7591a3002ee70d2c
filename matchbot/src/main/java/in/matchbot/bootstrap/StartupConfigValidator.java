package in.matchbot.bootstrap;

import in.matchbot.config.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Startup configuration validator.
 *
 * Runs before anything is wired. Throws IllegalStateException if the
 * configuration is invalid; App then refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    private static final Set<String> STORES = Set.of(AppConfig.STORE_POSTGRES, AppConfig.STORE_MEMORY);
    private static final Set<String> TRANSPORTS = Set.of(AppConfig.TRANSPORT_POLLING, AppConfig.TRANSPORT_WEBHOOK);

    public static void validate(AppConfig config) {
        log.info("Running startup config validation...");

        if (config.botToken() == null || config.botToken().isBlank()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: BOT_TOKEN is required\n" +
                "Set BOT_TOKEN to the token issued for the bot. System refuses to start."
            );
        }

        if (!STORES.contains(config.store())) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: STORE must be one of " + STORES + ", got '" + config.store() + "'");
        }

        if (!TRANSPORTS.contains(config.transport())) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: TRANSPORT must be one of " + TRANSPORTS + ", got '" + config.transport() + "'");
        }

        if (AppConfig.TRANSPORT_WEBHOOK.equals(config.transport())
                && (config.webhookSecret() == null || config.webhookSecret().isBlank())) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: TRANSPORT=webhook requires WEBHOOK_SECRET");
        }

        if (config.port() <= 0 || config.port() > 65535) {
            throw new IllegalStateException("❌ INVALID CONFIG: PORT out of range: " + config.port());
        }

        if (config.pollTimeoutSeconds() < 0 || config.pollTimeoutSeconds() > 50) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: POLL_TIMEOUT_SECONDS must be 0..50, got " + config.pollTimeoutSeconds());
        }

        if (!config.settings().isValid()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: profile rules are inconsistent: " + config.settings());
        }

        log.info("✅ Startup config validation passed ({})", config);
    }

    private StartupConfigValidator() {}
}
