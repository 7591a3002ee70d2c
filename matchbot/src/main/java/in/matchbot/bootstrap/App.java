package in.matchbot.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.matchbot.application.port.output.LikeRepository;
import in.matchbot.application.port.output.ProfileRepository;
import in.matchbot.application.service.BroadcastService;
import in.matchbot.application.service.ConversationEngine;
import in.matchbot.application.service.MatchNotifier;
import in.matchbot.application.service.MatchingService;
import in.matchbot.application.service.ProfileValidator;
import in.matchbot.application.service.SessionCoordinator;
import in.matchbot.application.service.UpdateDispatcher;
import in.matchbot.config.AppConfig;
import in.matchbot.infrastructure.metrics.PrometheusBotMetrics;
import in.matchbot.infrastructure.persistence.InMemoryMatchStore;
import in.matchbot.infrastructure.persistence.PostgresLikeRepository;
import in.matchbot.infrastructure.persistence.PostgresProfileRepository;
import in.matchbot.infrastructure.telegram.BackoffPolicy;
import in.matchbot.infrastructure.telegram.TelegramBotClient;
import in.matchbot.infrastructure.telegram.TelegramLongPoller;
import in.matchbot.infrastructure.telegram.TelegramUpdateMapper;
import in.matchbot.infrastructure.telegram.TelegramUpdateRouter;
import in.matchbot.migration.SchemaMigration;
import in.matchbot.transport.http.HealthHandler;
import in.matchbot.transport.http.PrometheusMetricsHandler;
import in.matchbot.transport.http.TelegramWebhookHandler;
import in.matchbot.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Core Java entry point (NO Spring).
 *
 * Wires:
 * - PostgreSQL repositories (or the in-memory store with STORE=memory)
 * - Matching engine, conversation engine, per-user dispatcher
 * - Telegram transport (long polling or webhook)
 * - Undertow for /metrics, /api/health and the webhook
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== matchbot starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        AppConfig config = AppConfig.fromEnv();
        try {
            StartupConfigValidator.validate(config);
        } catch (IllegalStateException e) {
            log.error("❌ STARTUP VALIDATION FAILED", e);
            System.err.println("\n" + e.getMessage() + "\n");
            System.exit(1);
        }

        // ═══════════════════════════════════════════════════════════════
        // Store
        // ═══════════════════════════════════════════════════════════════
        ProfileRepository profileRepo;
        LikeRepository likeRepo;
        HikariDataSource dataSource = null;

        if (config.isMemoryStore()) {
            log.warn("STORE=memory: profiles and likes are lost on restart");
            InMemoryMatchStore store = new InMemoryMatchStore();
            profileRepo = store;
            likeRepo = store;
        } else {
            dataSource = createDataSource();
            new SchemaMigration(dataSource).migrate();
            profileRepo = new PostgresProfileRepository(dataSource);
            likeRepo = new PostgresLikeRepository(dataSource);
        }

        // ═══════════════════════════════════════════════════════════════
        // Core
        // ═══════════════════════════════════════════════════════════════
        PrometheusBotMetrics metrics = new PrometheusBotMetrics();
        TelegramBotClient telegram = new TelegramBotClient(config.botToken());

        MatchingService matching = new MatchingService(profileRepo, likeRepo);
        ConversationEngine engine = new ConversationEngine(
            profileRepo, matching, new ProfileValidator(config.settings()), config.settings());
        BroadcastService broadcasts = new BroadcastService(profileRepo, telegram, metrics);
        UpdateDispatcher dispatcher = new UpdateDispatcher(
            engine, new MatchNotifier(profileRepo), telegram, broadcasts, new SessionCoordinator(), metrics);

        TelegramUpdateRouter router = new TelegramUpdateRouter(new TelegramUpdateMapper(), dispatcher, telegram);

        // ═══════════════════════════════════════════════════════════════
        // HTTP
        // ═══════════════════════════════════════════════════════════════
        RoutingHandler routes = Handlers.routing()
            .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            .get("/api/health", new HealthHandler(config.store(), config.transport(),
                dispatcher::sessionCount, dispatcher::pendingEvents));

        boolean webhookMode = AppConfig.TRANSPORT_WEBHOOK.equals(config.transport());
        if (webhookMode) {
            routes.post("/telegram/webhook", new TelegramWebhookHandler(router, config.webhookSecret()));
        }

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(routes)
            .build();
        server.start();
        log.info("HTTP listening on http://localhost:{}/ (metrics, health{})",
            config.port(), webhookMode ? ", webhook" : "");

        // ═══════════════════════════════════════════════════════════════
        // Transport
        // ═══════════════════════════════════════════════════════════════
        TelegramLongPoller poller = null;
        if (webhookMode) {
            if (config.webhookUrl() != null) {
                telegram.setWebhook(config.webhookUrl(), config.webhookSecret());
            } else {
                log.info("WEBHOOK_URL not set; assuming the webhook is registered externally");
            }
        } else {
            telegram.deleteWebhook();
            poller = new TelegramLongPoller(telegram, router, BackoffPolicy.forPolling(), config.pollTimeoutSeconds());
            poller.start();
        }

        // ═══════════════════════════════════════════════════════════════
        // Shutdown
        // ═══════════════════════════════════════════════════════════════
        final TelegramLongPoller pollerRef = poller;
        final HikariDataSource dataSourceRef = dataSource;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            if (pollerRef != null) {
                pollerRef.stop();
            }
            server.stop();
            dispatcher.shutdown();
            if (dataSourceRef != null) {
                dataSourceRef.close();
            }
            log.info("Shutdown complete");
        }, "shutdown-hook"));

        log.info("matchbot started (store={}, transport={})", config.store(), config.transport());
    }

    private static HikariDataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/matchbot");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("matchbot-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }

    private App() {}
}
