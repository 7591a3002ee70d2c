package in.matchbot.infrastructure.metrics;

import in.matchbot.application.port.output.BotMetrics;
import in.matchbot.domain.conversation.InputKind;
import in.matchbot.domain.like.LikeResultType;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of BotMetrics.
 *
 * Key Metrics:
 * - matchbot_events_total{kind} - inbound events
 * - matchbot_likes_total{outcome} - like outcomes
 * - matchbot_matches_total - matches formed
 * - matchbot_deliveries_total{status} - outbound deliveries
 * - matchbot_storage_errors_total{operation} - failed store operations
 * - matchbot_event_latency_seconds - event handling latency
 * - matchbot_active_sessions - sessions held in memory
 * - matchbot_broadcast_messages_total{status} - broadcast fan-out
 */
public class PrometheusBotMetrics implements BotMetrics {

    private final CollectorRegistry registry;

    private final Counter eventCounter;
    private final Counter likeCounter;
    private final Counter matchCounter;
    private final Counter deliveryCounter;
    private final Counter storageErrorCounter;
    private final Histogram eventLatency;
    private final Gauge activeSessions;
    private final Counter broadcastCounter;

    public PrometheusBotMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusBotMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.eventCounter = Counter.build()
            .name("matchbot_events_total")
            .help("Total number of inbound events")
            .labelNames("kind")
            .register(registry);

        this.likeCounter = Counter.build()
            .name("matchbot_likes_total")
            .help("Total number of like actions by outcome")
            .labelNames("outcome")
            .register(registry);

        this.matchCounter = Counter.build()
            .name("matchbot_matches_total")
            .help("Total number of matches formed")
            .register(registry);

        this.deliveryCounter = Counter.build()
            .name("matchbot_deliveries_total")
            .help("Total number of outbound deliveries")
            .labelNames("status")
            .register(registry);

        this.storageErrorCounter = Counter.build()
            .name("matchbot_storage_errors_total")
            .help("Total number of failed store operations")
            .labelNames("operation")
            .register(registry);

        this.eventLatency = Histogram.build()
            .name("matchbot_event_latency_seconds")
            .help("Event handling latency in seconds")
            .buckets(0.005, 0.01, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5)
            .register(registry);

        this.activeSessions = Gauge.build()
            .name("matchbot_active_sessions")
            .help("Conversation sessions held in memory")
            .register(registry);

        this.broadcastCounter = Counter.build()
            .name("matchbot_broadcast_messages_total")
            .help("Total number of broadcast messages")
            .labelNames("status")
            .register(registry);
    }

    @Override
    public void recordEvent(InputKind kind) {
        eventCounter.labels(kind.name()).inc();
    }

    @Override
    public void recordLike(LikeResultType outcome) {
        likeCounter.labels(outcome.name()).inc();
        if (outcome == LikeResultType.MATCH_FORMED) {
            matchCounter.inc();
        }
    }

    @Override
    public void recordDelivery(boolean success) {
        deliveryCounter.labels(success ? "success" : "failure").inc();
    }

    @Override
    public void recordStorageError(String operation) {
        storageErrorCounter.labels(operation).inc();
    }

    @Override
    public void recordHandlingLatency(Duration latency) {
        eventLatency.observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void setActiveSessions(int count) {
        activeSessions.set(count);
    }

    @Override
    public void recordBroadcast(int delivered, int total) {
        broadcastCounter.labels("delivered").inc(delivered);
        broadcastCounter.labels("failed").inc(total - delivered);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
