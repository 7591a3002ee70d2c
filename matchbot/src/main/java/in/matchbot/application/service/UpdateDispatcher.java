package in.matchbot.application.service;

import in.matchbot.application.port.output.BotMetrics;
import in.matchbot.application.port.output.DeliveryException;
import in.matchbot.application.port.output.MessageSender;
import in.matchbot.application.port.output.StorageException;
import in.matchbot.domain.conversation.ConversationSession;
import in.matchbot.domain.conversation.InboundEvent;
import in.matchbot.domain.conversation.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for inbound events from any transport.
 *
 * Events are routed to the sender's partition on the {@link SessionCoordinator},
 * so one user's events are handled one at a time in arrival order while
 * different users proceed concurrently.
 *
 * Per event:
 * 1. Snapshot the session
 * 2. Run the conversation engine
 * 3. On StorageException restore the snapshot and reply "try again"
 * 4. Drop the session once the user's profile is deleted
 * 5. Deliver match notices (both sides) then the replies, each independently
 * 6. Hand admin broadcasts to the broadcast service
 */
public final class UpdateDispatcher {
    private static final Logger log = LoggerFactory.getLogger(UpdateDispatcher.class);

    private final ConversationEngine engine;
    private final MatchNotifier notifier;
    private final MessageSender sender;
    private final BroadcastService broadcasts;
    private final SessionCoordinator coordinator;
    private final BotMetrics metrics;

    private final Map<Long, ConversationSession> sessions = new ConcurrentHashMap<>();

    public UpdateDispatcher(ConversationEngine engine,
                            MatchNotifier notifier,
                            MessageSender sender,
                            BroadcastService broadcasts,
                            SessionCoordinator coordinator,
                            BotMetrics metrics) {
        this.engine = engine;
        this.notifier = notifier;
        this.sender = sender;
        this.broadcasts = broadcasts;
        this.coordinator = coordinator;
        this.metrics = metrics;
    }

    /**
     * Queue an event on its user's partition.
     *
     * @return future completing once the event is handled and its replies are sent
     */
    public CompletableFuture<Void> dispatch(InboundEvent event) {
        return coordinator.execute(event.userId(), () -> process(event));
    }

    void process(InboundEvent event) {
        long startNanos = System.nanoTime();
        long userId = event.userId();
        metrics.recordEvent(event.input().kind());

        ConversationSession session = sessions.computeIfAbsent(userId, id -> new ConversationSession(id));
        metrics.setActiveSessions(sessions.size());
        ConversationSession snapshot = session.snapshot();

        EngineResult result;
        try {
            result = engine.handle(session, event);
        } catch (StorageException e) {
            session.restoreFrom(snapshot);
            metrics.recordStorageError(e.getOperation());
            log.error("[DISPATCH] Storage failure for user {}: {}", userId, e.getMessage());
            deliver(OutboundMessage.text(userId, Messages.TRY_AGAIN));
            return;
        } catch (RuntimeException e) {
            session.restoreFrom(snapshot);
            log.error("[DISPATCH] Unexpected failure for user {} in state {}", userId, snapshot.state(), e);
            deliver(OutboundMessage.text(userId, Messages.TRY_AGAIN));
            return;
        } finally {
            metrics.recordHandlingLatency(Duration.ofNanos(System.nanoTime() - startNanos));
        }

        if (result.partiallyFailed()) {
            metrics.recordStorageError(result.failedStorageOperation());
        }
        if (result.sessionEnded()) {
            sessions.remove(userId, session);
            metrics.setActiveSessions(sessions.size());
        }
        if (result.likeResult() != null) {
            metrics.recordLike(result.likeResult().type());
        }
        if (result.matchFormed()) {
            notifyMatch(result);
        }
        for (OutboundMessage reply : result.replies()) {
            deliver(reply);
        }
        if (result.hasBroadcast()) {
            broadcasts.submit(userId, result.broadcastText());
        }
    }

    private void notifyMatch(EngineResult result) {
        List<OutboundMessage> notices;
        try {
            notices = notifier.notices(result.likeResult());
        } catch (StorageException e) {
            // the match is recorded; only the notice is lost
            metrics.recordStorageError(e.getOperation());
            log.error("[MATCH] Could not build match notices for {} and {}: {}",
                result.likeResult().likerId(), result.likeResult().likeeId(), e.getMessage());
            return;
        }
        for (OutboundMessage notice : notices) {
            deliver(notice);
        }
    }

    private void deliver(OutboundMessage message) {
        try {
            sender.send(message);
            metrics.recordDelivery(true);
        } catch (DeliveryException e) {
            metrics.recordDelivery(false);
            log.warn("[DISPATCH] {}", e.getMessage());
        }
    }

    public int sessionCount() {
        return sessions.size();
    }

    Optional<ConversationSession> session(long userId) {
        return Optional.ofNullable(sessions.get(userId));
    }

    public int pendingEvents() {
        return coordinator.backlog();
    }

    public void shutdown() {
        coordinator.shutdown();
        broadcasts.shutdown();
    }
}
