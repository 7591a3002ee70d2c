package in.matchbot.application.service;

import in.matchbot.application.port.output.BotMetrics;
import in.matchbot.application.port.output.DeliveryException;
import in.matchbot.application.port.output.MessageSender;
import in.matchbot.application.port.output.ProfileRepository;
import in.matchbot.application.port.output.StorageException;
import in.matchbot.domain.conversation.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Admin broadcast to every active user.
 *
 * Runs on its own thread so a long fan-out never holds a session partition.
 * Each delivery is independent; the admin gets a "delivered X of Y" report.
 */
public final class BroadcastService {
    private static final Logger log = LoggerFactory.getLogger(BroadcastService.class);

    private final ProfileRepository profiles;
    private final MessageSender sender;
    private final BotMetrics metrics;
    private final ExecutorService executor;

    public BroadcastService(ProfileRepository profiles, MessageSender sender, BotMetrics metrics) {
        this.profiles = profiles;
        this.sender = sender;
        this.metrics = metrics;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread t = new Thread(runnable, "broadcast");
            t.setDaemon(true);
            return t;
        });
    }

    public record Report(int delivered, int total) {}

    /**
     * Queue a broadcast. A failure before any delivery (listing recipients)
     * is logged, counted and reported to the admin; the future still completes
     * exceptionally.
     */
    public CompletableFuture<Report> submit(long adminId, String text) {
        return CompletableFuture.supplyAsync(() -> run(adminId, text), executor)
            .whenComplete((report, error) -> {
                if (error != null) {
                    onFailure(adminId, error instanceof CompletionException ? error.getCause() : error);
                }
            });
    }

    /**
     * Fan the text out synchronously and report back to the admin.
     */
    public Report run(long adminId, String text) {
        List<Long> recipients = profiles.listActiveUserIds();
        int delivered = 0;
        for (long userId : recipients) {
            try {
                sender.send(OutboundMessage.text(userId, text));
                delivered++;
            } catch (DeliveryException e) {
                log.warn("[DISPATCH] Broadcast to {} failed: {}", userId, e.getMessage());
            }
        }

        Report report = new Report(delivered, recipients.size());
        metrics.recordBroadcast(report.delivered(), report.total());
        log.info("[DISPATCH] Broadcast from {} delivered to {} of {} users", adminId, delivered, recipients.size());

        try {
            sender.send(OutboundMessage.text(adminId, Messages.broadcastReport(delivered, recipients.size())));
        } catch (DeliveryException e) {
            log.warn("[DISPATCH] Broadcast report to {} failed: {}", adminId, e.getMessage());
        }
        return report;
    }

    private void onFailure(long adminId, Throwable cause) {
        if (cause instanceof StorageException) {
            metrics.recordStorageError(((StorageException) cause).getOperation());
        }
        log.error("[DISPATCH] Broadcast from {} failed: {}", adminId, cause.getMessage(), cause);
        try {
            sender.send(OutboundMessage.text(adminId, Messages.BROADCAST_FAILED));
        } catch (DeliveryException e) {
            log.warn("[DISPATCH] Broadcast failure notice to {} failed: {}", adminId, e.getMessage());
        }
    }

    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("[DISPATCH] Broadcast executor did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
