package in.matchbot.infrastructure.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * getUpdates loop on a daemon thread.
 *
 * The offset only moves past an update after it was queued on the dispatcher,
 * so a crash between fetch and queue re-delivers rather than drops.
 * Failures back off exponentially, never below a 429's retry_after; a success
 * resets the delay.
 */
public class TelegramLongPoller {
    private static final Logger log = LoggerFactory.getLogger(TelegramLongPoller.class);

    private final TelegramBotClient client;
    private final TelegramUpdateRouter router;
    private final BackoffPolicy backoff;
    private final int timeoutSeconds;

    private volatile boolean running = false;
    private Thread thread;
    private long offset = 0;

    public TelegramLongPoller(TelegramBotClient client, TelegramUpdateRouter router,
                              BackoffPolicy backoff, int timeoutSeconds) {
        this.client = client;
        this.router = router;
        this.backoff = backoff;
        this.timeoutSeconds = timeoutSeconds;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        thread = new Thread(this::loop, "telegram-poller");
        thread.setDaemon(true);
        thread.start();
        log.info("[TELEGRAM] Long polling started (timeout={}s)", timeoutSeconds);
    }

    public synchronized void stop() {
        running = false;
        if (thread != null) {
            thread.interrupt();
        }
        log.info("[TELEGRAM] Long polling stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void loop() {
        while (running) {
            try {
                List<JsonNode> updates = client.getUpdates(offset, timeoutSeconds);
                for (JsonNode update : updates) {
                    long updateId = router.route(update);
                    if (updateId >= offset) {
                        offset = updateId + 1;
                    }
                }
                backoff.recordSuccess();
            } catch (RuntimeException e) {
                if (!running) {
                    break;
                }
                Duration wait = e instanceof TelegramApiException
                    ? backoff.recordFailure(((TelegramApiException) e).getRetryAfter())
                    : backoff.recordFailure();
                log.warn("[TELEGRAM] Polling failed ({} in a row), retrying in {} ms: {}",
                    backoff.getConsecutiveFailures(), wait.toMillis(), e.getMessage());
                try {
                    Thread.sleep(wait.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }
}
