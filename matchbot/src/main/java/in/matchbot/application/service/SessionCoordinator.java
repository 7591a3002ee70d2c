package in.matchbot.application.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * SessionCoordinator - per-user serialization of conversation events.
 *
 * SINGLE-WRITER PER USER:
 * Every event of a user id goes to the same single-threaded partition, so a
 * user's events run in arrival order and never overlap. Users on different
 * partitions run in parallel; users sharing a partition queue behind each other.
 *
 * PARTITIONING:
 * - clamp(availableProcessors(), 8, 32) partitions unless given
 * - partition = floorMod(hash(userId), partitions)
 *
 * After {@link #shutdown()} new events are refused with a failed future.
 */
public final class SessionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(SessionCoordinator.class);

    private static final int MIN_PARTITIONS = 8;
    private static final int MAX_PARTITIONS = 32;
    private static final long DRAIN_TIMEOUT_MS = 30_000;

    private final ExecutorService[] partitions;
    private final AtomicInteger backlog = new AtomicInteger();

    public SessionCoordinator() {
        this(defaultPartitions());
    }

    public SessionCoordinator(int partitionCount) {
        if (partitionCount < 1) {
            throw new IllegalArgumentException("partitionCount must be positive: " + partitionCount);
        }
        this.partitions = new ExecutorService[partitionCount];
        for (int i = 0; i < partitionCount; i++) {
            String name = "session-partition-" + i;
            partitions[i] = Executors.newSingleThreadExecutor(runnable -> {
                Thread t = new Thread(runnable, name);
                t.setDaemon(true);
                return t;
            });
        }
        log.info("[DISPATCH] {} session partitions ({} CPUs)",
            partitionCount, Runtime.getRuntime().availableProcessors());
    }

    private static int defaultPartitions() {
        int cpus = Runtime.getRuntime().availableProcessors();
        return Math.max(MIN_PARTITIONS, Math.min(MAX_PARTITIONS, cpus));
    }

    /**
     * Queue a task behind the user's earlier tasks.
     */
    public CompletableFuture<Void> execute(long userId, Runnable task) {
        backlog.incrementAndGet();
        try {
            return CompletableFuture.runAsync(task, partitions[getPartition(userId)])
                .whenComplete((ignored, error) -> backlog.decrementAndGet());
        } catch (RejectedExecutionException e) {
            backlog.decrementAndGet();
            log.warn("[DISPATCH] Event for user {} refused: coordinator is shut down", userId);
            return CompletableFuture.failedFuture(e);
        }
    }

    int getPartition(long userId) {
        return Math.floorMod(Long.hashCode(userId), partitions.length);
    }

    /** Tasks queued or running. */
    public int backlog() {
        return backlog.get();
    }

    /**
     * Stop accepting events and let the queued ones finish, sharing one
     * drain deadline across all partitions.
     */
    public void shutdown() {
        log.info("[DISPATCH] Shutting down, {} events pending", backlog.get());
        for (ExecutorService partition : partitions) {
            partition.shutdown();
        }

        long deadline = System.currentTimeMillis() + DRAIN_TIMEOUT_MS;
        try {
            for (int i = 0; i < partitions.length; i++) {
                long remaining = Math.max(0, deadline - System.currentTimeMillis());
                if (!partitions[i].awaitTermination(remaining, TimeUnit.MILLISECONDS)) {
                    int dropped = partitions[i].shutdownNow().size();
                    log.warn("[DISPATCH] Partition {} did not drain in time, {} events dropped", i, dropped);
                }
            }
        } catch (InterruptedException e) {
            log.error("[DISPATCH] Shutdown interrupted", e);
            for (ExecutorService partition : partitions) {
                partition.shutdownNow();
            }
            Thread.currentThread().interrupt();
        }
        log.info("[DISPATCH] Session partitions stopped");
    }

    public int getPartitionCount() {
        return partitions.length;
    }
}
