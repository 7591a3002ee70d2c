package in.matchbot.application.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SessionCoordinatorTest {

    private SessionCoordinator coordinator;

    @AfterEach
    void tearDown() {
        if (coordinator != null) {
            coordinator.shutdown();
        }
    }

    @Test
    void testDefaultPartitionCountIsClamped() {
        coordinator = new SessionCoordinator();

        int count = coordinator.getPartitionCount();
        assertTrue(count >= 8 && count <= 32, "got " + count);
    }

    @Test
    void testRoutingIsStableAndInRange() {
        coordinator = new SessionCoordinator(4);

        for (long userId : new long[]{0L, 1L, -7L, Long.MIN_VALUE, Long.MAX_VALUE, 438466803L}) {
            int partition = coordinator.getPartition(userId);
            assertTrue(partition >= 0 && partition < 4);
            assertEquals(partition, coordinator.getPartition(userId));
        }
    }

    @Test
    void testRejectsNonPositivePartitions() {
        assertThrows(IllegalArgumentException.class, () -> new SessionCoordinator(0));
    }

    @Test
    void testTasksOfOneUserRunInOrder() throws Exception {
        coordinator = new SessionCoordinator(4);
        Map<Long, List<Integer>> seen = new ConcurrentHashMap<>();
        List<CompletableFuture<Void>> futures = new ArrayList<>();

        for (int i = 0; i < 200; i++) {
            for (long userId = 1; userId <= 5; userId++) {
                final int seq = i;
                final long user = userId;
                futures.add(coordinator.execute(userId, () ->
                    seen.computeIfAbsent(user, k -> Collections.synchronizedList(new ArrayList<>())).add(seq)));
            }
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

        for (long userId = 1; userId <= 5; userId++) {
            List<Integer> order = seen.get(userId);
            assertEquals(200, order.size());
            for (int i = 0; i < 200; i++) {
                assertEquals(i, order.get(i));
            }
        }
    }

    @Test
    void testBacklogCountsQueuedTasks() throws Exception {
        coordinator = new SessionCoordinator(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<Void> blocker = coordinator.execute(1L, () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        CompletableFuture<Void> queued = coordinator.execute(2L, () -> { });
        assertEquals(2, coordinator.backlog());

        release.countDown();
        CompletableFuture.allOf(blocker, queued).get(5, TimeUnit.SECONDS);
        assertEquals(0, coordinator.backlog());
    }

    @Test
    void testRefusesTasksAfterShutdown() {
        coordinator = new SessionCoordinator(2);
        coordinator.shutdown();

        CompletableFuture<Void> future = coordinator.execute(1L, () -> fail("must not run"));

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
        assertInstanceOf(RejectedExecutionException.class, e.getCause());
        assertEquals(0, coordinator.backlog());
    }
}
