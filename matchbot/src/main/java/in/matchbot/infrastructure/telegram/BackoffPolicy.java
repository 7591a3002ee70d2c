package in.matchbot.infrastructure.telegram;

import java.time.Duration;

/**
 * Exponential backoff for the update poller.
 *
 * The delay starts at {@code initialDelay}, grows by {@code multiplier} after
 * every consecutive failure and is capped at {@code maxDelay}. A success
 * resets it. Unlike a connect-once policy there is no attempt limit: the
 * poller keeps trying at the capped delay.
 *
 * Usage:
 * <pre>
 * BackoffPolicy policy = BackoffPolicy.forPolling();
 * try {
 *     poll();
 *     policy.recordSuccess();
 * } catch (Exception e) {
 *     Thread.sleep(policy.recordFailure().toMillis());
 * }
 * </pre>
 */
public class BackoffPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;

    private int consecutiveFailures = 0;
    private Duration currentDelay;

    private BackoffPolicy(Duration initialDelay, Duration maxDelay, double multiplier) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.currentDelay = initialDelay;
    }

    /**
     * Record a failed attempt.
     *
     * @return how long to wait before the next attempt
     */
    public synchronized Duration recordFailure() {
        return recordFailure(Duration.ZERO);
    }

    /**
     * Record a failure for which the server named a minimum wait (flood control).
     * The returned wait is at least {@code serverWait}; the exponential sequence
     * advances as usual.
     */
    public synchronized Duration recordFailure(Duration serverWait) {
        Duration wait = serverWait.compareTo(currentDelay) > 0 ? serverWait : currentDelay;
        consecutiveFailures++;
        long newDelayMillis = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(newDelayMillis, maxDelay.toMillis()));
        return wait;
    }

    public synchronized void recordSuccess() {
        consecutiveFailures = 0;
        currentDelay = initialDelay;
    }

    public synchronized Duration getNextDelay() {
        return currentDelay;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 1s doubling up to one minute.
     */
    public static BackoffPolicy forPolling() {
        return builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofMinutes(1))
            .multiplier(2.0)
            .build();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(1);
        private double multiplier = 2.0;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public BackoffPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new BackoffPolicy(initialDelay, maxDelay, multiplier);
        }
    }
}
