package fr.lapetina.airouter.routing;

import java.time.Duration;

/**
 * Wall-clock bound of one routing pass, measured on the monotonic clock.
 */
final class RoutingDeadline {

    private final long startNanos;
    private final long deadlineNanos;

    private RoutingDeadline(long startNanos, Duration overall) {
        this.startNanos = startNanos;
        this.deadlineNanos = startNanos + overall.toNanos();
    }

    static RoutingDeadline startingNow(Duration overall) {
        return new RoutingDeadline(System.nanoTime(), overall);
    }

    Duration remaining() {
        return Duration.ofNanos(Math.max(0, deadlineNanos - System.nanoTime()));
    }

    boolean isExpired() {
        return deadlineNanos - System.nanoTime() <= 0;
    }

    /**
     * Budget for the next attempt: the per-attempt timeout, cut short by the deadline.
     */
    Duration attemptBudget(Duration attemptTimeout) {
        Duration remaining = remaining();
        return remaining.compareTo(attemptTimeout) < 0 ? remaining : attemptTimeout;
    }

    long elapsedMs() {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
