package com.hcltech.asyncnode.controller;

import com.hcltech.asyncnode.common.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Keeps the number of in-flight operations near {@code maxWaitingOperations}.
 * <p>
 * One input can expand into many slow operations; without a bound the pending set and the
 * memory behind it grow without limit. {@link #forceDrain()} blocks the invoking thread on the
 * oldest excess operations for at most {@code maxWaitTime}. A timeout is logged, nothing is
 * cancelled, and whatever is still unresolved is looked at again on the next pass.
 */
public final class BackpressureEnforcer {
    private static final Logger log = LoggerFactory.getLogger(BackpressureEnforcer.class);

    private final PendingOperations pending;
    private final int maxWaitingOperations;
    private final Duration maxWaitTime;
    private final Metrics metrics;

    public BackpressureEnforcer(PendingOperations pending, int maxWaitingOperations, Duration maxWaitTime, Metrics metrics) {
        if (maxWaitingOperations <= 0) throw new IllegalArgumentException("maxWaitingOperations must be > 0");
        this.pending = Objects.requireNonNull(pending, "pending");
        this.maxWaitingOperations = maxWaitingOperations;
        this.maxWaitTime = Objects.requireNonNull(maxWaitTime, "maxWaitTime");
        this.metrics = metrics == null ? Metrics.nullMetrics : metrics;
    }

    /**
     * Invoking thread only.
     *
     * @return true if every forced operation resolved in time (or nothing needed forcing)
     */
    public boolean forceDrain() {
        pending.removeCompleted();
        List<CompletableFuture<?>> toForce = pending.oldestExcess(maxWaitingOperations);
        if (toForce.isEmpty()) return true;

        metrics.increment("asyncnode.backpressure.forced");
        metrics.histogram("asyncnode.backpressure.forced.n", toForce.size());
        boolean resolved = await(toForce);
        pending.removeCompleted();
        return resolved;
    }

    private boolean await(List<CompletableFuture<?>> toForce) {
        try {
            CompletableFuture.allOf(toForce.toArray(new CompletableFuture<?>[0]))
                    .get(maxWaitTime.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (ExecutionException e) {
            // all resolved; the failures travel through the completion queue
            log.debug("forceDrain: {} forced operations resolved, at least one failed", toForce.size());
            return true;
        } catch (TimeoutException e) {
            metrics.increment("asyncnode.backpressure.timeout");
            log.warn("forceDrain failed on {} operations: not resolved within {} ms", toForce.size(), maxWaitTime.toMillis());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("forceDrain interrupted while waiting on {} operations", toForce.size());
            return false;
        }
    }

    public int maxWaitingOperations() {
        return maxWaitingOperations;
    }
}
