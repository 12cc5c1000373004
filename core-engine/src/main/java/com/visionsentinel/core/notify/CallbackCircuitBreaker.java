package com.visionsentinel.core.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-target consecutive failure tracking for the callback channel.
 *
 * <p>
 * After {@code failureThreshold} consecutive failures the circuit for that
 * target opens and stays open until {@link #reset(String)} is called; while
 * open, {@link #allowRequest(String)} returns {@code false} so no request is
 * attempted. A success resets the count. Every {@code warnEvery}-th failure
 * is logged at WARN, the opening one at ERROR.
 * </p>
 *
 * @since 1.0.0
 */
public class CallbackCircuitBreaker {

    private static final Logger LOG = LoggerFactory.getLogger(CallbackCircuitBreaker.class);

    private final int failureThreshold;
    private final int warnEvery;
    private final Map<String, TargetState> targets = new ConcurrentHashMap<>();

    public CallbackCircuitBreaker(int failureThreshold, int warnEvery) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got: " + failureThreshold);
        }
        if (warnEvery < 1) {
            throw new IllegalArgumentException("warnEvery must be >= 1, got: " + warnEvery);
        }
        this.failureThreshold = failureThreshold;
        this.warnEvery = warnEvery;
    }

    public boolean allowRequest(String target) {
        TargetState state = targets.get(target);
        return state == null || !state.open;
    }

    public void recordSuccess(String target) {
        TargetState state = targets.get(target);
        if (state == null) {
            return;
        }
        synchronized (state) {
            if (state.failures > 0) {
                LOG.info("Callback target {} recovered after {} failure(s)", target, state.failures);
            }
            state.failures = 0;
        }
    }

    /**
     * @return the consecutive failure count after this failure
     */
    public int recordFailure(String target, String reason) {
        TargetState state = targets.computeIfAbsent(target, k -> new TargetState());
        synchronized (state) {
            state.failures++;
            int failures = state.failures;
            if (failures >= failureThreshold && !state.open) {
                state.open = true;
                LOG.error("Callback to {} disabled after {} consecutive failures (last: {})",
                        target, failures, reason);
            } else if (failures % warnEvery == 0) {
                LOG.warn("Callback to {} failed {} times in a row: {}", target, failures, reason);
            } else {
                LOG.debug("Callback to {} failed ({}): {}", target, failures, reason);
            }
            return failures;
        }
    }

    /**
     * Close the circuit for a target and clear its failure count.
     *
     * @return {@code true} if the circuit was open
     */
    public boolean reset(String target) {
        TargetState state = targets.remove(target);
        if (state != null && state.open) {
            LOG.info("Callback to {} re-enabled", target);
            return true;
        }
        return false;
    }

    public boolean isOpen(String target) {
        TargetState state = targets.get(target);
        return state != null && state.open;
    }

    public int failureCount(String target) {
        TargetState state = targets.get(target);
        if (state == null) {
            return 0;
        }
        synchronized (state) {
            return state.failures;
        }
    }

    /**
     * @return targets whose circuit is currently open, sorted
     */
    public Set<String> openTargets() {
        Set<String> open = new TreeSet<>();
        targets.forEach((target, state) -> {
            if (state.open) {
                open.add(target);
            }
        });
        return open;
    }

    private static final class TargetState {
        private int failures;
        private volatile boolean open;
    }
}
