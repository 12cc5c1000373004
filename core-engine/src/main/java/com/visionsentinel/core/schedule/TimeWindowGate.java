package com.visionsentinel.core.schedule;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Answers whether detection is currently permitted for a session.
 *
 * <p>
 * Sessions without an assigned policy are always permitted. Lookups are a
 * single map read plus a time comparison.
 * </p>
 *
 * @since 1.0.0
 */
public class TimeWindowGate {

    private final Map<String, TimePolicy> policies = new ConcurrentHashMap<>();
    private final Clock clock;

    public TimeWindowGate(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void assign(String sessionId, TimePolicy policy) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        if (policy == null) {
            policies.remove(sessionId);
        } else {
            policies.put(sessionId, policy);
        }
    }

    public void remove(String sessionId) {
        policies.remove(sessionId);
    }

    public boolean isPermitted(String sessionId) {
        return isPermitted(sessionId, clock.instant());
    }

    public boolean isPermitted(String sessionId, Instant now) {
        TimePolicy policy = policies.get(sessionId);
        return policy == null || policy.permits(LocalDateTime.ofInstant(now, clock.getZone()));
    }

    public Optional<TimePolicy> policy(String sessionId) {
        return Optional.ofNullable(policies.get(sessionId));
    }
}
