package com.visionsentinel.core.schedule;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Decides at which local times detection is permitted for a deployment.
 *
 * <p>
 * Implementations are immutable and {@link #permits(LocalDateTime)} performs
 * no I/O, since workers call it on every loop iteration.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class TimePolicy {

    public abstract TimePolicyType type();

    /**
     * @param now local date-time in the engine's zone
     * @return {@code true} if detection may run at {@code now}
     */
    public abstract boolean permits(LocalDateTime now);

    /**
     * @return the absolute end of the policy, if it has one
     */
    public Optional<LocalDateTime> expiry() {
        return Optional.empty();
    }

    /**
     * @return {@code true} once {@code now} is past {@link #expiry()}
     */
    public boolean isExpired(LocalDateTime now) {
        return expiry().map(now::isAfter).orElse(false);
    }
}
