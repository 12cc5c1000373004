package com.visionsentinel.core.schedule;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Type 1: permitted iff {@code start <= now <= end}.
 *
 * @since 1.0.0
 */
public final class AbsoluteRangePolicy extends TimePolicy {

    private final LocalDateTime start;
    private final LocalDateTime end;

    public AbsoluteRangePolicy(LocalDateTime start, LocalDateTime end) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end " + end + " is before start " + start);
        }
    }

    @Override
    public TimePolicyType type() {
        return TimePolicyType.ABSOLUTE;
    }

    @Override
    public boolean permits(LocalDateTime now) {
        return !now.isBefore(start) && !now.isAfter(end);
    }

    @Override
    public Optional<LocalDateTime> expiry() {
        return Optional.of(end);
    }

    public LocalDateTime getStart() {
        return start;
    }

    public LocalDateTime getEnd() {
        return end;
    }

    @Override
    public String toString() {
        return "AbsoluteRangePolicy[" + start + " .. " + end + "]";
    }
}
