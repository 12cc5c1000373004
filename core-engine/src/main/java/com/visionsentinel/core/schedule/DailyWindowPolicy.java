package com.visionsentinel.core.schedule;

import com.visionsentinel.core.model.TimeRange;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Type 3: permitted iff the time of day lies in {@code [start, end]}, which
 * wraps past midnight when {@code end < start}. Never expires.
 *
 * @since 1.0.0
 */
public final class DailyWindowPolicy extends TimePolicy {

    private final LocalTime start;
    private final LocalTime end;

    public DailyWindowPolicy(LocalTime start, LocalTime end) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
    }

    @Override
    public TimePolicyType type() {
        return TimePolicyType.DAILY;
    }

    @Override
    public boolean permits(LocalDateTime now) {
        return TimeRange.isWithin(start, end, now.toLocalTime());
    }

    public LocalTime getStart() {
        return start;
    }

    public LocalTime getEnd() {
        return end;
    }

    @Override
    public String toString() {
        return "DailyWindowPolicy[" + start + " .. " + end + "]";
    }
}
