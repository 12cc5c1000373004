package com.visionsentinel.core.schedule;

import com.visionsentinel.core.model.TimeRange;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.Month;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Type 2: permitted iff the current month is allowed and the time of day
 * lies in the daily window (wrapping past midnight when {@code end < start}).
 *
 * @since 1.0.0
 */
public final class SeasonalWindowPolicy extends TimePolicy {

    private final Set<Month> months;
    private final LocalTime start;
    private final LocalTime end;

    public SeasonalWindowPolicy(Set<Month> months, LocalTime start, LocalTime end) {
        Objects.requireNonNull(months, "months must not be null");
        if (months.isEmpty()) {
            throw new IllegalArgumentException("At least one month is required");
        }
        this.months = Collections.unmodifiableSet(EnumSet.copyOf(months));
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
    }

    @Override
    public TimePolicyType type() {
        return TimePolicyType.SEASONAL;
    }

    @Override
    public boolean permits(LocalDateTime now) {
        return months.contains(now.getMonth()) && TimeRange.isWithin(start, end, now.toLocalTime());
    }

    public Set<Month> getMonths() {
        return months;
    }

    public LocalTime getStart() {
        return start;
    }

    public LocalTime getEnd() {
        return end;
    }

    @Override
    public String toString() {
        return "SeasonalWindowPolicy[" + months + ", " + start + " .. " + end + "]";
    }
}
