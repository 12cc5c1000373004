package com.visionsentinel.core.model;

import java.io.Serializable;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Daily time-of-day window, {@code start} and {@code end} in {@code HH:mm} or
 * {@code HH:mm:ss}.
 *
 * <p>
 * Both bounds are inclusive. When {@code end} is before {@code start} the
 * window spans midnight, so {@code 22:00-06:00} covers late evening and early
 * morning.
 * </p>
 *
 * @since 1.0.0
 */
public class TimeRange implements Serializable {

    private static final long serialVersionUID = 1L;

    private String start;
    private String end;

    /** No-arg constructor required by SnakeYAML. */
    public TimeRange() {
    }

    public TimeRange(String start, String end) {
        this.start = start;
        this.end = end;
    }

    /**
     * @return {@code true} if {@code time} falls inside this window
     * @throws IllegalStateException if either bound cannot be parsed
     */
    public boolean contains(LocalTime time) {
        return isWithin(getStartTime(), getEndTime(), time);
    }

    /**
     * Inclusive daily window check with midnight wraparound.
     */
    public static boolean isWithin(LocalTime start, LocalTime end, LocalTime time) {
        Objects.requireNonNull(time, "time must not be null");
        if (!end.isBefore(start)) {
            return !time.isBefore(start) && !time.isAfter(end);
        }
        // spans midnight
        return !time.isBefore(start) || !time.isAfter(end);
    }

    public LocalTime getStartTime() {
        return parse(start, "start");
    }

    public LocalTime getEndTime() {
        return parse(end, "end");
    }

    public String getStart() {
        return start;
    }

    public void setStart(String start) {
        this.start = start;
    }

    public String getEnd() {
        return end;
    }

    public void setEnd(String end) {
        this.end = end;
    }

    private static LocalTime parse(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Time range '" + name + "' is required");
        }
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalStateException(
                    "Time range '" + name + "' must be HH:mm or HH:mm:ss, got: '" + value + "'", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeRange that))
            return false;
        return Objects.equals(start, that.start) && Objects.equals(end, that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
