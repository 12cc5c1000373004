package com.visionsentinel.core.schedule;

import com.visionsentinel.core.error.SentinelException;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.Month;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Builds {@link TimePolicy} instances from deployment request fields.
 *
 * <h3>Formats</h3>
 * <ul>
 * <li>Type 1: {@code start}/{@code end} as {@code yyyy-MM-dd HH:mm:ss}</li>
 * <li>Types 2 and 3: {@code HH:mm}, {@code HH:mm:ss}, or a full date-time
 * whose time part is used</li>
 * <li>Type 2: {@code months} as numbers 1-12</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class TimePolicies {

    /** Date-time format of type 1 bounds. */
    public static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private TimePolicies() {
        // utility class, not instantiable
    }

    /**
     * @throws SentinelException of kind {@code CONFIG} on invalid input
     */
    public static TimePolicy fromRequest(int dateType, String start, String end, List<Integer> months) {
        TimePolicyType type = TimePolicyType.fromCode(dateType);
        try {
            return switch (type) {
                case ABSOLUTE -> new AbsoluteRangePolicy(
                        parseDateTime(start, "start"), parseDateTime(end, "end"));
                case SEASONAL -> new SeasonalWindowPolicy(
                        parseMonths(months), parseTime(start, "start"), parseTime(end, "end"));
                case DAILY -> new DailyWindowPolicy(parseTime(start, "start"), parseTime(end, "end"));
            };
        } catch (IllegalArgumentException e) {
            throw SentinelException.config("Invalid time policy (dateType " + dateType + "): " + e.getMessage());
        }
    }

    static LocalDateTime parseDateTime(String value, String name) {
        requireValue(value, name);
        try {
            return LocalDateTime.parse(value.trim(), DATE_TIME);
        } catch (DateTimeParseException e) {
            throw SentinelException.config("'" + name + "' must be yyyy-MM-dd HH:mm:ss, got: '" + value + "'");
        }
    }

    static LocalTime parseTime(String value, String name) {
        requireValue(value, name);
        String v = value.trim();
        try {
            if (v.length() > 8) {
                return LocalDateTime.parse(v, DATE_TIME).toLocalTime();
            }
            return LocalTime.parse(v);
        } catch (DateTimeParseException e) {
            throw SentinelException.config("'" + name + "' must be HH:mm[:ss] or yyyy-MM-dd HH:mm:ss, got: '"
                    + value + "'");
        }
    }

    static Set<Month> parseMonths(List<Integer> months) {
        if (months == null || months.isEmpty()) {
            throw SentinelException.config("'months' is required for dateType 2");
        }
        Set<Month> result = EnumSet.noneOf(Month.class);
        for (Integer m : months) {
            if (m == null || m < 1 || m > 12) {
                throw SentinelException.config("Invalid month: " + m);
            }
            result.add(Month.of(m));
        }
        return result;
    }

    private static void requireValue(String value, String name) {
        if (value == null || value.isBlank()) {
            throw SentinelException.config("'" + name + "' is required");
        }
    }
}
