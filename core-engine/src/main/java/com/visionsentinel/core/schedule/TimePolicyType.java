package com.visionsentinel.core.schedule;

import com.visionsentinel.core.error.SentinelException;

/**
 * Deployment time policy kinds, identified externally by {@code dateType}.
 *
 * @since 1.0.0
 */
public enum TimePolicyType {

    /** Absolute start/end date-time range; expires at the end. */
    ABSOLUTE(1),
    /** Allowed months plus a daily time-of-day window. */
    SEASONAL(2),
    /** Daily time-of-day window with no expiry. */
    DAILY(3);

    private final int code;

    TimePolicyType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @throws SentinelException of kind {@code CONFIG} for an unknown code
     */
    public static TimePolicyType fromCode(int code) {
        for (TimePolicyType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw SentinelException.config("Unknown dateType: " + code + " (supported: 1, 2, 3)");
    }
}
