package com.visionsentinel.core.model;

/**
 * Alarm severity derived from detection confidence.
 *
 * @since 1.0.0
 */
public enum Severity {
    HIGH,
    MEDIUM,
    LOW;

    /**
     * Map a confidence to a severity.
     *
     * @param confidence detection confidence in [0, 1]
     * @param high       inclusive lower bound for {@link #HIGH}
     * @param medium     inclusive lower bound for {@link #MEDIUM}
     * @return the severity band {@code confidence} falls into
     */
    public static Severity fromConfidence(double confidence, double high, double medium) {
        if (confidence >= high) {
            return HIGH;
        }
        if (confidence >= medium) {
            return MEDIUM;
        }
        return LOW;
    }
}
