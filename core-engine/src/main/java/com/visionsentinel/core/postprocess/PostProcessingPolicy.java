package com.visionsentinel.core.postprocess;

/**
 * Closed set of result post-processing variants a session can select.
 *
 * @since 1.0.0
 */
public enum PostProcessingPolicy {
    /** Pass every result through unchanged. */
    NONE,
    /**
     * Compare subject and equipment counts (e.g. person vs helmet) and raise
     * a pseudo-detection for each unequipped subject.
     */
    REQUIRED_EQUIPMENT,
    /** Only continue once objects have been present for a minimum duration. */
    PRESENCE_DURATION
}
