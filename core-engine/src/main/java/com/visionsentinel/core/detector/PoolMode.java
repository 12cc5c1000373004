package com.visionsentinel.core.detector;

/**
 * How {@link ModelPool} hands out detector instances.
 *
 * @since 1.0.0
 */
public enum PoolMode {
    /** One instance per model; inference calls are serialized. */
    SHARED,
    /** One instance per (model, session); inference runs in parallel. */
    DEDICATED
}
