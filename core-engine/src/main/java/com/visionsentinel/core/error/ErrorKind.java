package com.visionsentinel.core.error;

/**
 * Classification of failures raised by the engine.
 *
 * <p>
 * Kinds in the first group are returned synchronously to callers of
 * registration, start and deployment operations. Kinds in the second group
 * are handled where they occur and only surface through session status,
 * counters and logs.
 * </p>
 *
 * @since 1.0.0
 */
public enum ErrorKind {

    /** Invalid registration, rule or deployment input. */
    CONFIG,
    /** A session with the same id is already registered. */
    DUPLICATE_ID,
    /** Admission refused because the session limit is reached. */
    CAPACITY_EXCEEDED,
    /** The referenced session, rule or deployment does not exist. */
    NOT_FOUND,
    /** The session already has a running worker. */
    ALREADY_ACTIVE,
    /** A detector could not be loaded for the requested model. */
    MODEL_LOAD,

    /** Frame source could not be opened or read. */
    CONNECTIVITY,
    /** A frame was empty or below the minimum size. */
    CORRUPT_FRAME,
    /** The detector failed on a frame. */
    INFERENCE,
    /** A notification channel failed to deliver. */
    NOTIFICATION_CHANNEL
}
