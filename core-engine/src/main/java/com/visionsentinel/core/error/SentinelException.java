package com.visionsentinel.core.error;

import java.util.Objects;

/**
 * Unchecked exception carrying an {@link ErrorKind}.
 *
 * <p>
 * Use the static factories so that messages stay consistent across
 * components.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public SentinelException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public SentinelException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ErrorKind getKind() {
        return kind;
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    public static SentinelException config(String message) {
        return new SentinelException(ErrorKind.CONFIG, message);
    }

    public static SentinelException duplicateId(String id) {
        return new SentinelException(ErrorKind.DUPLICATE_ID, "Session already registered: " + id);
    }

    public static SentinelException capacityExceeded(int max) {
        return new SentinelException(ErrorKind.CAPACITY_EXCEEDED,
                "Session limit reached (max " + max + ")");
    }

    public static SentinelException notFound(String what, String id) {
        return new SentinelException(ErrorKind.NOT_FOUND, what + " not found: " + id);
    }

    public static SentinelException alreadyActive(String id) {
        return new SentinelException(ErrorKind.ALREADY_ACTIVE, "Session already running: " + id);
    }

    public static SentinelException modelLoad(String modelId, Throwable cause) {
        String reason = cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : "";
        return new SentinelException(ErrorKind.MODEL_LOAD,
                "Failed to load model '" + modelId + "'" + reason, cause);
    }

    public static SentinelException notificationChannel(String channel, String message, Throwable cause) {
        return new SentinelException(ErrorKind.NOTIFICATION_CHANNEL,
                channel + " delivery failed: " + message, cause);
    }

    @Override
    public String toString() {
        return "SentinelException{kind=" + kind + ", message='" + getMessage() + "'}";
    }
}
