package com.visionsentinel.core.error;

import java.io.IOException;

/**
 * Raised by a frame source when opening or reading fails.
 *
 * <p>
 * {@link #isConnectionLost()} separates transient read hiccups, which the
 * worker simply retries, from a lost connection, which starts the reconnect
 * procedure.
 * </p>
 *
 * @since 1.0.0
 */
public class FrameReadException extends IOException {

    private static final long serialVersionUID = 1L;

    private final boolean connectionLost;

    public FrameReadException(String message, boolean connectionLost) {
        super(message);
        this.connectionLost = connectionLost;
    }

    public FrameReadException(String message, boolean connectionLost, Throwable cause) {
        super(message, cause);
        this.connectionLost = connectionLost;
    }

    public static FrameReadException transientFailure(String message) {
        return new FrameReadException(message, false);
    }

    public static FrameReadException connectionLost(String message) {
        return new FrameReadException(message, true);
    }

    public boolean isConnectionLost() {
        return connectionLost;
    }
}
