package com.visionsentinel.core.source;

import com.visionsentinel.core.error.FrameReadException;

/**
 * Blocking source of frames for one session, typically a network video
 * stream.
 *
 * <p>
 * Instances are used by a single worker thread and need not be thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public interface FrameSource extends AutoCloseable {

    /**
     * Open the underlying capture.
     *
     * @throws FrameReadException if the source cannot be opened
     */
    void open() throws FrameReadException;

    /**
     * Block until the next frame is available.
     *
     * @return the next frame, never {@code null}
     * @throws FrameReadException on a read failure; see
     *                            {@link FrameReadException#isConnectionLost()}
     */
    Frame read() throws FrameReadException;

    /**
     * Release the capture. Must be safe to call more than once.
     */
    @Override
    void close();
}
