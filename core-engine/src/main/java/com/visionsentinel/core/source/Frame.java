package com.visionsentinel.core.source;

/**
 * A decoded video frame.
 *
 * <p>
 * Pixel data stays opaque to the engine; it only needs the dimensions and a
 * way to obtain a resized copy for inference.
 * </p>
 *
 * @since 1.0.0
 */
public interface Frame {

    int width();

    int height();

    /**
     * @return {@code true} if the frame carries no pixel data
     */
    default boolean isEmpty() {
        return width() <= 0 || height() <= 0;
    }

    /**
     * @return a copy of this frame scaled to {@code width x height}
     */
    Frame resize(int width, int height);
}
