package com.visionsentinel.core.source;

/**
 * Creates frame sources from a source locator (RTSP/RTMP URL, file path,
 * device index). Implementations are discovered with
 * {@link java.util.ServiceLoader} by the application.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface FrameSourceFactory {

    FrameSource create(String locator);
}
