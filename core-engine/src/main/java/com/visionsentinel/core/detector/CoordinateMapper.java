package com.visionsentinel.core.detector;

import com.visionsentinel.core.model.Detection;

import java.util.List;

/**
 * Scale computation for inference input and mapping of detections back onto
 * the original frame.
 *
 * @since 1.0.0
 */
public final class CoordinateMapper {

    private CoordinateMapper() {
        // utility class, not instantiable
    }

    /**
     * Scale factor that brings the larger frame dimension down to
     * {@code maxResolution}; {@code 1.0} when the frame is already small
     * enough.
     */
    public static double scaleFor(int width, int height, int maxResolution) {
        int largest = Math.max(width, height);
        if (largest <= maxResolution || largest <= 0) {
            return 1.0;
        }
        return (double) maxResolution / largest;
    }

    /**
     * Map detections found on a frame scaled by {@code scale} back to a
     * {@code width x height} frame, clamping boxes to the frame bounds.
     */
    public static List<Detection> toOriginal(List<Detection> detections, double scale, int width, int height) {
        if (scale == 1.0) {
            return detections;
        }
        return detections.stream()
                .map(d -> d.withBox(d.getBox().unscale(scale).clamp(width, height)))
                .toList();
    }
}
