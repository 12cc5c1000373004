package com.visionsentinel.core.detector;

import com.visionsentinel.core.model.Detection;
import com.visionsentinel.core.source.Frame;

import java.util.List;
import java.util.Map;

/**
 * Object detector backed by a loaded model.
 *
 * <p>
 * Implementations are <strong>not</strong> required to be thread-safe;
 * {@link ModelPool} arbitrates concurrent access.
 * </p>
 *
 * @since 1.0.0
 */
public interface Detector extends AutoCloseable {

    /**
     * Run inference on a frame.
     *
     * @param frame               frame to analyse
     * @param confidenceThreshold minimum confidence to report
     * @param iouThreshold        IoU threshold for non-maximum suppression
     * @param imageSize           inference input size
     * @return detections in the coordinates of {@code frame}
     */
    List<Detection> infer(Frame frame, double confidenceThreshold, double iouThreshold, int imageSize);

    /**
     * @return class id to class name mapping of the loaded model
     */
    Map<Integer, String> classNames();

    @Override
    default void close() {
    }
}
