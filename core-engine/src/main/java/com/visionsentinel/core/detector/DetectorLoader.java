package com.visionsentinel.core.detector;

import java.io.IOException;

/**
 * Loads a detector for a model id. Implementations are discovered with
 * {@link java.util.ServiceLoader} by the application.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface DetectorLoader {

    /**
     * @param modelId model identifier, usually a weights path
     * @return a ready-to-use detector
     * @throws IOException if the model cannot be read
     */
    Detector load(String modelId) throws IOException;
}
