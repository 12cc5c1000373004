/**
 * Detector contracts and the model pool.
 *
 * <p>
 * The detector itself is an external collaborator loaded through
 * {@link com.visionsentinel.core.detector.DetectorLoader}.
 * {@link com.visionsentinel.core.detector.ModelPool} caches loaded
 * instances and decides whether sessions share them.
 * </p>
 *
 * @since 1.0.0
 */
package com.visionsentinel.core.detector;
