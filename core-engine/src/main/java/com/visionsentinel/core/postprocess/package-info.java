/**
 * Result post-processing between inference and alarm evaluation.
 *
 * <p>
 * Each session selects one
 * {@link com.visionsentinel.core.postprocess.PostProcessingPolicy}; the
 * matching {@link com.visionsentinel.core.postprocess.PostProcessor} may
 * rewrite the detections and decides whether the result proceeds.
 * {@link com.visionsentinel.core.postprocess.DetectionRegions} restricts
 * detections to regions of interest.
 * </p>
 *
 * <h3>Extending</h3>
 * <p>
 * Add an enum constant, implement {@code PostProcessor} for it and register
 * it in {@code PostProcessors.defaults()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.visionsentinel.core.postprocess;
