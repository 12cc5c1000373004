/**
 * Domain model: detections, per-frame results, alarm rules and alarm events.
 *
 * <p>
 * Value types ({@link com.visionsentinel.core.model.Detection},
 * {@link com.visionsentinel.core.model.DetectionResult},
 * {@link com.visionsentinel.core.model.AlarmEvent}) are immutable and built
 * through builders or constructors that validate their input.
 * {@link com.visionsentinel.core.model.AlarmRule} is a mutable POJO so that
 * it can be populated by SnakeYAML.
 * </p>
 *
 * @since 1.0.0
 */
package com.visionsentinel.core.model;
