package com.visionsentinel.core.postprocess;

import com.visionsentinel.core.model.DetectionResult;

/**
 * Rewrites, augments or suppresses a session's detection result before
 * alarm evaluation.
 *
 * <h3>State</h3>
 * <p>
 * One processor instance serves every session using its policy. Any state
 * must be kept per session id and dropped in {@link #clearSession(String)}.
 * Calls for the same session come from that session's worker thread only;
 * calls for different sessions may be concurrent.
 * </p>
 *
 * @since 1.0.0
 */
public interface PostProcessor {

    PostProcessingPolicy policy();

    /**
     * @param result result of the current frame
     * @return the outcome; never {@code null}
     */
    PostProcessOutcome apply(DetectionResult result);

    /**
     * Forget all state held for {@code sessionId}.
     */
    default void clearSession(String sessionId) {
    }
}
