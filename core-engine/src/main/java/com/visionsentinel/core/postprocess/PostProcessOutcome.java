package com.visionsentinel.core.postprocess;

import com.visionsentinel.core.model.DetectionResult;

import java.util.Objects;

/**
 * Result of a post-processing step: the possibly rewritten result and
 * whether it should go on to alarm evaluation.
 *
 * @since 1.0.0
 */
public final class PostProcessOutcome {

    private final DetectionResult result;
    private final boolean proceed;

    private PostProcessOutcome(DetectionResult result, boolean proceed) {
        this.result = Objects.requireNonNull(result, "result must not be null");
        this.proceed = proceed;
    }

    public static PostProcessOutcome proceed(DetectionResult result) {
        return new PostProcessOutcome(result, true);
    }

    public static PostProcessOutcome suppress(DetectionResult result) {
        return new PostProcessOutcome(result, false);
    }

    public DetectionResult getResult() {
        return result;
    }

    public boolean shouldProceed() {
        return proceed;
    }

    @Override
    public String toString() {
        return "PostProcessOutcome{proceed=" + proceed + ", result=" + result + '}';
    }
}
