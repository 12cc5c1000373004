package com.visionsentinel.core.postprocess;

import com.visionsentinel.core.model.DetectionResult;

/**
 * {@link PostProcessingPolicy#NONE}: every result proceeds unchanged.
 *
 * @since 1.0.0
 */
public class PassThroughProcessor implements PostProcessor {

    @Override
    public PostProcessingPolicy policy() {
        return PostProcessingPolicy.NONE;
    }

    @Override
    public PostProcessOutcome apply(DetectionResult result) {
        return PostProcessOutcome.proceed(result);
    }
}
