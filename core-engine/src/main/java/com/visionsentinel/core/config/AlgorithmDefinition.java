package com.visionsentinel.core.config;

import com.visionsentinel.core.postprocess.PostProcessingPolicy;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Binds an algorithm code used by deployments to a model, an optional
 * target-class allow-list and a post-processing policy.
 *
 * @since 1.0.0
 */
public class AlgorithmDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    private String code;
    private String modelId;
    private List<String> targetClasses = new ArrayList<>();
    private PostProcessingPolicy postProcessing = PostProcessingPolicy.NONE;

    /** No-arg constructor required by SnakeYAML. */
    public AlgorithmDefinition() {
    }

    public AlgorithmDefinition(String code, String modelId, List<String> targetClasses,
            PostProcessingPolicy postProcessing) {
        this.code = code;
        this.modelId = modelId;
        setTargetClasses(targetClasses);
        setPostProcessing(postProcessing);
    }

    /**
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (code == null || code.isBlank()) {
            errors.add("Algorithm 'code' is required");
        }
        if (modelId == null || modelId.isBlank()) {
            errors.add("Algorithm '" + code + "' requires 'modelId'");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid AlgorithmDefinition: " + String.join("; ", errors));
        }
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getModelId() {
        return modelId;
    }

    public void setModelId(String modelId) {
        this.modelId = modelId;
    }

    public List<String> getTargetClasses() {
        return Collections.unmodifiableList(targetClasses);
    }

    public void setTargetClasses(List<String> targetClasses) {
        this.targetClasses = targetClasses != null ? new ArrayList<>(targetClasses) : new ArrayList<>();
    }

    public PostProcessingPolicy getPostProcessing() {
        return postProcessing;
    }

    public void setPostProcessing(PostProcessingPolicy postProcessing) {
        this.postProcessing = postProcessing != null ? postProcessing : PostProcessingPolicy.NONE;
    }

    @Override
    public String toString() {
        return "AlgorithmDefinition{code='" + code + "', modelId='" + modelId
                + "', targetClasses=" + targetClasses + ", postProcessing=" + postProcessing + '}';
    }
}
