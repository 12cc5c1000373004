package com.visionsentinel.core.postprocess;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Registry holding one {@link PostProcessor} per {@link PostProcessingPolicy}.
 *
 * @since 1.0.0
 */
public final class PostProcessors {

    private final Map<PostProcessingPolicy, PostProcessor> processors;

    private PostProcessors(Map<PostProcessingPolicy, PostProcessor> processors) {
        this.processors = Collections.unmodifiableMap(processors);
    }

    /**
     * Registry with the built-in processor for every policy.
     */
    public static PostProcessors defaults(Duration presenceDuration) {
        return of(new PassThroughProcessor(),
                new RequiredEquipmentProcessor(),
                new PresenceDurationProcessor(presenceDuration));
    }

    /**
     * Registry from explicit processors; every policy must be covered.
     *
     * @throws IllegalArgumentException if a policy has no processor
     */
    public static PostProcessors of(PostProcessor... processors) {
        Map<PostProcessingPolicy, PostProcessor> map = new EnumMap<>(PostProcessingPolicy.class);
        for (PostProcessor p : processors) {
            map.put(p.policy(), p);
        }
        for (PostProcessingPolicy policy : PostProcessingPolicy.values()) {
            if (!map.containsKey(policy)) {
                throw new IllegalArgumentException("No post-processor for policy " + policy);
            }
        }
        return new PostProcessors(map);
    }

    public PostProcessor forPolicy(PostProcessingPolicy policy) {
        return processors.get(Objects.requireNonNull(policy, "policy must not be null"));
    }

    public Collection<PostProcessor> all() {
        return processors.values();
    }

    /**
     * Drop state held for {@code sessionId} in every processor.
     */
    public void clearSession(String sessionId) {
        processors.values().forEach(p -> p.clearSession(sessionId));
    }
}
