package com.visionsentinel.core.scene;

import com.visionsentinel.core.schedule.TimePolicy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A live deployment: the sessions and devices started for one scene.
 *
 * @since 1.0.0
 */
public final class SceneDeployment {

    private final String sceneId;
    private final String algorithmCode;
    private final TimePolicy policy;
    private final List<String> sessionIds;
    private final Set<String> deviceIds;
    private final Instant deployedAt;

    SceneDeployment(String sceneId, String algorithmCode, TimePolicy policy, List<String> sessionIds,
            Set<String> deviceIds, Instant deployedAt) {
        this.sceneId = sceneId;
        this.algorithmCode = algorithmCode;
        this.policy = policy;
        this.sessionIds = Collections.unmodifiableList(new ArrayList<>(sessionIds));
        this.deviceIds = Collections.unmodifiableSet(new LinkedHashSet<>(deviceIds));
        this.deployedAt = deployedAt;
    }

    public String getSceneId() {
        return sceneId;
    }

    public String getAlgorithmCode() {
        return algorithmCode;
    }

    public TimePolicy getPolicy() {
        return policy;
    }

    public List<String> getSessionIds() {
        return sessionIds;
    }

    public Set<String> getDeviceIds() {
        return deviceIds;
    }

    public Instant getDeployedAt() {
        return deployedAt;
    }

    @Override
    public String toString() {
        return "SceneDeployment{scene='" + sceneId + "', algorithm='" + algorithmCode + "', policy=" + policy
                + ", sessions=" + sessionIds + '}';
    }
}
