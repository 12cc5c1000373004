package com.visionsentinel.core.scene;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one deploy call: sessions that started and devices that did
 * not, each with a reason.
 *
 * @since 1.0.0
 */
public final class DeploymentResult {

    private final String sceneId;
    private final List<String> sessionIds;
    private final List<Failure> failed;

    DeploymentResult(String sceneId, List<String> sessionIds, List<Failure> failed) {
        this.sceneId = sceneId;
        this.sessionIds = Collections.unmodifiableList(new ArrayList<>(sessionIds));
        this.failed = Collections.unmodifiableList(new ArrayList<>(failed));
    }

    public String getSceneId() {
        return sceneId;
    }

    public List<String> getSessionIds() {
        return sessionIds;
    }

    public List<Failure> getFailed() {
        return failed;
    }

    /** @return {@code true} if at least one device is running */
    public boolean isDeployed() {
        return !sessionIds.isEmpty();
    }

    @Override
    public String toString() {
        return "DeploymentResult{scene='" + sceneId + "', sessions=" + sessionIds + ", failed=" + failed + '}';
    }

    /**
     * A device that could not be deployed.
     */
    public static final class Failure {

        private final String deviceId;
        private final String reason;

        Failure(String deviceId, String reason) {
            this.deviceId = deviceId;
            this.reason = reason;
        }

        public String getDeviceId() {
            return deviceId;
        }

        public String getReason() {
            return reason;
        }

        @Override
        public String toString() {
            return deviceId + ": " + reason;
        }
    }
}
