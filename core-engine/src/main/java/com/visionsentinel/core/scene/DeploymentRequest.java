package com.visionsentinel.core.scene;

import com.visionsentinel.core.error.SentinelException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Deploy one algorithm onto a set of devices under a time policy.
 *
 * <p>
 * {@code dateType} selects the policy: 1 absolute range
 * ({@code yyyy-MM-dd HH:mm:ss} bounds), 2 months plus daily window, 3 daily
 * window only. Instances are created through {@link #builder()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DeploymentRequest {

    private final String sceneId;
    private final String algorithmCode;
    private final List<DeviceSpec> devices;
    private final int dateType;
    private final String start;
    private final String end;
    private final List<Integer> months;
    private final String callbackUrl;

    private DeploymentRequest(Builder b) {
        this.sceneId = b.sceneId;
        this.algorithmCode = b.algorithmCode;
        this.devices = Collections.unmodifiableList(new ArrayList<>(b.devices));
        this.dateType = b.dateType;
        this.start = b.start;
        this.end = b.end;
        this.months = Collections.unmodifiableList(new ArrayList<>(b.months));
        this.callbackUrl = b.callbackUrl;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getSceneId() {
        return sceneId;
    }

    public String getAlgorithmCode() {
        return algorithmCode;
    }

    public List<DeviceSpec> getDevices() {
        return devices;
    }

    public int getDateType() {
        return dateType;
    }

    public String getStart() {
        return start;
    }

    public String getEnd() {
        return end;
    }

    public List<Integer> getMonths() {
        return months;
    }

    /** @return callback URL for alarms of this deployment, or {@code null} */
    public String getCallbackUrl() {
        return callbackUrl;
    }

    @Override
    public String toString() {
        return "DeploymentRequest{scene='" + sceneId + "', algorithm='" + algorithmCode + "', devices=" + devices
                + ", dateType=" + dateType + ", start='" + start + "', end='" + end + "', months=" + months + '}';
    }

    public static class Builder {

        private String sceneId;
        private String algorithmCode;
        private final List<DeviceSpec> devices = new ArrayList<>();
        private int dateType = 3;
        private String start;
        private String end;
        private final List<Integer> months = new ArrayList<>();
        private String callbackUrl;

        public Builder sceneId(String v) {
            this.sceneId = v;
            return this;
        }

        public Builder algorithmCode(String v) {
            this.algorithmCode = v;
            return this;
        }

        public Builder device(String deviceId) {
            this.devices.add(DeviceSpec.of(deviceId));
            return this;
        }

        public Builder device(String deviceId, String area) {
            this.devices.add(new DeviceSpec(deviceId, area));
            return this;
        }

        public Builder devices(List<DeviceSpec> v) {
            this.devices.addAll(v);
            return this;
        }

        public Builder dateType(int v) {
            this.dateType = v;
            return this;
        }

        public Builder start(String v) {
            this.start = v;
            return this;
        }

        public Builder end(String v) {
            this.end = v;
            return this;
        }

        public Builder months(List<Integer> v) {
            this.months.addAll(v);
            return this;
        }

        public Builder callbackUrl(String v) {
            this.callbackUrl = v;
            return this;
        }

        /**
         * @throws SentinelException of kind {@code CONFIG} if required fields
         *                           are missing
         */
        public DeploymentRequest build() {
            List<String> errors = new ArrayList<>();
            if (sceneId == null || sceneId.isBlank()) {
                errors.add("sceneId is required");
            }
            if (algorithmCode == null || algorithmCode.isBlank()) {
                errors.add("algorithmCode is required");
            }
            if (devices.isEmpty()) {
                errors.add("at least one device is required");
            }
            if (!errors.isEmpty()) {
                throw SentinelException.config("Invalid deployment request: " + String.join("; ", errors));
            }
            return new DeploymentRequest(this);
        }
    }
}
