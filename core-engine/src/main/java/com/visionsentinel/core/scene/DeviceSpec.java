package com.visionsentinel.core.scene;

import java.util.Objects;

/**
 * One device of a deployment request with its optional detection area.
 *
 * @since 1.0.0
 */
public final class DeviceSpec {

    private final String deviceId;
    private final String area;

    public DeviceSpec(String deviceId, String area) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("deviceId must not be blank");
        }
        this.deviceId = deviceId;
        this.area = area != null ? area : "";
    }

    public static DeviceSpec of(String deviceId) {
        return new DeviceSpec(deviceId, "");
    }

    public String getDeviceId() {
        return deviceId;
    }

    /** @return polygon list in {@code "(x,y),(x,y),(x,y);..."} form, empty for the whole frame */
    public String getArea() {
        return area;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DeviceSpec)) {
            return false;
        }
        DeviceSpec that = (DeviceSpec) o;
        return deviceId.equals(that.deviceId) && area.equals(that.area);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, area);
    }

    @Override
    public String toString() {
        return area.isEmpty() ? deviceId : deviceId + "[" + area + "]";
    }
}
