package com.visionsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Where alarms raised for a session should be delivered and how they are
 * labelled for downstream consumers.
 *
 * <p>
 * All fields are optional. A blank {@code callbackUrl} disables the HTTP
 * callback channel for the session.
 * </p>
 *
 * @since 1.0.0
 */
public final class NotificationTarget implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Target with no callback, device or scene. */
    public static final NotificationTarget NONE = new NotificationTarget(null, null, null);

    private final String callbackUrl;
    private final String deviceId;
    private final String sceneId;

    public NotificationTarget(String callbackUrl, String deviceId, String sceneId) {
        this.callbackUrl = blankToNull(callbackUrl);
        this.deviceId = blankToNull(deviceId);
        this.sceneId = blankToNull(sceneId);
    }

    public String getCallbackUrl() {
        return callbackUrl;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getSceneId() {
        return sceneId;
    }

    public boolean hasCallback() {
        return callbackUrl != null;
    }

    private static String blankToNull(String v) {
        return v == null || v.isBlank() ? null : v;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NotificationTarget that))
            return false;
        return Objects.equals(callbackUrl, that.callbackUrl)
                && Objects.equals(deviceId, that.deviceId)
                && Objects.equals(sceneId, that.sceneId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(callbackUrl, deviceId, sceneId);
    }

    @Override
    public String toString() {
        return "NotificationTarget{callbackUrl='" + callbackUrl + "', deviceId='" + deviceId
                + "', sceneId='" + sceneId + "'}";
    }
}
