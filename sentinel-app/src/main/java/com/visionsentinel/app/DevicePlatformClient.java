package com.visionsentinel.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.visionsentinel.core.heartbeat.HeartbeatSender;
import com.visionsentinel.core.scene.StreamAddressResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * HTTP client of the device management platform.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code POST {base}/api/channel/getPlayUrlByGbCode} with
 * {@code {"deviceGbCode":"..."}}; a reply
 * {@code {"status":0,"data":{"rtmp":..,"rtsp":..,"flv":..,"hls":..}}}
 * yields the first non-blank address in the order rtmp, rtsp, flv, hls</li>
 * <li>{@code POST {base}/api/channel/heartbeatByGbCode} with the same body;
 * {@code status 0} means acknowledged</li>
 * </ul>
 *
 * <p>
 * Address lookups are retried up to {@code maxAttempts} times with a fixed
 * delay; heartbeats are sent once per call.
 * </p>
 *
 * @since 1.0.0
 */
public class DevicePlatformClient implements StreamAddressResolver, HeartbeatSender {

    private static final Logger LOG = LoggerFactory.getLogger(DevicePlatformClient.class);

    static final String PLAY_URL_PATH = "/api/channel/getPlayUrlByGbCode";
    static final String HEARTBEAT_PATH = "/api/channel/heartbeatByGbCode";
    private static final List<String> PROTOCOL_PREFERENCE = List.of("rtmp", "rtsp", "flv", "hls");

    private final HttpClient http;
    private final String baseUrl;
    private final Duration timeout;
    private final int maxAttempts;
    private final Duration retryDelay;
    private final ObjectMapper mapper = new ObjectMapper();

    public DevicePlatformClient(HttpClient http, String baseUrl, Duration timeout, int maxAttempts,
            Duration retryDelay) {
        this.http = Objects.requireNonNull(http, "http must not be null");
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
    }

    @Override
    public Optional<String> resolve(String deviceId) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                JsonNode reply = post(PLAY_URL_PATH, deviceId);
                if (reply.path("status").asInt(-1) == 0) {
                    Optional<String> address = pickAddress(reply.path("data"));
                    if (address.isEmpty()) {
                        LOG.warn("Device {} has no playable stream address", deviceId);
                    } else {
                        LOG.info("Device {} stream address resolved: {}", deviceId, address.get());
                    }
                    return address;
                }
                LOG.warn("Play URL lookup for device {} rejected: {} (attempt {}/{})",
                        deviceId, reply.path("message").asText("unknown error"), attempt, maxAttempts);
            } catch (IOException e) {
                LOG.warn("Play URL lookup for device {} failed: {} (attempt {}/{})",
                        deviceId, e.getMessage(), attempt, maxAttempts);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
            if (attempt < maxAttempts && !pause()) {
                return Optional.empty();
            }
        }
        LOG.error("Play URL lookup for device {} failed after {} attempt(s)", deviceId, maxAttempts);
        return Optional.empty();
    }

    @Override
    public boolean send(String deviceId) {
        try {
            JsonNode reply = post(HEARTBEAT_PATH, deviceId);
            if (reply.path("status").asInt(-1) == 0) {
                LOG.debug("Heartbeat acknowledged for device {}", deviceId);
                return true;
            }
            LOG.warn("Heartbeat for device {} rejected: {}", deviceId,
                    reply.path("message").asText("unknown error"));
            return false;
        } catch (IOException e) {
            LOG.warn("Heartbeat for device {} failed: {}", deviceId, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private JsonNode post(String path, String deviceId) throws IOException, InterruptedException {
        byte[] body = mapper.writeValueAsBytes(Map.of("deviceGbCode", deviceId));
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        HttpResponse<byte[]> response = http.send(request, HttpResponse.BodyHandlers.ofByteArray());
        if (response.statusCode() / 100 != 2) {
            throw new IOException("HTTP " + response.statusCode() + " from " + path);
        }
        return mapper.readTree(response.body());
    }

    static Optional<String> pickAddress(JsonNode data) {
        for (String protocol : PROTOCOL_PREFERENCE) {
            String value = data.path(protocol).asText("");
            if (!value.isBlank()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    private boolean pause() {
        try {
            Thread.sleep(retryDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
