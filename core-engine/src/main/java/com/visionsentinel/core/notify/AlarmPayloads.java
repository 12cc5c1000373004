package com.visionsentinel.core.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.visionsentinel.core.model.AlarmEvent;
import com.visionsentinel.core.model.NotificationTarget;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * JSON payloads sent to external alarm consumers. Field names are part of
 * the downstream contract and must not change.
 *
 * @since 1.0.0
 */
public final class AlarmPayloads {

    /** Format of {@code alarmTime} in message-bus payloads. */
    public static final DateTimeFormatter ALARM_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private AlarmPayloads() {
        // utility class, not instantiable
    }

    /**
     * HTTP callback body:
     * {@code {"type","stream_id","rule_id","timestamp","alarm_type","confidence","bbox","class_name","consecutive_count","pic"}}.
     */
    public static ObjectNode callback(AlarmEvent event) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", "alarm");
        node.put("stream_id", event.getSessionId());
        node.put("rule_id", event.getRuleId());
        node.put("timestamp", event.getTimestamp().toString());
        node.put("alarm_type", event.getSeverity().name().toLowerCase(Locale.ROOT));
        node.put("confidence", event.getConfidence());
        ArrayNode bbox = node.putArray("bbox");
        for (double v : event.getBox().toArray()) {
            bbox.add(v);
        }
        node.put("class_name", event.getClassName());
        node.put("consecutive_count", event.getConsecutiveCount());
        node.put("pic", nullToEmpty(event.getMediaUrl()));
        return node;
    }

    /**
     * Message-bus body: {@code {"scene","alarmTime","pic","deviceGbCode","record"}}.
     * The scene falls back to the session id, the device to the session id.
     */
    public static ObjectNode messageBus(AlarmEvent event, ZoneId zone) {
        NotificationTarget target = event.getTarget();
        ObjectNode node = MAPPER.createObjectNode();
        node.put("scene", target.getSceneId() != null ? target.getSceneId() : event.getSessionId());
        node.put("alarmTime", ALARM_TIME_FORMAT.format(event.getTimestamp().atZone(zone)));
        node.put("pic", nullToEmpty(event.getMediaUrl()));
        node.put("deviceGbCode", deviceId(event));
        node.put("record", "");
        return node;
    }

    static String deviceId(AlarmEvent event) {
        String deviceId = event.getTarget().getDeviceId();
        return deviceId != null ? deviceId : event.getSessionId();
    }

    static String toJson(ObjectNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize alarm payload", e);
        }
    }

    private static String nullToEmpty(String v) {
        return v != null ? v : "";
    }
}
