package com.visionsentinel.core.artifact;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Deterministic naming of per-detection artifacts.
 *
 * <p>
 * Each detection event gets one directory
 * {@code {yyyy-MM-dd}/{sessionId}/{HH-mm-ss-SSS}_frame_{frameId}} holding
 * {@value #SUMMARY_FILE} and {@value #ANNOTATED_IMAGE}. Because the path
 * depends only on (date, session, timestamp, frame id), the picture URL can
 * be derived whether or not the files were written.
 * </p>
 *
 * @since 1.0.0
 */
public final class ArtifactLayout {

    public static final String SUMMARY_FILE = "detection_info.json";
    public static final String ANNOTATED_IMAGE = "annotated.jpg";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH-mm-ss-SSS");

    private final String baseUrl;
    private final ZoneId zone;

    public ArtifactLayout(String baseUrl, ZoneId zone) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    /**
     * @return the relative directory of one detection event
     */
    public String directory(String sessionId, Instant timestamp, long frameId) {
        ZonedDateTime t = timestamp.atZone(zone);
        return DATE.format(t) + "/" + sessionId + "/" + TIME.format(t) + "_frame_" + frameId;
    }

    /**
     * @return URL of the annotated image of one detection event
     */
    public String pictureUrl(String sessionId, Instant timestamp, long frameId) {
        String path = directory(sessionId, timestamp, frameId) + "/" + ANNOTATED_IMAGE;
        return baseUrl.isEmpty() ? path : baseUrl + "/" + path;
    }

    /**
     * @return URL of the structured summary of one detection event
     */
    public String summaryUrl(String sessionId, Instant timestamp, long frameId) {
        String path = directory(sessionId, timestamp, frameId) + "/" + SUMMARY_FILE;
        return baseUrl.isEmpty() ? path : baseUrl + "/" + path;
    }
}
