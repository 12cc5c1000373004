package com.visionsentinel.core.artifact;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ArtifactLayout}.
 */
class ArtifactLayoutTest {

    private static final Instant AT = Instant.parse("2024-06-10T23:59:58.123Z");

    @Test
    @DisplayName("Should name the event directory by date, session, time and frame")
    void shouldBuildDirectory() {
        ArtifactLayout layout = new ArtifactLayout("", ZoneOffset.UTC);

        assertThat(layout.directory("cam-1", AT, 42)).isEqualTo("2024-06-10/cam-1/23-59-58-123_frame_42");
    }

    @Test
    @DisplayName("Should use the configured zone for the date and time parts")
    void shouldUseZone() {
        ArtifactLayout layout = new ArtifactLayout("", ZoneId.of("Asia/Shanghai"));

        assertThat(layout.directory("cam-1", AT, 1)).isEqualTo("2024-06-11/cam-1/07-59-58-123_frame_1");
    }

    @Test
    @DisplayName("Should prefix URLs with the base URL without doubling the slash")
    void shouldPrefixBaseUrl() {
        ArtifactLayout layout = new ArtifactLayout("https://media.example/detections/", ZoneOffset.UTC);

        assertThat(layout.pictureUrl("cam-1", AT, 42))
                .isEqualTo("https://media.example/detections/2024-06-10/cam-1/23-59-58-123_frame_42/annotated.jpg");
        assertThat(layout.summaryUrl("cam-1", AT, 42))
                .endsWith("/23-59-58-123_frame_42/" + ArtifactLayout.SUMMARY_FILE);
    }

    @Test
    @DisplayName("Should return relative paths without a base URL")
    void shouldReturnRelativePath() {
        ArtifactLayout layout = new ArtifactLayout("", ZoneOffset.UTC);

        assertThat(layout.pictureUrl("cam-1", AT, 7)).isEqualTo("2024-06-10/cam-1/23-59-58-123_frame_7/annotated.jpg");
    }

    @Test
    @DisplayName("Should derive the same path for the same event")
    void shouldBeDeterministic() {
        ArtifactLayout layout = new ArtifactLayout("http://x", ZoneOffset.UTC);

        assertThat(layout.pictureUrl("cam-1", AT, 3)).isEqualTo(layout.pictureUrl("cam-1", AT, 3));
        assertThat(layout.pictureUrl("cam-1", AT, 3)).isNotEqualTo(layout.pictureUrl("cam-1", AT, 4));
    }
}
