package com.visionsentinel.core.postprocess;

import com.visionsentinel.core.model.BoundingBox;
import com.visionsentinel.core.model.Detection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DetectionRegions}.
 */
class DetectionRegionsTest {

    @Test
    @DisplayName("Should accept everything when no area is configured")
    void shouldAcceptAllWithoutArea() {
        assertThat(DetectionRegions.parse(null)).isSameAs(DetectionRegions.NONE);
        assertThat(DetectionRegions.parse("  ")).isSameAs(DetectionRegions.NONE);
        assertThat(DetectionRegions.NONE.contains(-5, 10_000)).isTrue();
    }

    @Test
    @DisplayName("Should parse several polygons separated by semicolons")
    void shouldParseMultiplePolygons() {
        DetectionRegions regions = DetectionRegions.parse(
                "(10,10),(200,10),(200,150);(300, 0), (400, 0), (400, 90), (300, 90)");

        assertThat(regions.polygonCount()).isEqualTo(2);
        assertThat(regions.contains(150, 50)).isTrue();
        assertThat(regions.contains(350, 45)).isTrue();
        assertThat(regions.contains(250, 45)).isFalse();
    }

    @Test
    @DisplayName("Should ignore polygons with fewer than three points")
    void shouldIgnoreDegeneratePolygons() {
        DetectionRegions regions = DetectionRegions.parse("(0,0),(10,10);(0,0),(100,0),(100,100),(0,100)");

        assertThat(regions.polygonCount()).isEqualTo(1);
        assertThat(DetectionRegions.parse("(0,0),(10,10)").isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should filter detections by the center of their box")
    void shouldFilterByCenter() {
        DetectionRegions regions = DetectionRegions.parse("(0,0),(100,0),(100,100),(0,100)");
        Detection inside = new Detection("person", 0, 0.9, new BoundingBox(40, 40, 60, 60));
        Detection straddling = new Detection("person", 0, 0.9, new BoundingBox(80, 80, 200, 200));

        List<Detection> kept = regions.filter(List.of(inside, straddling));

        assertThat(kept).containsExactly(inside);
    }
}
