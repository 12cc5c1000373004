package com.visionsentinel.core.detector;

import com.visionsentinel.core.model.BoundingBox;
import com.visionsentinel.core.model.Detection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CoordinateMapper}.
 */
class CoordinateMapperTest {

    @Test
    @DisplayName("Should keep frames within the limit at full scale")
    void shouldNotScaleSmallFrames() {
        assertThat(CoordinateMapper.scaleFor(640, 480, 640)).isEqualTo(1.0);
        assertThat(CoordinateMapper.scaleFor(320, 240, 640)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should scale by the larger dimension")
    void shouldScaleByLargerDimension() {
        assertThat(CoordinateMapper.scaleFor(1920, 1080, 640)).isEqualTo(640.0 / 1920);
        assertThat(CoordinateMapper.scaleFor(720, 1280, 640)).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should map boxes back to the original frame")
    void shouldMapBack() {
        Detection scaled = new Detection("person", 0, 0.9, new BoundingBox(10, 20, 110, 220));

        List<Detection> mapped = CoordinateMapper.toOriginal(List.of(scaled), 0.5, 1280, 720);

        BoundingBox box = mapped.get(0).getBox();
        assertThat(box.toArray()).containsExactly(20.0, 40.0, 220.0, 440.0);
        assertThat(mapped.get(0).getConfidence()).isEqualTo(0.9);
    }

    @Test
    @DisplayName("Should clamp mapped boxes to the frame bounds")
    void shouldClamp() {
        Detection scaled = new Detection("car", 2, 0.6, new BoundingBox(600, 300, 660, 380));

        BoundingBox box = CoordinateMapper.toOriginal(List.of(scaled), 0.5, 1280, 720).get(0).getBox();

        assertThat(box.getX2()).isEqualTo(1280.0);
        assertThat(box.getY2()).isEqualTo(720.0);
    }
}
