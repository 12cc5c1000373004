package com.visionsentinel.core.postprocess;

import com.visionsentinel.core.model.BoundingBox;
import com.visionsentinel.core.model.Detection;
import com.visionsentinel.core.model.DetectionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RequiredEquipmentProcessor}.
 */
class RequiredEquipmentProcessorTest {

    private final RequiredEquipmentProcessor processor = new RequiredEquipmentProcessor();

    @Test
    @DisplayName("Should flag a person without a helmet inside their box")
    void shouldFlagMissingHelmet() {
        Detection worker = person(100, 100, 200, 400);
        Detection helmetElsewhere = helmet(500, 100, 540, 140);

        PostProcessOutcome outcome = processor.apply(result(worker, helmetElsewhere));

        assertThat(outcome.shouldProceed()).isTrue();
        Detection violation = outcome.getResult().getDetections().get(2);
        assertThat(violation.getClassName()).isEqualTo(RequiredEquipmentProcessor.MISSING_EQUIPMENT_CLASS);
        assertThat(violation.getBox()).isEqualTo(worker.getBox());
        assertThat(violation.getConfidence()).isEqualTo(worker.getConfidence());
        assertThat(processor.violationCount("cam-1")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should suppress the result when every person wears a helmet")
    void shouldSuppressWhenEquipped() {
        PostProcessOutcome outcome = processor.apply(result(person(100, 100, 200, 400), helmet(130, 100, 170, 140)));

        assertThat(outcome.shouldProceed()).isFalse();
        assertThat(processor.violationCount("cam-1")).isZero();
    }

    @Test
    @DisplayName("Should suppress frames without people")
    void shouldSuppressWithoutSubjects() {
        assertThat(processor.apply(result(helmet(0, 0, 10, 10))).shouldProceed()).isFalse();
        assertThat(processor.apply(result()).shouldProceed()).isFalse();
    }

    @Test
    @DisplayName("Should flag only the unequipped people among several")
    void shouldFlagOnlyUnequipped() {
        PostProcessOutcome outcome = processor.apply(result(
                person(0, 0, 100, 300), helmet(30, 0, 70, 40),
                person(300, 0, 400, 300)));

        assertThat(outcome.getResult().getDetections())
                .filteredOn(d -> d.getClassName().equals(RequiredEquipmentProcessor.MISSING_EQUIPMENT_CLASS))
                .extracting(d -> d.getBox().getX1())
                .containsExactly(300.0);
    }

    @Test
    @DisplayName("Should forget violation counts of a cleared session")
    void shouldClearSession() {
        processor.apply(result(person(0, 0, 100, 300)));

        processor.clearSession("cam-1");

        assertThat(processor.violationCount("cam-1")).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static DetectionResult result(Detection... detections) {
        return DetectionResult.builder()
                .sessionId("cam-1")
                .timestamp(Instant.parse("2024-06-10T08:00:00Z"))
                .frameId(1)
                .detections(List.of(detections))
                .build();
    }

    private static Detection person(double x1, double y1, double x2, double y2) {
        return new Detection("person", 0, 0.85, new BoundingBox(x1, y1, x2, y2));
    }

    private static Detection helmet(double x1, double y1, double x2, double y2) {
        return new Detection("helmet", 1, 0.8, new BoundingBox(x1, y1, x2, y2));
    }
}
