package com.visionsentinel.core.postprocess;

import com.visionsentinel.core.model.Detection;
import com.visionsentinel.core.model.DetectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Flags subjects that are not wearing required equipment, such as a person
 * without a helmet.
 *
 * <p>
 * A subject counts as equipped when the center of at least one equipment
 * detection lies inside its box. For every unequipped subject a
 * {@value #MISSING_EQUIPMENT_CLASS} detection with the subject's box and
 * confidence is appended. The result proceeds only when there is at least
 * one violation.
 * </p>
 *
 * @since 1.0.0
 */
public class RequiredEquipmentProcessor implements PostProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(RequiredEquipmentProcessor.class);

    /** Class name of synthesized violation detections. */
    public static final String MISSING_EQUIPMENT_CLASS = "missing_equipment";

    /** Class id of synthesized violation detections. */
    public static final int MISSING_EQUIPMENT_CLASS_ID = -1;

    private final String subjectClass;
    private final String equipmentClass;
    private final Map<String, AtomicLong> violations = new ConcurrentHashMap<>();

    public RequiredEquipmentProcessor() {
        this("person", "helmet");
    }

    public RequiredEquipmentProcessor(String subjectClass, String equipmentClass) {
        this.subjectClass = Objects.requireNonNull(subjectClass, "subjectClass must not be null");
        this.equipmentClass = Objects.requireNonNull(equipmentClass, "equipmentClass must not be null");
    }

    @Override
    public PostProcessingPolicy policy() {
        return PostProcessingPolicy.REQUIRED_EQUIPMENT;
    }

    @Override
    public PostProcessOutcome apply(DetectionResult result) {
        List<Detection> subjects = new ArrayList<>();
        List<Detection> equipment = new ArrayList<>();
        for (Detection d : result.getDetections()) {
            if (subjectClass.equals(d.getClassName())) {
                subjects.add(d);
            } else if (equipmentClass.equals(d.getClassName())) {
                equipment.add(d);
            }
        }
        if (subjects.isEmpty()) {
            return PostProcessOutcome.suppress(result);
        }

        List<Detection> missing = new ArrayList<>();
        for (Detection subject : subjects) {
            boolean equipped = equipment.stream()
                    .anyMatch(e -> subject.getBox().contains(e.getCenterX(), e.getCenterY()));
            if (!equipped) {
                missing.add(new Detection(MISSING_EQUIPMENT_CLASS, MISSING_EQUIPMENT_CLASS_ID,
                        subject.getConfidence(), subject.getBox()));
            }
        }
        if (missing.isEmpty()) {
            return PostProcessOutcome.suppress(result);
        }

        long total = violations.computeIfAbsent(result.getSessionId(), k -> new AtomicLong())
                .addAndGet(missing.size());
        LOG.debug("Session {}: {} subject(s), {} {}, {} without it (total {})",
                result.getSessionId(), subjects.size(), equipment.size(), equipmentClass,
                missing.size(), total);

        List<Detection> augmented = new ArrayList<>(result.getDetections());
        augmented.addAll(missing);
        return PostProcessOutcome.proceed(result.withDetections(augmented));
    }

    /**
     * @return number of violations synthesized for a session so far
     */
    public long violationCount(String sessionId) {
        AtomicLong count = violations.get(sessionId);
        return count != null ? count.get() : 0;
    }

    @Override
    public void clearSession(String sessionId) {
        violations.remove(sessionId);
    }
}
