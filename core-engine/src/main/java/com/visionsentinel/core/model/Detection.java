package com.visionsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A single object found on a frame by the detector.
 *
 * <p>
 * Immutable. Center and area are derived from the bounding box so they
 * always agree with it, including after coordinate mapping.
 * </p>
 *
 * @since 1.0.0
 */
public final class Detection implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String className;
    private final int classId;
    private final double confidence;
    private final BoundingBox box;

    public Detection(String className, int classId, double confidence, BoundingBox box) {
        this.className = Objects.requireNonNull(className, "className must not be null");
        this.classId = classId;
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got: " + confidence);
        }
        this.confidence = confidence;
        this.box = Objects.requireNonNull(box, "box must not be null");
    }

    /**
     * @return a copy of this detection with a different bounding box
     */
    public Detection withBox(BoundingBox newBox) {
        return new Detection(className, classId, confidence, newBox);
    }

    public String getClassName() {
        return className;
    }

    public int getClassId() {
        return classId;
    }

    public double getConfidence() {
        return confidence;
    }

    public BoundingBox getBox() {
        return box;
    }

    public double getCenterX() {
        return box.getCenterX();
    }

    public double getCenterY() {
        return box.getCenterY();
    }

    public double getArea() {
        return box.getArea();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Detection that))
            return false;
        return classId == that.classId
                && Double.compare(confidence, that.confidence) == 0
                && className.equals(that.className)
                && box.equals(that.box);
    }

    @Override
    public int hashCode() {
        return Objects.hash(className, classId, confidence, box);
    }

    @Override
    public String toString() {
        return "Detection{" + className + '#' + classId
                + ", confidence=" + String.format("%.3f", confidence)
                + ", box=" + box + '}';
    }
}
