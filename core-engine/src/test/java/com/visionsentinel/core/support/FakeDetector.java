package com.visionsentinel.core.support;

import com.visionsentinel.core.detector.Detector;
import com.visionsentinel.core.model.BoundingBox;
import com.visionsentinel.core.model.Detection;
import com.visionsentinel.core.source.Frame;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Detector returning whatever the test configures for each frame.
 */
public class FakeDetector implements Detector {

    private volatile Function<Frame, List<Detection>> behaviour = frame -> List.of();
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final List<Frame> seen = new ArrayList<>();

    public static FakeDetector returning(Detection... detections) {
        FakeDetector d = new FakeDetector();
        d.respondWith(List.of(detections));
        return d;
    }

    public static Detection person(double confidence) {
        return new Detection("person", 0, confidence, new BoundingBox(100, 100, 200, 300));
    }

    public FakeDetector respondWith(List<Detection> detections) {
        this.behaviour = frame -> detections;
        return this;
    }

    public FakeDetector respondWith(Function<Frame, List<Detection>> fn) {
        this.behaviour = fn;
        return this;
    }

    public FakeDetector failWith(RuntimeException e) {
        this.behaviour = frame -> {
            throw e;
        };
        return this;
    }

    @Override
    public List<Detection> infer(Frame frame, double confidenceThreshold, double iouThreshold, int imageSize) {
        calls.incrementAndGet();
        synchronized (seen) {
            seen.add(frame);
        }
        return behaviour.apply(frame);
    }

    @Override
    public Map<Integer, String> classNames() {
        return Map.of(0, "person", 1, "helmet");
    }

    @Override
    public void close() {
        closed.set(true);
    }

    public int calls() {
        return calls.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    public List<Frame> seenFrames() {
        synchronized (seen) {
            return new ArrayList<>(seen);
        }
    }
}
