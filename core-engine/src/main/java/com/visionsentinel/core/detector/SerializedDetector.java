package com.visionsentinel.core.detector;

import com.visionsentinel.core.model.Detection;
import com.visionsentinel.core.source.Frame;

import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Wraps a detector so that only one inference runs at a time.
 */
final class SerializedDetector implements Detector {

    private final Detector delegate;
    private final ReentrantLock lock = new ReentrantLock();

    SerializedDetector(Detector delegate) {
        this.delegate = delegate;
    }

    @Override
    public List<Detection> infer(Frame frame, double confidenceThreshold, double iouThreshold, int imageSize) {
        lock.lock();
        try {
            return delegate.infer(frame, confidenceThreshold, iouThreshold, imageSize);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<Integer, String> classNames() {
        return delegate.classNames();
    }

    @Override
    public void close() {
        lock.lock();
        try {
            delegate.close();
        } finally {
            lock.unlock();
        }
    }
}
