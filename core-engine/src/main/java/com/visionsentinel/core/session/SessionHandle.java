package com.visionsentinel.core.session;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Stop signal and thread of one worker run.
 */
final class SessionHandle {

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile Thread thread;

    void attach(Thread thread) {
        this.thread = thread;
    }

    void requestStop() {
        stopSignal.countDown();
    }

    boolean isStopRequested() {
        return stopSignal.getCount() == 0;
    }

    /**
     * Sleep up to {@code timeout}, waking early on stop.
     *
     * @return {@code true} if stop was requested
     */
    boolean awaitStop(Duration timeout) {
        try {
            return stopSignal.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    /**
     * @return {@code true} if the worker thread has ended within
     *         {@code timeout}
     */
    boolean join(Duration timeout) {
        Thread t = thread;
        if (t == null || t == Thread.currentThread()) {
            return true;
        }
        try {
            t.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !t.isAlive();
    }
}
