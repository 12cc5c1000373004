package com.visionsentinel.core.detector;

import com.visionsentinel.core.error.SentinelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns loaded detector instances and hands them out to sessions.
 *
 * <h3>Modes</h3>
 * <ul>
 * <li>{@link PoolMode#SHARED}: one instance per model id. The returned
 * handle serializes {@code infer} calls because most backends are not
 * thread-safe.</li>
 * <li>{@link PoolMode#DEDICATED}: one instance per (model id, session id).
 * Sessions infer in parallel at the cost of memory.</li>
 * </ul>
 *
 * <h3>Loading</h3>
 * <p>
 * Loading is single-flight per key: when several sessions request the same
 * model at once, exactly one of them calls the {@link DetectorLoader} and
 * the others wait for its outcome. A failed load is not cached, so a later
 * request retries.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelPool implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ModelPool.class);

    private final DetectorLoader loader;
    private final PoolMode mode;
    private final Map<String, CompletableFuture<Detector>> detectors = new ConcurrentHashMap<>();
    private final AtomicLong loads = new AtomicLong();

    public ModelPool(DetectorLoader loader, PoolMode mode) {
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
    }

    /**
     * Return a detector for {@code modelId} usable by {@code sessionId},
     * loading it on first use.
     *
     * @throws SentinelException of kind {@code MODEL_LOAD} if loading fails
     */
    public Detector getDetector(String modelId, String sessionId) {
        Objects.requireNonNull(modelId, "modelId must not be null");
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        String key = keyFor(modelId, sessionId);

        CompletableFuture<Detector> created = new CompletableFuture<>();
        CompletableFuture<Detector> existing = detectors.putIfAbsent(key, created);
        if (existing != null) {
            try {
                return existing.join();
            } catch (CompletionException e) {
                throw SentinelException.modelLoad(modelId, e.getCause());
            }
        }

        LOG.info("Loading model '{}' ({} mode, key={})", modelId, mode, key);
        long started = System.nanoTime();
        try {
            Detector detector = loader.load(modelId);
            if (detector == null) {
                throw new IOException("loader returned no detector");
            }
            Detector handle = mode == PoolMode.SHARED ? new SerializedDetector(detector) : detector;
            created.complete(handle);
            loads.incrementAndGet();
            LOG.info("Model '{}' loaded in {} ms", modelId, (System.nanoTime() - started) / 1_000_000);
            return handle;
        } catch (IOException | RuntimeException e) {
            detectors.remove(key, created);
            created.completeExceptionally(e);
            LOG.error("Failed to load model '{}': {}", modelId, e.getMessage(), e);
            throw SentinelException.modelLoad(modelId, e);
        } catch (Error e) {
            // waiters must not hang on a future nobody completes
            detectors.remove(key, created);
            created.completeExceptionally(e);
            LOG.error("Failed to load model '{}': {}", modelId, e.toString(), e);
            throw e;
        }
    }

    /**
     * Release the detector held for a session. Only dedicated instances are
     * closed; shared instances live until {@link #close()}.
     */
    public void release(String modelId, String sessionId) {
        if (mode != PoolMode.DEDICATED) {
            return;
        }
        CompletableFuture<Detector> future = detectors.remove(keyFor(modelId, sessionId));
        if (future != null) {
            closeQuietly(future);
            LOG.debug("Released dedicated detector for session {}", sessionId);
        }
    }

    public PoolMode getMode() {
        return mode;
    }

    /**
     * @return number of detector instances currently held
     */
    public int size() {
        return detectors.size();
    }

    /**
     * @return total number of successful loads since creation
     */
    public long getLoadCount() {
        return loads.get();
    }

    @Override
    public void close() {
        List<CompletableFuture<Detector>> all = new ArrayList<>(detectors.values());
        detectors.clear();
        all.forEach(this::closeQuietly);
        LOG.info("Model pool closed ({} instance(s))", all.size());
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private String keyFor(String modelId, String sessionId) {
        return mode == PoolMode.SHARED ? modelId : modelId + "@" + sessionId;
    }

    private void closeQuietly(CompletableFuture<Detector> future) {
        if (!future.isDone() || future.isCompletedExceptionally()) {
            return;
        }
        try {
            future.join().close();
        } catch (RuntimeException e) {
            LOG.warn("Error closing detector: {}", e.getMessage(), e);
        }
    }
}
