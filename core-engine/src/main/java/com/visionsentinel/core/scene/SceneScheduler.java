package com.visionsentinel.core.scene;

import com.visionsentinel.core.config.AlgorithmDefinition;
import com.visionsentinel.core.config.EngineConfig;
import com.visionsentinel.core.error.ErrorKind;
import com.visionsentinel.core.error.SentinelException;
import com.visionsentinel.core.heartbeat.HeartbeatManager;
import com.visionsentinel.core.model.NotificationTarget;
import com.visionsentinel.core.postprocess.DetectionRegions;
import com.visionsentinel.core.schedule.TimePolicies;
import com.visionsentinel.core.schedule.TimePolicy;
import com.visionsentinel.core.schedule.TimeWindowGate;
import com.visionsentinel.core.session.StreamConfig;
import com.visionsentinel.core.session.StreamManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Deploys algorithms onto devices as scene-keyed groups of sessions.
 *
 * <h3>Deploy</h3>
 * <p>
 * A deploy call resolves the algorithm and builds the time policy first, so
 * a bad request is rejected before anything is torn down. If the scene is
 * already deployed, the old deployment is stopped and its sessions
 * unregistered before the new ones are created. Each device gets one
 * session named {@code scene_<sceneId>_<deviceId>} and a heartbeat. Devices
 * that fail are reported in the {@link DeploymentResult}; a deployment with
 * no running device is not recorded.
 * </p>
 *
 * <h3>Expiration</h3>
 * <p>
 * {@link #expireDeployments()} (run periodically by
 * {@link #startExpirationMonitor()}) tears down every deployment whose
 * policy has an expiry in the past. Only absolute-range policies expire.
 * </p>
 *
 * <p>
 * Deploy, stop and expiration are serialised by one lock; the per-frame
 * permission check goes straight to the {@link TimeWindowGate}.
 * </p>
 *
 * @since 1.0.0
 */
public class SceneScheduler implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SceneScheduler.class);

    private final StreamManager streams;
    private final HeartbeatManager heartbeats;
    private final AlgorithmCatalog algorithms;
    private final StreamAddressResolver resolver;
    private final TimeWindowGate gate;
    private final EngineConfig config;
    private final Clock clock;

    private final Object deployLock = new Object();
    private final Map<String, SceneDeployment> deployments = new LinkedHashMap<>();

    private ScheduledExecutorService expirationMonitor;

    public SceneScheduler(StreamManager streams, HeartbeatManager heartbeats, AlgorithmCatalog algorithms,
            StreamAddressResolver resolver, TimeWindowGate gate, EngineConfig config, Clock clock) {
        this.streams = Objects.requireNonNull(streams, "streams must not be null");
        this.heartbeats = Objects.requireNonNull(heartbeats, "heartbeats must not be null");
        this.algorithms = Objects.requireNonNull(algorithms, "algorithms must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Session id used for a device of a scene.
     */
    public static String sessionId(String sceneId, String deviceId) {
        return ("scene_" + sceneId + "_" + deviceId).replace(' ', '_');
    }

    // ---------------------------------------------------------------
    // Deploy / stop
    // ---------------------------------------------------------------

    /**
     * Deploy (or redeploy) a scene.
     *
     * @throws SentinelException of kind {@code CONFIG} for an unknown
     *                           algorithm or an invalid or already expired
     *                           time policy
     */
    public DeploymentResult deploy(DeploymentRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String sceneId = request.getSceneId();
        synchronized (deployLock) {
            AlgorithmDefinition algorithm = algorithms.find(request.getAlgorithmCode())
                    .orElseThrow(() -> SentinelException.config(
                            "Unknown algorithm: " + request.getAlgorithmCode()));
            TimePolicy policy = TimePolicies.fromRequest(request.getDateType(), request.getStart(),
                    request.getEnd(), request.getMonths());
            if (policy.isExpired(LocalDateTime.now(clock))) {
                throw SentinelException.config("Time policy already expired: " + policy);
            }

            SceneDeployment existing = deployments.get(sceneId);
            if (existing != null) {
                LOG.info("Scene {} already deployed; tearing down before redeploy", sceneId);
                teardown(existing);
            }

            List<String> started = new ArrayList<>();
            Set<String> devices = new LinkedHashSet<>();
            List<DeploymentResult.Failure> failed = new ArrayList<>();
            for (DeviceSpec device : request.getDevices()) {
                Optional<String> failure = deployDevice(request, algorithm, policy, device);
                if (failure.isPresent()) {
                    failed.add(new DeploymentResult.Failure(device.getDeviceId(), failure.get()));
                } else {
                    started.add(sessionId(sceneId, device.getDeviceId()));
                    devices.add(device.getDeviceId());
                }
            }

            if (started.isEmpty()) {
                LOG.warn("Scene {} not deployed: no device could be started ({})", sceneId, failed);
            } else {
                deployments.put(sceneId, new SceneDeployment(sceneId, algorithm.getCode(), policy, started,
                        devices, clock.instant()));
                LOG.info("Scene {} deployed: algorithm={}, policy={}, sessions={}, failed={}",
                        sceneId, algorithm.getCode(), policy, started.size(), failed.size());
            }
            return new DeploymentResult(sceneId, started, failed);
        }
    }

    /**
     * Stop and unregister every session of a scene and stop heartbeats of
     * devices no other scene uses.
     *
     * @throws SentinelException {@code NOT_FOUND} if the scene is not deployed
     */
    public void stopDeployment(String sceneId) {
        synchronized (deployLock) {
            SceneDeployment deployment = deployments.get(sceneId);
            if (deployment == null) {
                throw SentinelException.notFound("Deployment", sceneId);
            }
            teardown(deployment);
        }
        LOG.info("Scene {} stopped", sceneId);
    }

    /**
     * Tear down every deployment whose policy has expired.
     *
     * @return number of deployments removed
     */
    public int expireDeployments() {
        LocalDateTime now = LocalDateTime.now(clock);
        int expired = 0;
        synchronized (deployLock) {
            for (SceneDeployment deployment : new ArrayList<>(deployments.values())) {
                if (deployment.getPolicy().isExpired(now)) {
                    LOG.info("Scene {} expired at {}; stopping", deployment.getSceneId(),
                            deployment.getPolicy().expiry().orElse(null));
                    teardown(deployment);
                    expired++;
                }
            }
        }
        return expired;
    }

    public synchronized void startExpirationMonitor() {
        if (expirationMonitor != null) {
            return;
        }
        expirationMonitor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "scene-expiration-monitor");
            t.setDaemon(true);
            return t;
        });
        long interval = config.getExpirationCheckInterval().toMillis();
        expirationMonitor.scheduleWithFixedDelay(() -> {
            try {
                expireDeployments();
            } catch (RuntimeException e) {
                LOG.error("Expiration check failed: {}", e.getMessage(), e);
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
        LOG.info("Scene expiration monitor started (every {} ms)", interval);
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * Whether a session may process frames at {@code now}. No I/O.
     */
    public boolean isPermitted(String sessionId, Instant now) {
        return gate.isPermitted(sessionId, now);
    }

    public Optional<SceneDeployment> deployment(String sceneId) {
        synchronized (deployLock) {
            return Optional.ofNullable(deployments.get(sceneId));
        }
    }

    public List<SceneDeployment> deployments() {
        synchronized (deployLock) {
            return new ArrayList<>(deployments.values());
        }
    }

    /**
     * Stop the expiration monitor. Deployments and their sessions are left
     * to the stream manager's own shutdown.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (expirationMonitor != null) {
                expirationMonitor.shutdownNow();
                expirationMonitor = null;
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * @return failure reason, or empty if the device session is running
     */
    private Optional<String> deployDevice(DeploymentRequest request, AlgorithmDefinition algorithm,
            TimePolicy policy, DeviceSpec device) {
        String deviceId = device.getDeviceId();
        Optional<String> locator;
        try {
            locator = resolver.resolve(deviceId);
        } catch (RuntimeException e) {
            LOG.warn("Scene {}: stream address lookup failed for device {}: {}",
                    request.getSceneId(), deviceId, e.getMessage());
            return Optional.of("stream address lookup failed: " + e.getMessage());
        }
        if (locator.isEmpty()) {
            return Optional.of("stream address unavailable");
        }

        String id = sessionId(request.getSceneId(), deviceId);
        boolean registered = false;
        try {
            StreamConfig streamConfig = StreamConfig.builder()
                    .id(id)
                    .sourceLocator(locator.get())
                    .modelId(algorithm.getModelId())
                    .confidenceThreshold(config.getDefaultConfidence())
                    .iouThreshold(config.getDefaultIou())
                    .fpsLimit(config.getDefaultFpsLimit())
                    .targetClasses(new LinkedHashSet<>(algorithm.getTargetClasses()))
                    .postProcessing(algorithm.getPostProcessing())
                    .timePolicy(policy)
                    .target(new NotificationTarget(request.getCallbackUrl(), deviceId, request.getSceneId()))
                    .regions(DetectionRegions.parse(device.getArea()))
                    .build();
            streams.register(streamConfig);
            registered = true;
            streams.start(id);
        } catch (SentinelException e) {
            LOG.warn("Scene {}: device {} not started: {}", request.getSceneId(), deviceId, e.getMessage());
            if (registered) {
                unregisterQuietly(id);
            }
            return Optional.of(e.getMessage());
        }
        heartbeats.start(deviceId);
        return Optional.empty();
    }

    private void teardown(SceneDeployment deployment) {
        deployments.remove(deployment.getSceneId());
        for (String id : deployment.getSessionIds()) {
            unregisterQuietly(id);
        }
        for (String deviceId : deployment.getDeviceIds()) {
            boolean shared = deployments.values().stream().anyMatch(d -> d.getDeviceIds().contains(deviceId));
            if (!shared) {
                heartbeats.stop(deviceId);
            }
        }
    }

    private void unregisterQuietly(String id) {
        try {
            streams.unregister(id);
        } catch (SentinelException e) {
            if (e.getKind() != ErrorKind.NOT_FOUND) {
                throw e;
            }
            LOG.debug("Session {} already unregistered", id);
        }
    }
}
