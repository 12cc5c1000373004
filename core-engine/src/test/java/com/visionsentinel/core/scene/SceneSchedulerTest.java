package com.visionsentinel.core.scene;

import com.visionsentinel.core.artifact.ArtifactLayout;
import com.visionsentinel.core.config.AlgorithmDefinition;
import com.visionsentinel.core.config.EngineConfig;
import com.visionsentinel.core.detector.ModelPool;
import com.visionsentinel.core.detector.PoolMode;
import com.visionsentinel.core.error.ErrorKind;
import com.visionsentinel.core.error.SentinelException;
import com.visionsentinel.core.heartbeat.HeartbeatManager;
import com.visionsentinel.core.postprocess.PostProcessingPolicy;
import com.visionsentinel.core.postprocess.PostProcessors;
import com.visionsentinel.core.schedule.AbsoluteRangePolicy;
import com.visionsentinel.core.schedule.DailyWindowPolicy;
import com.visionsentinel.core.schedule.TimeWindowGate;
import com.visionsentinel.core.session.StreamConfig;
import com.visionsentinel.core.session.StreamManager;
import com.visionsentinel.core.support.FakeDetector;
import com.visionsentinel.core.support.MutableClock;
import com.visionsentinel.core.support.ScriptedSources;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SceneScheduler}.
 */
class SceneSchedulerTest {

    private final MutableClock clock = MutableClock.at(LocalDateTime.of(2024, 6, 10, 12, 0));
    private final FakeDetector detector = new FakeDetector();

    private TimeWindowGate gate;
    private StreamManager streams;
    private HeartbeatManager heartbeats;
    private SceneScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.close();
        }
        if (streams != null) {
            streams.close();
        }
        if (heartbeats != null) {
            heartbeats.close();
        }
    }

    // ---- Deploy

    @Test
    @DisplayName("Should start one session and one heartbeat per device")
    void shouldDeployDevices() {
        scheduler = scheduler(10);

        DeploymentResult result = scheduler.deploy(request("s1")
                .device("dev-1", "(0,0),(100,0),(100,100)")
                .device("dev-2")
                .callbackUrl("http://platform/alarm")
                .build());

        assertThat(result.isDeployed()).isTrue();
        assertThat(result.getSessionIds()).containsExactly("scene_s1_dev-1", "scene_s1_dev-2");
        assertThat(result.getFailed()).isEmpty();
        assertThat(streams.isRunning("scene_s1_dev-1")).isTrue();
        assertThat(heartbeats.activeDevices()).containsExactly("dev-1", "dev-2");

        StreamConfig config = streams.config("scene_s1_dev-1").orElseThrow();
        assertThat(config.getSourceLocator()).isEqualTo("rtsp://platform/dev-1");
        assertThat(config.getModelId()).isEqualTo("models/fire.pt");
        assertThat(config.getTargetClasses()).containsExactly("fire", "smoke");
        assertThat(config.getRegions().polygonCount()).isEqualTo(1);
        assertThat(config.getTarget().getCallbackUrl()).isEqualTo("http://platform/alarm");
        assertThat(config.getTarget().getDeviceId()).isEqualTo("dev-1");
        assertThat(config.getTarget().getSceneId()).isEqualTo("s1");
        assertThat(gate.policy("scene_s1_dev-1")).containsInstanceOf(DailyWindowPolicy.class);

        SceneDeployment deployment = scheduler.deployment("s1").orElseThrow();
        assertThat(deployment.getAlgorithmCode()).isEqualTo("fire_detection");
        assertThat(deployment.getDeviceIds()).containsExactly("dev-1", "dev-2");
    }

    @Test
    @DisplayName("Should carry the algorithm's post-processing policy into the session")
    void shouldApplyAlgorithmPostProcessing() {
        scheduler = scheduler(10);

        scheduler.deploy(DeploymentRequest.builder()
                .sceneId("site")
                .algorithmCode("helmet_detection")
                .device("dev-1")
                .dateType(3).start("00:00").end("23:59:59")
                .build());

        assertThat(streams.config("scene_site_dev-1").orElseThrow().getPostProcessing())
                .isEqualTo(PostProcessingPolicy.REQUIRED_EQUIPMENT);
    }

    @Test
    @DisplayName("Should replace the previous deployment when a scene is deployed again")
    void shouldRedeployIdempotently() {
        scheduler = scheduler(10);
        scheduler.deploy(request("s1").device("dev-1").device("dev-2").build());

        DeploymentResult again = scheduler.deploy(request("s1").device("dev-2").device("dev-3").build());

        assertThat(again.getSessionIds()).containsExactly("scene_s1_dev-2", "scene_s1_dev-3");
        assertThat(streams.contains("scene_s1_dev-1")).isFalse();
        assertThat(streams.sessions()).hasSize(2);
        assertThat(scheduler.deployments()).hasSize(1);
        assertThat(heartbeats.activeDevices()).containsExactly("dev-2", "dev-3");
    }

    @Test
    @DisplayName("Should deploy the reachable devices and report the others")
    void shouldReportFailedDevices() {
        scheduler = scheduler(10);

        DeploymentResult result = scheduler.deploy(request("s1")
                .device("dev-1").device("offline").device("broken").build());

        assertThat(result.getSessionIds()).containsExactly("scene_s1_dev-1");
        assertThat(result.getFailed()).extracting(DeploymentResult.Failure::getDeviceId)
                .containsExactly("offline", "broken");
        assertThat(result.getFailed()).extracting(DeploymentResult.Failure::getReason)
                .containsExactly("stream address unavailable", "stream address lookup failed: platform timeout");
        assertThat(heartbeats.activeDevices()).containsExactly("dev-1");
    }

    @Test
    @DisplayName("Should not record a deployment when no device starts")
    void shouldNotRecordEmptyDeployment() {
        scheduler = scheduler(10);

        DeploymentResult result = scheduler.deploy(request("s1").device("offline").build());

        assertThat(result.isDeployed()).isFalse();
        assertThat(scheduler.deployment("s1")).isEmpty();
    }

    @Test
    @DisplayName("Should report devices refused by admission control")
    void shouldReportCapacityFailures() {
        scheduler = scheduler(1);

        DeploymentResult result = scheduler.deploy(request("s1").device("dev-1").device("dev-2").build());

        assertThat(result.getSessionIds()).containsExactly("scene_s1_dev-1");
        assertThat(result.getFailed()).singleElement()
                .satisfies(f -> assertThat(f.getReason()).contains("Session limit reached"));
        assertThat(streams.contains("scene_s1_dev-2")).isFalse();
    }

    @Test
    @DisplayName("Should reject an unknown algorithm without touching the running deployment")
    void shouldRejectUnknownAlgorithm() {
        scheduler = scheduler(10);
        scheduler.deploy(request("s1").device("dev-1").build());

        assertKind(() -> scheduler.deploy(DeploymentRequest.builder()
                .sceneId("s1").algorithmCode("no_such_algorithm").device("dev-9")
                .start("00:00").end("23:59:59").build()), ErrorKind.CONFIG);

        assertThat(streams.isRunning("scene_s1_dev-1")).isTrue();
        assertThat(scheduler.deployment("s1")).isPresent();
    }

    @Test
    @DisplayName("Should reject an invalid time policy without touching the running deployment")
    void shouldRejectInvalidPolicy() {
        scheduler = scheduler(10);
        scheduler.deploy(request("s1").device("dev-1").build());

        assertKind(() -> scheduler.deploy(DeploymentRequest.builder()
                .sceneId("s1").algorithmCode("fire_detection").device("dev-1")
                .dateType(4).start("08:00").end("18:00").build()), ErrorKind.CONFIG);

        assertThat(streams.isRunning("scene_s1_dev-1")).isTrue();
    }

    @Test
    @DisplayName("Should reject an absolute range that has already ended")
    void shouldRejectExpiredRange() {
        scheduler = scheduler(10);

        assertKind(() -> scheduler.deploy(DeploymentRequest.builder()
                .sceneId("s1").algorithmCode("fire_detection").device("dev-1")
                .dateType(1).start("2024-06-01 00:00:00").end("2024-06-09 23:59:59").build()), ErrorKind.CONFIG);

        assertThat(streams.sessions()).isEmpty();
    }

    // ---- Stop and expiration

    @Test
    @DisplayName("Should stop and unregister every session of a scene")
    void shouldStopDeployment() {
        scheduler = scheduler(10);
        scheduler.deploy(request("s1").device("dev-1").device("dev-2").build());

        scheduler.stopDeployment("s1");

        assertThat(streams.sessions()).isEmpty();
        assertThat(heartbeats.activeDevices()).isEmpty();
        assertThat(scheduler.deployment("s1")).isEmpty();
        assertKind(() -> scheduler.stopDeployment("s1"), ErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("Should keep a device heartbeat while another scene still uses the device")
    void shouldKeepSharedHeartbeat() {
        scheduler = scheduler(10);
        scheduler.deploy(request("fire").device("dev-1").build());
        scheduler.deploy(request("smoke").device("dev-1").build());

        scheduler.stopDeployment("fire");
        assertThat(heartbeats.isRunning("dev-1")).isTrue();
        assertThat(streams.isRunning("scene_smoke_dev-1")).isTrue();

        scheduler.stopDeployment("smoke");
        assertThat(heartbeats.isRunning("dev-1")).isFalse();
    }

    @Test
    @DisplayName("Should tear down absolute-range deployments once they end")
    void shouldExpireDeployments() {
        scheduler = scheduler(10);
        scheduler.deploy(DeploymentRequest.builder()
                .sceneId("event").algorithmCode("fire_detection").device("dev-1")
                .dateType(1).start("2024-06-10 11:00:00").end("2024-06-10 13:00:00").build());
        scheduler.deploy(request("daily").device("dev-2").build());
        assertThat(scheduler.deployment("event").orElseThrow().getPolicy()).isInstanceOf(AbsoluteRangePolicy.class);

        assertThat(scheduler.expireDeployments()).isZero();

        clock.set(LocalDateTime.of(2024, 6, 10, 13, 0, 1));

        assertThat(scheduler.expireDeployments()).isEqualTo(1);
        assertThat(scheduler.deployment("event")).isEmpty();
        assertThat(streams.contains("scene_event_dev-1")).isFalse();
        assertThat(scheduler.deployment("daily")).isPresent();
    }

    // ---- Queries

    @Test
    @DisplayName("Should answer permission checks from the scene's time policy")
    void shouldAnswerPermission() {
        scheduler = scheduler(10);
        scheduler.deploy(DeploymentRequest.builder()
                .sceneId("s1").algorithmCode("fire_detection").device("dev-1")
                .dateType(3).start("08:00").end("18:00").build());
        String id = SceneScheduler.sessionId("s1", "dev-1");

        assertThat(scheduler.isPermitted(id, LocalDateTime.of(2024, 6, 10, 7, 59).toInstant(ZoneOffset.UTC)))
                .isFalse();
        assertThat(scheduler.isPermitted(id, LocalDateTime.of(2024, 6, 10, 18, 0).toInstant(ZoneOffset.UTC)))
                .isTrue();
        assertThat(scheduler.isPermitted("unknown", LocalDateTime.of(2024, 6, 10, 3, 0).toInstant(ZoneOffset.UTC)))
                .isTrue();
    }

    @Test
    @DisplayName("Should build session ids from scene and device without spaces")
    void shouldNameSessions() {
        assertThat(SceneScheduler.sessionId("s1", "dev-1")).isEqualTo("scene_s1_dev-1");
        assertThat(SceneScheduler.sessionId("north gate", "cam 2")).isEqualTo("scene_north_gate_cam_2");
    }

    @Test
    @DisplayName("Should reject requests without scene, algorithm or devices")
    void shouldValidateRequest() {
        assertThatThrownBy(() -> DeploymentRequest.builder().build())
                .isInstanceOf(SentinelException.class)
                .hasMessageContaining("sceneId is required")
                .hasMessageContaining("algorithmCode is required")
                .hasMessageContaining("at least one device is required");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private SceneScheduler scheduler(int maxSessions) {
        EngineConfig config = EngineConfig.builder()
                .maxSessions(maxSessions)
                .stopTimeout(Duration.ofSeconds(2))
                .gatePollInterval(Duration.ofMillis(20))
                .zone(ZoneOffset.UTC)
                .build();
        gate = new TimeWindowGate(clock);
        streams = new StreamManager(config, new ModelPool(modelId -> detector, PoolMode.SHARED),
                ScriptedSources.endless(), gate, PostProcessors.defaults(Duration.ofSeconds(10)), result -> { },
                new ArtifactLayout("", ZoneOffset.UTC), clock);
        heartbeats = new HeartbeatManager(deviceId -> true, Duration.ofHours(1), 3, Duration.ofSeconds(1), clock);
        AlgorithmCatalog algorithms = new AlgorithmCatalog(List.of(
                new AlgorithmDefinition("fire_detection", "models/fire.pt", List.of("fire", "smoke"),
                        PostProcessingPolicy.NONE),
                new AlgorithmDefinition("helmet_detection", "models/helmet.pt", List.of(),
                        PostProcessingPolicy.REQUIRED_EQUIPMENT)));
        return new SceneScheduler(streams, heartbeats, algorithms, SceneSchedulerTest::resolve, gate, config, clock);
    }

    private static Optional<String> resolve(String deviceId) {
        if (deviceId.equals("offline")) {
            return Optional.empty();
        }
        if (deviceId.equals("broken")) {
            throw new IllegalStateException("platform timeout");
        }
        return Optional.of("rtsp://platform/" + deviceId);
    }

    private static DeploymentRequest.Builder request(String sceneId) {
        return DeploymentRequest.builder()
                .sceneId(sceneId)
                .algorithmCode("fire_detection")
                .dateType(3)
                .start("00:00")
                .end("23:59:59");
    }

    private static void assertKind(Runnable action, ErrorKind kind) {
        assertThatThrownBy(action::run)
                .isInstanceOf(SentinelException.class)
                .satisfies(e -> assertThat(((SentinelException) e).getKind()).isEqualTo(kind));
    }
}
