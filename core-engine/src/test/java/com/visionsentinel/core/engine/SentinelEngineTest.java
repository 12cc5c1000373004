package com.visionsentinel.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import com.visionsentinel.core.config.AlgorithmDefinition;
import com.visionsentinel.core.config.EngineConfig;
import com.visionsentinel.core.config.RulesConfig;
import com.visionsentinel.core.model.AlarmRule;
import com.visionsentinel.core.model.ChannelType;
import com.visionsentinel.core.model.Severity;
import com.visionsentinel.core.notify.LogChannel;
import com.visionsentinel.core.postprocess.PostProcessingPolicy;
import com.visionsentinel.core.scene.DeploymentRequest;
import com.visionsentinel.core.scene.DeploymentResult;
import com.visionsentinel.core.scene.SceneScheduler;
import com.visionsentinel.core.support.Await;
import com.visionsentinel.core.support.FakeDetector;
import com.visionsentinel.core.support.ScriptedSources;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests wiring every component through {@link SentinelEngine}.
 */
class SentinelEngineTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicInteger callbackStatus = new AtomicInteger(200);
    private final List<byte[]> callbacks = new CopyOnWriteArrayList<>();
    private final MockProducer<String, String> producer =
            new MockProducer<>(true, new StringSerializer(), new StringSerializer());

    private HttpServer server;
    private String callbackUrl;
    private SentinelEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/alarm", exchange -> {
            try (InputStream in = exchange.getRequestBody()) {
                callbacks.add(in.readAllBytes());
            }
            exchange.sendResponseHeaders(callbackStatus.get(), -1);
            exchange.close();
        });
        server.start();
        callbackUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/alarm";
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
        server.stop(0);
    }

    @Test
    @DisplayName("Should raise an alarm from a deployed scene on every configured channel")
    void shouldDeliverAlarmEndToEnd() throws IOException {
        engine = engine(config().build(), rule(2, 60));
        engine.start();

        DeploymentResult result = engine.scheduler().deploy(request("s1", "dev-1"));
        assertThat(result.isDeployed()).isTrue();

        Await.until("callback received", () -> !callbacks.isEmpty());
        Await.until("message published", () -> !producer.history().isEmpty());
        Await.until("log channel delivery", () -> logChannel().getDeliveredCount() > 0);

        JsonNode body = mapper.readTree(callbacks.get(0));
        assertThat(body.get("stream_id").asText()).isEqualTo("scene_s1_dev-1");
        assertThat(body.get("class_name").asText()).isEqualTo("person");
        assertThat(body.get("alarm_type").asText()).isEqualTo("high");

        ProducerRecord<String, String> record = producer.history().get(0);
        assertThat(record.topic()).isEqualTo("vision-alarms");
        assertThat(record.key()).isEqualTo("dev-1");
        JsonNode message = mapper.readTree(record.value());
        assertThat(message.get("scene").asText()).isEqualTo("s1");

        assertThat(engine.alarms().getAlarmCountBySeverity().get(Severity.HIGH)).isPositive();
        assertThat(engine.heartbeats().isRunning("dev-1")).isTrue();
    }

    @Test
    @DisplayName("Should honour the cooldown across frames of a running session")
    void shouldRespectCooldown() {
        engine = engine(config().build(), rule(1, 3600));
        engine.start();

        engine.scheduler().deploy(request("s1", "dev-1"));
        Await.until("first alarm", () -> engine.alarms().getAlarmCount() == 1);
        Await.until("more frames evaluated", () -> engine.alarms().getEvaluatedCount() > 5);

        assertThat(engine.alarms().getAlarmCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should clear alarm state when a scene is stopped")
    void shouldClearAlarmStateOnStop() {
        engine = engine(config().build(), rule(1000, 60));
        engine.start();
        engine.scheduler().deploy(request("s1", "dev-1"));
        Await.until("frames counted", () -> engine.alarms().consecutiveCount(
                "scene_s1_dev-1", "person", "person") > 0);

        engine.scheduler().stopDeployment("s1");

        assertThat(engine.alarms().consecutiveCount("scene_s1_dev-1", "person", "person")).isZero();
        assertThat(engine.streams().sessions()).isEmpty();
        assertThat(engine.heartbeats().activeDevices()).isEmpty();
    }

    @Test
    @DisplayName("Should open the callback circuit after repeated failures and re-enable it on request")
    void shouldAdministerCallbackCircuit() {
        callbackStatus.set(500);
        engine = engine(config().callbackFailureThreshold(2).build(), rule(1, 0));
        engine.start();
        engine.scheduler().deploy(request("s1", "dev-1"));

        Await.until("circuit open", () -> engine.isCallbackCircuitOpen(callbackUrl));

        assertThat(engine.disabledCallbackTargets()).containsExactly(callbackUrl);
        assertThat(engine.callbackFailureCount(callbackUrl)).isGreaterThanOrEqualTo(2);
        callbackStatus.set(200);
        assertThat(engine.enableCallback(callbackUrl)).isTrue();
        assertThat(engine.isCallbackCircuitOpen(callbackUrl)).isFalse();
        Await.until("callbacks delivered again", () -> !callbacks.isEmpty()
                && engine.callbackFailureCount(callbackUrl) == 0);
        assertThat(engine.enableCallback("http://never-failed")).isFalse();
    }

    @Test
    @DisplayName("Should stop sessions and heartbeats on close")
    void shouldCloseEverything() {
        engine = engine(config().build(), rule(2, 60));
        engine.start();
        engine.scheduler().deploy(request("s1", "dev-1"));
        assertThat(engine.isRunning()).isTrue();

        engine.close();

        assertThat(engine.isRunning()).isFalse();
        assertThat(engine.streams().isRunning(SceneScheduler.sessionId("s1", "dev-1"))).isFalse();
        assertThat(engine.heartbeats().activeDevices()).isEmpty();
        assertThat(engine.dispatcher().isRunning()).isFalse();
        assertThat(producer.closed()).isTrue();
    }

    @Test
    @DisplayName("Should refuse to build without its required collaborators")
    void shouldValidateBuilder() {
        assertThatThrownBy(() -> SentinelEngine.builder().build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("detectorLoader is required")
                .hasMessageContaining("frameSources is required");
    }

    @Test
    @DisplayName("Should refuse invalid rules at build time")
    void shouldRejectInvalidRules() {
        AlarmRule bad = new AlarmRule();
        bad.setId("bad");
        bad.setConsecutiveFrames(0);
        RulesConfig rules = new RulesConfig();
        rules.setRules(List.of(bad));

        assertThatThrownBy(() -> SentinelEngine.builder()
                .detectorLoader(modelId -> new FakeDetector())
                .frameSources(ScriptedSources.endless())
                .rules(rules)
                .build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("consecutiveFrames");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private SentinelEngine engine(EngineConfig config, AlarmRule rule) {
        RulesConfig rules = new RulesConfig();
        rules.setRules(List.of(rule));
        rules.setAlgorithms(List.of(new AlgorithmDefinition("person_detection", "models/person.pt",
                List.of("person"), PostProcessingPolicy.NONE)));
        return SentinelEngine.builder()
                .config(config)
                .detectorLoader(modelId -> FakeDetector.returning(FakeDetector.person(0.9)))
                .frameSources(ScriptedSources.endless())
                .rules(rules)
                .addressResolver(deviceId -> Optional.of("rtsp://platform/" + deviceId))
                .heartbeatSender(deviceId -> true)
                .messageBus(producer, "vision-alarms")
                .build();
    }

    private static EngineConfig.Builder config() {
        return EngineConfig.builder()
                .defaultFpsLimit(50)
                .stopTimeout(Duration.ofSeconds(2))
                .callbackTimeout(Duration.ofSeconds(2))
                .notificationWorkers(2)
                .heartbeatInterval(Duration.ofSeconds(30))
                .zone(ZoneOffset.UTC);
    }

    private static AlarmRule rule(int consecutiveFrames, long cooldownSeconds) {
        AlarmRule rule = new AlarmRule();
        rule.setId("person");
        rule.setName("Person detected");
        rule.setClassNames(List.of("person"));
        rule.setConsecutiveFrames(consecutiveFrames);
        rule.setCooldownSeconds(cooldownSeconds);
        rule.setChannels(List.of(ChannelType.LOG, ChannelType.CALLBACK, ChannelType.MESSAGE_BUS));
        return rule;
    }

    private DeploymentRequest request(String sceneId, String deviceId) {
        return DeploymentRequest.builder()
                .sceneId(sceneId)
                .algorithmCode("person_detection")
                .device(deviceId)
                .dateType(3)
                .start("00:00")
                .end("23:59:59")
                .callbackUrl(callbackUrl)
                .build();
    }

    private LogChannel logChannel() {
        return (LogChannel) engine.dispatcher().channel(ChannelType.LOG);
    }
}
