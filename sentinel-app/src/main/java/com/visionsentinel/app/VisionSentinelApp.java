package com.visionsentinel.app;

import com.visionsentinel.core.config.RulesConfig;
import com.visionsentinel.core.config.RulesLoader;
import com.visionsentinel.core.detector.DetectorLoader;
import com.visionsentinel.core.engine.SentinelEngine;
import com.visionsentinel.core.source.FrameSourceFactory;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Iterator;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point of the Vision Sentinel service.
 *
 * <h3>Startup</h3>
 * <pre>
 *   AppConfig (env)
 *     → rules + algorithm catalog (YAML)
 *     → detector loader and frame sources (ServiceLoader)
 *     → SentinelEngine (sessions, alarms, notifications, scenes)
 *     → health server
 * </pre>
 *
 * <p>
 * Detector and frame-source implementations are discovered through
 * {@link ServiceLoader}; the service refuses to start without them.
 * Scene deployments are driven by an embedding management layer through
 * {@link SentinelEngine#scheduler()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class VisionSentinelApp {

    private static final Logger LOG = LoggerFactory.getLogger(VisionSentinelApp.class);

    private VisionSentinelApp() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws Exception {
        // 1. Load configuration
        AppConfig config = AppConfig.fromEnvironment();
        LOG.info("Starting Vision Sentinel with config: {}", config);

        // 2. Load alarm rules and algorithms
        RulesConfig rules = loadRules(config);
        LOG.info("Loaded {} alarm rule(s) and {} algorithm(s)",
                rules.getRules().size(), rules.getAlgorithms().size());

        // 3. Discover detector and frame source implementations
        DetectorLoader detectorLoader = loadService(DetectorLoader.class);
        FrameSourceFactory frameSources = loadService(FrameSourceFactory.class);

        // 4. Assemble the engine
        SentinelEngine engine = buildEngine(config, rules, detectorLoader, frameSources);
        engine.start();

        // 5. Start health server with shutdown hook
        HealthServer healthServer = new HealthServer(engine::isRunning, () -> engine.streams().sessions());
        healthServer.start(config.getHealthPort());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutdown requested");
            healthServer.stop();
            engine.close();
            stopped.countDown();
        }, "sentinel-shutdown"));

        LOG.info("Vision Sentinel running");
        stopped.await();
    }

    // ---------------------------------------------------------------
    // Assembly
    // ---------------------------------------------------------------

    static SentinelEngine buildEngine(AppConfig config, RulesConfig rules, DetectorLoader detectorLoader,
            FrameSourceFactory frameSources) {
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(config.getDevicePlatformTimeout())
                .build();

        SentinelEngine.Builder builder = SentinelEngine.builder()
                .config(config.toEngineConfig())
                .rules(rules)
                .detectorLoader(detectorLoader)
                .frameSources(frameSources);

        if (config.hasDevicePlatform()) {
            DevicePlatformClient platform = new DevicePlatformClient(http, config.getDevicePlatformUrl(),
                    config.getDevicePlatformTimeout(), config.getDevicePlatformRetries(), Duration.ofSeconds(1));
            builder.addressResolver(platform).heartbeatSender(platform);
        } else {
            LOG.warn("DEVICE_PLATFORM_URL not set: device ids are used as stream locators, heartbeats are not sent");
            builder.addressResolver(Optional::of).heartbeatSender(deviceId -> true);
        }

        if (config.isKafkaEnabled()) {
            builder.messageBus(new KafkaProducer<>(config.kafkaProducerProperties()), config.getKafkaAlarmTopic());
            LOG.info("Alarm publishing to Kafka topic {} at {}",
                    config.getKafkaAlarmTopic(), config.getKafkaBootstrapServers());
        }
        return builder.build();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static RulesConfig loadRules(AppConfig config) {
        String rulesPath = config.getRulesConfigPath();
        if (rulesPath != null && !rulesPath.isBlank()) {
            return RulesLoader.fromFile(rulesPath);
        }
        return RulesLoader.load();
    }

    private static <T> T loadService(Class<T> type) {
        Iterator<T> it = ServiceLoader.load(type).iterator();
        if (!it.hasNext()) {
            throw new IllegalStateException("No " + type.getSimpleName()
                    + " implementation found; add one to the classpath with a META-INF/services entry");
        }
        T service = it.next();
        LOG.info("Using {} {}", type.getSimpleName(), service.getClass().getName());
        return service;
    }
}
