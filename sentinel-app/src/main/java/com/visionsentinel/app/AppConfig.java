package com.visionsentinel.app;

import com.visionsentinel.core.config.EngineConfig;
import com.visionsentinel.core.detector.PoolMode;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable configuration of the Vision Sentinel service.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the service is configured entirely through container env vars or a shell
 * environment.
 * </p>
 *
 * <h3>Variables</h3>
 * <ul>
 * <li>{@code KAFKA_ENABLED}, {@code KAFKA_BOOTSTRAP_SERVERS},
 * {@code KAFKA_ALARM_TOPIC}, {@code KAFKA_CLIENT_ID}</li>
 * <li>{@code RULES_CONFIG_PATH}, {@code HEALTH_PORT}</li>
 * <li>{@code DEVICE_PLATFORM_URL}, {@code DEVICE_PLATFORM_TIMEOUT_MS},
 * {@code DEVICE_PLATFORM_RETRIES}</li>
 * <li>{@code MAX_SESSIONS}, {@code MODEL_POOL_MODE},
 * {@code NOTIFICATION_WORKERS}, {@code NOTIFICATION_QUEUE_CAPACITY},
 * {@code HEARTBEAT_INTERVAL_SECONDS}, {@code PRESENCE_DURATION_SECONDS},
 * {@code ARTIFACT_BASE_URL}, {@code SENTINEL_TIMEZONE}</li>
 * </ul>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class AppConfig {

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final boolean kafkaEnabled;
    private final String kafkaBootstrapServers;
    private final String kafkaAlarmTopic;
    private final String kafkaClientId;

    // ---------------------------------------------------------------
    // Rules / health
    // ---------------------------------------------------------------
    private final String rulesConfigPath;
    private final int healthPort;

    // ---------------------------------------------------------------
    // Device platform
    // ---------------------------------------------------------------
    private final String devicePlatformUrl;
    private final long devicePlatformTimeoutMs;
    private final int devicePlatformRetries;

    // ---------------------------------------------------------------
    // Engine
    // ---------------------------------------------------------------
    private final int maxSessions;
    private final PoolMode modelPoolMode;
    private final int notificationWorkers;
    private final int notificationQueueCapacity;
    private final long heartbeatIntervalSeconds;
    private final long presenceDurationSeconds;
    private final String artifactBaseUrl;
    private final ZoneId zone;

    private AppConfig(Builder b) {
        this.kafkaEnabled = b.kafkaEnabled;
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaAlarmTopic = b.kafkaAlarmTopic;
        this.kafkaClientId = b.kafkaClientId;
        this.rulesConfigPath = b.rulesConfigPath;
        this.healthPort = b.healthPort;
        this.devicePlatformUrl = b.devicePlatformUrl;
        this.devicePlatformTimeoutMs = b.devicePlatformTimeoutMs;
        this.devicePlatformRetries = b.devicePlatformRetries;
        this.maxSessions = b.maxSessions;
        this.modelPoolMode = b.modelPoolMode;
        this.notificationWorkers = b.notificationWorkers;
        this.notificationQueueCapacity = b.notificationQueueCapacity;
        this.heartbeatIntervalSeconds = b.heartbeatIntervalSeconds;
        this.presenceDurationSeconds = b.presenceDurationSeconds;
        this.artifactBaseUrl = b.artifactBaseUrl;
        this.zone = b.zone;
    }

    // ---------------------------------------------------------------
    // Factory, resolved from the environment
    // ---------------------------------------------------------------

    /**
     * Build an {@link AppConfig} from the process environment.
     *
     * @throws IllegalStateException    if a value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static AppConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build an {@link AppConfig} from the given variables.
     *
     * @throws IllegalStateException    if a value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static AppConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env must not be null");
        try {
            return new Builder()
                    .kafkaEnabled(Boolean.parseBoolean(env(env, "KAFKA_ENABLED", "false")))
                    .kafkaBootstrapServers(env(env, "KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaAlarmTopic(env(env, "KAFKA_ALARM_TOPIC", "vision-alarms"))
                    .kafkaClientId(env(env, "KAFKA_CLIENT_ID", "vision-sentinel"))
                    .rulesConfigPath(env(env, "RULES_CONFIG_PATH", ""))
                    .healthPort(Integer.parseInt(env(env, "HEALTH_PORT", "8080")))
                    .devicePlatformUrl(env(env, "DEVICE_PLATFORM_URL", ""))
                    .devicePlatformTimeoutMs(Long.parseLong(env(env, "DEVICE_PLATFORM_TIMEOUT_MS", "10000")))
                    .devicePlatformRetries(Integer.parseInt(env(env, "DEVICE_PLATFORM_RETRIES", "3")))
                    .maxSessions(Integer.parseInt(env(env, "MAX_SESSIONS", "10")))
                    .modelPoolMode(parsePoolMode(env(env, "MODEL_POOL_MODE", "SHARED")))
                    .notificationWorkers(Integer.parseInt(env(env, "NOTIFICATION_WORKERS", "4")))
                    .notificationQueueCapacity(Integer.parseInt(env(env, "NOTIFICATION_QUEUE_CAPACITY", "1000")))
                    .heartbeatIntervalSeconds(Long.parseLong(env(env, "HEARTBEAT_INTERVAL_SECONDS", "10")))
                    .presenceDurationSeconds(Long.parseLong(env(env, "PRESENCE_DURATION_SECONDS", "10")))
                    .artifactBaseUrl(env(env, "ARTIFACT_BASE_URL", ""))
                    .zone(ZoneId.of(env(env, "SENTINEL_TIMEZONE", ZoneId.systemDefault().getId())))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        } catch (DateTimeException e) {
            throw new IllegalStateException("Invalid SENTINEL_TIMEZONE: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Derived configuration
    // ---------------------------------------------------------------

    /**
     * Engine configuration: the values set here over the engine defaults.
     */
    public EngineConfig toEngineConfig() {
        return EngineConfig.builder()
                .maxSessions(maxSessions)
                .modelPoolMode(modelPoolMode)
                .notificationWorkers(notificationWorkers)
                .notificationQueueCapacity(notificationQueueCapacity)
                .heartbeatInterval(Duration.ofSeconds(heartbeatIntervalSeconds))
                .presenceDuration(Duration.ofSeconds(presenceDurationSeconds))
                .artifactBaseUrl(artifactBaseUrl)
                .zone(zone)
                .build();
    }

    /**
     * Build Kafka producer {@link Properties} for the alarm topic.
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("client.id", kafkaClientId);
        props.setProperty("acks", "all");
        props.setProperty("retries", "3");
        props.setProperty("compression.type", "gzip");
        props.setProperty("key.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        props.setProperty("value.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public boolean isKafkaEnabled() {
        return kafkaEnabled;
    }

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaAlarmTopic() {
        return kafkaAlarmTopic;
    }

    public String getKafkaClientId() {
        return kafkaClientId;
    }

    public String getRulesConfigPath() {
        return rulesConfigPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    public String getDevicePlatformUrl() {
        return devicePlatformUrl;
    }

    public boolean hasDevicePlatform() {
        return !devicePlatformUrl.isBlank();
    }

    public Duration getDevicePlatformTimeout() {
        return Duration.ofMillis(devicePlatformTimeoutMs);
    }

    public int getDevicePlatformRetries() {
        return devicePlatformRetries;
    }

    public int getMaxSessions() {
        return maxSessions;
    }

    public PoolMode getModelPoolMode() {
        return modelPoolMode;
    }

    public ZoneId getZone() {
        return zone;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AppConfig}.
     *
     * <p>
     * {@link #build()} checks that counts and timeouts are positive, the
     * health port is in [0, 65535] (0 picks a free port) and topic and
     * client names are not blank.
     * </p>
     */
    public static class Builder {
        private boolean kafkaEnabled;
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaAlarmTopic = "vision-alarms";
        private String kafkaClientId = "vision-sentinel";
        private String rulesConfigPath = "";
        private int healthPort = 8080;
        private String devicePlatformUrl = "";
        private long devicePlatformTimeoutMs = 10_000;
        private int devicePlatformRetries = 3;
        private int maxSessions = 10;
        private PoolMode modelPoolMode = PoolMode.SHARED;
        private int notificationWorkers = 4;
        private int notificationQueueCapacity = 1000;
        private long heartbeatIntervalSeconds = 10;
        private long presenceDurationSeconds = 10;
        private String artifactBaseUrl = "";
        private ZoneId zone = ZoneId.systemDefault();

        public Builder kafkaEnabled(boolean v) {
            this.kafkaEnabled = v;
            return this;
        }

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaAlarmTopic(String v) {
            this.kafkaAlarmTopic = v;
            return this;
        }

        public Builder kafkaClientId(String v) {
            this.kafkaClientId = v;
            return this;
        }

        public Builder rulesConfigPath(String v) {
            this.rulesConfigPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        public Builder devicePlatformUrl(String v) {
            this.devicePlatformUrl = v;
            return this;
        }

        public Builder devicePlatformTimeoutMs(long v) {
            this.devicePlatformTimeoutMs = v;
            return this;
        }

        public Builder devicePlatformRetries(int v) {
            this.devicePlatformRetries = v;
            return this;
        }

        public Builder maxSessions(int v) {
            this.maxSessions = v;
            return this;
        }

        public Builder modelPoolMode(PoolMode v) {
            this.modelPoolMode = v;
            return this;
        }

        public Builder notificationWorkers(int v) {
            this.notificationWorkers = v;
            return this;
        }

        public Builder notificationQueueCapacity(int v) {
            this.notificationQueueCapacity = v;
            return this;
        }

        public Builder heartbeatIntervalSeconds(long v) {
            this.heartbeatIntervalSeconds = v;
            return this;
        }

        public Builder presenceDurationSeconds(long v) {
            this.presenceDurationSeconds = v;
            return this;
        }

        public Builder artifactBaseUrl(String v) {
            this.artifactBaseUrl = v;
            return this;
        }

        public Builder zone(ZoneId v) {
            this.zone = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @throws IllegalArgumentException if any value is invalid
         */
        public AppConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            Objects.requireNonNull(modelPoolMode, "modelPoolMode required");
            Objects.requireNonNull(zone, "zone required");
            requireNonBlank(kafkaAlarmTopic, "kafkaAlarmTopic");
            requireNonBlank(kafkaClientId, "kafkaClientId");
            rulesConfigPath = rulesConfigPath != null ? rulesConfigPath : "";
            devicePlatformUrl = devicePlatformUrl != null ? devicePlatformUrl : "";
            artifactBaseUrl = artifactBaseUrl != null ? artifactBaseUrl : "";

            if (healthPort < 0 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [0, 65535], got: " + healthPort);
            }
            if (devicePlatformTimeoutMs < 1) {
                throw new IllegalArgumentException(
                        "devicePlatformTimeoutMs must be >= 1, got: " + devicePlatformTimeoutMs);
            }
            if (devicePlatformRetries < 1) {
                throw new IllegalArgumentException(
                        "devicePlatformRetries must be >= 1, got: " + devicePlatformRetries);
            }
            if (maxSessions < 1) {
                throw new IllegalArgumentException("maxSessions must be >= 1, got: " + maxSessions);
            }
            if (notificationWorkers < 1) {
                throw new IllegalArgumentException(
                        "notificationWorkers must be >= 1, got: " + notificationWorkers);
            }
            if (notificationQueueCapacity < 1) {
                throw new IllegalArgumentException(
                        "notificationQueueCapacity must be >= 1, got: " + notificationQueueCapacity);
            }
            if (heartbeatIntervalSeconds < 1) {
                throw new IllegalArgumentException(
                        "heartbeatIntervalSeconds must be >= 1, got: " + heartbeatIntervalSeconds);
            }
            if (presenceDurationSeconds < 0) {
                throw new IllegalArgumentException(
                        "presenceDurationSeconds must be >= 0, got: " + presenceDurationSeconds);
            }

            return new AppConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static PoolMode parsePoolMode(String value) {
        try {
            return PoolMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("MODEL_POOL_MODE must be SHARED or DEDICATED, got: " + value, e);
        }
    }

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "AppConfig{" +
                "kafkaEnabled=" + kafkaEnabled +
                ", kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaAlarmTopic='" + kafkaAlarmTopic + '\'' +
                ", rulesConfigPath='" + rulesConfigPath + '\'' +
                ", healthPort=" + healthPort +
                ", devicePlatformUrl='" + devicePlatformUrl + '\'' +
                ", maxSessions=" + maxSessions +
                ", modelPoolMode=" + modelPoolMode +
                ", zone=" + zone +
                '}';
    }
}
