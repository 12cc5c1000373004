package com.visionsentinel.core.engine;

import com.visionsentinel.core.alarm.AlarmEngine;
import com.visionsentinel.core.artifact.ArtifactLayout;
import com.visionsentinel.core.config.EngineConfig;
import com.visionsentinel.core.config.RulesConfig;
import com.visionsentinel.core.detector.DetectorLoader;
import com.visionsentinel.core.detector.ModelPool;
import com.visionsentinel.core.heartbeat.HeartbeatManager;
import com.visionsentinel.core.heartbeat.HeartbeatSender;
import com.visionsentinel.core.model.AlarmRule;
import com.visionsentinel.core.notify.CallbackChannel;
import com.visionsentinel.core.notify.CallbackCircuitBreaker;
import com.visionsentinel.core.notify.LogChannel;
import com.visionsentinel.core.notify.MessageBusChannel;
import com.visionsentinel.core.notify.NotificationChannel;
import com.visionsentinel.core.notify.NotificationDispatcher;
import com.visionsentinel.core.postprocess.PostProcessors;
import com.visionsentinel.core.scene.AlgorithmCatalog;
import com.visionsentinel.core.scene.SceneScheduler;
import com.visionsentinel.core.scene.StreamAddressResolver;
import com.visionsentinel.core.schedule.TimeWindowGate;
import com.visionsentinel.core.session.StreamManager;
import com.visionsentinel.core.source.FrameSourceFactory;
import org.apache.kafka.clients.producer.Producer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires every component of the engine together and owns their lifecycle.
 *
 * <p>
 * Detection results flow from session workers into the {@link AlarmEngine};
 * alarms are queued on the {@link NotificationDispatcher}, which fans them
 * out to the log, callback and (when a Kafka producer is supplied) message
 * bus channels.
 * </p>
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * SentinelEngine engine = SentinelEngine.builder()
 *         .config(EngineConfig.defaults())
 *         .detectorLoader(loader)
 *         .frameSources(sources)
 *         .rules(RulesLoader.load())
 *         .build();
 * engine.start();
 * engine.scheduler().deploy(request);
 * }</pre>
 *
 * <h3>Shutdown order</h3>
 * <ol>
 * <li>scene expiration monitor</li>
 * <li>stream health monitor and all sessions</li>
 * <li>heartbeats</li>
 * <li>notification queue drain</li>
 * <li>model pool and Kafka producer</li>
 * </ol>
 *
 * @since 1.0.0
 */
public class SentinelEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelEngine.class);

    private final EngineConfig config;
    private final Clock clock;
    private final ModelPool models;
    private final TimeWindowGate gate;
    private final PostProcessors postProcessors;
    private final AlarmEngine alarms;
    private final NotificationDispatcher dispatcher;
    private final CallbackChannel callbacks;
    private final MessageBusChannel messageBus;
    private final StreamManager streams;
    private final HeartbeatManager heartbeats;
    private final AlgorithmCatalog algorithms;
    private final SceneScheduler scheduler;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private SentinelEngine(Builder b) {
        this.config = b.config;
        this.clock = b.clock != null ? b.clock.withZone(config.getZone()) : Clock.system(config.getZone());

        this.models = new ModelPool(b.detectorLoader, config.getModelPoolMode());
        this.gate = new TimeWindowGate(clock);
        this.postProcessors = PostProcessors.defaults(config.getPresenceDuration());

        List<NotificationChannel> channels = new ArrayList<>();
        channels.add(new LogChannel());
        HttpClient http = b.httpClient != null ? b.httpClient
                : HttpClient.newBuilder().connectTimeout(config.getCallbackTimeout()).build();
        this.callbacks = new CallbackChannel(http, config.getCallbackTimeout(),
                new CallbackCircuitBreaker(config.getCallbackFailureThreshold(), config.getCallbackWarnEvery()));
        channels.add(callbacks);
        if (b.producer != null) {
            this.messageBus = new MessageBusChannel(b.producer, b.alarmTopic, config.getMessageBusTimeout(),
                    config.getZone());
            channels.add(messageBus);
        } else {
            this.messageBus = null;
        }
        this.dispatcher = new NotificationDispatcher(config.getNotificationQueueCapacity(),
                config.getNotificationWorkers(), channels, clock);

        this.alarms = new AlarmEngine(dispatcher, config.getZone(),
                config.getHighSeverityThreshold(), config.getMediumSeverityThreshold());
        for (AlarmRule rule : b.rules.getRules()) {
            alarms.addRule(rule);
        }

        this.streams = new StreamManager(config, models, b.frameSources, gate, postProcessors, alarms::evaluate,
                new ArtifactLayout(config.getArtifactBaseUrl(), config.getZone()), clock);
        streams.addRemovalListener(alarms::clearSession);

        this.heartbeats = new HeartbeatManager(b.heartbeatSender, config.getHeartbeatInterval(),
                config.getHeartbeatFailureThreshold(), config.getHeartbeatStopTimeout(), clock);
        this.algorithms = new AlgorithmCatalog(b.rules.getAlgorithms());
        this.scheduler = new SceneScheduler(streams, heartbeats, algorithms, b.addressResolver, gate, config, clock);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Start the notification workers and the periodic monitors. Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        dispatcher.start();
        streams.startHealthMonitor();
        scheduler.startExpirationMonitor();
        LOG.info("Engine started: maxSessions={}, modelPool={}, rules={}, algorithms={}, messageBus={}",
                config.getMaxSessions(), config.getModelPoolMode(), alarms.rules().size(), algorithms.size(),
                messageBus != null ? "enabled" : "disabled");
    }

    /**
     * @return {@code true} between {@link #start()} and {@link #close()}
     */
    public boolean isRunning() {
        return started.get() && !closed.get();
    }

    // ---------------------------------------------------------------
    // Callback circuit administration
    // ---------------------------------------------------------------

    /**
     * Re-enable a callback target whose circuit was opened.
     *
     * @return {@code true} if the circuit had been open
     */
    public boolean enableCallback(String url) {
        return callbacks.enable(url);
    }

    public Set<String> disabledCallbackTargets() {
        return callbacks.getCircuitBreaker().openTargets();
    }

    public boolean isCallbackCircuitOpen(String url) {
        return callbacks.getCircuitBreaker().isOpen(url);
    }

    public int callbackFailureCount(String url) {
        return callbacks.getCircuitBreaker().failureCount(url);
    }

    // ---------------------------------------------------------------
    // Components
    // ---------------------------------------------------------------

    public EngineConfig getConfig() {
        return config;
    }

    public Clock getClock() {
        return clock;
    }

    public StreamManager streams() {
        return streams;
    }

    public SceneScheduler scheduler() {
        return scheduler;
    }

    public AlarmEngine alarms() {
        return alarms;
    }

    public NotificationDispatcher dispatcher() {
        return dispatcher;
    }

    public HeartbeatManager heartbeats() {
        return heartbeats;
    }

    public ModelPool models() {
        return models;
    }

    public AlgorithmCatalog algorithms() {
        return algorithms;
    }

    public PostProcessors postProcessors() {
        return postProcessors;
    }

    public Optional<MessageBusChannel> messageBus() {
        return Optional.ofNullable(messageBus);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        LOG.info("Engine shutting down");
        scheduler.close();
        streams.close();
        heartbeats.close();
        dispatcher.shutdown(config.getMessageBusTimeout().plus(config.getCallbackTimeout()));
        models.close();
        if (messageBus != null) {
            messageBus.close();
        }
        LOG.info("Engine stopped");
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {

        private EngineConfig config = EngineConfig.defaults();
        private DetectorLoader detectorLoader;
        private FrameSourceFactory frameSources;
        private RulesConfig rules = new RulesConfig();
        private StreamAddressResolver addressResolver = deviceId -> Optional.empty();
        private HeartbeatSender heartbeatSender = deviceId -> true;
        private Producer<String, String> producer;
        private String alarmTopic;
        private HttpClient httpClient;
        private Clock clock;

        public Builder config(EngineConfig v) {
            this.config = v;
            return this;
        }

        public Builder detectorLoader(DetectorLoader v) {
            this.detectorLoader = v;
            return this;
        }

        public Builder frameSources(FrameSourceFactory v) {
            this.frameSources = v;
            return this;
        }

        public Builder rules(RulesConfig v) {
            this.rules = v;
            return this;
        }

        public Builder addressResolver(StreamAddressResolver v) {
            this.addressResolver = v;
            return this;
        }

        public Builder heartbeatSender(HeartbeatSender v) {
            this.heartbeatSender = v;
            return this;
        }

        /**
         * Enable the message-bus channel.
         */
        public Builder messageBus(Producer<String, String> producer, String topic) {
            this.producer = producer;
            this.alarmTopic = topic;
            return this;
        }

        public Builder httpClient(HttpClient v) {
            this.httpClient = v;
            return this;
        }

        public Builder clock(Clock v) {
            this.clock = v;
            return this;
        }

        /**
         * @throws IllegalStateException if a required collaborator is missing
         *                               or the rules are invalid
         */
        public SentinelEngine build() {
            List<String> errors = new ArrayList<>();
            if (config == null) {
                errors.add("config is required");
            }
            if (detectorLoader == null) {
                errors.add("detectorLoader is required");
            }
            if (frameSources == null) {
                errors.add("frameSources is required");
            }
            if (rules == null) {
                errors.add("rules is required");
            }
            if (addressResolver == null) {
                errors.add("addressResolver is required");
            }
            if (heartbeatSender == null) {
                errors.add("heartbeatSender is required");
            }
            if (producer != null && (alarmTopic == null || alarmTopic.isBlank())) {
                errors.add("alarm topic is required when a producer is set");
            }
            if (!errors.isEmpty()) {
                throw new IllegalStateException("Invalid engine setup: " + String.join("; ", errors));
            }
            rules.validate();
            return new SentinelEngine(this);
        }
    }
}
