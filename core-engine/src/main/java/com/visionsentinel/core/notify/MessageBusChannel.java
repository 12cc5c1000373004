package com.visionsentinel.core.notify;

import com.visionsentinel.core.error.SentinelException;
import com.visionsentinel.core.model.ChannelType;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes alarms to a Kafka topic, keyed by device id.
 *
 * <p>
 * Sends are synchronous and bounded by the configured timeout so that the
 * dispatcher worker learns the outcome. Failures are counted and reported
 * to the dispatcher; they have no effect on other channels.
 * </p>
 *
 * @since 1.0.0
 */
public class MessageBusChannel implements NotificationChannel, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MessageBusChannel.class);

    private final Producer<String, String> producer;
    private final String topic;
    private final Duration timeout;
    private final ZoneId zone;

    private final AtomicLong published = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public MessageBusChannel(Producer<String, String> producer, String topic, Duration timeout, ZoneId zone) {
        this.producer = Objects.requireNonNull(producer, "producer must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    @Override
    public ChannelType type() {
        return ChannelType.MESSAGE_BUS;
    }

    @Override
    public boolean deliver(NotificationTask task) {
        String key = AlarmPayloads.deviceId(task.getEvent());
        String value = AlarmPayloads.toJson(AlarmPayloads.messageBus(task.getEvent(), zone));
        try {
            RecordMetadata metadata = producer.send(new ProducerRecord<>(topic, key, value))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            published.incrementAndGet();
            LOG.debug("Alarm published to {}-{}@{} (key={})",
                    metadata.topic(), metadata.partition(), metadata.offset(), key);
            return true;
        } catch (ExecutionException e) {
            throw failure(key, e.getCause() != null ? e.getCause() : e);
        } catch (TimeoutException e) {
            throw failure(key, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure(key, e);
        } catch (RuntimeException e) {
            throw failure(key, e);
        }
    }

    public String getTopic() {
        return topic;
    }

    public long getPublishedCount() {
        return published.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    @Override
    public void close() {
        producer.close(timeout);
    }

    private SentinelException failure(String key, Throwable cause) {
        failed.incrementAndGet();
        LOG.warn("Publishing alarm for {} to topic {} failed: {}", key, topic, cause.toString());
        return SentinelException.notificationChannel("Message bus", topic + " (" + cause + ")", cause);
    }
}
