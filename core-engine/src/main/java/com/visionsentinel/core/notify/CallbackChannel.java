package com.visionsentinel.core.notify;

import com.visionsentinel.core.error.SentinelException;
import com.visionsentinel.core.model.ChannelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * POSTs the alarm as JSON to the session's callback URL.
 *
 * <p>
 * Failures are tracked per URL by a {@link CallbackCircuitBreaker}; once a
 * target's circuit is open, deliveries to it are skipped without a request
 * until it is re-enabled with {@link #enable(String)}. Sessions without a
 * callback URL are skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class CallbackChannel implements NotificationChannel {

    private static final Logger LOG = LoggerFactory.getLogger(CallbackChannel.class);

    private final HttpClient client;
    private final Duration timeout;
    private final CallbackCircuitBreaker breaker;

    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    public CallbackChannel(HttpClient client, Duration timeout, CallbackCircuitBreaker breaker) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.breaker = Objects.requireNonNull(breaker, "breaker must not be null");
    }

    @Override
    public ChannelType type() {
        return ChannelType.CALLBACK;
    }

    @Override
    public boolean deliver(NotificationTask task) {
        String url = task.getEvent().getTarget().getCallbackUrl();
        if (url == null) {
            LOG.trace("No callback URL for session {}", task.getEvent().getSessionId());
            return false;
        }
        if (!breaker.allowRequest(url)) {
            rejected.incrementAndGet();
            LOG.debug("Callback to {} skipped: circuit open", url);
            return false;
        }

        String body = AlarmPayloads.toJson(AlarmPayloads.callback(task.getEvent()));
        HttpResponse<Void> response;
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            response = client.send(request, HttpResponse.BodyHandlers.discarding());
        } catch (IOException | IllegalArgumentException e) {
            throw failure(url, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure(url, "interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw failure(url, "HTTP " + status, null);
        }
        breaker.recordSuccess(url);
        delivered.incrementAndGet();
        return true;
    }

    /**
     * Re-enable a target whose circuit is open.
     *
     * @return {@code true} if the target was disabled
     */
    public boolean enable(String url) {
        return breaker.reset(url);
    }

    public CallbackCircuitBreaker getCircuitBreaker() {
        return breaker;
    }

    public long getDeliveredCount() {
        return delivered.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    /**
     * @return deliveries skipped because the target's circuit was open
     */
    public long getRejectedCount() {
        return rejected.get();
    }

    private SentinelException failure(String url, String reason, Throwable cause) {
        failed.incrementAndGet();
        breaker.recordFailure(url, reason);
        return SentinelException.notificationChannel("Callback", url + " (" + reason + ")", cause);
    }
}
