package com.visionsentinel.core.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import com.visionsentinel.core.error.ErrorKind;
import com.visionsentinel.core.error.SentinelException;
import com.visionsentinel.core.model.ChannelType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CallbackChannel} against a local HTTP endpoint.
 */
class CallbackChannelTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicInteger requests = new AtomicInteger();
    private final AtomicInteger status = new AtomicInteger(200);
    private final List<byte[]> bodies = new CopyOnWriteArrayList<>();

    private HttpServer server;
    private String url;
    private CallbackChannel channel;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/alarm", exchange -> {
            requests.incrementAndGet();
            try (InputStream in = exchange.getRequestBody()) {
                bodies.add(in.readAllBytes());
            }
            exchange.sendResponseHeaders(status.get(), -1);
            exchange.close();
        });
        server.start();
        url = "http://127.0.0.1:" + server.getAddress().getPort() + "/alarm";
        channel = new CallbackChannel(HttpClient.newHttpClient(), Duration.ofSeconds(2),
                new CallbackCircuitBreaker(10, 3));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    @DisplayName("Should POST the alarm payload and count the delivery")
    void shouldDeliverPayload() throws IOException {
        boolean delivered = channel.deliver(NotifyFixtures.task(url, ChannelType.CALLBACK));

        assertThat(delivered).isTrue();
        assertThat(channel.getDeliveredCount()).isEqualTo(1);
        JsonNode body = mapper.readTree(bodies.get(0));
        assertThat(body.get("type").asText()).isEqualTo("alarm");
        assertThat(body.get("stream_id").asText()).isEqualTo("scene_s1_dev-1");
        assertThat(body.get("rule_id").asText()).isEqualTo("person-rule");
        assertThat(body.get("alarm_type").asText()).isEqualTo("high");
        assertThat(body.get("class_name").asText()).isEqualTo("person");
        assertThat(body.get("consecutive_count").asInt()).isEqualTo(3);
        assertThat(body.get("bbox")).hasSize(4);
        assertThat(body.get("pic").asText()).endsWith("annotated.jpg");
    }

    @Test
    @DisplayName("Should skip silently when no callback URL is set")
    void shouldSkipWithoutUrl() {
        assertThat(channel.deliver(NotifyFixtures.task(null, ChannelType.CALLBACK))).isFalse();
        assertThat(requests.get()).isZero();
    }

    @Test
    @DisplayName("Should throw a channel error on a non-2xx reply")
    void shouldFailOnServerError() {
        status.set(500);

        assertThatThrownBy(() -> channel.deliver(NotifyFixtures.task(url, ChannelType.CALLBACK)))
                .isInstanceOf(SentinelException.class)
                .satisfies(e -> assertThat(((SentinelException) e).getKind())
                        .isEqualTo(ErrorKind.NOTIFICATION_CHANNEL));
        assertThat(channel.getFailedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should stop calling a target after 10 failures until it is re-enabled")
    void shouldFastFailAfterTenFailures() {
        status.set(503);
        for (int i = 0; i < 10; i++) {
            deliverIgnoringFailure();
        }
        assertThat(requests.get()).isEqualTo(10);

        // 11th attempt is not even tried
        assertThat(channel.deliver(NotifyFixtures.task(url, ChannelType.CALLBACK))).isFalse();
        assertThat(requests.get()).isEqualTo(10);
        assertThat(channel.getRejectedCount()).isEqualTo(1);

        status.set(200);
        assertThat(channel.enable(url)).isTrue();
        assertThat(channel.deliver(NotifyFixtures.task(url, ChannelType.CALLBACK))).isTrue();
        assertThat(requests.get()).isEqualTo(11);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void deliverIgnoringFailure() {
        try {
            channel.deliver(NotifyFixtures.task(url, ChannelType.CALLBACK));
        } catch (SentinelException expected) {
            assertThat(expected.getKind()).isEqualTo(ErrorKind.NOTIFICATION_CHANNEL);
        }
    }
}
