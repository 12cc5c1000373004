package com.visionsentinel.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.visionsentinel.core.session.SessionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Lightweight HTTP server that exposes health, readiness and session
 * status.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} returns {@code 200} with {@code {"status":"UP"}}
 * while the process is serving</li>
 * <li>{@code GET /readiness} returns {@code 200 UP} once the engine is
 * started, {@code 503 DOWN} otherwise</li>
 * <li>{@code GET /sessions} returns a JSON array of session snapshots</li>
 * </ul>
 *
 * <p>
 * Read-only: sessions cannot be changed through this server.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final byte[] UP = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] DOWN = "{\"status\":\"DOWN\"}".getBytes(StandardCharsets.UTF_8);

    private final BooleanSupplier ready;
    private final Supplier<List<SessionSnapshot>> sessions;
    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthServer(BooleanSupplier ready, Supplier<List<SessionSnapshot>> sessions) {
        this.ready = Objects.requireNonNull(ready, "ready must not be null");
        this.sessions = Objects.requireNonNull(sessions, "sessions must not be null");
    }

    /**
     * Start the server on the given port.
     *
     * @param port TCP port to bind to; 0 picks a free port
     * @throws IllegalArgumentException if port is out of range
     * @throws IOException              if the port cannot be bound
     */
    public void start(int port) throws IOException {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/health", exchange -> respond(exchange, 200, UP));
        server.createContext("/readiness", this::handleReadiness);
        server.createContext("/sessions", this::handleSessions);

        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "health-server");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.start();
        running.set(true);
        LOG.info("Health server started on port {}", getPort());
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("Health server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or -1 if not started
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleReadiness(HttpExchange exchange) throws IOException {
        if (ready.getAsBoolean()) {
            respond(exchange, 200, UP);
        } else {
            respond(exchange, 503, DOWN);
        }
    }

    private void handleSessions(HttpExchange exchange) throws IOException {
        byte[] body;
        try {
            body = mapper.writeValueAsBytes(sessions.get());
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialise session snapshots: {}", e.getMessage(), e);
            respond(exchange, 500, "{\"error\":\"serialisation failed\"}".getBytes(StandardCharsets.UTF_8));
            return;
        }
        respond(exchange, 200, body);
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
