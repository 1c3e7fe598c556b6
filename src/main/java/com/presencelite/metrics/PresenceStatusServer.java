package com.presencelite.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.presencelite.broadcast.BroadcastCodec;
import com.presencelite.engine.PresenceManager;
import com.presencelite.model.ConnectionState;
import com.presencelite.projection.IndicatorProjector;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Minimal HTTP status endpoint for a presence node.
 * <ul>
 *   <li>{@code /metrics}: counters as JSON</li>
 *   <li>{@code /views}: the local user's current views of its peers</li>
 *   <li>{@code /indicators}: the views that carry a location, styled for a map</li>
 *   <li>{@code /health}: 200 while the node is not disconnected, 503 after</li>
 * </ul>
 */
public class PresenceStatusServer {

    private static final Logger log = LoggerFactory.getLogger(PresenceStatusServer.class);

    private final HttpServer server;
    private final ExecutorService executor;

    public PresenceStatusServer(int port, PresenceManager manager) throws IOException {
        this.server = HttpServer.create(new InetSocketAddress(port), 10);
        this.executor = Executors.newFixedThreadPool(2, r -> {
            var thread = new Thread(r, "presence-status-http");
            thread.setDaemon(true);
            return thread;
        });

        server.createContext("/metrics", exchange -> respond(exchange, 200, manager.metrics().toJson()));
        server.createContext("/views", exchange -> respond(exchange, 200, toJson(manager.getViews())));
        server.createContext("/indicators", exchange ->
            respond(exchange, 200, toJson(IndicatorProjector.toIndicators(manager.getViews()))));
        server.createContext("/health", exchange -> {
            var state = manager.getConnectionState();
            var body = new LinkedHashMap<String, Object>();
            body.put("status", state == ConnectionState.DISCONNECTED ? "DOWN" : "UP");
            body.put("connection", state);
            body.put("channel", manager.config().channelId());
            body.put("peers", manager.getViews().size());
            body.put("online", manager.getOnlineUsers().size());
            respond(exchange, state == ConnectionState.DISCONNECTED ? 503 : 200, toJson(body));
        });
        server.setExecutor(executor);
    }

    private static String toJson(Object value) {
        try {
            return BroadcastCodec.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render status JSON", e);
        }
    }

    private static void respond(HttpExchange exchange, int status, String json) throws IOException {
        var body = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (var out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    public void start() {
        server.start();
        log.info("Presence status server listening on http://localhost:{}/health", port());
    }

    public int port() {
        return server.getAddress().getPort();
    }

    public void stop() {
        server.stop(1);
        executor.shutdownNow();
    }
}
