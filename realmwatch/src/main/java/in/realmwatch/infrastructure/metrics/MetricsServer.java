package in.realmwatch.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BooleanSupplier;

/**
 * Undertow server exposing /metrics and /health.
 */
public final class MetricsServer {
    private static final Logger log = LoggerFactory.getLogger(MetricsServer.class);

    private final Undertow server;
    private final int port;

    public MetricsServer(String host, int port, CollectorRegistry registry, BooleanSupplier healthy) {
        this.port = port;
        this.server = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(Handlers.path()
                .addPrefixPath("/metrics", new PrometheusMetricsHandler(registry))
                .addExactPath("/health", exchange -> writeHealth(exchange, healthy.getAsBoolean())))
            .build();
    }

    public void start() {
        server.start();
        log.info("[METRICS] Serving /metrics and /health on port {}", port);
    }

    public void stop() {
        server.stop();
        log.info("[METRICS] Server stopped");
    }

    private static void writeHealth(HttpServerExchange exchange, boolean healthy) {
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.setStatusCode(healthy ? 200 : 503);
        exchange.getResponseSender().send(healthy ? "{\"status\":\"UP\"}" : "{\"status\":\"DOWN\"}");
    }
}
