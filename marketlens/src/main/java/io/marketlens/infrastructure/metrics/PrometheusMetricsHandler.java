package io.marketlens.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * {@code GET /metrics} in Prometheus text format 0.0.4.
 *
 * Honours the standard {@code name[]} query parameter, so
 * {@code /metrics?name[]=gateway_connections_active} returns just that family.
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Set<String> names = requestedNames(exchange);
        try {
            StringWriter writer = new StringWriter();
            TextFormat.write004(writer, names.isEmpty()
                ? registry.metricFamilySamples()
                : registry.filteredMetricFamilySamples(names));

            exchange.setStatusCode(200);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
            exchange.getResponseSender().send(writer.toString());
            log.debug("[METRICS] scrape served ({} families requested)", names.isEmpty() ? "all" : names.size());
        } catch (IOException e) {
            log.error("[METRICS] Failed to export metrics", e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Error exporting metrics");
        }
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get("name[]");
        return values == null ? Collections.emptySet() : new HashSet<>(values);
    }
}
