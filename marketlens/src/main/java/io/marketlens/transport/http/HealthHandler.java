package io.marketlens.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.marketlens.infrastructure.fetch.CircuitState;
import io.marketlens.infrastructure.fetch.RateLimitedFetcher;
import io.marketlens.service.broadcast.SubscriptionRegistry;
import io.marketlens.transport.ws.Gateway;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.TreeSet;

/**
 * {@code GET /health}: process status, connection counts and per-source circuit state.
 * Reports DEGRADED when any circuit is open.
 */
public final class HealthHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(HealthHandler.class);

    private final Gateway gateway;
    private final SubscriptionRegistry registry;
    private final RateLimitedFetcher fetcher;
    private final ObjectMapper mapper;

    public HealthHandler(Gateway gateway, SubscriptionRegistry registry, RateLimitedFetcher fetcher, ObjectMapper mapper) {
        this.gateway = gateway;
        this.registry = registry;
        this.fetcher = fetcher;
        this.mapper = mapper;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        ObjectNode body = snapshot();
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        try {
            exchange.setStatusCode(200);
            exchange.getResponseSender().send(mapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            log.error("[HEALTH] Failed to serialize health status", e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("{\"status\":\"ERROR\"}");
        }
    }

    ObjectNode snapshot() {
        ObjectNode body = mapper.createObjectNode();
        body.put("connections", gateway.getConnectionCount());
        body.put("subscriptions", registry.subscriptionCount());
        ObjectNode sources = body.putObject("sources");
        boolean degraded = false;
        for (String source : new TreeSet<>(fetcher.sources())) {
            CircuitState state = fetcher.guard(source).circuitState();
            sources.put(source, state.name());
            degraded |= state == CircuitState.OPEN;
        }
        body.put("status", degraded ? "DEGRADED" : "UP");
        return body;
    }
}
