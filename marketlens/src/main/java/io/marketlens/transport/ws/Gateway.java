package io.marketlens.transport.ws;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.marketlens.auth.AuthenticationException;
import io.marketlens.auth.CredentialVerifier;
import io.marketlens.auth.Principal;
import io.marketlens.config.FeatureFlags;
import io.marketlens.domain.analysis.AnalysisKind;
import io.marketlens.domain.analysis.AnalysisRequest;
import io.marketlens.domain.analysis.Insight;
import io.marketlens.domain.common.Deadline;
import io.marketlens.domain.common.ErrorKind;
import io.marketlens.domain.common.MarketLensException;
import io.marketlens.domain.data.SubscriptionKey;
import io.marketlens.domain.data.Timeframe;
import io.marketlens.domain.data.Topic;
import io.marketlens.domain.session.Connection;
import io.marketlens.domain.session.ConnectionState;
import io.marketlens.infrastructure.metrics.GatewayMetrics;
import io.marketlens.security.InputValidator;
import io.marketlens.service.analysis.OrchestrationException;
import io.marketlens.service.analysis.OrchestrationRouter;
import io.marketlens.service.broadcast.BroadcastEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;

/**
 * Single entry point for client connections.
 *
 * Owns every {@link Connection} and is the only component that changes
 * connection state:
 * <pre>
 * CONNECTING -> ACTIVE      credential verified
 * CONNECTING -> CLOSED      credential rejected
 * ACTIVE     -> DRAINING    client close, transport closed, protocol violation or shutdown
 * DRAINING   -> CLOSED      in-flight analyses finished, or drain timeout (they are cancelled)
 * </pre>
 * DRAINING accepts no new frames but still delivers queued updates and the
 * results of in-flight analyses. CLOSED drops every subscription and releases
 * the outbound buffer.
 *
 * Transport-independent; {@link UndertowGatewayEndpoint} adapts it to WebSockets.
 */
public final class Gateway {
    private static final Logger log = LoggerFactory.getLogger(Gateway.class);

    private static final int CLOSE_POLICY_VIOLATION = 1008;
    private static final int CLOSE_GOING_AWAY = 1001;

    private final CredentialVerifier verifier;
    private final BroadcastEngine broadcast;
    private final OrchestrationRouter router;
    private final ExecutorService analysisPool;
    private final FrameCodec codec;
    private final InputValidator validator;
    private final FeatureFlags features;
    private final Settings settings;
    private final Clock clock;
    private final GatewayMetrics metrics;

    private final ConcurrentMap<String, ClientSession> sessions = new ConcurrentHashMap<>();

    /**
     * @param outboundCapacity per-connection buffer size
     * @param drainTimeout     longest a connection may stay DRAINING
     * @param defaultDeadline  analysis budget when the client sends none
     * @param maxDeadline      upper bound for client-supplied budgets
     */
    public record Settings(int outboundCapacity, Duration drainTimeout, Duration defaultDeadline, Duration maxDeadline) {
    }

    public Gateway(CredentialVerifier verifier,
                   BroadcastEngine broadcast,
                   OrchestrationRouter router,
                   ExecutorService analysisPool,
                   FrameCodec codec,
                   InputValidator validator,
                   FeatureFlags features,
                   Settings settings,
                   Clock clock,
                   GatewayMetrics metrics) {
        this.verifier = verifier;
        this.broadcast = broadcast;
        this.router = router;
        this.analysisPool = analysisPool;
        this.codec = codec;
        this.validator = validator;
        this.features = features;
        this.settings = settings;
        this.clock = clock;
        this.metrics = metrics;
    }

    // ----------------------------------------------------------------------------------------
    // Lifecycle
    // ----------------------------------------------------------------------------------------

    /**
     * Authenticate a new transport and make it ACTIVE.
     *
     * @throws AuthenticationException after sending AUTH_FAILED and closing the transport
     */
    public ClientSession open(ConnectionTransport transport, String credential) {
        Connection connection = new Connection(
            UUID.randomUUID().toString(), transport.remoteAddress(), settings.outboundCapacity(), clock);
        ClientSession session = new ClientSession(connection, transport);

        Optional<Principal> principal = verify(credential);
        if (principal.isEmpty()) {
            connection.transition(ConnectionState.CONNECTING, ConnectionState.CLOSED);
            send(session, codec.error(ErrorKind.AUTH_FAILED, ErrorKind.AUTH_FAILED.clientMessage(), null));
            transport.close(CLOSE_POLICY_VIOLATION, "Authentication failed");
            metrics.recordConnectionEvent("auth_failed");
            log.warn("[GATEWAY] Connection rejected: invalid credential from {}", transport.remoteAddress());
            throw new AuthenticationException("Invalid credential from " + transport.remoteAddress());
        }

        connection.authenticate(principal.get().id());
        connection.transition(ConnectionState.CONNECTING, ConnectionState.ACTIVE);
        sessions.put(connection.connectionId(), session);
        metrics.recordConnectionEvent("opened");
        metrics.setActiveConnections(sessions.size());
        log.info("[GATEWAY] Connected: {} (principal={}, connection={})",
            transport.remoteAddress(), principal.get().id(), connection.connectionId());

        ObjectNode payload = codec.newPayload();
        payload.put("connectionId", connection.connectionId());
        payload.put("principal", principal.get().id());
        send(session, codec.ack("connect", payload));
        return session;
    }

    private Optional<Principal> verify(String credential) {
        try {
            return verifier.verify(credential);
        } catch (RuntimeException e) {
            log.error("[GATEWAY] Credential verifier failed", e);
            return Optional.empty();
        }
    }

    /**
     * Client asked to close, or the transport went away. Moves to DRAINING and
     * closes as soon as nothing is in flight.
     */
    public void beginDrain(ClientSession session, String reason) {
        if (enterDraining(session, reason) && session.connection().inFlightCount() == 0) {
            finishClose(session, reason);
        }
    }

    private boolean enterDraining(ClientSession session, String reason) {
        Connection connection = session.connection();
        if (!connection.transition(ConnectionState.ACTIVE, ConnectionState.DRAINING)) {
            return false;
        }
        metrics.recordConnectionEvent("draining");
        log.info("[GATEWAY] Draining {} ({}), {} analyses in flight",
            connection.connectionId(), reason, connection.inFlightCount());
        return true;
    }

    public void onTransportClosed(ClientSession session) {
        beginDrain(session, "transport closed");
    }

    /**
     * Close every connection still past its drain timeout, cancelling its analyses.
     *
     * @return number of connections force-closed
     */
    public int sweepDraining() {
        int closed = 0;
        for (ClientSession session : sessions.values()) {
            Connection connection = session.connection();
            if (connection.state() != ConnectionState.DRAINING || connection.drainStartedAt() == null) {
                continue;
            }
            Duration draining = Duration.between(connection.drainStartedAt(), clock.instant());
            if (draining.compareTo(settings.drainTimeout()) >= 0) {
                int cancelled = connection.cancelInFlight();
                log.warn("[GATEWAY] Drain timeout for {} after {}ms, cancelled {} analyses",
                    connection.connectionId(), draining.toMillis(), cancelled);
                finishClose(session, "drain timeout");
                closed++;
            }
        }
        return closed;
    }

    /**
     * Drain every connection, then force-close whatever is left.
     */
    public void shutdown() {
        log.info("[GATEWAY] Shutting down {} connections", sessions.size());
        for (ClientSession session : new ArrayList<>(sessions.values())) {
            forceClose(session, CLOSE_GOING_AWAY, "server shutdown");
        }
    }

    private void finishClose(ClientSession session, String reason) {
        Connection connection = session.connection();
        if (!connection.transition(ConnectionState.DRAINING, ConnectionState.CLOSED)) {
            return;
        }
        int dropped = broadcast.dropConnection(connection.connectionId());
        sessions.remove(connection.connectionId());
        connection.cancelInFlight();
        if (session.transport().isOpen()) {
            session.transport().close(session.closeCode(), reason);
        }
        metrics.recordConnectionEvent("closed");
        metrics.setActiveConnections(sessions.size());
        log.info("[GATEWAY] Closed {} (principal={}, reason={}, subscriptions dropped={}, updates dropped={})",
            connection.connectionId(), connection.principal(), reason, dropped, connection.outbound().droppedCount());
    }

    private void terminate(ClientSession session, ErrorKind kind, String message) {
        send(session, codec.error(kind, message, null));
        metrics.recordConnectionEvent("protocol_violation");
        forceClose(session, CLOSE_POLICY_VIOLATION, "protocol violation");
    }

    /**
     * Close without waiting for in-flight analyses. The code is set first because
     * cancelling a task may itself complete the close.
     */
    private void forceClose(ClientSession session, int closeCode, String reason) {
        session.closeCode(closeCode);
        enterDraining(session, reason);
        session.connection().cancelInFlight();
        finishClose(session, reason);
    }

    // ----------------------------------------------------------------------------------------
    // Inbound frames
    // ----------------------------------------------------------------------------------------

    public void onMessage(ClientSession session, String raw) {
        Connection connection = session.connection();
        if (connection.state() != ConnectionState.ACTIVE) {
            if (connection.state() == ConnectionState.DRAINING) {
                send(session, codec.error(ErrorKind.DISCONNECTED, ErrorKind.DISCONNECTED.clientMessage(), null));
            }
            return;
        }
        connection.touch();

        ClientMessage msg;
        try {
            msg = codec.decode(raw);
        } catch (ProtocolException e) {
            log.warn("[GATEWAY] Protocol violation from {}: {}", connection.connectionId(), e.getMessage());
            terminate(session, e.getKind(), validator.sanitize(e.getMessage()));
            return;
        }

        try {
            switch (msg.action) {
                case "subscribe" -> handleSubscribe(session, msg);
                case "unsubscribe" -> handleUnsubscribe(session, msg);
                case "analyze" -> handleAnalyze(session, msg);
                case "ping" -> send(session, codec.pong(validator.sanitize(msg.nonce)));
                case "close" -> beginDrain(session, "client request");
                default -> {
                    log.warn("[GATEWAY] Unknown action from {}: {}", connection.connectionId(), msg.action);
                    terminate(session, ErrorKind.INVALID_REQUEST, "Unknown action: " + validator.sanitize(msg.action));
                }
            }
        } catch (MarketLensException e) {
            log.debug("[GATEWAY] {} rejected for {}: {}", msg.action, connection.connectionId(), e.getMessage());
            send(session, codec.error(e.getKind(), clientText(e), requestIdOf(msg), e.retryAfter().orElse(null)));
        } catch (IllegalArgumentException e) {
            log.debug("[GATEWAY] Invalid {} from {}: {}", msg.action, connection.connectionId(), e.getMessage());
            send(session, codec.error(ErrorKind.INVALID_REQUEST, validator.sanitize(e.getMessage()), requestIdOf(msg)));
        }
    }

    private void handleSubscribe(ClientSession session, ClientMessage msg) {
        if (!features.realTimeUpdates()) {
            throw new MarketLensException(ErrorKind.FEATURE_DISABLED, "Real-time updates are disabled");
        }
        SubscriptionKey key = parseKey(msg);
        boolean added = broadcast.attach(session.connection(), key);
        ObjectNode payload = keyPayload(key);
        payload.put("subscribed", added);
        send(session, codec.ack("subscribe", payload));
    }

    private void handleUnsubscribe(ClientSession session, ClientMessage msg) {
        SubscriptionKey key = parseKey(msg);
        boolean removed = broadcast.detach(session.connection(), key);
        ObjectNode payload = keyPayload(key);
        payload.put("unsubscribed", removed);
        send(session, codec.ack("unsubscribe", payload));
    }

    private void handleAnalyze(ClientSession session, ClientMessage msg) {
        if (!features.aiInsights()) {
            throw new MarketLensException(ErrorKind.FEATURE_DISABLED, "AI insights are disabled");
        }
        validator.validateRequestId(msg.requestId);
        List<String> requested = msg.symbols != null ? msg.symbols
            : msg.symbol != null ? List.of(msg.symbol) : List.of();
        List<String> symbols = validator.normalizeSymbols(requested);
        Set<AnalysisKind> kinds = resolveKinds(msg.kinds);
        Timeframe timeframe = msg.timeframe == null ? Timeframe.ONE_HOUR : Timeframe.parse(msg.timeframe);
        Connection connection = session.connection();

        AnalysisRequest request = new AnalysisRequest(
            msg.requestId, connection.principal(), symbols, kinds, timeframe,
            Deadline.after(clampDeadline(msg.deadlineMs), clock));

        FutureTask<Void> task = new FutureTask<>(() -> runAnalysis(session, request), null) {
            @Override
            protected void done() {
                connection.completeInFlight(this);
                if (connection.state() == ConnectionState.DRAINING && connection.inFlightCount() == 0) {
                    finishClose(session, "drained");
                }
            }
        };
        connection.trackInFlight(task);

        // ACK goes out before the task can possibly answer
        ObjectNode payload = codec.newPayload();
        payload.put("requestId", request.requestId());
        payload.put("deadlineMs", request.deadline().remainingMillis());
        send(session, codec.ack("analyze", payload));

        try {
            analysisPool.execute(task);
        } catch (RejectedExecutionException e) {
            connection.completeInFlight(task);
            log.warn("[GATEWAY] Analysis pool rejected request {}", request.requestId());
            throw new MarketLensException(ErrorKind.INTERNAL, "Analysis capacity exhausted", e);
        }
    }

    private void runAnalysis(ClientSession session, AnalysisRequest request) {
        try {
            Insight insight = router.handle(request);
            send(session, codec.insight(insight));
        } catch (OrchestrationException e) {
            if (e.getKind() == ErrorKind.DISCONNECTED) {
                log.debug("[GATEWAY] Request {} cancelled", request.requestId());
                return;
            }
            send(session, codec.error(e.getKind(), e.clientMessage(), request.requestId(), e.retryAfter().orElse(null)));
        } catch (RuntimeException e) {
            log.error("[GATEWAY] Request {} failed unexpectedly", request.requestId(), e);
            send(session, codec.error(ErrorKind.INTERNAL, ErrorKind.INTERNAL.clientMessage(), request.requestId()));
        }
    }

    /**
     * Parse requested kinds. No kinds, or AI_INSIGHT alone, means every enabled analyzer.
     *
     * @throws MarketLensException FEATURE_DISABLED if a requested kind is switched off
     */
    Set<AnalysisKind> resolveKinds(List<String> requested) {
        Set<AnalysisKind> kinds = EnumSet.noneOf(AnalysisKind.class);
        if (requested != null) {
            for (String name : requested) {
                AnalysisKind kind = AnalysisKind.fromWire(name);
                if (!features.isEnabled(kind)) {
                    throw new MarketLensException(ErrorKind.FEATURE_DISABLED, kind.wireName() + " analysis is disabled");
                }
                kinds.add(kind);
            }
        }
        if (kinds.stream().noneMatch(AnalysisKind::isAnalyzer)) {
            for (AnalysisKind kind : AnalysisKind.analyzerKinds()) {
                if (features.isEnabled(kind)) kinds.add(kind);
            }
        }
        return kinds;
    }

    Duration clampDeadline(Long deadlineMs) {
        if (deadlineMs == null || deadlineMs <= 0) {
            return settings.defaultDeadline();
        }
        Duration requested = Duration.ofMillis(deadlineMs);
        return requested.compareTo(settings.maxDeadline()) > 0 ? settings.maxDeadline() : requested;
    }

    private SubscriptionKey parseKey(ClientMessage msg) {
        if (msg.topic == null || msg.symbol == null || msg.timeframe == null) {
            throw new IllegalArgumentException("topic, symbol and timeframe are required");
        }
        return new SubscriptionKey(
            Topic.fromWire(msg.topic),
            validator.normalizeSymbol(msg.symbol),
            Timeframe.parse(msg.timeframe));
    }

    private ObjectNode keyPayload(SubscriptionKey key) {
        ObjectNode payload = codec.newPayload();
        payload.put("topic", key.topic().wireName());
        payload.put("symbol", key.symbol());
        payload.put("timeframe", key.timeframe().code());
        return payload;
    }

    /**
     * Validation and feature messages are ours and safe to show; anything else
     * gets the kind's generic message.
     */
    private String clientText(MarketLensException e) {
        return switch (e.getKind()) {
            case INVALID_REQUEST, FEATURE_DISABLED -> validator.sanitize(e.getMessage());
            default -> e.clientMessage();
        };
    }

    private static String requestIdOf(ClientMessage msg) {
        return "analyze".equals(msg.action) ? msg.requestId : null;
    }

    // ----------------------------------------------------------------------------------------
    // Outbound
    // ----------------------------------------------------------------------------------------

    private void send(ClientSession session, String frame) {
        if (!session.transport().isOpen()) {
            return;
        }
        session.transport().send(frame).whenComplete((v, error) -> {
            if (error != null) {
                log.debug("[GATEWAY] Send to {} failed: {}", session.id(), error.toString());
            }
        });
    }

    /**
     * Sessions that may still receive frames (ACTIVE or DRAINING).
     */
    public Collection<ClientSession> sessions() {
        return sessions.values();
    }

    public Optional<ClientSession> session(String connectionId) {
        return Optional.ofNullable(sessions.get(connectionId));
    }

    public int getConnectionCount() {
        return sessions.size();
    }
}
