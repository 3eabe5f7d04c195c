package io.marketlens.transport.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.marketlens.auth.AuthenticationException;
import io.marketlens.auth.StaticTokenVerifier;
import io.marketlens.config.FeatureFlags;
import io.marketlens.domain.analysis.AnalysisKind;
import io.marketlens.domain.analysis.AnalysisRequest;
import io.marketlens.domain.analysis.Insight;
import io.marketlens.domain.analysis.Outlook;
import io.marketlens.domain.common.ErrorKind;
import io.marketlens.domain.common.MarketLensException;
import io.marketlens.domain.data.SubscriptionKey;
import io.marketlens.domain.data.Timeframe;
import io.marketlens.domain.data.Topic;
import io.marketlens.domain.session.ConnectionState;
import io.marketlens.infrastructure.metrics.GatewayMetrics;
import io.marketlens.security.InputValidator;
import io.marketlens.service.analysis.OrchestrationException;
import io.marketlens.service.analysis.OrchestrationRouter;
import io.marketlens.service.broadcast.BroadcastEngine;
import io.marketlens.service.broadcast.SubscriptionRegistry;
import io.marketlens.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GatewayTest {

    private static final String TOKEN = "secret-token";
    private static final SubscriptionKey AAPL_1M = new SubscriptionKey(Topic.OHLCV, "AAPL", Timeframe.ONE_MINUTE);

    @Mock
    private OrchestrationRouter router;

    private MutableClock clock;
    private SubscriptionRegistry registry;
    private BroadcastEngine broadcast;
    private ExecutorService analysisPool;
    private Gateway gateway;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = new SubscriptionRegistry();
        broadcast = new BroadcastEngine(registry, GatewayMetrics.noop());
        analysisPool = Executors.newFixedThreadPool(2);
        gateway = gateway(FeatureFlags.allEnabled());
    }

    @AfterEach
    void tearDown() {
        analysisPool.shutdownNow();
    }

    private Gateway gateway(FeatureFlags features) {
        return new Gateway(
            new StaticTokenVerifier(Map.of(TOKEN, "alice")),
            broadcast,
            router,
            analysisPool,
            new FrameCodec(new ObjectMapper(), clock),
            new InputValidator(),
            features,
            new Gateway.Settings(16, Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofSeconds(30)),
            clock,
            GatewayMetrics.noop());
    }

    private void awaitAnalyses() throws InterruptedException {
        analysisPool.shutdown();
        assertTrue(analysisPool.awaitTermination(5, TimeUnit.SECONDS), "Analyses finished");
    }

    private static Insight insight(String requestId) {
        return new Insight(requestId, List.of("AAPL"), "Momentum building", Outlook.BULLISH, 0.8,
            false, Set.of(), "local", Instant.parse("2024-01-15T10:00:00Z"), null);
    }

    // ----------------------------------------------------------------------------------------
    // Connect
    // ----------------------------------------------------------------------------------------

    @Test
    void testInvalidCredentialIsRejected() {
        RecordingTransport transport = new RecordingTransport();

        assertThrows(AuthenticationException.class, () -> gateway.open(transport, "wrong"));

        JsonNode error = transport.last();
        assertEquals("ERROR", error.get("type").asText());
        assertEquals("AUTH_FAILED", error.at("/payload/code").asText());
        assertEquals(1008, transport.closeCode);
        assertEquals(0, gateway.getConnectionCount());
    }

    @Test
    void testValidCredentialActivatesConnection() {
        RecordingTransport transport = new RecordingTransport();

        ClientSession session = gateway.open(transport, TOKEN);

        assertEquals(ConnectionState.ACTIVE, session.connection().state());
        assertEquals("alice", session.connection().principal());
        JsonNode ack = transport.last();
        assertEquals("ACK", ack.get("type").asText());
        assertEquals("connect", ack.at("/payload/action").asText());
        assertEquals(session.id(), ack.at("/payload/connectionId").asText());
        assertEquals(1, gateway.getConnectionCount());
    }

    // ----------------------------------------------------------------------------------------
    // Subscriptions
    // ----------------------------------------------------------------------------------------

    @Test
    void testSubscribeAndUnsubscribe() {
        RecordingTransport transport = new RecordingTransport();
        ClientSession session = gateway.open(transport, TOKEN);
        String frame = "{\"action\":\"subscribe\",\"topic\":\"ohlcv\",\"symbol\":\"aapl\",\"timeframe\":\"1m\"}";

        gateway.onMessage(session, frame);
        assertTrue(transport.last().at("/payload/subscribed").asBoolean());
        assertEquals("AAPL", transport.last().at("/payload/symbol").asText());
        assertEquals(Set.of(AAPL_1M), registry.subscriptionsOf(session.id()));

        gateway.onMessage(session, frame);
        assertFalse(transport.last().at("/payload/subscribed").asBoolean(), "Duplicate subscribe is a no-op");

        gateway.onMessage(session, frame.replace("\"subscribe\"", "\"unsubscribe\""));
        assertTrue(transport.last().at("/payload/unsubscribed").asBoolean());
        assertTrue(registry.subscriptionsOf(session.id()).isEmpty());
    }

    @Test
    void testInvalidSubscribeKeepsConnectionOpen() {
        RecordingTransport transport = new RecordingTransport();
        ClientSession session = gateway.open(transport, TOKEN);

        gateway.onMessage(session, "{\"action\":\"subscribe\",\"topic\":\"ohlcv\",\"symbol\":\"$$$\",\"timeframe\":\"1m\"}");

        assertEquals("INVALID_REQUEST", transport.last().at("/payload/code").asText());
        assertTrue(transport.last().at("/payload/message").asText().contains("Invalid symbol"));
        assertEquals(ConnectionState.ACTIVE, session.connection().state());
        assertTrue(transport.isOpen());
    }

    @Test
    void testSubscribeRejectedWhenRealTimeDisabled() {
        gateway = gateway(new FeatureFlags(true, true, true, false));
        RecordingTransport transport = new RecordingTransport();
        ClientSession session = gateway.open(transport, TOKEN);

        gateway.onMessage(session, "{\"action\":\"subscribe\",\"topic\":\"ohlcv\",\"symbol\":\"AAPL\",\"timeframe\":\"1m\"}");

        assertEquals("FEATURE_DISABLED", transport.last().at("/payload/code").asText());
        assertEquals(0, registry.subscriptionCount());
    }

    // ----------------------------------------------------------------------------------------
    // Protocol violations
    // ----------------------------------------------------------------------------------------

    @Test
    void testMalformedFrameTerminatesConnection() {
        RecordingTransport transport = new RecordingTransport();
        ClientSession session = gateway.open(transport, TOKEN);
        broadcast.attach(session.connection(), AAPL_1M);

        gateway.onMessage(session, "{not json");

        assertEquals("INVALID_REQUEST", transport.last().at("/payload/code").asText());
        assertFalse(transport.isOpen());
        assertEquals(1008, transport.closeCode, "Policy violation, not a normal close");
        assertEquals(ConnectionState.CLOSED, session.connection().state());
        assertEquals(0, registry.subscriptionCount(), "Closed connection drops its subscriptions");
        assertEquals(0, gateway.getConnectionCount());
    }

    @Test
    void testUnknownActionTerminatesConnection() {
        RecordingTransport transport = new RecordingTransport();
        ClientSession session = gateway.open(transport, TOKEN);

        gateway.onMessage(session, "{\"action\":\"trade\"}");

        assertTrue(transport.last().at("/payload/message").asText().contains("Unknown action"));
        assertEquals(ConnectionState.CLOSED, session.connection().state());
        assertEquals(1008, transport.closeCode);
    }

    @Test
    void testProtocolViolationWithAnalysisInFlightClosesAsViolation() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        when(router.handle(any())).thenAnswer(inv -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                throw new OrchestrationException("req-6", ErrorKind.DISCONNECTED, "cancelled");
            }
            return insight("req-6");
        });
        RecordingTransport transport = new RecordingTransport();
        ClientSession session = gateway.open(transport, TOKEN);
        gateway.onMessage(session, "{\"action\":\"analyze\",\"requestId\":\"req-6\",\"symbol\":\"AAPL\"}");
        assertTrue(started.await(5, TimeUnit.SECONDS));

        gateway.onMessage(session, "{not json");
        awaitAnalyses();

        assertEquals(ConnectionState.CLOSED, session.connection().state());
        assertEquals(1008, transport.closeCode, "Cancelling the analysis does not turn this into a normal close");
    }

    @Test
    void testPing() {
        RecordingTransport transport = new RecordingTransport();
        ClientSession session = gateway.open(transport, TOKEN);

        gateway.onMessage(session, "{\"action\":\"ping\",\"nonce\":\"n-42\"}");

        assertEquals("PONG", transport.last().get("type").asText());
        assertEquals("n-42", transport.last().at("/payload/nonce").asText());
    }

    // ----------------------------------------------------------------------------------------
    // Analysis
    // ----------------------------------------------------------------------------------------

    @Test
    void testAnalyzeSendsAckThenInsight() throws Exception {
        when(router.handle(any())).thenReturn(insight("req-1"));
        RecordingTransport transport = new RecordingTransport();
        ClientSession session = gateway.open(transport, TOKEN);

        gateway.onMessage(session,
            "{\"action\":\"analyze\",\"requestId\":\"req-1\",\"symbols\":[\"aapl\",\"AAPL\",\"msft\"],\"deadlineMs\":60000}");
        awaitAnalyses();

        List<JsonNode> frames = transport.parsed();
        assertEquals("ACK", frames.get(frames.size() - 2).get("type").asText());
        assertEquals("analyze", frames.get(frames.size() - 2).at("/payload/action").asText());
        assertEquals("INSIGHT", frames.get(frames.size() - 1).get("type").asText());
        assertEquals("req-1", frames.get(frames.size() - 1).at("/payload/requestId").asText());

        ArgumentCaptor<AnalysisRequest> captor = ArgumentCaptor.forClass(AnalysisRequest.class);
        verify(router).handle(captor.capture());
        AnalysisRequest request = captor.getValue();
        assertEquals(List.of("AAPL", "MSFT"), request.symbols());
        assertEquals(AnalysisKind.analyzerKinds(), request.analyzerKinds());
        assertEquals(Timeframe.ONE_HOUR, request.timeframe());
        assertEquals(Duration.ofSeconds(30), request.deadline().remaining(), "Deadline clamped to the maximum");
        assertEquals(0, session.connection().inFlightCount());
    }

    @Test
    void testAnalyzeFailureCarriesRequestId() throws Exception {
        when(router.handle(any())).thenThrow(
            new OrchestrationException("req-2", ErrorKind.NO_CONTEXT, "Every analyzer slot failed"));
        RecordingTransport transport = new RecordingTransport();
        ClientSession session = gateway.open(transport, TOKEN);

        gateway.onMessage(session, "{\"action\":\"analyze\",\"requestId\":\"req-2\",\"symbol\":\"TSLA\"}");
        awaitAnalyses();

        JsonNode error = transport.last();
        assertEquals("ERROR", error.get("type").asText());
        assertEquals("NO_CONTEXT", error.at("/payload/code").asText());
        assertEquals("req-2", error.at("/payload/requestId").asText());
        assertEquals(ErrorKind.NO_CONTEXT.clientMessage(), error.at("/payload/message").asText());
    }

    @Test
    void testAnalyzeFailureCarriesRetryHint() throws Exception {
        when(router.handle(any())).thenThrow(new OrchestrationException("req-3", ErrorKind.REASONING_UNAVAILABLE,
            "Local and cloud reasoning both failed", null, Duration.ofSeconds(12)));
        RecordingTransport transport = new RecordingTransport();
        ClientSession session = gateway.open(transport, TOKEN);

        gateway.onMessage(session, "{\"action\":\"analyze\",\"requestId\":\"req-3\",\"symbol\":\"TSLA\"}");
        awaitAnalyses();

        JsonNode error = transport.last();
        assertEquals("REASONING_UNAVAILABLE", error.at("/payload/code").asText());
        assertTrue(error.at("/payload/retryable").asBoolean());
        assertEquals(12_000, error.at("/payload/retryAfterMs").asLong());
    }

    @Test
    void testAnalyzeRejectedWhenInsightsDisabled() {
        gateway = gateway(new FeatureFlags(false, true, true, true));
        RecordingTransport transport = new RecordingTransport();
        ClientSession session = gateway.open(transport, TOKEN);

        gateway.onMessage(session, "{\"action\":\"analyze\",\"requestId\":\"req-3\",\"symbol\":\"TSLA\"}");

        assertEquals("FEATURE_DISABLED", transport.last().at("/payload/code").asText());
        assertEquals("req-3", transport.last().at("/payload/requestId").asText());
        verifyNoInteractions(router);
    }

    @Test
    void testAnalyzeWithInvalidRequestId() {
        RecordingTransport transport = new RecordingTransport();
        ClientSession session = gateway.open(transport, TOKEN);

        gateway.onMessage(session, "{\"action\":\"analyze\",\"requestId\":\"bad id!\",\"symbol\":\"TSLA\"}");

        assertEquals("INVALID_REQUEST", transport.last().at("/payload/code").asText());
        assertEquals(ConnectionState.ACTIVE, session.connection().state());
    }

    @Test
    void testResolveKinds() {
        assertEquals(AnalysisKind.analyzerKinds(), gateway.resolveKinds(null));
        assertEquals(AnalysisKind.analyzerKinds(), gateway.resolveKinds(List.of()));

        Gateway noSentiment = gateway(new FeatureFlags(true, true, false, true));
        Set<AnalysisKind> expanded = noSentiment.resolveKinds(List.of("ai-insight"));
        assertTrue(expanded.contains(AnalysisKind.TECHNICAL));
        assertTrue(expanded.contains(AnalysisKind.PATTERN));
        assertFalse(expanded.contains(AnalysisKind.SENTIMENT), "Disabled kinds are not expanded");

        MarketLensException e = assertThrows(MarketLensException.class,
            () -> noSentiment.resolveKinds(List.of("sentiment")));
        assertEquals(ErrorKind.FEATURE_DISABLED, e.getKind());
        assertThrows(IllegalArgumentException.class, () -> gateway.resolveKinds(List.of("astrology")));
    }

    @Test
    void testClampDeadline() {
        assertEquals(Duration.ofSeconds(10), gateway.clampDeadline(null));
        assertEquals(Duration.ofSeconds(10), gateway.clampDeadline(0L));
        assertEquals(Duration.ofSeconds(10), gateway.clampDeadline(-5L));
        assertEquals(Duration.ofMillis(2_500), gateway.clampDeadline(2_500L));
        assertEquals(Duration.ofSeconds(30), gateway.clampDeadline(120_000L));
    }

    // ----------------------------------------------------------------------------------------
    // Draining
    // ----------------------------------------------------------------------------------------

    @Test
    void testCloseWaitsForInFlightAnalysis() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(router.handle(any())).thenAnswer(inv -> {
            release.await();
            return insight("req-4");
        });
        RecordingTransport transport = new RecordingTransport();
        ClientSession session = gateway.open(transport, TOKEN);

        gateway.onMessage(session, "{\"action\":\"analyze\",\"requestId\":\"req-4\",\"symbol\":\"AAPL\"}");
        gateway.onMessage(session, "{\"action\":\"close\"}");

        assertEquals(ConnectionState.DRAINING, session.connection().state());
        assertTrue(transport.isOpen(), "Connection stays open while an analysis is running");

        gateway.onMessage(session, "{\"action\":\"ping\"}");
        assertEquals("DISCONNECTED", transport.last().at("/payload/code").asText(), "No new work while draining");

        release.countDown();
        awaitAnalyses();

        assertEquals("INSIGHT", transport.framesOfType("INSIGHT").get(0).get("type").asText());
        assertEquals(ConnectionState.CLOSED, session.connection().state());
        assertEquals(1000, transport.closeCode);
    }

    @Test
    void testDrainTimeoutCancelsAnalysis() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        when(router.handle(any())).thenAnswer(inv -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                throw new OrchestrationException("req-5", ErrorKind.DISCONNECTED, "cancelled");
            }
            return insight("req-5");
        });
        RecordingTransport transport = new RecordingTransport();
        ClientSession session = gateway.open(transport, TOKEN);
        gateway.onMessage(session, "{\"action\":\"analyze\",\"requestId\":\"req-5\",\"symbol\":\"AAPL\"}");
        assertTrue(started.await(5, TimeUnit.SECONDS));
        gateway.onTransportClosed(session);

        clock.advance(Duration.ofSeconds(4));
        assertEquals(0, gateway.sweepDraining());

        clock.advance(Duration.ofSeconds(1));
        assertEquals(1, gateway.sweepDraining());

        assertEquals(ConnectionState.CLOSED, session.connection().state());
        awaitAnalyses();
        assertTrue(transport.framesOfType("INSIGHT").isEmpty(), "Cancelled analysis sends nothing");
    }

    @Test
    void testShutdownClosesEveryConnection() {
        RecordingTransport t1 = new RecordingTransport();
        RecordingTransport t2 = new RecordingTransport();
        gateway.open(t1, TOKEN);
        gateway.open(t2, TOKEN);

        gateway.shutdown();

        assertEquals(0, gateway.getConnectionCount());
        assertEquals(1001, t1.closeCode);
        assertEquals(1001, t2.closeCode);
    }
}
