package io.marketlens.service.analysis;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.marketlens.domain.analysis.AnalysisKind;
import io.marketlens.domain.analysis.AnalysisRequest;
import io.marketlens.domain.analysis.ContextBundle;
import io.marketlens.domain.analysis.Insight;
import io.marketlens.domain.analysis.Outlook;
import io.marketlens.domain.analysis.ReasoningOutput;
import io.marketlens.domain.analysis.SlotKey;
import io.marketlens.domain.analysis.SlotOutcome;
import io.marketlens.domain.common.Deadline;
import io.marketlens.domain.common.ErrorKind;
import io.marketlens.domain.data.Timeframe;
import io.marketlens.infrastructure.fetch.RateLimitedFetcher;
import io.marketlens.infrastructure.fetch.SourceLimits;
import io.marketlens.infrastructure.metrics.GatewayMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrchestrationRouterTest {

    @Mock
    private ContextAssembler assembler;

    @Mock
    private ReasoningBackend local;

    @Mock
    private ReasoningBackend cloud;

    private ExecutorService reasoningPool;
    private RateLimitedFetcher fetcher;
    private OrchestrationRouter router;

    @BeforeEach
    void setUp() {
        lenient().when(local.name()).thenReturn("local");
        lenient().when(cloud.name()).thenReturn("cloud");
        reasoningPool = Executors.newFixedThreadPool(4);
        fetcher = new RateLimitedFetcher(Clock.systemUTC(), GatewayMetrics.noop());
        SourceLimits limits = SourceLimits.perMinute(100, 5, Duration.ofSeconds(30));
        fetcher.registerGuard(OrchestrationRouter.LOCAL_SOURCE, limits);
        fetcher.registerGuard(OrchestrationRouter.CLOUD_SOURCE, limits);
        router = new OrchestrationRouter(assembler, fetcher, local, cloud, Duration.ofMillis(200),
            reasoningPool, Clock.systemUTC(), GatewayMetrics.noop());
    }

    @AfterEach
    void tearDown() {
        reasoningPool.shutdownNow();
    }

    private static AnalysisRequest request(Duration budget) {
        return new AnalysisRequest("req-1", "alice", List.of("AAPL"),
            EnumSet.of(AnalysisKind.TECHNICAL, AnalysisKind.SENTIMENT), Timeframe.ONE_HOUR, Deadline.after(budget));
    }

    private static ContextBundle bundle(boolean sentimentOk, boolean technicalOk) {
        Map<SlotKey, SlotOutcome> slots = new LinkedHashMap<>();
        slots.put(new SlotKey(AnalysisKind.TECHNICAL, "AAPL"), technicalOk
            ? SlotOutcome.success(JsonNodeFactory.instance.objectNode().put("rsi", 61), false)
            : SlotOutcome.failure(ErrorKind.UPSTREAM_FAILURE));
        slots.put(new SlotKey(AnalysisKind.SENTIMENT, "AAPL"), sentimentOk
            ? SlotOutcome.success(JsonNodeFactory.instance.objectNode().put("score", 0.4), false)
            : SlotOutcome.failure(ErrorKind.TIMEOUT));
        return new ContextBundle("req-1", slots);
    }

    private static ReasoningOutput output(String summary) {
        return new ReasoningOutput(summary, Outlook.BULLISH, 0.7, null);
    }

    @Test
    void testLocalBackendAnswers() throws Exception {
        when(assembler.assemble(any())).thenReturn(bundle(true, true));
        when(local.infer(any(), any())).thenReturn(output("local view"));

        Insight insight = router.handle(request(Duration.ofSeconds(2)));

        assertEquals("local", insight.backend());
        assertEquals("local view", insight.summary());
        assertFalse(insight.partial());
        assertTrue(insight.missingKinds().isEmpty());
        verify(cloud, never()).infer(any(), any());
    }

    @Test
    void testLocalFailureFallsBackToCloud() throws Exception {
        when(assembler.assemble(any())).thenReturn(bundle(true, true));
        when(local.infer(any(), any())).thenThrow(new IOException("local down"));
        when(cloud.infer(any(), any())).thenReturn(output("cloud view"));

        Insight insight = router.handle(request(Duration.ofSeconds(2)));

        assertEquals("cloud", insight.backend());
        assertEquals("cloud view", insight.summary());
    }

    @Test
    void testSlowLocalBackendFallsBackWithinDeadline() throws Exception {
        when(assembler.assemble(any())).thenReturn(bundle(true, true));
        when(local.infer(any(), any())).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return output("too late");
        });
        when(cloud.infer(any(), any())).thenReturn(output("cloud view"));

        long start = System.nanoTime();
        Insight insight = router.handle(request(Duration.ofSeconds(3)));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertEquals("cloud", insight.backend());
        assertTrue(elapsedMs < 2_000, "Local attempt was capped at its budget, took " + elapsedMs + "ms");
    }

    @Test
    void testPartialBundleMarksInsightPartial() throws Exception {
        when(assembler.assemble(any())).thenReturn(bundle(false, true));
        when(local.infer(any(), any())).thenReturn(output("partial view"));

        Insight insight = router.handle(request(Duration.ofSeconds(2)));

        assertTrue(insight.partial());
        assertEquals(java.util.Set.of(AnalysisKind.SENTIMENT), insight.missingKinds());
    }

    @Test
    void testNoContextWhenEverySlotFailed() {
        when(assembler.assemble(any())).thenReturn(bundle(false, false));

        OrchestrationException e = assertThrows(OrchestrationException.class,
            () -> router.handle(request(Duration.ofSeconds(2))));

        assertEquals(ErrorKind.NO_CONTEXT, e.getKind());
        assertEquals("req-1", e.getRequestId());
        verifyNoInteractions(local, cloud);
    }

    @Test
    void testBothBackendsFailing() throws Exception {
        when(assembler.assemble(any())).thenReturn(bundle(true, true));
        when(local.infer(any(), any())).thenThrow(new IOException("local down"));
        when(cloud.infer(any(), any())).thenThrow(new IOException("cloud down"));

        OrchestrationException e = assertThrows(OrchestrationException.class,
            () -> router.handle(request(Duration.ofSeconds(2))));

        assertEquals(ErrorKind.REASONING_UNAVAILABLE, e.getKind());
    }

    @Test
    void testRateLimitedCloudReportsWhenToRetry() throws Exception {
        for (int i = 0; i < 100; i++) {
            fetcher.execute(OrchestrationRouter.CLOUD_SOURCE, Deadline.after(Duration.ofSeconds(1)), d -> "spent");
        }
        when(assembler.assemble(any())).thenReturn(bundle(true, true));
        when(local.infer(any(), any())).thenThrow(new IOException("local down"));

        OrchestrationException e = assertThrows(OrchestrationException.class,
            () -> router.handle(request(Duration.ofSeconds(2))));

        assertEquals(ErrorKind.REASONING_UNAVAILABLE, e.getKind());
        Duration retryAfter = e.retryAfter().orElseThrow();
        assertTrue(retryAfter.compareTo(Duration.ofMillis(600)) <= 0, "100 per minute refill one every 600ms");
        verify(cloud, never()).infer(any(), any());
    }

    @Test
    void testDeadlineExceededWhenCloudIsTooSlow() throws Exception {
        when(assembler.assemble(any())).thenReturn(bundle(true, true));
        when(local.infer(any(), any())).thenThrow(new IOException("local down"));
        when(cloud.infer(any(), any())).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return output("too late");
        });

        OrchestrationException e = assertThrows(OrchestrationException.class,
            () -> router.handle(request(Duration.ofMillis(400))));

        assertEquals(ErrorKind.DEADLINE_EXCEEDED, e.getKind());
    }
}
