package io.marketlens.infrastructure.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.marketlens.domain.common.Deadline;
import io.marketlens.domain.common.ErrorKind;
import io.marketlens.infrastructure.metrics.GatewayMetrics;
import io.marketlens.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RateLimitedFetcherTest {

    private static final String SOURCE = "alpha_vantage";

    @Mock
    private UpstreamSource upstream;

    private MutableClock clock;
    private RateLimitedFetcher fetcher;
    private final FetchParams params = FetchParams.of("AAPL", Map.of("timeframe", "1m"));

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        fetcher = new RateLimitedFetcher(clock, GatewayMetrics.noop());
    }

    @Test
    void testSuccessfulFetchReturnsUpstreamResult() throws Exception {
        fetcher.registerSource(SOURCE, new SourceLimits(5, 5, Duration.ofMinutes(1), 3, Duration.ofSeconds(30)), upstream);
        JsonNode result = JsonNodeFactory.instance.objectNode().put("close", "101.5");
        when(upstream.fetch(eq(params), any())).thenReturn(result);

        JsonNode fetched = fetcher.fetch(SOURCE, params, deadline());

        assertSame(result, fetched);
        assertEquals(CircuitState.CLOSED, fetcher.guard(SOURCE).circuitState());
    }

    @Test
    void testOpenCircuitFailsFastWithoutCallingUpstream() throws Exception {
        fetcher.registerSource(SOURCE, new SourceLimits(10, 10, Duration.ofMinutes(1), 2, Duration.ofSeconds(30)), upstream);
        when(upstream.fetch(any(), any())).thenThrow(new IOException("connection refused"));

        for (int i = 0; i < 2; i++) {
            FetchException e = assertThrows(FetchException.class, () -> fetcher.fetch(SOURCE, params, deadline()));
            assertEquals(ErrorKind.UPSTREAM_FAILURE, e.getKind());
        }
        assertEquals(CircuitState.OPEN, fetcher.guard(SOURCE).circuitState());
        double tokensBefore = fetcher.guard(SOURCE).availableTokens();

        for (int i = 0; i < 5; i++) {
            FetchException e = assertThrows(FetchException.class, () -> fetcher.fetch(SOURCE, params, deadline()));
            assertEquals(ErrorKind.CIRCUIT_OPEN, e.getKind());
            assertEquals(Duration.ofSeconds(30), e.retryAfter().orElseThrow(), "Whole cool-down still ahead");
        }

        verify(upstream, times(2)).fetch(any(), any());
        assertEquals(tokensBefore, fetcher.guard(SOURCE).availableTokens(), 1e-9,
            "Calls rejected by an open circuit must not spend tokens");
    }

    @Test
    void testProbeAfterCoolDownClosesCircuit() throws Exception {
        fetcher.registerSource(SOURCE, new SourceLimits(10, 10, Duration.ofMinutes(1), 1, Duration.ofSeconds(30)), upstream);
        when(upstream.fetch(any(), any()))
            .thenThrow(new IOException("down"))
            .thenReturn(JsonNodeFactory.instance.objectNode());

        assertThrows(FetchException.class, () -> fetcher.fetch(SOURCE, params, deadline()));
        assertEquals(CircuitState.OPEN, fetcher.guard(SOURCE).circuitState());

        clock.advance(Duration.ofSeconds(30));
        fetcher.fetch(SOURCE, params, deadline());

        assertEquals(CircuitState.CLOSED, fetcher.guard(SOURCE).circuitState());
        assertEquals(0, fetcher.guard(SOURCE).consecutiveFailures());
    }

    @Test
    void testRateLimitedCallsAreRejectedNotQueued() throws Exception {
        fetcher.registerSource(SOURCE, SourceLimits.perMinute(2, 5, Duration.ofSeconds(30)), upstream);
        when(upstream.fetch(any(), any())).thenReturn(JsonNodeFactory.instance.objectNode());

        fetcher.fetch(SOURCE, params, deadline());
        fetcher.fetch(SOURCE, params, deadline());
        FetchException e = assertThrows(FetchException.class, () -> fetcher.fetch(SOURCE, params, deadline()));

        assertEquals(ErrorKind.RATE_LIMITED, e.getKind());
        assertEquals(SOURCE, e.getSource());
        assertEquals(Duration.ofSeconds(30), e.retryAfter().orElseThrow(), "2 tokens per minute refill one every 30s");
        verify(upstream, times(2)).fetch(any(), any());
        assertEquals(CircuitState.CLOSED, fetcher.guard(SOURCE).circuitState(), "Rate limiting is not a failure");
    }

    @Test
    void testExpiredDeadlineNeverReachesUpstream() {
        fetcher.registerSource(SOURCE, SourceLimits.perMinute(5, 5, Duration.ofSeconds(30)), upstream);

        FetchException e = assertThrows(FetchException.class,
            () -> fetcher.fetch(SOURCE, params, Deadline.after(Duration.ZERO, clock)));

        assertEquals(ErrorKind.TIMEOUT, e.getKind());
        verifyNoInteractions(upstream);
    }

    @Test
    void testUpstreamTimeoutMapsToTimeoutAndCountsAsFailure() throws Exception {
        fetcher.registerSource(SOURCE, SourceLimits.perMinute(5, 5, Duration.ofSeconds(30)), upstream);
        when(upstream.fetch(any(), any())).thenThrow(new HttpTimeoutException("request timed out"));

        FetchException e = assertThrows(FetchException.class, () -> fetcher.fetch(SOURCE, params, deadline()));

        assertEquals(ErrorKind.TIMEOUT, e.getKind());
        assertEquals(1, fetcher.guard(SOURCE).consecutiveFailures());
    }

    @Test
    void testExecuteGuardsArbitraryCalls() {
        fetcher.registerGuard("reasoning-local", SourceLimits.perMinute(1, 5, Duration.ofSeconds(30)));

        String answer = fetcher.execute("reasoning-local", deadline(), d -> "ok");
        FetchException e = assertThrows(FetchException.class,
            () -> fetcher.execute("reasoning-local", deadline(), d -> "again"));

        assertEquals("ok", answer);
        assertEquals(ErrorKind.RATE_LIMITED, e.getKind());
    }

    @Test
    void testUnknownAndDuplicateSources() {
        fetcher.registerGuard("news_api", SourceLimits.perHour(100, 5, Duration.ofSeconds(30)));

        assertThrows(IllegalStateException.class,
            () -> fetcher.registerGuard("news_api", SourceLimits.perHour(100, 5, Duration.ofSeconds(30))));
        assertThrows(IllegalArgumentException.class, () -> fetcher.execute("nope", deadline(), d -> "x"));
        assertThrows(IllegalArgumentException.class, () -> fetcher.fetch("news_api", params, deadline()),
            "A guard-only source has no upstream for fetch()");
    }

    private Deadline deadline() {
        return Deadline.after(Duration.ofSeconds(5), clock);
    }
}
