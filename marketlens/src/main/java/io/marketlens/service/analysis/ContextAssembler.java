package io.marketlens.service.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import io.marketlens.domain.analysis.AnalysisKind;
import io.marketlens.domain.analysis.AnalysisRequest;
import io.marketlens.domain.analysis.ContextBundle;
import io.marketlens.domain.analysis.SlotKey;
import io.marketlens.domain.analysis.SlotOutcome;
import io.marketlens.domain.common.ErrorKind;
import io.marketlens.infrastructure.fetch.FetchException;
import io.marketlens.infrastructure.fetch.FetchParams;
import io.marketlens.infrastructure.fetch.RateLimitedFetcher;
import io.marketlens.service.cache.CacheKeys;
import io.marketlens.service.cache.TtlCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Fans one analysis request out to every (kind, symbol) slot and merges the
 * results into a {@link ContextBundle}.
 *
 * Slots are answered from the cache when possible. Misses run concurrently on
 * the analyzer pool, each through the fetcher; a slot that fails or is still
 * running at the deadline is recorded as an error and never fails its siblings.
 * Successful fresh results are written back with the kind's TTL.
 */
public final class ContextAssembler {
    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

    private static final String SOURCE_PREFIX = "analyzer-";

    private final RateLimitedFetcher fetcher;
    private final TtlCache<JsonNode> cache;
    private final Map<AnalysisKind, Duration> ttls;
    private final ExecutorService analyzerPool;

    public ContextAssembler(RateLimitedFetcher fetcher,
                            TtlCache<JsonNode> cache,
                            Map<AnalysisKind, Duration> ttls,
                            ExecutorService analyzerPool) {
        this.fetcher = fetcher;
        this.cache = cache;
        this.ttls = new EnumMap<>(ttls);
        this.analyzerPool = analyzerPool;
        for (AnalysisKind kind : AnalysisKind.analyzerKinds()) {
            if (!this.ttls.containsKey(kind)) {
                throw new IllegalArgumentException("No cache TTL configured for " + kind);
            }
        }
    }

    /** Fetcher source name for an analyzer kind. */
    public static String sourceFor(AnalysisKind kind) {
        return SOURCE_PREFIX + kind.wireName();
    }

    public ContextBundle assemble(AnalysisRequest request) {
        Map<SlotKey, SlotOutcome> outcomes = new LinkedHashMap<>();
        List<SlotKey> pending = new ArrayList<>();
        List<Callable<JsonNode>> calls = new ArrayList<>();
        int cacheHits = 0;

        for (AnalysisKind kind : request.analyzerKinds()) {
            for (String symbol : request.symbols()) {
                SlotKey slot = new SlotKey(kind, symbol);
                String source = sourceFor(kind);
                FetchParams params = FetchParams.of(symbol, Map.of("timeframe", request.timeframe().code()));
                String cacheKey = CacheKeys.of(source, symbol, params.params());

                Optional<JsonNode> cached = cache.get(cacheKey);
                if (cached.isPresent()) {
                    outcomes.put(slot, SlotOutcome.success(cached.get(), true));
                    cacheHits++;
                    continue;
                }
                outcomes.put(slot, null);
                pending.add(slot);
                Duration ttl = ttls.get(kind);
                calls.add(() -> {
                    JsonNode result = fetcher.fetch(source, params, request.deadline());
                    if (result == null || result.isNull()) {
                        throw new FetchException(source, ErrorKind.UPSTREAM_FAILURE, "Empty analyzer response");
                    }
                    cache.put(cacheKey, result, ttl);
                    return result;
                });
            }
        }

        if (!pending.isEmpty()) {
            runPending(request, pending, calls, outcomes);
        }

        ContextBundle bundle = new ContextBundle(request.requestId(), outcomes);
        log.debug("[ASSEMBLER] request={} slots={} cacheHits={} complete={}",
            request.requestId(), outcomes.size(), cacheHits, bundle.isComplete());
        return bundle;
    }

    private void runPending(AnalysisRequest request,
                            List<SlotKey> pending,
                            List<Callable<JsonNode>> calls,
                            Map<SlotKey, SlotOutcome> outcomes) {
        List<Future<JsonNode>> futures;
        try {
            // invokeAll cancels whatever is still running when the deadline elapses
            futures = analyzerPool.invokeAll(calls, request.deadline().remainingMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[ASSEMBLER] request={} interrupted while waiting for analyzers", request.requestId());
            for (SlotKey slot : pending) {
                outcomes.put(slot, SlotOutcome.failure(ErrorKind.TIMEOUT));
            }
            return;
        }

        for (int i = 0; i < pending.size(); i++) {
            SlotKey slot = pending.get(i);
            SlotOutcome outcome = outcomeOf(futures.get(i));
            if (!outcome.isSuccess()) {
                log.warn("[ASSEMBLER] request={} slot={} failed: {}",
                    request.requestId(), slot, outcome.error().code());
            }
            outcomes.put(slot, outcome);
        }
    }

    private static SlotOutcome outcomeOf(Future<JsonNode> future) {
        if (future.isCancelled()) {
            return SlotOutcome.failure(ErrorKind.TIMEOUT);
        }
        try {
            return SlotOutcome.success(future.get(), false);
        } catch (CancellationException e) {
            return SlotOutcome.failure(ErrorKind.TIMEOUT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SlotOutcome.failure(ErrorKind.TIMEOUT);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof FetchException) {
                return SlotOutcome.failure(((FetchException) cause).getKind());
            }
            log.error("[ASSEMBLER] Unexpected analyzer error", cause);
            return SlotOutcome.failure(ErrorKind.INTERNAL);
        }
    }
}
