package io.marketlens.service.analysis;

import io.marketlens.domain.analysis.AnalysisRequest;
import io.marketlens.domain.analysis.ContextBundle;
import io.marketlens.domain.analysis.Insight;
import io.marketlens.domain.analysis.ReasoningOutput;
import io.marketlens.domain.common.Deadline;
import io.marketlens.domain.common.ErrorKind;
import io.marketlens.infrastructure.fetch.FetchException;
import io.marketlens.infrastructure.fetch.RateLimitedFetcher;
import io.marketlens.infrastructure.metrics.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one analysis request end to end.
 *
 * Flow:
 * 1. Assemble the context bundle (fails with NO_CONTEXT if every slot errored)
 * 2. Try the local reasoning backend within min(localBudget, remaining)
 * 3. On any local failure, try the cloud backend with whatever is left
 *
 * Both backends are called through the fetcher so each has its own rate
 * limit and circuit. Exactly one insight or one error per request.
 */
public final class OrchestrationRouter {
    private static final Logger log = LoggerFactory.getLogger(OrchestrationRouter.class);

    public static final String LOCAL_SOURCE = "reasoning-local";
    public static final String CLOUD_SOURCE = "reasoning-cloud";

    private final ContextAssembler assembler;
    private final RateLimitedFetcher fetcher;
    private final ReasoningBackend local;
    private final ReasoningBackend cloud;
    private final Duration localBudget;
    private final ExecutorService reasoningPool;
    private final Clock clock;
    private final GatewayMetrics metrics;

    public OrchestrationRouter(ContextAssembler assembler,
                               RateLimitedFetcher fetcher,
                               ReasoningBackend local,
                               ReasoningBackend cloud,
                               Duration localBudget,
                               ExecutorService reasoningPool,
                               Clock clock,
                               GatewayMetrics metrics) {
        this.assembler = assembler;
        this.fetcher = fetcher;
        this.local = local;
        this.cloud = cloud;
        this.localBudget = localBudget;
        this.reasoningPool = reasoningPool;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * @throws OrchestrationException NO_CONTEXT, DEADLINE_EXCEEDED, REASONING_UNAVAILABLE
     *                                or DISCONNECTED when the calling thread is interrupted
     */
    public Insight handle(AnalysisRequest request) {
        long start = System.nanoTime();
        try {
            Insight insight = route(request);
            metrics.recordAnalysis("insight", insight.partial(), Duration.ofNanos(System.nanoTime() - start));
            log.info("[ROUTER] request={} answered by {} (partial={}, confidence={})",
                request.requestId(), insight.backend(), insight.partial(), insight.confidence());
            return insight;
        } catch (OrchestrationException e) {
            metrics.recordAnalysis(e.getKind().code(), false, Duration.ofNanos(System.nanoTime() - start));
            log.warn("[ROUTER] request={} failed: {} ({})", request.requestId(), e.getKind(), e.getMessage());
            throw e;
        }
    }

    private Insight route(AnalysisRequest request) {
        ContextBundle bundle = assembler.assemble(request);
        if (!bundle.hasAnySuccess()) {
            throw new OrchestrationException(request.requestId(), ErrorKind.NO_CONTEXT,
                "Every analyzer slot failed");
        }
        checkInterrupted(request);

        Deadline overall = request.deadline();
        try {
            ReasoningOutput output = attempt(request, LOCAL_SOURCE, local, bundle, overall.cappedAt(localBudget));
            return toInsight(request, bundle, output, local.name());
        } catch (FetchException localFailure) {
            log.info("[ROUTER] request={} local reasoning failed ({}), falling back to cloud",
                request.requestId(), localFailure.getKind());
        }

        try {
            ReasoningOutput output = attempt(request, CLOUD_SOURCE, cloud, bundle, overall);
            return toInsight(request, bundle, output, cloud.name());
        } catch (FetchException cloudFailure) {
            if (cloudFailure.getKind() == ErrorKind.TIMEOUT || overall.isExpired()) {
                throw new OrchestrationException(request.requestId(), ErrorKind.DEADLINE_EXCEEDED,
                    "No reasoning backend answered before the deadline", cloudFailure);
            }
            // a rejected cloud call knows when its source admits again
            throw new OrchestrationException(request.requestId(), ErrorKind.REASONING_UNAVAILABLE,
                "Local and cloud reasoning both failed", cloudFailure, cloudFailure.retryAfter().orElse(null));
        }
    }

    private ReasoningOutput attempt(AnalysisRequest request, String source, ReasoningBackend backend,
                                    ContextBundle bundle, Deadline deadline) {
        Future<ReasoningOutput> future = reasoningPool.submit(
            () -> fetcher.execute(source, deadline, d -> backend.infer(bundle, d)));
        try {
            ReasoningOutput output = future.get(deadline.remainingMillis(), TimeUnit.MILLISECONDS);
            if (output == null) {
                throw new FetchException(source, ErrorKind.UPSTREAM_FAILURE, "Backend returned no output");
            }
            metrics.recordReasoning(backend.name(), "success");
            return output;
        } catch (TimeoutException e) {
            future.cancel(true);
            metrics.recordReasoning(backend.name(), "timeout");
            throw new FetchException(source, ErrorKind.TIMEOUT, "No answer within " + deadline, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            FetchException failure = cause instanceof FetchException
                ? (FetchException) cause
                : new FetchException(source, ErrorKind.UPSTREAM_FAILURE, "Reasoning call failed", cause);
            metrics.recordReasoning(backend.name(), failure.getKind().code());
            throw failure;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new OrchestrationException(request.requestId(), ErrorKind.DISCONNECTED,
                "Request cancelled while waiting for " + backend.name(), e);
        }
    }

    private static void checkInterrupted(AnalysisRequest request) {
        if (Thread.currentThread().isInterrupted()) {
            throw new OrchestrationException(request.requestId(), ErrorKind.DISCONNECTED,
                "Request cancelled during context assembly");
        }
    }

    private Insight toInsight(AnalysisRequest request, ContextBundle bundle, ReasoningOutput output, String backend) {
        return new Insight(
            request.requestId(),
            request.symbols(),
            output.summary(),
            output.outlook(),
            output.confidence(),
            !bundle.isComplete(),
            bundle.missingKinds(),
            backend,
            Instant.now(clock),
            output.details());
    }
}
