package io.marketlens.bootstrap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.marketlens.auth.StaticTokenVerifier;
import io.marketlens.config.GatewayConfig;
import io.marketlens.domain.analysis.AnalysisKind;
import io.marketlens.domain.data.MarketUpdate;
import io.marketlens.infrastructure.fetch.RateLimitedFetcher;
import io.marketlens.infrastructure.http.HttpAnalyzerBackend;
import io.marketlens.infrastructure.http.HttpFeedSource;
import io.marketlens.infrastructure.http.HttpJsonClient;
import io.marketlens.infrastructure.http.HttpReasoningBackend;
import io.marketlens.infrastructure.metrics.PrometheusGatewayMetrics;
import io.marketlens.infrastructure.metrics.PrometheusMetricsHandler;
import io.marketlens.security.InputValidator;
import io.marketlens.service.analysis.AnalyzerBackend;
import io.marketlens.service.analysis.ContextAssembler;
import io.marketlens.service.analysis.OrchestrationRouter;
import io.marketlens.service.broadcast.BroadcastEngine;
import io.marketlens.service.broadcast.SubscriptionRegistry;
import io.marketlens.service.cache.TtlCache;
import io.marketlens.service.feed.FeedPoller;
import io.marketlens.service.feed.FeedSource;
import io.marketlens.service.feed.FeedSubscription;
import io.marketlens.service.feed.MarketUpdateMapper;
import io.marketlens.transport.http.HealthHandler;
import io.marketlens.transport.ws.DeliveryPump;
import io.marketlens.transport.ws.FrameCodec;
import io.marketlens.transport.ws.Gateway;
import io.marketlens.transport.ws.UndertowGatewayEndpoint;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core Java entry point (NO Spring).
 *
 * Every shared registry (fetcher guards, caches, subscriptions, connections)
 * is an explicit object built here once and handed to its users by constructor.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final String ALPHA_VANTAGE = "alpha_vantage";
    static final String NEWS_API = "news_api";

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== MarketLens Gateway Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        GatewayConfig config = GatewayConfig.fromEnv();
        StartupConfigValidator.validate(config);

        Clock clock = Clock.systemUTC();
        ObjectMapper mapper = new ObjectMapper();

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusGatewayMetrics metrics = new PrometheusGatewayMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Upstream admission control + HTTP bridges
        // ═══════════════════════════════════════════════════════════════
        RateLimitedFetcher fetcher = new RateLimitedFetcher(clock, metrics);
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();

        HttpJsonClient analysisClient = new HttpJsonClient(httpClient, mapper, config.analysisServiceUrl());
        for (AnalysisKind kind : AnalysisKind.analyzerKinds()) {
            AnalyzerBackend backend = new HttpAnalyzerBackend(kind, analysisClient);
            fetcher.registerSource(ContextAssembler.sourceFor(kind), config.analyzerLimits(), backend.asUpstream());
        }
        fetcher.registerGuard(OrchestrationRouter.LOCAL_SOURCE, config.reasoningLimits());
        fetcher.registerGuard(OrchestrationRouter.CLOUD_SOURCE, config.reasoningLimits());

        HttpJsonClient feedClient = new HttpJsonClient(httpClient, mapper, config.feedServiceUrl());
        FeedSource prices = new HttpFeedSource(ALPHA_VANTAGE, feedClient);
        FeedSource news = new HttpFeedSource(NEWS_API, feedClient);
        fetcher.registerSource(prices.name(), config.alphaVantageLimits(), prices.asUpstream());
        fetcher.registerSource(news.name(), config.newsApiLimits(), news.asUpstream());
        for (FeedSubscription feed : config.feeds()) {
            if (fetcher.guard(feed.source()) == null) {
                throw new IllegalStateException("FEEDS entry " + feed + " names unknown source " + feed.source()
                    + " (known: " + fetcher.sources() + ")");
            }
        }
        log.info("✓ Fetcher sources registered: {}", fetcher.sources());

        // ═══════════════════════════════════════════════════════════════
        // Caches (expired entries swept off the read path)
        // ═══════════════════════════════════════════════════════════════
        TtlCache<JsonNode> analysisCache = new TtlCache<>("analysis", clock, metrics);
        TtlCache<MarketUpdate> feedCache = new TtlCache<>("feed", clock, metrics);
        ScheduledExecutorService maintenance = Executors.newScheduledThreadPool(2, named("maintenance"));
        long sweepMs = config.cacheSweepInterval().toMillis();
        maintenance.scheduleAtFixedRate(() -> {
            analysisCache.purgeExpired();
            feedCache.purgeExpired();
        }, sweepMs, sweepMs, TimeUnit.MILLISECONDS);

        // ═══════════════════════════════════════════════════════════════
        // Analysis: assembler + router
        // ═══════════════════════════════════════════════════════════════
        ExecutorService analyzerPool = Executors.newFixedThreadPool(config.analyzerThreads(), named("analyzer"));
        ExecutorService reasoningPool = Executors.newFixedThreadPool(config.reasoningThreads(), named("reasoning"));
        ExecutorService analysisPool = Executors.newFixedThreadPool(config.analysisThreads(), named("analysis"));

        ContextAssembler assembler = new ContextAssembler(fetcher, analysisCache, config.analysisTtls(), analyzerPool);
        OrchestrationRouter router = new OrchestrationRouter(
            assembler,
            fetcher,
            new HttpReasoningBackend("local", new HttpJsonClient(httpClient, mapper, config.localReasoningUrl()), "/v1/reason"),
            new HttpReasoningBackend("cloud", new HttpJsonClient(httpClient, mapper, config.cloudReasoningUrl()), "/v1/reason"),
            config.localReasoningBudget(),
            reasoningPool,
            clock,
            metrics);
        log.info("✓ Orchestration router ready (local budget {}ms)", config.localReasoningBudget().toMillis());

        // ═══════════════════════════════════════════════════════════════
        // Broadcast + Gateway
        // ═══════════════════════════════════════════════════════════════
        SubscriptionRegistry registry = new SubscriptionRegistry();
        BroadcastEngine broadcast = new BroadcastEngine(registry, metrics);
        FrameCodec codec = new FrameCodec(mapper, clock);

        Gateway gateway = new Gateway(
            StaticTokenVerifier.parse(config.gatewayTokens()),
            broadcast,
            router,
            analysisPool,
            codec,
            new InputValidator(),
            config.features(),
            new Gateway.Settings(config.outboundBufferCapacity(), config.drainTimeout(),
                config.defaultDeadline(), config.maxDeadline()),
            clock,
            metrics);
        maintenance.scheduleAtFixedRate(gateway::sweepDraining, 1, 1, TimeUnit.SECONDS);

        DeliveryPump pump = new DeliveryPump(gateway::sessions, codec, config.deliveryBatchMax());
        pump.start(config.flushInterval());

        // ═══════════════════════════════════════════════════════════════
        // Feed ingestion
        // ═══════════════════════════════════════════════════════════════
        FeedPoller poller = new FeedPoller(fetcher, new MarketUpdateMapper(), feedCache, broadcast,
            Executors.newScheduledThreadPool(2, named("feed-poller")), Duration.ofSeconds(10), clock, metrics);
        List<FeedSubscription> feeds = config.features().realTimeUpdates() ? config.feeds() : List.of();
        poller.start(feeds, config.feedPollInterval());

        // ═══════════════════════════════════════════════════════════════
        // HTTP server
        // ═══════════════════════════════════════════════════════════════
        int port = config.port();
        RoutingHandler routes = Handlers.routing()
            .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            .get("/health", new HealthHandler(gateway, registry, fetcher, mapper))
            .get("/ws", new UndertowGatewayEndpoint(gateway).websocketHandler())
            .setFallbackHandler(exchange -> {
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "MarketLens Gateway\n\n" +
                    "HTTP: GET /health, /metrics\n" +
                    "WS:   ws://localhost:" + port + "/ws?token=<token>\n");
            });

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(routes)
            .build();
        server.start();
        log.info("✓ MarketLens Gateway started on http://localhost:{}/", port);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            poller.stop();
            gateway.shutdown();
            pump.stop();
            server.stop();
            analysisPool.shutdownNow();
            reasoningPool.shutdownNow();
            analyzerPool.shutdownNow();
            maintenance.shutdownNow();
            log.info("MarketLens Gateway stopped");
        }, "shutdown"));
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private App() {}
}
