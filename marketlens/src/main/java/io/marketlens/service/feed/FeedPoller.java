package io.marketlens.service.feed;

import com.fasterxml.jackson.databind.JsonNode;
import io.marketlens.domain.common.Deadline;
import io.marketlens.domain.common.ErrorKind;
import io.marketlens.domain.data.MarketUpdate;
import io.marketlens.infrastructure.fetch.FetchException;
import io.marketlens.infrastructure.fetch.FetchParams;
import io.marketlens.infrastructure.fetch.RateLimitedFetcher;
import io.marketlens.infrastructure.metrics.GatewayMetrics;
import io.marketlens.service.broadcast.BroadcastEngine;
import io.marketlens.service.cache.TtlCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Polls configured feeds and pushes their updates into the broadcast engine.
 *
 * Each feed gets its own fixed-delay task. A round that is rate limited or hits
 * an open circuit is skipped quietly; any other failure is logged and the task
 * keeps running.
 */
public final class FeedPoller {
    private static final Logger log = LoggerFactory.getLogger(FeedPoller.class);

    private final RateLimitedFetcher fetcher;
    private final MarketUpdateMapper mapper;
    private final TtlCache<MarketUpdate> latestCache;
    private final BroadcastEngine broadcast;
    private final ScheduledExecutorService scheduler;
    private final Duration pollTimeout;
    private final Clock clock;
    private final GatewayMetrics metrics;
    private final List<ScheduledFuture<?>> tasks = new ArrayList<>();

    public FeedPoller(RateLimitedFetcher fetcher,
                      MarketUpdateMapper mapper,
                      TtlCache<MarketUpdate> latestCache,
                      BroadcastEngine broadcast,
                      ScheduledExecutorService scheduler,
                      Duration pollTimeout,
                      Clock clock,
                      GatewayMetrics metrics) {
        this.fetcher = fetcher;
        this.mapper = mapper;
        this.latestCache = latestCache;
        this.broadcast = broadcast;
        this.scheduler = scheduler;
        this.pollTimeout = pollTimeout;
        this.clock = clock;
        this.metrics = metrics;
    }

    public static String cacheKey(FeedSubscription feed) {
        return "feed:" + feed.key();
    }

    public synchronized void start(List<FeedSubscription> feeds, Duration interval) {
        for (FeedSubscription feed : feeds) {
            tasks.add(scheduler.scheduleWithFixedDelay(
                () -> pollSafely(feed), 0, interval.toMillis(), TimeUnit.MILLISECONDS));
            log.info("[FEED] Polling {} every {}ms", feed, interval.toMillis());
        }
    }

    public synchronized void stop() {
        for (ScheduledFuture<?> task : tasks) {
            task.cancel(false);
        }
        tasks.clear();
        log.info("[FEED] Poller stopped");
    }

    /**
     * Poll one feed once.
     *
     * @return number of updates accepted by the broadcast engine
     * @throws FetchException when the fetch itself fails
     */
    public int pollOnce(FeedSubscription feed) {
        FetchParams params = FetchParams.of(feed.symbol(), Map.of(
            "topic", feed.topic().wireName(),
            "timeframe", feed.timeframe().code()));
        JsonNode raw = fetcher.fetch(feed.source(), params, Deadline.after(pollTimeout, clock));

        int published = 0;
        MarketUpdate newest = null;
        for (MarketUpdate update : mapper.map(feed, raw)) {
            if (broadcast.publish(update)) {
                published++;
                newest = update;
            }
        }
        if (newest != null) {
            latestCache.put(cacheKey(feed), newest, feed.timeframe().toDuration());
        }
        metrics.recordFeedPoll(feed.source(), "success");
        return published;
    }

    private void pollSafely(FeedSubscription feed) {
        try {
            int n = pollOnce(feed);
            log.debug("[FEED] {} published {} updates", feed, n);
        } catch (FetchException e) {
            metrics.recordFeedPoll(feed.source(), e.getKind().code().toLowerCase());
            if (e.getKind() == ErrorKind.RATE_LIMITED || e.getKind() == ErrorKind.CIRCUIT_OPEN) {
                log.debug("[FEED] {} skipped: {}", feed, e.getKind());
            } else {
                log.warn("[FEED] {} poll failed: {}", feed, e.toString());
            }
        } catch (RuntimeException e) {
            // a scheduled task that throws is never rescheduled
            metrics.recordFeedPoll(feed.source(), "error");
            log.error("[FEED] {} unexpected poll error", feed, e);
        }
    }
}
