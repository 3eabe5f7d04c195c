package io.marketlens.infrastructure.fetch;

import java.time.Duration;

/**
 * Admission settings for one external source.
 *
 * @param burst            bucket capacity
 * @param refillTokens     tokens added per {@code refillPeriod}
 * @param failureThreshold consecutive failures that open the circuit
 * @param coolDown         how long the circuit stays open before a probe
 */
public record SourceLimits(
    long burst,
    long refillTokens,
    Duration refillPeriod,
    int failureThreshold,
    Duration coolDown
) {
    public static SourceLimits perMinute(long requests, int failureThreshold, Duration coolDown) {
        return new SourceLimits(requests, requests, Duration.ofMinutes(1), failureThreshold, coolDown);
    }

    public static SourceLimits perHour(long requests, int failureThreshold, Duration coolDown) {
        return new SourceLimits(requests, requests, Duration.ofHours(1), failureThreshold, coolDown);
    }
}
