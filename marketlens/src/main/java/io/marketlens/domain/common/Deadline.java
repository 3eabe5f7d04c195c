package io.marketlens.domain.common;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Absolute point in time by which a request must finish.
 *
 * Passed explicitly through every call boundary (request, assembler, analyzers,
 * reasoning backends) so nested calls always see the remaining budget rather
 * than a fresh per-layer timeout.
 */
public final class Deadline {

    private final Instant expiresAt;
    private final Clock clock;

    private Deadline(Instant expiresAt, Clock clock) {
        this.expiresAt = expiresAt;
        this.clock = clock;
    }

    public static Deadline after(Duration budget) {
        return after(budget, Clock.systemUTC());
    }

    public static Deadline after(Duration budget, Clock clock) {
        if (budget == null || budget.isNegative()) {
            throw new IllegalArgumentException("Deadline budget must be non-negative");
        }
        return new Deadline(clock.instant().plus(budget), clock);
    }

    public static Deadline at(Instant expiresAt, Clock clock) {
        return new Deadline(expiresAt, clock);
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    /**
     * Remaining budget, never negative.
     */
    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public long remainingMillis() {
        return remaining().toMillis();
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    /**
     * Sub-deadline that expires after {@code budget} or at this deadline, whichever is first.
     */
    public Deadline cappedAt(Duration budget) {
        Instant capped = clock.instant().plus(budget);
        return capped.isBefore(expiresAt) ? new Deadline(capped, clock) : this;
    }

    @Override
    public String toString() {
        return "Deadline{remaining=" + remainingMillis() + "ms}";
    }
}
