package io.marketlens.domain.data;

import java.time.Duration;
import java.util.List;

/**
 * Candle/aggregation timeframe such as {@code 1m}, {@code 4h} or {@code 1M}.
 *
 * Standard timeframes are 1m 5m 15m 30m 1h 4h 1d 1w 1M. Any other positive
 * {@code <value><unit>} combination is accepted as a custom timeframe.
 */
public record Timeframe(int value, Unit unit) {

    public enum Unit {
        MINUTES('m', 60),
        HOURS('h', 3_600),
        DAYS('d', 86_400),
        WEEKS('w', 604_800),
        MONTHS('M', 2_592_000); // 30-day month

        private final char symbol;
        private final long seconds;

        Unit(char symbol, long seconds) {
            this.symbol = symbol;
            this.seconds = seconds;
        }

        public char symbol() {
            return symbol;
        }

        public long seconds() {
            return seconds;
        }

        static Unit fromSymbol(char c) {
            for (Unit u : values()) {
                if (u.symbol == c) return u;
            }
            return null;
        }
    }

    public static final Timeframe ONE_MINUTE = new Timeframe(1, Unit.MINUTES);
    public static final Timeframe FIVE_MINUTES = new Timeframe(5, Unit.MINUTES);
    public static final Timeframe FIFTEEN_MINUTES = new Timeframe(15, Unit.MINUTES);
    public static final Timeframe THIRTY_MINUTES = new Timeframe(30, Unit.MINUTES);
    public static final Timeframe ONE_HOUR = new Timeframe(1, Unit.HOURS);
    public static final Timeframe FOUR_HOURS = new Timeframe(4, Unit.HOURS);
    public static final Timeframe ONE_DAY = new Timeframe(1, Unit.DAYS);
    public static final Timeframe ONE_WEEK = new Timeframe(1, Unit.WEEKS);
    public static final Timeframe ONE_MONTH = new Timeframe(1, Unit.MONTHS);

    private static final List<Timeframe> STANDARD = List.of(
        ONE_MINUTE, FIVE_MINUTES, FIFTEEN_MINUTES, THIRTY_MINUTES,
        ONE_HOUR, FOUR_HOURS, ONE_DAY, ONE_WEEK, ONE_MONTH);

    public Timeframe {
        if (value <= 0) {
            throw new IllegalArgumentException("Timeframe value must be positive: " + value);
        }
        if (unit == null) {
            throw new IllegalArgumentException("Timeframe unit is required");
        }
    }

    /**
     * Parse a timeframe code. Unit symbols are case-sensitive ({@code m} minutes, {@code M} months).
     *
     * @throws IllegalArgumentException if the code is malformed or not positive
     */
    public static Timeframe parse(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Timeframe is required");
        }
        String s = code.trim();
        if (s.length() < 2) {
            throw new IllegalArgumentException("Invalid timeframe format: " + code);
        }
        Unit unit = Unit.fromSymbol(s.charAt(s.length() - 1));
        if (unit == null) {
            throw new IllegalArgumentException("Invalid timeframe unit: " + code);
        }
        int value;
        try {
            value = Integer.parseInt(s.substring(0, s.length() - 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid timeframe value: " + code);
        }
        return new Timeframe(value, unit);
    }

    public static List<Timeframe> standardTimeframes() {
        return STANDARD;
    }

    public boolean isStandard() {
        return STANDARD.contains(this);
    }

    public Duration toDuration() {
        return Duration.ofSeconds(value * unit.seconds());
    }

    public String code() {
        return String.valueOf(value) + unit.symbol();
    }

    @Override
    public String toString() {
        return code();
    }
}
