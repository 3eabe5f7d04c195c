package io.marketlens.domain.data;

/**
 * Subscription topics. The wire name is what clients send in subscribe frames.
 */
public enum Topic {
    OHLCV("ohlcv"),
    TICK("tick"),
    NEWS("news");

    private final String wireName;

    Topic(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @throws IllegalArgumentException for unknown topics
     */
    public static Topic fromWire(String name) {
        if (name != null) {
            for (Topic t : values()) {
                if (t.wireName.equalsIgnoreCase(name.trim())) {
                    return t;
                }
            }
        }
        throw new IllegalArgumentException("Unknown topic: " + name);
    }
}
