package io.marketlens.auth;

/**
 * Opaque authenticated identity. The gateway never interprets it.
 */
public record Principal(String id) {

    public Principal {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Principal id is required");
        }
    }

    @Override
    public String toString() {
        return id;
    }
}
