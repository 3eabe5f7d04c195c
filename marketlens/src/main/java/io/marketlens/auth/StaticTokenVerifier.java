package io.marketlens.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Verifies bearer tokens against a fixed token -> principal table
 * (configured as {@code GATEWAY_TOKENS=token:principal,...}).
 */
public final class StaticTokenVerifier implements CredentialVerifier {
    private static final Logger log = LoggerFactory.getLogger(StaticTokenVerifier.class);

    private final Map<String, Principal> tokens;

    public StaticTokenVerifier(Map<String, String> tokenToPrincipal) {
        Map<String, Principal> m = new LinkedHashMap<>();
        tokenToPrincipal.forEach((token, principal) -> m.put(token, new Principal(principal)));
        this.tokens = Map.copyOf(m);
    }

    /**
     * @throws IllegalArgumentException on a malformed entry
     */
    public static StaticTokenVerifier parse(String raw) {
        Map<String, String> m = new LinkedHashMap<>();
        if (raw != null && !raw.isBlank()) {
            for (String entry : raw.split(",")) {
                if (entry.isBlank()) continue;
                int idx = entry.indexOf(':');
                if (idx <= 0 || idx == entry.length() - 1) {
                    throw new IllegalArgumentException("Invalid token entry (expected token:principal)");
                }
                m.put(entry.substring(0, idx).trim(), entry.substring(idx + 1).trim());
            }
        }
        log.info("[AUTH] Loaded {} gateway tokens", m.size());
        return new StaticTokenVerifier(m);
    }

    @Override
    public Optional<Principal> verify(String credential) {
        if (credential == null || credential.isBlank()) {
            return Optional.empty();
        }
        byte[] presented = credential.getBytes(StandardCharsets.UTF_8);
        Principal match = null;
        for (Map.Entry<String, Principal> e : tokens.entrySet()) {
            // constant-time compare on every entry
            if (MessageDigest.isEqual(presented, e.getKey().getBytes(StandardCharsets.UTF_8))) {
                match = e.getValue();
            }
        }
        return Optional.ofNullable(match);
    }

    public int size() {
        return tokens.size();
    }
}
