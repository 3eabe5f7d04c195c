package io.marketlens.auth;

import java.util.Optional;

/**
 * Resolves a connection credential to a principal.
 */
public interface CredentialVerifier {

    /**
     * @return the principal, or empty if the credential is missing, unknown or invalid
     */
    Optional<Principal> verify(String credential);
}
