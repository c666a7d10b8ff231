package com.emcit.domain.vault;

/**
 * One-shot plaintext result of a reveal. Never cached or persisted.
 */
public record RevealedSecrets(String productKey, String password) {

    public static final String NO_PASSWORD = "N/A";

    @Override
    public String toString() {
        return "RevealedSecrets[****]";
    }
}
