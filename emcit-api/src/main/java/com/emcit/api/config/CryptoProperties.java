package com.emcit.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Process-wide encryption key for secrets at rest and challenge tokens.
 *
 * IMPORTANT:
 * - 32 random bytes, base64 encoded (e.g. {@code openssl rand -base64 32})
 * - Must come from env (EMCIT_ENCRYPTION_KEY) or a secret store, never from the repo
 * - Rotating it makes every stored product key and password unreadable
 */
@ConfigurationProperties(prefix = "emcit.crypto")
public record CryptoProperties(String encryptionKey) {

  @Override
  public String toString() {
    return "CryptoProperties[encryptionKey=****]";
  }
}
