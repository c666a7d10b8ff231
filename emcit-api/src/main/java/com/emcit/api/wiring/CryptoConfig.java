package com.emcit.api.wiring;

import com.emcit.api.config.CryptoProperties;
import com.emcit.application.ports.CryptoPort;
import com.emcit.infrastructure.security.AesGcmSecretCipher;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Encryption boundary.
 * Fail-fast: a missing or malformed key aborts startup, so nothing can be stored unencrypted.
 */
@Configuration
@EnableConfigurationProperties(CryptoProperties.class)
public class CryptoConfig {

  @Bean
  public CryptoPort cryptoPort(CryptoProperties props) {
    return AesGcmSecretCipher.fromBase64Key(props.encryptionKey());
  }
}
