package com.emcit.api.security;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.OctetSequenceKey;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import com.nimbusds.jose.jwk.source.JWKSource;
import com.nimbusds.jose.proc.SecurityContext;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtValidators;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

/**
 * Session tokens for the admin console and staff portal: HS256, signed and verified with one
 * key derived from {@code emcit.auth.jwtSecret}. Decoding also pins the issuer.
 */
@Configuration
public class JwtBeans {

  static final int MIN_SECRET_LENGTH = 16;
  private static final String DEV_SECRET = "emcit-dev-secret-change-me";

  private final Environment env;

  public JwtBeans(Environment env) {
    this.env = env;
  }

  @Bean
  public PasswordEncoder passwordEncoder() {
    return new BCryptPasswordEncoder();
  }

  @Bean
  public SecretKey jwtSigningKey(@Value("${emcit.auth.jwtSecret:}") String secret) {
    return new SecretKeySpec(deriveKey(secret), "HmacSHA256");
  }

  @Bean
  @ConditionalOnMissingBean(name = "jwtEncoder")
  public JwtEncoder jwtEncoder(SecretKey jwtSigningKey) {
    var jwk = new OctetSequenceKey.Builder(jwtSigningKey)
        .algorithm(JWSAlgorithm.HS256)
        .keyID("emcit-hs256")
        .build();
    JWKSource<SecurityContext> jwkSource = new ImmutableJWKSet<>(new JWKSet(jwk));
    return new NimbusJwtEncoder(jwkSource);
  }

  @Bean
  @ConditionalOnMissingBean(name = "jwtDecoder")
  public JwtDecoder jwtDecoder(SecretKey jwtSigningKey, @Value("${emcit.auth.issuer}") String issuer) {
    NimbusJwtDecoder decoder = NimbusJwtDecoder.withSecretKey(jwtSigningKey)
        .macAlgorithm(MacAlgorithm.HS256)
        .build();
    decoder.setJwtValidator(JwtValidators.createDefaultWithIssuer(issuer));
    return decoder;
  }

  private byte[] deriveKey(String secret) {
    String s = (secret == null) ? "" : secret.trim();
    boolean dev = env.acceptsProfiles(Profiles.of("dev"));
    if (s.isEmpty() && dev) {
      s = DEV_SECRET;
    }
    if (s.length() < MIN_SECRET_LENGTH) {
      throw new IllegalStateException("emcit.auth.jwtSecret must be at least " + MIN_SECRET_LENGTH
          + " characters. Set EMCIT_JWT_SECRET.");
    }

    try {
      return MessageDigest.getInstance("SHA-256").digest(s.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
