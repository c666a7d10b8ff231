package com.emcit.api.security;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtValidationException;

import javax.crypto.SecretKey;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtBeansTest {

  private static final String SECRET = "unit-test-secret-0123456789";

  private static String mint(JwtBeans beans, SecretKey key, String issuer) {
    var claims = JwtClaimsSet.builder()
        .issuer(issuer)
        .subject("u-1")
        .issuedAt(Instant.now())
        .expiresAt(Instant.now().plusSeconds(300))
        .claim("role", "admin")
        .build();
    return beans.jwtEncoder(key)
        .encode(JwtEncoderParameters.from(JwsHeader.with(MacAlgorithm.HS256).build(), claims))
        .getTokenValue();
  }

  @Test
  void tokenFromOwnIssuerDecodes() {
    var beans = new JwtBeans(new MockEnvironment());
    SecretKey key = beans.jwtSigningKey(SECRET);

    var jwt = beans.jwtDecoder(key, "emcit-one").decode(mint(beans, key, "emcit-one"));

    assertThat(jwt.getSubject()).isEqualTo("u-1");
    assertThat(jwt.getClaimAsString("role")).isEqualTo("admin");
  }

  @Test
  void foreignIssuerIsRejected() {
    var beans = new JwtBeans(new MockEnvironment());
    SecretKey key = beans.jwtSigningKey(SECRET);
    String token = mint(beans, key, "someone-else");

    assertThatThrownBy(() -> beans.jwtDecoder(key, "emcit-one").decode(token))
        .isInstanceOf(JwtValidationException.class);
  }

  @Test
  void shortOrBlankSecretFailsOutsideDev() {
    var beans = new JwtBeans(new MockEnvironment());

    assertThatThrownBy(() -> beans.jwtSigningKey("")).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> beans.jwtSigningKey("too-short")).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void devProfileFallsBackWhenBlank() {
    var env = new MockEnvironment();
    env.setActiveProfiles("dev");

    assertThat(new JwtBeans(env).jwtSigningKey(" ").getEncoded()).hasSize(32);
  }
}
