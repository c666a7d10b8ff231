package com.emcit.api.auth;

import com.emcit.api.tracing.RequestContext;
import com.emcit.application.audit.AuditActions;
import com.emcit.application.audit.AuditRecorder;
import com.emcit.domain.access.Role;
import com.emcit.infrastructure.user.UserEntity;
import com.emcit.infrastructure.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.jwt.*;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

@Service
public class AuthService {

  private static final Logger log = LoggerFactory.getLogger(AuthService.class);

  private final UserRepository users;
  private final PasswordEncoder passwordEncoder;
  private final JwtEncoder jwtEncoder;
  private final AuditRecorder audit;
  private final Clock clock;

  private final String issuer;
  private final long accessTokenMinutes;

  public AuthService(
      UserRepository users,
      PasswordEncoder passwordEncoder,
      JwtEncoder jwtEncoder,
      AuditRecorder audit,
      Clock clock,
      @Value("${emcit.auth.issuer}") String issuer,
      @Value("${emcit.auth.accessTokenMinutes}") long accessTokenMinutes
  ) {
    this.users = users;
    this.passwordEncoder = passwordEncoder;
    this.jwtEncoder = jwtEncoder;
    this.audit = audit;
    this.clock = clock;
    this.issuer = issuer;
    this.accessTokenMinutes = accessTokenMinutes;
  }

  public AccessToken login(String email, String password) {
    String normalized = normalizeEmail(email);
    var entity = users.findByEmailIgnoreCase(normalized)
        .orElseThrow(() -> new IllegalArgumentException("Invalid email or password"));

    if (!passwordEncoder.matches(password, entity.getPasswordHash())) {
      throw new IllegalArgumentException("Invalid email or password");
    }
    if (Role.parse(entity.getRole()).isEmpty()) {
      log.warn("User {} has unknown role '{}'; login refused", entity.getId(), entity.getRole());
      throw new IllegalArgumentException("Invalid email or password");
    }

    AccessToken token = issue(entity, Role.parse(entity.getRole()).orElseThrow());
    audit.record(entity.getId(), AuditActions.LOGIN, AuditActions.target("user", entity.getId()),
        RequestContext.originAddress());
    return token;
  }

  private AccessToken issue(UserEntity user, Role role) {
    Instant now = clock.instant();
    Instant exp = now.plus(accessTokenMinutes, ChronoUnit.MINUTES);

    var claims = JwtClaimsSet.builder()
        .issuer(issuer)
        .issuedAt(now)
        .expiresAt(exp)
        .subject(user.getId().toString())
        .claim("email", user.getEmail())
        .claim("role", role.claim())
        .build();

    // Pin HS256 explicitly; the encoder cannot pick a MAC key without it.
    final String value;
    try {
      value = jwtEncoder.encode(
          JwtEncoderParameters.from(JwsHeader.with(MacAlgorithm.HS256).build(), claims)
      ).getTokenValue();
    } catch (JwtEncodingException e) {
      log.error("JWT encode failed (check emcit.auth.jwtSecret / issuer config)", e);
      throw e;
    }
    return new AccessToken(value, ChronoUnit.SECONDS.between(now, exp), role);
  }

  private static String normalizeEmail(String email) {
    if (email == null) return "";
    return email.trim().toLowerCase(Locale.ROOT);
  }

  public record AccessToken(String value, long expiresInSeconds, Role role) {}
}
