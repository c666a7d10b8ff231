package com.emcit.api.security;

import com.emcit.domain.access.Actor;
import com.emcit.domain.access.Role;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

import java.util.Optional;
import java.util.UUID;

/**
 * Provides a stable way for service-layer code to understand who is acting.
 *
 * - actor id = JWT subject
 * - role = JWT claim "role"
 * - no JWT, unparsable subject or unknown role = no actor (fails every gate)
 */
public final class SecurityActor {

  private SecurityActor() {}

  public static Actor current() {
    Authentication auth = SecurityContextHolder.getContext().getAuthentication();
    if (!(auth instanceof JwtAuthenticationToken jat)) {
      return null;
    }
    return fromJwt(jat.getToken());
  }

  static Actor fromJwt(Jwt jwt) {
    UUID userId = parseUuidOrNull(jwt.getSubject());
    Optional<Role> role = Role.parse(jwt.getClaimAsString("role"));
    if (userId == null || role.isEmpty()) {
      return null;
    }
    return new Actor(userId, role.get());
  }

  private static UUID parseUuidOrNull(String value) {
    if (value == null || value.isBlank()) return null;
    try {
      return UUID.fromString(value.trim());
    } catch (IllegalArgumentException ignored) {
      return null;
    }
  }
}
