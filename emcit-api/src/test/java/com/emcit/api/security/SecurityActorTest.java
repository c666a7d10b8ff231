package com.emcit.api.security;

import com.emcit.domain.access.Actor;
import com.emcit.domain.access.Role;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.security.authentication.TestingAuthenticationToken;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class SecurityActorTest {

  @AfterEach
  void clear() {
    SecurityContextHolder.clearContext();
  }

  private static Jwt jwt(String subject, String role) {
    var b = Jwt.withTokenValue("t").header("alg", "HS256");
    if (subject != null) b.subject(subject);
    if (role != null) b.claim("role", role);
    return b.build();
  }

  @Test
  void actorFromSubjectAndRoleClaim() {
    UUID id = UUID.randomUUID();

    Actor actor = SecurityActor.fromJwt(jwt(id.toString(), "super_admin"));

    assertThat(actor).isEqualTo(new Actor(id, Role.SUPER_ADMIN));
  }

  @Test
  void unknownRoleOrBadSubjectGivesNoActor() {
    assertThat(SecurityActor.fromJwt(jwt(UUID.randomUUID().toString(), "root"))).isNull();
    assertThat(SecurityActor.fromJwt(jwt("not-a-uuid", "admin"))).isNull();
    assertThat(SecurityActor.fromJwt(jwt(UUID.randomUUID().toString(), null))).isNull();
  }

  @Test
  void currentReadsJwtAuthenticationOnly() {
    assertThat(SecurityActor.current()).isNull();

    SecurityContextHolder.getContext().setAuthentication(new TestingAuthenticationToken("x", "y", "ROLE_ADMIN"));
    assertThat(SecurityActor.current()).isNull();

    UUID id = UUID.randomUUID();
    SecurityContextHolder.getContext().setAuthentication(new JwtAuthenticationToken(jwt(id.toString(), "admin")));
    assertThat(SecurityActor.current()).isEqualTo(new Actor(id, Role.ADMIN));
  }
}
