package com.emcit.api.security;

import com.emcit.domain.access.Role;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

import java.util.List;

/**
 * Maps JWT claim "role" ("user", "admin", "super_admin") to ROLE_USER, ROLE_ADMIN, ROLE_SUPER_ADMIN.
 * A missing or unknown role grants nothing; the token still authenticates, so the vault answers
 * such callers with its own refusal.
 */
public final class JwtRoleConverter implements Converter<Jwt, AbstractAuthenticationToken> {

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    List<GrantedAuthority> authorities = Role.parse(jwt.getClaimAsString("role"))
        .<List<GrantedAuthority>>map(r -> List.of(new SimpleGrantedAuthority("ROLE_" + r.name())))
        .orElse(List.of());
    return new JwtAuthenticationToken(jwt, authorities, jwt.getSubject());
  }
}
