package com.protocolguide.api.security;

import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Maps the "role" claim ("USER", "ADMIN") or a "roles" list to ROLE_* authorities.
 * No role claim means ROLE_USER.
 */
public final class JwtRoleConverter implements Converter<Jwt, AbstractAuthenticationToken> {

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    Collection<SimpleGrantedAuthority> authorities = new ArrayList<>();
    String role = jwt.getClaimAsString("role");
    if (role != null && !role.isBlank()) {
      authorities.add(authority(role));
    }
    List<String> roles = jwt.getClaimAsStringList("roles");
    if (roles != null) {
      roles.stream().filter(r -> r != null && !r.isBlank()).map(JwtRoleConverter::authority).forEach(authorities::add);
    }
    if (authorities.isEmpty()) {
      authorities.add(new SimpleGrantedAuthority("ROLE_USER"));
    }
    return new JwtAuthenticationToken(jwt, authorities, jwt.getSubject());
  }

  private static SimpleGrantedAuthority authority(String role) {
    return new SimpleGrantedAuthority("ROLE_" + role.trim().toUpperCase(Locale.ROOT));
  }
}
