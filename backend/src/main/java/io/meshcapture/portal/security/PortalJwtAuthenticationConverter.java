package io.meshcapture.portal.security;

import io.meshcapture.portal.lifecycle.PortalRole;
import java.util.Collection;
import java.util.List;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

@Component
public class PortalJwtAuthenticationConverter
    implements Converter<Jwt, AbstractAuthenticationToken> {

  public static final String ROLE_CLAIM = "role";

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    Collection<GrantedAuthority> authorities = extractAuthorities(jwt);
    return new JwtAuthenticationToken(jwt, authorities, jwt.getSubject());
  }

  private Collection<GrantedAuthority> extractAuthorities(Jwt jwt) {
    PortalRole role = extractRole(jwt);
    if (role == null) {
      return List.of();
    }
    return List.of(new SimpleGrantedAuthority(role.authority()));
  }

  /** Returns the portal role carried by the token, or null if absent or unrecognised. */
  static PortalRole extractRole(Jwt jwt) {
    String value = jwt.getClaimAsString(ROLE_CLAIM);
    if (value == null) {
      return null;
    }
    try {
      return PortalRole.fromValue(value);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
