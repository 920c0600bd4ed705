package io.meshcapture.portal.security;

import io.meshcapture.portal.exception.ForbiddenException;
import io.meshcapture.portal.lifecycle.PortalRole;
import java.util.Objects;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Identity of the user performing a lifecycle action. The role is taken as already scoped to the
 * project by the identity provider; no per-project assignment check happens here.
 *
 * @param userId token subject
 * @param role portal role from the {@value PortalJwtAuthenticationConverter#ROLE_CLAIM} claim
 */
public record ActingUser(String userId, PortalRole role) {

  public ActingUser {
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(role, "role");
  }

  /**
   * Resolves the acting user from a validated token.
   *
   * @throws ForbiddenException if the token carries no recognised role claim
   */
  public static ActingUser from(Jwt jwt) {
    PortalRole role = PortalJwtAuthenticationConverter.extractRole(jwt);
    if (role == null || jwt.getSubject() == null) {
      throw ForbiddenException.missingRole();
    }
    return new ActingUser(jwt.getSubject(), role);
  }
}
