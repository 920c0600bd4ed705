package io.meshcapture.portal.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.meshcapture.portal.exception.ForbiddenException;
import io.meshcapture.portal.lifecycle.PortalRole;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;

class PortalJwtAuthenticationConverterTest {

  private final PortalJwtAuthenticationConverter converter = new PortalJwtAuthenticationConverter();

  @Test
  void convert_grantsAuthorityForRoleClaim() {
    var token = converter.convert(jwtWithRole("sales_lead"));

    assertThat(token.getAuthorities())
        .extracting(GrantedAuthority::getAuthority)
        .containsExactly("ROLE_SALES_LEAD");
    assertThat(token.getName()).isEqualTo("user_42");
  }

  @Test
  void convert_unknownRole_grantsNothing() {
    var token = converter.convert(jwtWithRole("superuser"));

    assertThat(token.getAuthorities()).isEmpty();
  }

  @Test
  void actingUser_resolvesSubjectAndRole() {
    var actor = ActingUser.from(jwtWithRole("customer_owner"));

    assertThat(actor.userId()).isEqualTo("user_42");
    assertThat(actor.role()).isEqualTo(PortalRole.CUSTOMER_OWNER);
  }

  @Test
  void actingUser_missingRole_isForbidden() {
    var jwt =
        Jwt.withTokenValue("token")
            .header("alg", "none")
            .subject("user_42")
            .issuedAt(Instant.now())
            .build();

    assertThatThrownBy(() -> ActingUser.from(jwt)).isInstanceOf(ForbiddenException.class);
  }

  private static Jwt jwtWithRole(String role) {
    return Jwt.withTokenValue("token")
        .header("alg", "none")
        .subject("user_42")
        .claim(PortalJwtAuthenticationConverter.ROLE_CLAIM, role)
        .issuedAt(Instant.now())
        .build();
  }
}
