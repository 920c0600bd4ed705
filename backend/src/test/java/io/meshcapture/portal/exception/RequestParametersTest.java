package io.meshcapture.portal.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.meshcapture.portal.lifecycle.PortalRole;
import io.meshcapture.portal.lifecycle.ProjectState;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class RequestParametersTest {

  @Test
  void requireState_acceptsLabelIgnoringCase() {
    assertThat(RequestParameters.requireState("to", " delivered "))
        .isEqualTo(ProjectState.DELIVERED);
  }

  @Test
  void requireState_unknownLabel_isBadRequest() {
    assertThatThrownBy(() -> RequestParameters.requireState("targetState", "In Progress"))
        .isInstanceOfSatisfying(
            InvalidRequestException.class,
            ex -> {
              assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
              assertThat(ex.getBody().getDetail())
                  .isEqualTo("Parameter 'targetState' is not a valid project state: In Progress");
            });
  }

  @Test
  void optionalState_absentValue_isNull() {
    assertThat(RequestParameters.optionalState("state", null)).isNull();
  }

  @Test
  void requireRole_unknownValue_isBadRequest() {
    assertThat(RequestParameters.requireRole("role", "approver")).isEqualTo(PortalRole.APPROVER);
    assertThatThrownBy(() -> RequestParameters.requireRole("role", "superuser"))
        .isInstanceOfSatisfying(
            InvalidRequestException.class,
            ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST));
  }
}
