package io.meshcapture.portal.exception;

import io.meshcapture.portal.lifecycle.PortalRole;
import io.meshcapture.portal.lifecycle.ProjectState;

/** Parses lifecycle values arriving in requests, rejecting unknown ones with a 400. */
public final class RequestParameters {

  private RequestParameters() {}

  public static ProjectState requireState(String parameter, String value) {
    try {
      return ProjectState.fromLabel(value);
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException(
          "Parameter '%s' is not a valid project state: %s".formatted(parameter, value));
    }
  }

  /** Like {@link #requireState} but maps an absent value to null. */
  public static ProjectState optionalState(String parameter, String value) {
    return value != null ? requireState(parameter, value) : null;
  }

  public static PortalRole requireRole(String parameter, String value) {
    try {
      return PortalRole.fromValue(value);
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException(
          "Parameter '%s' is not a valid portal role: %s".formatted(parameter, value));
    }
  }
}
