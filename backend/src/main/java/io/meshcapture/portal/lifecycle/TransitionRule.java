package io.meshcapture.portal.lifecycle;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One admissible edge of the lifecycle graph.
 *
 * @param from originating state
 * @param to target state
 * @param allowedRoles roles that may trigger this move; never empty
 * @param requiresApproval whether the move carries sign-off semantics for the caller
 * @param description human-readable intent, used in confirmation dialogs and audit metadata
 */
public record TransitionRule(
    ProjectState from,
    ProjectState to,
    Set<PortalRole> allowedRoles,
    boolean requiresApproval,
    String description) {

  public TransitionRule {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(allowedRoles, "allowedRoles");
    Objects.requireNonNull(description, "description");
    if (allowedRoles.isEmpty()) {
      throw new IllegalArgumentException(
          "Transition " + from + " -> " + to + " must allow at least one role");
    }
    allowedRoles = Collections.unmodifiableSet(EnumSet.copyOf(allowedRoles));
  }

  public boolean permits(PortalRole role) {
    return allowedRoles.contains(role);
  }

  /** Allowed roles as wire values in declaration order, e.g. {@code "admin, sales_lead"}. */
  public String allowedRolesDisplay() {
    return allowedRoles.stream().map(PortalRole::value).collect(Collectors.joining(", "));
  }
}
