package io.meshcapture.portal.lifecycle;

import java.util.Objects;

/**
 * Sole authority on whether a project may move from one state to another for a given role. Pure
 * and stateless; safe to call from any thread.
 */
public final class TransitionValidator {

  private TransitionValidator() {}

  /**
   * Decides whether {@code actingRole} may move a project from {@code currentState} to {@code
   * targetState}.
   *
   * <ol>
   *   <li>Same state: valid no-op, decided before any table lookup.
   *   <li>No rule for the pair: invalid. There are no shortcuts over intermediate states.
   *   <li>Role outside the rule's allowed roles: invalid.
   *   <li>Otherwise valid, carrying the matched rule.
   * </ol>
   *
   * @throws NullPointerException if any argument is null
   */
  public static TransitionDecision validate(
      ProjectState currentState, ProjectState targetState, PortalRole actingRole) {
    Objects.requireNonNull(currentState, "currentState");
    Objects.requireNonNull(targetState, "targetState");
    Objects.requireNonNull(actingRole, "actingRole");

    if (currentState == targetState) {
      return TransitionDecision.noOp();
    }

    var rule = TransitionTable.find(currentState, targetState);
    if (rule.isEmpty()) {
      return TransitionDecision.noRule(currentState, targetState);
    }
    if (!rule.get().permits(actingRole)) {
      return TransitionDecision.roleNotPermitted(actingRole, rule.get());
    }
    return TransitionDecision.allowed(rule.get());
  }
}
