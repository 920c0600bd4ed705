package io.meshcapture.portal.lifecycle;

import java.util.Optional;

/**
 * Outcome of {@link TransitionValidator#validate}. A disallowed move is an ordinary value, not an
 * exception.
 *
 * @param valid whether the move may be committed
 * @param error human-readable reason; null when valid
 * @param rule matched rule; null when invalid or for a same-state no-op
 * @param rejection why the move was refused; {@link Rejection#NONE} when valid
 */
public record TransitionDecision(
    boolean valid, String error, TransitionRule rule, Rejection rejection) {

  public enum Rejection {
    NONE,
    NO_RULE,
    ROLE_NOT_PERMITTED
  }

  private static final TransitionDecision NO_OP =
      new TransitionDecision(true, null, null, Rejection.NONE);

  static TransitionDecision noOp() {
    return NO_OP;
  }

  static TransitionDecision allowed(TransitionRule rule) {
    return new TransitionDecision(true, null, rule, Rejection.NONE);
  }

  static TransitionDecision noRule(ProjectState from, ProjectState to) {
    return new TransitionDecision(
        false, "transition from " + from + " to " + to + " not allowed", null, Rejection.NO_RULE);
  }

  static TransitionDecision roleNotPermitted(PortalRole role, TransitionRule rule) {
    return new TransitionDecision(
        false,
        "role '"
            + role.value()
            + "' cannot perform this transition; required one of: "
            + rule.allowedRolesDisplay(),
        null,
        Rejection.ROLE_NOT_PERMITTED);
  }

  public Optional<TransitionRule> matchedRule() {
    return Optional.ofNullable(rule);
  }

  /** True for the idempotent same-state case. */
  public boolean isNoOp() {
    return valid && rule == null;
  }

  public boolean requiresApproval() {
    return rule != null && rule.requiresApproval();
  }
}
