package io.meshcapture.portal.lifecycle;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Read-only views derived from the {@link TransitionTable}, for rendering available actions. */
public final class LifecycleQueries {

  private static final List<ProjectState> HAPPY_PATH =
      List.of(
          ProjectState.REQUESTED,
          ProjectState.ASSIGNED,
          ProjectState.CAPTURED,
          ProjectState.PROCESSING,
          ProjectState.QA,
          ProjectState.DELIVERED,
          ProjectState.APPROVED,
          ProjectState.ARCHIVED);

  private static final Set<ProjectState> TERMINAL_STATES =
      Collections.unmodifiableSet(EnumSet.of(ProjectState.APPROVED, ProjectState.ARCHIVED));

  private static final Set<ProjectState> PAYOUT_ELIGIBLE_STATES =
      Collections.unmodifiableSet(EnumSet.of(ProjectState.APPROVED));

  private LifecycleQueries() {}

  /**
   * States {@code role} may move a project to from {@code current}, in happy-path order. The
   * same-state no-op is not listed. May be empty.
   */
  public static Set<ProjectState> validNextStates(ProjectState current, PortalRole role) {
    var next = EnumSet.noneOf(ProjectState.class);
    for (TransitionRule rule : TransitionTable.outgoing(current)) {
      if (TransitionValidator.validate(current, rule.to(), role).valid()) {
        next.add(rule.to());
      }
    }
    return Collections.unmodifiableSet(next);
  }

  public static Optional<TransitionRule> transitionInfo(ProjectState from, ProjectState to) {
    return TransitionTable.find(from, to);
  }

  /** False when no rule matches. */
  public static boolean requiresApproval(ProjectState from, ProjectState to) {
    return transitionInfo(from, to).map(TransitionRule::requiresApproval).orElse(false);
  }

  /** Advisory text; falls back to a generic phrase when no rule matches. */
  public static String description(ProjectState from, ProjectState to) {
    return transitionInfo(from, to)
        .map(TransitionRule::description)
        .orElseGet(() -> "move from " + from + " to " + to);
  }

  /** Canonical forward-only progression, for progress indicators. */
  public static List<ProjectState> happyPath() {
    return HAPPY_PATH;
  }

  /** Zero-based position of {@code state} on the happy path. */
  public static int progressIndex(ProjectState state) {
    return HAPPY_PATH.indexOf(state);
  }

  public static List<ProjectState> allStates() {
    return List.of(ProjectState.values());
  }

  public static Set<ProjectState> terminalStates() {
    return TERMINAL_STATES;
  }

  public static boolean isTerminal(ProjectState state) {
    return TERMINAL_STATES.contains(state);
  }

  /** States at which external payout logic may trigger. */
  public static Set<ProjectState> payoutEligibleStates() {
    return PAYOUT_ELIGIBLE_STATES;
  }

  public static boolean isPayoutEligible(ProjectState state) {
    return PAYOUT_ELIGIBLE_STATES.contains(state);
  }
}
