package io.meshcapture.portal.lifecycle;

import static io.meshcapture.portal.lifecycle.PortalRole.ADMIN;
import static io.meshcapture.portal.lifecycle.PortalRole.APPROVER;
import static io.meshcapture.portal.lifecycle.PortalRole.CUSTOMER_OWNER;
import static io.meshcapture.portal.lifecycle.PortalRole.SALES_LEAD;
import static io.meshcapture.portal.lifecycle.PortalRole.TECHNICIAN;
import static io.meshcapture.portal.lifecycle.ProjectState.APPROVED;
import static io.meshcapture.portal.lifecycle.ProjectState.ARCHIVED;
import static io.meshcapture.portal.lifecycle.ProjectState.ASSIGNED;
import static io.meshcapture.portal.lifecycle.ProjectState.CAPTURED;
import static io.meshcapture.portal.lifecycle.ProjectState.DELIVERED;
import static io.meshcapture.portal.lifecycle.ProjectState.PROCESSING;
import static io.meshcapture.portal.lifecycle.ProjectState.QA;
import static io.meshcapture.portal.lifecycle.ProjectState.REQUESTED;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed catalogue of legal lifecycle moves. Built once when the class loads and never mutated.
 *
 * <p>The graph is cyclic on purpose: {@code QA -> Captured} and {@code Delivered -> Captured} send
 * a project back for a retake instead of ending it. Every non-terminal state can be cancelled to
 * {@code Archived}, with one explicit row per originating state. Nothing leaves {@code Archived}.
 */
public final class TransitionTable {

  private static final List<TransitionRule> RULES =
      List.of(
          rule(
              REQUESTED,
              ASSIGNED,
              Set.of(ADMIN, SALES_LEAD),
              false,
              "Assign technician to project"),
          rule(ASSIGNED, CAPTURED, Set.of(TECHNICIAN), false, "Upload captured photos"),
          rule(
              CAPTURED, PROCESSING, Set.of(TECHNICIAN, ADMIN), false, "Start processing raw files"),
          rule(PROCESSING, QA, Set.of(TECHNICIAN, ADMIN), false, "Submit for quality assurance"),
          rule(QA, DELIVERED, Set.of(APPROVER), true, "Approve quality, ready for customer"),
          rule(QA, CAPTURED, Set.of(APPROVER), false, "Reject QA, request retake"),
          rule(
              DELIVERED,
              APPROVED,
              Set.of(CUSTOMER_OWNER),
              true,
              "Customer approves outcome, trigger payout"),
          rule(
              DELIVERED,
              CAPTURED,
              Set.of(CUSTOMER_OWNER),
              false,
              "Customer rejects, request retake"),
          rule(APPROVED, ARCHIVED, Set.of(ADMIN, APPROVER), false, "Archive completed project"),
          // cancellation, role set narrows per source state
          rule(
              REQUESTED,
              ARCHIVED,
              Set.of(ADMIN, SALES_LEAD, CUSTOMER_OWNER),
              false,
              "Cancel project"),
          rule(ASSIGNED, ARCHIVED, Set.of(ADMIN, SALES_LEAD), false, "Cancel assigned project"),
          rule(CAPTURED, ARCHIVED, Set.of(ADMIN, SALES_LEAD), false, "Cancel project"),
          rule(PROCESSING, ARCHIVED, Set.of(ADMIN, SALES_LEAD), false, "Cancel project"),
          rule(QA, ARCHIVED, Set.of(ADMIN, APPROVER), false, "Cancel project"),
          rule(
              DELIVERED,
              ARCHIVED,
              Set.of(ADMIN, SALES_LEAD, CUSTOMER_OWNER),
              false,
              "Cancel project"));

  private static final Map<ProjectState, Map<ProjectState, TransitionRule>> BY_EDGE = index(RULES);

  private TransitionTable() {}

  /** All rules in declaration order. */
  public static List<TransitionRule> rules() {
    return RULES;
  }

  /** Looks up the unique rule for the {@code (from, to)} pair, if any. */
  public static Optional<TransitionRule> find(ProjectState from, ProjectState to) {
    return Optional.ofNullable(BY_EDGE.get(from).get(to));
  }

  /** Rules leaving {@code from}, in declaration order. Empty for {@code Archived}. */
  public static List<TransitionRule> outgoing(ProjectState from) {
    return RULES.stream().filter(rule -> rule.from() == from).toList();
  }

  private static TransitionRule rule(
      ProjectState from,
      ProjectState to,
      Set<PortalRole> roles,
      boolean requiresApproval,
      String description) {
    return new TransitionRule(from, to, roles, requiresApproval, description);
  }

  static Map<ProjectState, Map<ProjectState, TransitionRule>> index(List<TransitionRule> rules) {
    var byEdge = new EnumMap<ProjectState, Map<ProjectState, TransitionRule>>(ProjectState.class);
    for (ProjectState state : ProjectState.values()) {
      byEdge.put(state, new EnumMap<>(ProjectState.class));
    }
    var duplicates = new ArrayList<String>();
    for (TransitionRule rule : rules) {
      var previous = byEdge.get(rule.from()).putIfAbsent(rule.to(), rule);
      if (previous != null) {
        duplicates.add(rule.from() + " -> " + rule.to());
      }
    }
    if (!duplicates.isEmpty()) {
      throw new IllegalStateException("Duplicate transition rules: " + duplicates);
    }
    return byEdge;
  }
}
