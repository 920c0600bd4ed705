package io.meshcapture.portal.project;

import io.meshcapture.portal.exception.RequestParameters;
import io.meshcapture.portal.lifecycle.LifecycleQueries;
import io.meshcapture.portal.lifecycle.PortalRole;
import io.meshcapture.portal.lifecycle.ProjectState;
import io.meshcapture.portal.lifecycle.TransitionRule;
import io.meshcapture.portal.lifecycle.TransitionTable;
import io.meshcapture.portal.lifecycle.TransitionValidator;
import java.util.Collection;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Read-only view of the lifecycle graph, for progress bars and action hints. */
@RestController
@RequestMapping("/api/lifecycle")
public class LifecycleController {

  @GetMapping
  public ResponseEntity<LifecycleResponse> describeLifecycle() {
    var rules = TransitionTable.rules().stream().map(RuleResponse::from).toList();
    return ResponseEntity.ok(
        new LifecycleResponse(
            labels(LifecycleQueries.happyPath()),
            labels(LifecycleQueries.terminalStates()),
            labels(LifecycleQueries.payoutEligibleStates()),
            rules));
  }

  /** Dry-run of the validator, without touching any project. */
  @GetMapping("/check")
  public ResponseEntity<CheckResponse> check(
      @RequestParam String from, @RequestParam String to, @RequestParam String role) {
    var fromState = RequestParameters.requireState("from", from);
    var toState = RequestParameters.requireState("to", to);
    var decision =
        TransitionValidator.validate(
            fromState, toState, RequestParameters.requireRole("role", role));
    return ResponseEntity.ok(
        new CheckResponse(
            decision.valid(),
            decision.error(),
            LifecycleQueries.requiresApproval(fromState, toState),
            LifecycleQueries.description(fromState, toState)));
  }

  private static List<String> labels(Collection<ProjectState> states) {
    return states.stream().map(ProjectState::label).toList();
  }

  // --- DTOs ---

  public record LifecycleResponse(
      List<String> happyPath,
      List<String> terminalStates,
      List<String> payoutEligibleStates,
      List<RuleResponse> transitions) {}

  public record RuleResponse(
      String from,
      String to,
      List<String> allowedRoles,
      boolean requiresApproval,
      String description) {

    public static RuleResponse from(TransitionRule rule) {
      return new RuleResponse(
          rule.from().label(),
          rule.to().label(),
          rule.allowedRoles().stream().map(PortalRole::value).toList(),
          rule.requiresApproval(),
          rule.description());
    }
  }

  public record CheckResponse(
      boolean valid, String error, boolean requiresApproval, String description) {}
}
