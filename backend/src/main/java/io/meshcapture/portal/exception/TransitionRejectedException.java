package io.meshcapture.portal.exception;

import io.meshcapture.portal.lifecycle.LifecycleQueries;
import io.meshcapture.portal.lifecycle.ProjectState;
import io.meshcapture.portal.lifecycle.TransitionDecision;
import io.meshcapture.portal.lifecycle.TransitionDecision.Rejection;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Raised at the HTTP boundary when a requested state change was refused by the validator. A
 * missing edge maps to 409 Conflict (the project is not in a state that allows the move); a role
 * outside the edge's allowed set maps to 403 Forbidden.
 */
public class TransitionRejectedException extends ErrorResponseException {

  private final transient TransitionDecision decision;

  public TransitionRejectedException(
      ProjectState from, ProjectState to, TransitionDecision decision) {
    super(statusFor(decision), createProblem(from, to, decision), null);
    this.decision = decision;
  }

  public TransitionDecision getDecision() {
    return decision;
  }

  private static HttpStatus statusFor(TransitionDecision decision) {
    if (decision.valid()) {
      throw new IllegalArgumentException("Cannot reject a valid transition decision");
    }
    return decision.rejection() == Rejection.ROLE_NOT_PERMITTED
        ? HttpStatus.FORBIDDEN
        : HttpStatus.CONFLICT;
  }

  private static ProblemDetail createProblem(
      ProjectState from, ProjectState to, TransitionDecision decision) {
    var problem = ProblemDetail.forStatus(statusFor(decision));
    problem.setTitle(
        decision.rejection() == Rejection.ROLE_NOT_PERMITTED
            ? "Transition not permitted for role"
            : "Transition not allowed");
    problem.setDetail(decision.error());
    problem.setProperty("fromState", from.label());
    problem.setProperty("toState", to.label());
    problem.setProperty("rejection", decision.rejection().name());
    problem.setProperty("description", LifecycleQueries.description(from, to));
    return problem;
  }
}
