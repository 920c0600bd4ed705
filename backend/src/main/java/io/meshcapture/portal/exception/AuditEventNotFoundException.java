package io.meshcapture.portal.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class AuditEventNotFoundException extends ErrorResponseException {

  public AuditEventNotFoundException(UUID eventId) {
    super(HttpStatus.NOT_FOUND, createProblem(eventId), null);
  }

  private static ProblemDetail createProblem(UUID eventId) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle("Audit event not found");
    problem.setDetail("No audit event found with id " + eventId);
    problem.setProperty("eventId", eventId);
    return problem;
  }
}
