package io.meshcapture.portal.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ProjectNotFoundException extends ErrorResponseException {

  public ProjectNotFoundException(UUID projectId) {
    super(HttpStatus.NOT_FOUND, createProblem(projectId), null);
  }

  private static ProblemDetail createProblem(UUID projectId) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle("Project not found");
    problem.setDetail("No project found with id " + projectId);
    problem.setProperty("projectId", projectId);
    return problem;
  }
}
