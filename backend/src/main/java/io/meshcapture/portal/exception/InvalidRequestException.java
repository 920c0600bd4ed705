package io.meshcapture.portal.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Malformed request input, such as an unknown state label or an over-long reason. */
public class InvalidRequestException extends ErrorResponseException {

  public InvalidRequestException(String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid request");
    problem.setDetail(detail);
    return problem;
  }
}
