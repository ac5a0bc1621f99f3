package io.b2mash.b2b.banklink.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** An integration is disabled because required configuration is absent. */
public class IntegrationNotConfiguredException extends ErrorResponseException {

  public IntegrationNotConfiguredException(String detail) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Integration not configured");
    problem.setDetail(detail);
    problem.setProperty("code", "NOT_CONFIGURED");
    return problem;
  }
}
