package io.b2mash.b2b.banklink.integration.banking;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Base for banking errors surfaced to API callers. The problem body carries a machine-readable
 * {@code code} property alongside the RFC 7807 fields.
 */
public class BankingException extends ErrorResponseException {

  private final String code;

  public BankingException(HttpStatus status, String code, String title, String detail) {
    this(status, code, title, detail, null);
  }

  public BankingException(
      HttpStatus status, String code, String title, String detail, Throwable cause) {
    super(status, createProblem(status, code, title, detail), cause);
    this.code = code;
  }

  public String getCode() {
    return code;
  }

  private static ProblemDetail createProblem(
      HttpStatus status, String code, String title, String detail) {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("code", code);
    return problem;
  }
}
