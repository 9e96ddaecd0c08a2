package io.b2mash.shopdesk.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The identity store could not be reached. Transient: callers may retry. */
public class IdentityLookupException extends ErrorResponseException {

  public IdentityLookupException(String detail, Throwable cause) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Identity service unavailable");
    problem.setDetail(detail);
    return problem;
  }
}
