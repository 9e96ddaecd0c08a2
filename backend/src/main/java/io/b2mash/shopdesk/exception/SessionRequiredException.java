package io.b2mash.shopdesk.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class SessionRequiredException extends ErrorResponseException {

  public SessionRequiredException() {
    super(HttpStatus.UNAUTHORIZED, createProblem(), null);
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.UNAUTHORIZED);
    problem.setTitle("Not signed in");
    problem.setDetail("This operation requires a signed-in session");
    return problem;
  }
}
