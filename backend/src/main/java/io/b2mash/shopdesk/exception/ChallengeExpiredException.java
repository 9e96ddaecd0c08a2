package io.b2mash.shopdesk.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The challenge ran out of time or attempts. The user must request a new code. */
public class ChallengeExpiredException extends ErrorResponseException {

  public ChallengeExpiredException(String detail) {
    super(HttpStatus.GONE, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.GONE);
    problem.setTitle("Challenge expired");
    problem.setDetail(detail);
    return problem;
  }
}
