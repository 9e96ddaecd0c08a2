package io.b2mash.shopdesk.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The submitted one-time code does not match the active challenge. The challenge stays open. */
public class InvalidCodeException extends ErrorResponseException {

  public InvalidCodeException(String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid code");
    problem.setDetail(detail);
    return problem;
  }
}
