package io.b2mash.shopdesk.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class AccountNotFoundException extends ErrorResponseException {

  public AccountNotFoundException(String identifier) {
    super(HttpStatus.NOT_FOUND, createProblem(identifier), null);
  }

  private static ProblemDetail createProblem(String identifier) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle("Account not found");
    problem.setDetail("No account exists for " + identifier + ". Sign up first.");
    return problem;
  }
}
