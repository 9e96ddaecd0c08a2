package io.b2mash.shopdesk.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * The session subject does not own the business it tried to select or mutate. Also raised for ids
 * that do not exist, so a caller cannot probe which business ids are taken.
 */
public class NotOwnerException extends ErrorResponseException {

  private final UUID businessId;

  public NotOwnerException(UUID businessId) {
    super(HttpStatus.FORBIDDEN, createProblem(businessId), null);
    this.businessId = businessId;
  }

  public UUID getBusinessId() {
    return businessId;
  }

  private static ProblemDetail createProblem(UUID businessId) {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Not the business owner");
    problem.setDetail("Business not found or access denied: " + businessId);
    return problem;
  }
}
