package io.b2mash.shopdesk.exception;

import io.b2mash.shopdesk.session.Channel;
import java.util.Locale;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class NoActiveChallengeException extends ErrorResponseException {

  public NoActiveChallengeException(Channel channel) {
    super(HttpStatus.CONFLICT, createProblem(channel), null);
  }

  private static ProblemDetail createProblem(Channel channel) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("No active challenge");
    problem.setDetail(
        "No verification code has been sent for " + channel.name().toLowerCase(Locale.ROOT));
    return problem;
  }
}
