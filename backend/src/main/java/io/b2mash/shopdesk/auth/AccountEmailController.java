package io.b2mash.shopdesk.auth;

import io.b2mash.shopdesk.otp.ChallengeFlowStores;
import io.b2mash.shopdesk.otp.ChallengeResponse;
import io.b2mash.shopdesk.otp.OtpChallengeService;
import io.b2mash.shopdesk.otp.VerifiedSession;
import io.b2mash.shopdesk.session.Channel;
import io.b2mash.shopdesk.session.CredentialCookies;
import io.b2mash.shopdesk.session.CurrentSession;
import io.b2mash.shopdesk.session.Session;
import io.b2mash.shopdesk.session.SessionResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Attaches and verifies a new email address on the signed-in account. */
@RestController
@RequestMapping("/api/account/email")
public class AccountEmailController {

  private final OtpChallengeService challengeService;
  private final ChallengeFlowStores flowStores;
  private final CredentialCookies cookies;

  public AccountEmailController(
      OtpChallengeService challengeService,
      ChallengeFlowStores flowStores,
      CredentialCookies cookies) {
    this.challengeService = challengeService;
    this.flowStores = flowStores;
    this.cookies = cookies;
  }

  @PostMapping
  public ResponseEntity<ChallengeResponse> sendCode(
      @CurrentSession Session session,
      @Valid @RequestBody AttachEmailRequest body,
      HttpServletRequest request,
      HttpServletResponse response) {
    var flow =
        challengeService.startAttach(
            flowStores.forRequest(request, response), session, body.email());
    return ResponseEntity.ok(ChallengeResponse.from(flow));
  }

  @PostMapping("/verify")
  public ResponseEntity<SessionResponse> verify(
      @CurrentSession Session session,
      @Valid @RequestBody VerifyEmailRequest body,
      HttpServletRequest request,
      HttpServletResponse response) {
    VerifiedSession verified =
        challengeService.verifyChallenge(
            flowStores.forRequest(request, response), Channel.EMAIL, body.code(), session);
    cookies.writeSession(response, verified.credential());
    return ResponseEntity.ok(SessionResponse.from(verified.session()));
  }

  public record AttachEmailRequest(
      @NotBlank(message = "email is required")
          @Size(max = 320, message = "email must be at most 320 characters")
          String email) {}

  public record VerifyEmailRequest(@NotBlank(message = "code is required") String code) {}
}
