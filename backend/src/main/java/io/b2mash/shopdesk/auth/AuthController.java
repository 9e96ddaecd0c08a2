package io.b2mash.shopdesk.auth;

import io.b2mash.shopdesk.business.TenantPointers;
import io.b2mash.shopdesk.identity.FederatedSignIn;
import io.b2mash.shopdesk.identity.IdentityStore;
import io.b2mash.shopdesk.otp.ChallengeCookieCodec;
import io.b2mash.shopdesk.otp.ChallengeFlowStores;
import io.b2mash.shopdesk.otp.ChallengeMode;
import io.b2mash.shopdesk.otp.ChallengeResponse;
import io.b2mash.shopdesk.otp.OtpChallengeService;
import io.b2mash.shopdesk.otp.VerifiedSession;
import io.b2mash.shopdesk.routing.RedirectTargets;
import io.b2mash.shopdesk.session.Channel;
import io.b2mash.shopdesk.session.CredentialCookies;
import io.b2mash.shopdesk.session.Session;
import io.b2mash.shopdesk.session.SessionAttributes;
import io.b2mash.shopdesk.session.SessionResponse;
import io.b2mash.shopdesk.session.SessionTokenCodec;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Sign-in, signup and sign-out. Endpoints here never require a session. */
@RestController
@RequestMapping("/auth")
public class AuthController {

  private static final Logger log = LoggerFactory.getLogger(AuthController.class);
  private static final String UNAUTHORIZED_LANDING = "/unauthorized";

  private final OtpChallengeService challengeService;
  private final ChallengeFlowStores flowStores;
  private final IdentityStore identityStore;
  private final SessionTokenCodec codec;
  private final CredentialCookies cookies;
  private final TenantPointers tenantPointers;

  public AuthController(
      OtpChallengeService challengeService,
      ChallengeFlowStores flowStores,
      IdentityStore identityStore,
      SessionTokenCodec codec,
      CredentialCookies cookies,
      TenantPointers tenantPointers) {
    this.challengeService = challengeService;
    this.flowStores = flowStores;
    this.identityStore = identityStore;
    this.codec = codec;
    this.cookies = cookies;
    this.tenantPointers = tenantPointers;
  }

  @PostMapping("/login")
  public ResponseEntity<ChallengeResponse> login(
      @Valid @RequestBody LoginRequest body,
      HttpServletRequest request,
      HttpServletResponse response) {
    var flow =
        challengeService.startChallenge(
            flowStores.forRequest(request, response),
            ChallengeMode.LOGIN,
            body.identifier(),
            null);
    return ResponseEntity.ok(ChallengeResponse.from(flow));
  }

  @PostMapping("/signup")
  public ResponseEntity<ChallengeResponse> signup(
      @Valid @RequestBody SignupRequest body,
      HttpServletRequest request,
      HttpServletResponse response) {
    var flow =
        challengeService.startChallenge(
            flowStores.forRequest(request, response),
            ChallengeMode.SIGNUP,
            body.identifier(),
            body.fullName());
    return ResponseEntity.ok(ChallengeResponse.from(flow));
  }

  @PostMapping("/verify")
  public ResponseEntity<SessionResponse> verify(
      @Valid @RequestBody VerifyRequest body,
      HttpServletRequest request,
      HttpServletResponse response) {
    VerifiedSession verified =
        challengeService.verifyChallenge(
            flowStores.forRequest(request, response),
            body.channel(),
            body.code(),
            currentSession(request));
    cookies.writeSession(response, verified.credential());
    return ResponseEntity.ok(SessionResponse.from(verified.session()));
  }

  @PostMapping("/resend")
  public ResponseEntity<ChallengeResponse> resend(
      @Valid @RequestBody ChannelRequest body,
      HttpServletRequest request,
      HttpServletResponse response) {
    var flow =
        challengeService.resend(
            flowStores.forRequest(request, response), body.channel(), currentSession(request));
    return ResponseEntity.ok(ChallengeResponse.from(flow));
  }

  @PostMapping("/cancel")
  public ResponseEntity<ChallengeResponse> cancel(
      @Valid @RequestBody ChannelRequest body,
      HttpServletRequest request,
      HttpServletResponse response) {
    var flow = challengeService.cancel(flowStores.forRequest(request, response), body.channel());
    return ResponseEntity.ok(ChallengeResponse.from(flow));
  }

  @GetMapping("/federated/{provider}")
  public ResponseEntity<Void> federated(
      @PathVariable String provider, @RequestParam(name = "next", required = false) String next) {
    URI location = identityStore.signInFederated(provider, next);
    return ResponseEntity.status(HttpStatus.FOUND).location(location).build();
  }

  /**
   * Provider callback. A completed sign-in lands on the requested page; a failed one lands on the
   * dashboard when the caller already has a live session, else on the unauthorized page.
   */
  @GetMapping("/callback")
  public ResponseEntity<Void> callback(
      @RequestParam(name = "provider", defaultValue = "google") String provider,
      @RequestParam(name = "code", required = false) String code,
      @RequestParam(name = "state", required = false) String state,
      @RequestParam(name = "error", required = false) String error,
      HttpServletRequest request,
      HttpServletResponse response) {
    String target;
    if (error != null || code == null) {
      log.info(
          "security.auth_failed reason=federated_callback provider={} error={}", provider, error);
      target = fallbackTarget(request);
    } else {
      try {
        FederatedSignIn signIn = identityStore.completeFederatedSignIn(provider, code, state);
        cookies.writeSession(response, codec.issueSession(signIn.session()));
        target = RedirectTargets.safe(signIn.redirectTarget());
      } catch (ErrorResponseException e) {
        log.warn("Federated sign-in via {} failed: {}", provider, e.getBody().getDetail());
        target = fallbackTarget(request);
      }
    }
    return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(target)).build();
  }

  @PostMapping("/logout")
  public ResponseEntity<Void> logout(HttpServletRequest request, HttpServletResponse response) {
    cookies.clearSession(response);
    tenantPointers.clear(response);
    for (Channel channel : Channel.values()) {
      cookies.clear(response, ChallengeCookieCodec.cookieName(channel));
    }
    SessionAttributes.get(request)
        .ifPresent(session -> log.info("Subject {} signed out", session.subject()));
    return ResponseEntity.noContent().build();
  }

  private String fallbackTarget(HttpServletRequest request) {
    return SessionAttributes.get(request).isPresent()
        ? RedirectTargets.DEFAULT_TARGET
        : UNAUTHORIZED_LANDING;
  }

  private static Session currentSession(HttpServletRequest request) {
    return SessionAttributes.get(request).orElse(null);
  }

  public record LoginRequest(
      @NotBlank(message = "identifier is required")
          @Size(max = 320, message = "identifier must be at most 320 characters")
          String identifier) {}

  public record SignupRequest(
      @NotBlank(message = "identifier is required")
          @Size(max = 320, message = "identifier must be at most 320 characters")
          String identifier,
      @NotBlank(message = "fullName is required")
          @Size(max = 255, message = "fullName must be at most 255 characters")
          String fullName) {}

  public record VerifyRequest(
      @NotNull(message = "channel is required") Channel channel,
      @NotBlank(message = "code is required") String code) {}

  public record ChannelRequest(@NotNull(message = "channel is required") Channel channel) {}
}
