package io.b2mash.shopdesk.session;

import io.b2mash.shopdesk.identity.ClaimsUpdate;
import io.b2mash.shopdesk.identity.IdentityStore;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/session")
public class SessionController {

  private final IdentityStore identityStore;
  private final SessionTokenCodec codec;
  private final CredentialCookies cookies;

  public SessionController(
      IdentityStore identityStore, SessionTokenCodec codec, CredentialCookies cookies) {
    this.identityStore = identityStore;
    this.codec = codec;
    this.cookies = cookies;
  }

  @GetMapping
  public ResponseEntity<SessionResponse> getSession(@CurrentSession Session session) {
    return ResponseEntity.ok(SessionResponse.from(session));
  }

  /** Re-issues the credential with claims re-read from the identity store. */
  @PostMapping("/refresh")
  public ResponseEntity<SessionResponse> refresh(
      @CurrentSession Session session, HttpServletRequest request, HttpServletResponse response) {
    String credential = identityStore.refreshSession(cookies.readSession(request));
    cookies.writeSession(response, credential);
    return ResponseEntity.ok(SessionResponse.from(codec.decodeSession(credential)));
  }

  @PatchMapping("/claims")
  public ResponseEntity<SessionResponse> updateClaims(
      @CurrentSession Session session,
      @Valid @RequestBody UpdateClaimsRequest request,
      HttpServletResponse response) {
    Session updated =
        identityStore.updateClaims(
            session.subject(), new ClaimsUpdate(request.fullName(), request.avatarUrl()));
    String credential = codec.issueSession(updated);
    cookies.writeSession(response, credential);
    return ResponseEntity.ok(SessionResponse.from(codec.decodeSession(credential)));
  }

  public record UpdateClaimsRequest(
      @Size(min = 1, max = 255, message = "fullName must be 1 to 255 characters") String fullName,
      @Size(max = 2048, message = "avatarUrl must be at most 2048 characters") String avatarUrl) {}
}
