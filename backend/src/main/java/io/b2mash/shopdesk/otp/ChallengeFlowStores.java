package io.b2mash.shopdesk.otp;

import io.b2mash.shopdesk.session.CredentialCookies;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;

/** Creates the cookie-backed {@link ChallengeFlowStore} for a request. */
@Component
public class ChallengeFlowStores {

  private final CredentialCookies cookies;
  private final ChallengeCookieCodec codec;

  public ChallengeFlowStores(CredentialCookies cookies, ChallengeCookieCodec codec) {
    this.cookies = cookies;
    this.codec = codec;
  }

  public ChallengeFlowStore forRequest(HttpServletRequest request, HttpServletResponse response) {
    return new CookieChallengeFlowStore(request, response, cookies, codec);
  }
}
