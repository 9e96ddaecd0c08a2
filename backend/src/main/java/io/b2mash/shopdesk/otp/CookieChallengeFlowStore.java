package io.b2mash.shopdesk.otp;

import io.b2mash.shopdesk.session.Channel;
import io.b2mash.shopdesk.session.CredentialCookies;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.EnumMap;
import java.util.Map;

/**
 * Request-scoped {@link ChallengeFlowStore} backed by one signed cookie per channel. Writes made
 * during the request are visible to later reads of the same request.
 */
public class CookieChallengeFlowStore implements ChallengeFlowStore {

  private final HttpServletRequest request;
  private final HttpServletResponse response;
  private final CredentialCookies cookies;
  private final ChallengeCookieCodec codec;
  private final Map<Channel, ChallengeFlow> written = new EnumMap<>(Channel.class);

  public CookieChallengeFlowStore(
      HttpServletRequest request,
      HttpServletResponse response,
      CredentialCookies cookies,
      ChallengeCookieCodec codec) {
    this.request = request;
    this.response = response;
    this.cookies = cookies;
    this.codec = codec;
  }

  @Override
  public ChallengeFlow get(Channel channel) {
    ChallengeFlow pending = written.get(channel);
    if (pending != null) {
      return pending;
    }
    return codec
        .decode(channel, cookies.read(request, ChallengeCookieCodec.cookieName(channel)))
        .orElseGet(() -> ChallengeFlow.idle(channel));
  }

  @Override
  public void put(ChallengeFlow flow) {
    if (!flow.isPending()) {
      clear(flow.channel());
      written.put(flow.channel(), flow);
      return;
    }
    written.put(flow.channel(), flow);
    cookies.write(
        response,
        ChallengeCookieCodec.cookieName(flow.channel()),
        codec.encode(flow),
        codec.lifetime());
  }

  @Override
  public void clear(Channel channel) {
    written.put(channel, ChallengeFlow.idle(channel));
    cookies.clear(response, ChallengeCookieCodec.cookieName(channel));
  }
}
