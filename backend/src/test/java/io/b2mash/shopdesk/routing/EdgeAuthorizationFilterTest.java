package io.b2mash.shopdesk.routing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.shopdesk.TestSessions;
import io.b2mash.shopdesk.session.CredentialCookies;
import io.b2mash.shopdesk.session.ResolvedSession;
import io.b2mash.shopdesk.session.SessionAttributes;
import io.b2mash.shopdesk.session.SessionResolver;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import java.io.IOException;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@ExtendWith(MockitoExtension.class)
class EdgeAuthorizationFilterTest {

  @Mock private SessionResolver sessionResolver;

  private EdgeAuthorizationFilter filter;
  private MockHttpServletRequest request;
  private MockHttpServletResponse response;
  private MockFilterChain chain;

  @BeforeEach
  void setUp() {
    var routes = TestSessions.routeProperties();
    var gate = new EdgeAuthorizationGate(new RouteClassifier(routes), sessionResolver, routes);
    filter =
        new EdgeAuthorizationFilter(
            gate, new CredentialCookies(TestSessions.sessionProperties()));
    request = new MockHttpServletRequest();
    response = new MockHttpServletResponse();
    chain = new MockFilterChain();
  }

  @Test
  void protectedPath_withoutSession_forwardsInternally() throws ServletException, IOException {
    request.setRequestURI("/dashboard/reports");
    when(sessionResolver.resolve(null)).thenReturn(Optional.empty());

    filter.doFilterInternal(request, response, chain);

    assertThat(response.getForwardedUrl()).isEqualTo("/unauthorized");
    assertThat(response.getRedirectedUrl()).isNull();
    assertThat(chain.getRequest()).isNull();
    assertThat(SessionAttributes.isResolved(request)).isTrue();
  }

  @Test
  void protectedPath_withSession_continuesAndBindsSession() throws ServletException, IOException {
    request.setRequestURI("/dashboard");
    request.setCookies(new Cookie("sd_session", "token"));
    when(sessionResolver.resolve("token"))
        .thenReturn(Optional.of(new ResolvedSession(TestSessions.session("u1"), null)));

    filter.doFilterInternal(request, response, chain);

    assertThat(chain.getRequest()).isSameAs(request);
    assertThat(response.getForwardedUrl()).isNull();
    assertThat(SessionAttributes.get(request)).map(s -> s.subject()).contains("u1");
    assertThat(response.getHeaders(HttpHeaders.SET_COOKIE)).isEmpty();
  }

  @Test
  void rotatedCredential_isWrittenEvenWhenRewriting() throws ServletException, IOException {
    request.setRequestURI("/login");
    request.setCookies(new Cookie("sd_session", "old"));
    when(sessionResolver.resolve("old"))
        .thenReturn(Optional.of(new ResolvedSession(TestSessions.session("u1"), "fresh")));

    filter.doFilterInternal(request, response, chain);

    assertThat(response.getForwardedUrl()).isEqualTo("/authorized");
    assertThat(response.getHeader(HttpHeaders.SET_COOKIE))
        .startsWith("sd_session=fresh")
        .contains("HttpOnly")
        .contains("SameSite=Lax");
  }

  @Test
  void publicPath_passesThroughUntouched() throws ServletException, IOException {
    request.setRequestURI("/pricing");

    filter.doFilterInternal(request, response, chain);

    assertThat(chain.getRequest()).isSameAs(request);
    assertThat(SessionAttributes.isResolved(request)).isFalse();
    verifyNoInteractions(sessionResolver);
  }

  @Test
  void staticAsset_isNotFiltered() throws ServletException, IOException {
    request.setRequestURI("/dashboard/logo.svg");

    filter.doFilter(request, response, chain);

    assertThat(chain.getRequest()).isSameAs(request);
    verifyNoInteractions(sessionResolver);
  }

  @Test
  void contextPath_isStrippedBeforeClassifying() throws ServletException, IOException {
    request.setContextPath("/app");
    request.setRequestURI("/app/settings");
    when(sessionResolver.resolve(null)).thenReturn(Optional.empty());

    filter.doFilterInternal(request, response, chain);

    assertThat(response.getForwardedUrl()).isEqualTo("/unauthorized");
  }
}
