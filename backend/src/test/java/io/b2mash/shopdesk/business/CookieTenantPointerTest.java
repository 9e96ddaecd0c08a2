package io.b2mash.shopdesk.business;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.shopdesk.TestSessions;
import io.b2mash.shopdesk.session.CredentialCookies;
import jakarta.servlet.http.Cookie;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class CookieTenantPointerTest {

  private static final UUID BUSINESS = UUID.fromString("0f5b0d3a-2222-4000-8000-000000000001");

  private MockHttpServletRequest request;
  private MockHttpServletResponse response;
  private TenantPointers pointers;

  @BeforeEach
  void setUp() {
    request = new MockHttpServletRequest();
    response = new MockHttpServletResponse();
    pointers =
        new TenantPointers(
            new CredentialCookies(TestSessions.sessionProperties()),
            new TenancyProperties(null, false, null, null, 0, null));
  }

  @Test
  void get_readsRequestCookie() {
    request.setCookies(new Cookie("sd_business", BUSINESS.toString()));

    assertThat(pointers.forRequest(request, response).get()).contains(BUSINESS.toString());
  }

  @Test
  void set_writesCookieAndIsVisibleWithinRequest() {
    var pointer = pointers.forRequest(request, response);

    pointer.set(BUSINESS);

    assertThat(pointer.get()).contains(BUSINESS.toString());
    assertThat(response.getHeaders(HttpHeaders.SET_COOKIE))
        .singleElement()
        .asString()
        .startsWith("sd_business=" + BUSINESS)
        .contains("HttpOnly")
        .contains("Path=/");
  }

  @Test
  void set_ofCurrentValue_emitsNoHeader() {
    request.setCookies(new Cookie("sd_business", BUSINESS.toString()));

    pointers.forRequest(request, response).set(BUSINESS);

    assertThat(response.getHeaders(HttpHeaders.SET_COOKIE)).isEmpty();
  }

  @Test
  void clear_expiresCookieOnlyWhenSet() {
    var empty = pointers.forRequest(request, response);
    empty.clear();
    assertThat(response.getHeaders(HttpHeaders.SET_COOKIE)).isEmpty();

    request.setCookies(new Cookie("sd_business", BUSINESS.toString()));
    var pointer = pointers.forRequest(request, response);
    pointer.clear();

    assertThat(pointer.get()).isEmpty();
    assertThat(response.getHeader(HttpHeaders.SET_COOKIE)).contains("Max-Age=0");
  }
}
