package io.b2mash.shopdesk.security;

import io.b2mash.shopdesk.session.Session;
import io.b2mash.shopdesk.session.SessionAttributes;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/** Puts the request id, subject and current business id into the logging MDC. */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final String MDC_REQUEST_ID = "requestId";
  private static final String MDC_SUBJECT = "subject";
  private static final String MDC_BUSINESS_ID = "businessId";

  private final String pointerCookieName;

  public RequestLoggingFilter(
      @Value("${shopdesk.tenancy.pointer-cookie-name:sd_business}") String pointerCookieName) {
    this.pointerCookieName = pointerCookieName;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      Session session = SessionAttributes.get(request).orElse(null);
      if (session != null) {
        MDC.put(MDC_SUBJECT, session.subject());
        String businessId = pointerValue(request);
        if (businessId != null) {
          MDC.put(MDC_BUSINESS_ID, businessId);
        }
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_BUSINESS_ID);
      MDC.remove(MDC_SUBJECT);
      MDC.remove(MDC_REQUEST_ID);
    }
  }

  private String pointerValue(HttpServletRequest request) {
    if (request.getCookies() == null) {
      return null;
    }
    for (var cookie : request.getCookies()) {
      if (pointerCookieName.equals(cookie.getName())) {
        return cookie.getValue();
      }
    }
    return null;
  }
}
