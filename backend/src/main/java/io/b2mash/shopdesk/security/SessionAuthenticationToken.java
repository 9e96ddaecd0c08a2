package io.b2mash.shopdesk.security;

import io.b2mash.shopdesk.session.Session;
import java.util.List;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

/** Spring Security view of a resolved {@link Session}. Always authenticated. */
public class SessionAuthenticationToken extends AbstractAuthenticationToken {

  private final Session session;

  public SessionAuthenticationToken(Session session) {
    super(List.of(new SimpleGrantedAuthority("ROLE_USER")));
    this.session = session;
    setAuthenticated(true);
  }

  public Session getSession() {
    return session;
  }

  @Override
  public Object getCredentials() {
    return "";
  }

  @Override
  public Object getPrincipal() {
    return session.subject();
  }

  @Override
  public String getName() {
    return session.subject();
  }
}
