package io.b2mash.shopdesk.session;

import io.b2mash.shopdesk.identity.IdentityStore;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves the session behind a request credential. Fails soft: a missing, tampered or expired
 * credential, a subject the identity store no longer knows, and an unreachable identity store all
 * yield {@link Optional#empty()}. Nothing is cached between calls.
 */
@Component
public class SessionResolver {

  private static final Logger log = LoggerFactory.getLogger(SessionResolver.class);

  private final SessionTokenCodec codec;
  private final IdentityStore identityStore;

  public SessionResolver(SessionTokenCodec codec, IdentityStore identityStore) {
    this.codec = codec;
    this.identityStore = identityStore;
  }

  public Optional<ResolvedSession> resolve(String credential) {
    if (credential == null || credential.isBlank()) {
      return Optional.empty();
    }
    try {
      Session session = codec.decodeSession(credential);
      if (!identityStore.isActive(session.subject())) {
        log.info("Session presented for unknown subject {}", session.subject());
        return Optional.empty();
      }
      if (codec.shouldRotate(session)) {
        String rotated = identityStore.refreshSession(credential);
        return Optional.of(new ResolvedSession(codec.decodeSession(rotated), rotated));
      }
      return Optional.of(new ResolvedSession(session, null));
    } catch (SessionTokenException e) {
      log.debug("Rejected session credential: {}", e.getMessage());
      return Optional.empty();
    } catch (RuntimeException e) {
      // Identity store failures fail closed
      log.warn("Session resolution failed, treating request as anonymous: {}", e.getMessage());
      return Optional.empty();
    }
  }
}
