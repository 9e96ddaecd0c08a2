package io.b2mash.shopdesk.otp;

import io.b2mash.shopdesk.session.Session;

/**
 * A session obtained by verifying a challenge.
 *
 * @param session the live session, claims already reflecting the verified channel
 * @param credential the session credential to hand to the client
 */
public record VerifiedSession(Session session, String credential) {}
