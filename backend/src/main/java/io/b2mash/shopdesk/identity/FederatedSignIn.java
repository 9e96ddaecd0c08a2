package io.b2mash.shopdesk.identity;

import io.b2mash.shopdesk.session.Session;

/**
 * Outcome of a federated sign-in callback.
 *
 * @param session the live session for the signed-in account
 * @param redirectTarget where the user asked to land after sign-in
 */
public record FederatedSignIn(Session session, String redirectTarget) {}
