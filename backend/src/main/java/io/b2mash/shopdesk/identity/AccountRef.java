package io.b2mash.shopdesk.identity;

/**
 * Reference to an identity-store account.
 *
 * @param subject the account's subject identifier
 * @param created true when the account was created by this call
 */
public record AccountRef(String subject, boolean created) {}
