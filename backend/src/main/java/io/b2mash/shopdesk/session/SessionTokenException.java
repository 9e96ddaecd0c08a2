package io.b2mash.shopdesk.session;

/** A credential failed to parse, verify, or carried the wrong token type. Never web-facing. */
public class SessionTokenException extends RuntimeException {

  public SessionTokenException(String message) {
    super(message);
  }

  public SessionTokenException(String message, Throwable cause) {
    super(message, cause);
  }
}
