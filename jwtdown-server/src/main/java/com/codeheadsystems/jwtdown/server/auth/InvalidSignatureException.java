package com.codeheadsystems.jwtdown.server.auth;

/**
 * Raised by {@link TokenCodec} when a token is malformed, signed with another algorithm or key,
 * or (with expiry enabled) expired. Causes are intentionally not distinguished.
 */
public class InvalidSignatureException extends SecurityException {

  /**
   * The message returned for every verification failure.
   */
  public static final String MESSAGE = "invalid token";

  public InvalidSignatureException() {
    super(MESSAGE);
  }
}
