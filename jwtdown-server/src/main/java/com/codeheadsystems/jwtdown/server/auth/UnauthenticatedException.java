package com.codeheadsystems.jwtdown.server.auth;

/**
 * Raised whenever a caller cannot be authenticated: unknown user, wrong password, missing token,
 * bad token, or a token whose subject no longer exists.
 * <p>
 * The message is always the same so that callers cannot tell the causes apart.
 */
public class UnauthenticatedException extends SecurityException {

  /**
   * The message returned for every authentication failure.
   */
  public static final String MESSAGE = "Invalid authentication credentials";

  public UnauthenticatedException() {
    super(MESSAGE);
  }
}
