package com.codeheadsystems.jwtdown.server.store;

/**
 * Failure reported by a {@link UserStore}.
 */
public class UserStoreException extends RuntimeException {

  public UserStoreException(String message) {
    super(message);
  }

  public UserStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
