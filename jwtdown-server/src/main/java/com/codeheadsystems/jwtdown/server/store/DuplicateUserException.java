package com.codeheadsystems.jwtdown.server.store;

/**
 * Raised by {@link UserStore#createUser} when the username already exists.
 */
public class DuplicateUserException extends UserStoreException {

  public DuplicateUserException(String username) {
    super("User already exists: " + username);
  }
}
