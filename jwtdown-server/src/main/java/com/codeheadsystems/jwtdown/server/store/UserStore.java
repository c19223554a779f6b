package com.codeheadsystems.jwtdown.server.store;

import java.util.Optional;

/**
 * Storage abstraction for user accounts.
 * <p>
 * Implementations must be thread-safe and are responsible for enforcing username uniqueness.
 * Typical production implementations back this with a relational database.
 */
public interface UserStore {

  /**
   * Looks up a user by username.
   *
   * @param username the login name
   * @return the user, or empty if no such user exists
   */
  Optional<UserRecord> getUser(String username);

  /**
   * Creates a user.
   *
   * @param username     the login name, unique
   * @param passwordHash the already-hashed password
   * @param email        contact address, may be null
   * @throws DuplicateUserException if the username is taken
   * @throws UserStoreException     for any other storage failure
   */
  void createUser(String username, String passwordHash, String email);
}
