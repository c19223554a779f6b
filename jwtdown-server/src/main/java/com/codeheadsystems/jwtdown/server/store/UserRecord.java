package com.codeheadsystems.jwtdown.server.store;

/**
 * A user as held by the {@link UserStore}.
 *
 * @param id           store-assigned identifier
 * @param username     unique login name
 * @param passwordHash bcrypt hash of the password
 * @param email        contact address, may be null
 */
public record UserRecord(int id, String username, String passwordHash, String email) {

  @Override
  public String toString() {
    return "UserRecord[id=" + id + ", username=" + username + "]";
  }
}
