package com.codeheadsystems.jwtdown.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for account creation.
 * <p>
 * {@code fullName} and {@code disabled} are accepted for client compatibility but are not
 * stored.
 * <p>
 * Used by: {@code POST /api/users}
 *
 * @param username unique login name
 * @param email    optional contact address
 * @param fullName optional display name, ignored
 * @param disabled optional account flag, ignored
 * @param password plaintext password, hashed before it reaches the store
 */
public record SignupRequest(
    @JsonProperty("username") String username,
    @JsonProperty("email") String email,
    @JsonProperty("full_name") String fullName,
    @JsonProperty("disabled") Boolean disabled,
    @JsonProperty("password") String password) {

  @Override
  public String toString() {
    return "SignupRequest[username=" + username + ", email=" + email + "]";
  }
}
