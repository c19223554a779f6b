package com.codeheadsystems.jwtdown.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for the authenticated user.
 * <p>
 * Note: {@code passwordHash} is part of the existing response contract and is returned as-is.
 * <p>
 * Used by: {@code GET /users/me} response
 *
 * @param id           store-assigned identifier
 * @param username     login name
 * @param passwordHash stored bcrypt hash
 * @param email        contact address, may be null
 */
public record UserResponse(
    @JsonProperty("id") int id,
    @JsonProperty("username") String username,
    @JsonProperty("passwordHash") String passwordHash,
    @JsonProperty("email") String email) {
}
