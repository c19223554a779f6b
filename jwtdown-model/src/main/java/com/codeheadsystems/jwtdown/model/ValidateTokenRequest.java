package com.codeheadsystems.jwtdown.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model carrying a token to check.
 * <p>
 * Used by: {@code POST /token/validate}
 *
 * @param token compact JWT to verify
 */
public record ValidateTokenRequest(@JsonProperty("token") String token) {
}
