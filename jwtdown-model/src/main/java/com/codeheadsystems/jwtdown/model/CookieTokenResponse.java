package com.codeheadsystems.jwtdown.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model echoing the token held in the session cookie back to a browser client.
 * <p>
 * Used by: {@code GET /token} response (only when the cookie is present)
 *
 * @param token the raw cookie value
 */
public record CookieTokenResponse(@JsonProperty("token") String token) {
}
