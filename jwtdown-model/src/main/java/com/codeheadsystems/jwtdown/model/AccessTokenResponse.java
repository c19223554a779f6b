package com.codeheadsystems.jwtdown.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a successful password login.
 * <p>
 * Follows the OAuth2 token response shape so that standard password-flow clients can read it.
 * The same token is also set as an HTTP-only cookie on the login response.
 * <p>
 * Used by: {@code POST /token} response
 *
 * @param accessToken signed compact JWT whose {@code sub} claim is the username
 * @param tokenType   always {@value #BEARER}
 */
public record AccessTokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("token_type") String tokenType) {

  /**
   * The only token type issued.
   */
  public static final String BEARER = "bearer";

  /**
   * Bearer access token response.
   *
   * @param accessToken the access token
   * @return the access token response
   */
  public static AccessTokenResponse bearer(String accessToken) {
    return new AccessTokenResponse(accessToken, BEARER);
  }
}
