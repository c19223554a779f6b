package com.codeheadsystems.jwtdown.server.manager;

import com.codeheadsystems.jwtdown.model.AccessTokenResponse;
import com.codeheadsystems.jwtdown.server.cookie.SessionCookie;

/**
 * Outcome of a successful login: the response body and the cookie carrying the same token.
 *
 * @param body   the token response
 * @param cookie the cookie to set
 */
public record LoginResult(AccessTokenResponse body, SessionCookie cookie) {
}
