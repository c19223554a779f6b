package com.codeheadsystems.jwtdown.server.auth;

import java.util.Optional;

/**
 * One place a request may carry a token, such as a header or a cookie.
 *
 * @param <R> the framework's request type
 */
@FunctionalInterface
public interface TokenSource<R> {

  /**
   * Extracts the candidate token.
   *
   * @param request the inbound request
   * @return the token, or empty if this source carries none
   */
  Optional<String> extract(R request);
}
