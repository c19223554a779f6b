package com.codeheadsystems.jwtdown.server.auth;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Factories for the standard {@link TokenSource}s.
 */
public final class TokenSources {

  private static final String BEARER_SCHEME = "bearer";

  private TokenSources() {
  }

  /**
   * A source reading {@code Authorization: Bearer <token>}.
   * <p>
   * A missing header, another scheme, or an empty parameter all count as no token.
   *
   * @param authorizationHeader returns the raw header value, or null
   * @param <R>                 the request type
   * @return the token source
   */
  public static <R> TokenSource<R> bearerHeader(Function<R, String> authorizationHeader) {
    return request -> parseBearer(authorizationHeader.apply(request));
  }

  /**
   * A source reading a cookie value. An empty value counts as no token.
   *
   * @param cookieValue returns the cookie value, or null if the cookie is absent
   * @param <R>         the request type
   * @return the token source
   */
  public static <R> TokenSource<R> cookie(Function<R, String> cookieValue) {
    return request -> {
      String value = cookieValue.apply(request);
      return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    };
  }

  /**
   * Parses an Authorization header value. The scheme match is case-insensitive.
   *
   * @param header the header value, may be null
   * @return the bearer token, or empty
   */
  public static Optional<String> parseBearer(String header) {
    if (header == null || header.isBlank()) {
      return Optional.empty();
    }
    String trimmed = header.strip();
    int space = trimmed.indexOf(' ');
    String scheme = space < 0 ? trimmed : trimmed.substring(0, space);
    if (!BEARER_SCHEME.equals(scheme.toLowerCase(Locale.ROOT))) {
      return Optional.empty();
    }
    String token = space < 0 ? "" : trimmed.substring(space + 1).strip();
    return token.isEmpty() ? Optional.empty() : Optional.of(token);
  }
}
