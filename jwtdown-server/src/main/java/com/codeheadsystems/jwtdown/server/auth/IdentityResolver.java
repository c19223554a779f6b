package com.codeheadsystems.jwtdown.server.auth;

import com.auth0.jwt.RegisteredClaims;
import com.codeheadsystems.jwtdown.server.store.UserRecord;
import com.codeheadsystems.jwtdown.server.store.UserStore;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the authenticated user of a request that may carry a token in several places.
 * <p>
 * Sources are consulted in order and the first one holding a token wins. Later sources are never
 * consulted once an earlier one produced a token, even if that token turns out to be invalid.
 * <p>
 * Every failure (no token, bad token, missing subject, unknown user) surfaces as the same
 * {@link UnauthenticatedException}.
 *
 * @param <R> the framework's request type
 */
public class IdentityResolver<R> {

  private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

  private final List<TokenSource<R>> sources;
  private final TokenCodec tokenCodec;
  private final UserStore userStore;

  /**
   * Instantiates a new Identity resolver.
   *
   * @param sources    token sources in priority order
   * @param tokenCodec the token codec
   * @param userStore  the user store
   */
  public IdentityResolver(List<TokenSource<R>> sources, TokenCodec tokenCodec, UserStore userStore) {
    if (sources.isEmpty()) {
      throw new IllegalArgumentException("At least one token source is required");
    }
    this.sources = List.copyOf(sources);
    this.tokenCodec = tokenCodec;
    this.userStore = userStore;
  }

  /**
   * Picks the token the request is authenticated with.
   *
   * @param request the inbound request
   * @return the token of the first source that has one, or empty
   */
  public Optional<String> selectToken(R request) {
    for (TokenSource<R> source : sources) {
      Optional<String> token = source.extract(request);
      if (token.isPresent()) {
        return token;
      }
    }
    return Optional.empty();
  }

  /**
   * Resolves the user the request is authenticated as.
   *
   * @param request the inbound request
   * @return the user
   * @throws UnauthenticatedException if no valid token identifies an existing user
   */
  public UserRecord resolve(R request) {
    String token = selectToken(request).orElseThrow(() -> {
      log.debug("resolve(): no token present");
      return new UnauthenticatedException();
    });
    String subject = subjectOf(token);
    return userStore.getUser(subject).orElseThrow(() -> {
      log.debug("resolve(): token subject has no account");
      return new UnauthenticatedException();
    });
  }

  private String subjectOf(String token) {
    Map<String, Object> claims;
    try {
      claims = tokenCodec.verify(token);
    } catch (InvalidSignatureException e) {
      throw new UnauthenticatedException();
    }
    if (claims.get(RegisteredClaims.SUBJECT) instanceof String subject && !subject.isEmpty()) {
      return subject;
    }
    log.debug("resolve(): token has no usable subject");
    throw new UnauthenticatedException();
  }
}
