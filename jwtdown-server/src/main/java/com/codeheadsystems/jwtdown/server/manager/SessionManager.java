package com.codeheadsystems.jwtdown.server.manager;

import com.codeheadsystems.jwtdown.model.AccessTokenResponse;
import com.codeheadsystems.jwtdown.model.CookieTokenResponse;
import com.codeheadsystems.jwtdown.model.SignupRequest;
import com.codeheadsystems.jwtdown.model.UserResponse;
import com.codeheadsystems.jwtdown.server.auth.CredentialVerifier;
import com.codeheadsystems.jwtdown.server.auth.InvalidSignatureException;
import com.codeheadsystems.jwtdown.server.auth.PasswordHasher;
import com.codeheadsystems.jwtdown.server.auth.TokenCodec;
import com.codeheadsystems.jwtdown.server.auth.UnauthenticatedException;
import com.codeheadsystems.jwtdown.server.cookie.CookiePolicy;
import com.codeheadsystems.jwtdown.server.cookie.SessionCookie;
import com.codeheadsystems.jwtdown.server.store.UserRecord;
import com.codeheadsystems.jwtdown.server.store.UserStore;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service behind the session endpoints: login, token read, signup, identity
 * read, token validation and logout.
 * <p>
 * Holds no per-request state. Framework adapters ({@code SessionController} for Spring Boot) only
 * translate HTTP input into calls here and exceptions into HTTP responses.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link IllegalArgumentException}: bad or missing request data, HTTP 400</li>
 *   <li>{@link UnauthenticatedException}: login failure, HTTP 401 with a Bearer challenge</li>
 *   <li>{@link InvalidSignatureException}: token rejected by {@link #validate}, HTTP 422</li>
 *   <li>{@code UserStoreException}: propagated unchanged from the {@link UserStore}</li>
 * </ul>
 */
public class SessionManager {

  private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

  private final CredentialVerifier credentialVerifier;
  private final TokenCodec tokenCodec;
  private final PasswordHasher passwordHasher;
  private final UserStore userStore;
  private final CookiePolicy cookiePolicy;

  public SessionManager(CredentialVerifier credentialVerifier, TokenCodec tokenCodec,
                        PasswordHasher passwordHasher, UserStore userStore, CookiePolicy cookiePolicy) {
    this.credentialVerifier = credentialVerifier;
    this.tokenCodec = tokenCodec;
    this.passwordHasher = passwordHasher;
    this.userStore = userStore;
    this.cookiePolicy = cookiePolicy;
  }

  /**
   * Checks the password and issues a token for the user, both in the body and as a cookie.
   *
   * @param username the login name
   * @param password the plaintext password
   * @param origin   the request's Origin header, may be null
   * @return the token response and cookie
   * @throws UnauthenticatedException if the credentials do not match an account
   */
  public LoginResult login(String username, String password, String origin) {
    log.debug("login()");
    UserRecord user = credentialVerifier.authenticate(username, password)
        .orElseThrow(UnauthenticatedException::new);
    String token = tokenCodec.issueForSubject(user.username());
    return new LoginResult(AccessTokenResponse.bearer(token), cookiePolicy.issue(token, origin));
  }

  /**
   * Echoes the cookie-borne token.
   *
   * @param cookieToken the cookie value, or null when the cookie is absent
   * @return the token, or empty when there is no cookie
   */
  public Optional<CookieTokenResponse> readToken(String cookieToken) {
    return Optional.ofNullable(cookieToken).map(CookieTokenResponse::new);
  }

  /**
   * Creates an account. Username uniqueness is left to the {@link UserStore}.
   *
   * @param request the signup request
   * @throws IllegalArgumentException if username or password is missing
   */
  public void signup(SignupRequest request) {
    log.debug("signup()");
    if (request == null || request.username() == null || request.username().isBlank()) {
      throw new IllegalArgumentException("Missing required field: username");
    }
    if (request.password() == null) {
      throw new IllegalArgumentException("Missing required field: password");
    }
    String hash = passwordHasher.hash(request.password());
    userStore.createUser(request.username(), hash, request.email());
    log.info("Created user {}", request.username());
  }

  /**
   * Projects the resolved identity for the client.
   * <p>
   * A disabled-account check would go here; accounts have no such state today.
   *
   * @param identity the user resolved from the request's token
   * @return the user response
   */
  public UserResponse currentUser(UserRecord identity) {
    return new UserResponse(identity.id(), identity.username(), identity.passwordHash(), identity.email());
  }

  /**
   * Checks only that the token is well-formed and signed with this server's key. The subject is
   * not looked up.
   *
   * @param token compact JWT
   * @return the decoded payload
   * @throws InvalidSignatureException if the signature does not verify
   */
  public Map<String, Object> validate(String token) {
    log.debug("validate()");
    return tokenCodec.verifySignature(token);
  }

  /**
   * The cookie that clears the session. Safe to call with no session.
   *
   * @param origin the request's Origin header, may be null
   * @return the clearing cookie
   */
  public SessionCookie logout(String origin) {
    log.debug("logout()");
    return cookiePolicy.clear(origin);
  }

  /**
   * The name of the token cookie.
   *
   * @return the cookie name
   */
  public String cookieName() {
    return cookiePolicy.cookieName();
  }
}
