package com.codeheadsystems.jwtdown.server.auth;

import com.codeheadsystems.jwtdown.server.store.UserRecord;
import com.codeheadsystems.jwtdown.server.store.UserStore;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a username and password against the {@link UserStore}.
 * <p>
 * An unknown user and a wrong password both produce an empty result; neither is an error.
 */
public class CredentialVerifier {

  private static final Logger log = LoggerFactory.getLogger(CredentialVerifier.class);

  private final UserStore userStore;
  private final PasswordHasher passwordHasher;

  /**
   * Instantiates a new Credential verifier.
   *
   * @param userStore      the user store
   * @param passwordHasher the password hasher
   */
  public CredentialVerifier(UserStore userStore, PasswordHasher passwordHasher) {
    this.userStore = userStore;
    this.passwordHasher = passwordHasher;
  }

  /**
   * Authenticates a user.
   *
   * @param username the login name
   * @param password the plaintext password
   * @return the user if the password matches, empty otherwise
   */
  public Optional<UserRecord> authenticate(String username, String password) {
    if (username == null || username.isBlank() || password == null) {
      return Optional.empty();
    }
    Optional<UserRecord> user = userStore.getUser(username);
    if (user.isEmpty()) {
      log.debug("authenticate(): no such user");
      return Optional.empty();
    }
    if (!passwordHasher.verify(password, user.get().passwordHash())) {
      log.debug("authenticate(): password mismatch for user id={}", user.get().id());
      return Optional.empty();
    }
    return user;
  }
}
