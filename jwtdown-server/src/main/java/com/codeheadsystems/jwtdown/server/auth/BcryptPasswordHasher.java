package com.codeheadsystems.jwtdown.server.auth;

import java.security.SecureRandom;
import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.generators.OpenBSDBCrypt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PasswordHasher} using bcrypt in the OpenBSD modular-crypt format ({@code $2b$}).
 * <p>
 * Hashes written by other bcrypt implementations ({@code $2a$}, {@code $2y$}, {@code $2b$}) verify
 * unchanged. The comparison inside {@link OpenBSDBCrypt#checkPassword(String, char[])} is
 * constant-time.
 */
public class BcryptPasswordHasher implements PasswordHasher {

  private static final Logger log = LoggerFactory.getLogger(BcryptPasswordHasher.class);

  /**
   * Cost used when none is configured.
   */
  public static final int DEFAULT_COST = 12;

  private static final int MIN_COST = 4;
  private static final int MAX_COST = 31;
  private static final int SALT_LENGTH = 16;
  private static final String VERSION = "2b";
  private static final String PREFIX = "$2";

  private final SecureRandom secureRandom;
  private final int cost;

  /**
   * Instantiates a new Bcrypt password hasher.
   *
   * @param secureRandom source of salts
   * @param cost         log2 of the bcrypt round count, 4 to 31
   */
  public BcryptPasswordHasher(SecureRandom secureRandom, int cost) {
    if (cost < MIN_COST || cost > MAX_COST) {
      throw new IllegalArgumentException("bcrypt cost must be between " + MIN_COST + " and " + MAX_COST);
    }
    this.secureRandom = secureRandom;
    this.cost = cost;
  }

  @Override
  public String hash(String plaintext) {
    if (plaintext == null) {
      throw new IllegalArgumentException("Missing required field: password");
    }
    byte[] salt = new byte[SALT_LENGTH];
    secureRandom.nextBytes(salt);
    return OpenBSDBCrypt.generate(VERSION, plaintext.toCharArray(), salt, cost);
  }

  @Override
  public boolean verify(String plaintext, String hash) {
    if (plaintext == null || hash == null || !hash.startsWith(PREFIX)) {
      return false;
    }
    try {
      return OpenBSDBCrypt.checkPassword(hash, plaintext.toCharArray());
    } catch (IllegalArgumentException | DataLengthException e) {
      log.debug("Stored hash is not a valid bcrypt string: {}", e.getMessage());
      return false;
    }
  }
}
