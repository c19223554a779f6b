package com.codeheadsystems.jwtdown.server.auth;

/**
 * One-way hashing of stored passwords.
 * <p>
 * Implementations must be thread-safe and deliberately slow.
 */
public interface PasswordHasher {

  /**
   * Hashes a plaintext password with a fresh random salt.
   *
   * @param plaintext the password
   * @return the encoded hash, including algorithm, cost and salt
   */
  String hash(String plaintext);

  /**
   * Checks a plaintext password against a stored hash.
   * <p>
   * Never throws for a mismatch or a malformed hash; both return {@code false}.
   *
   * @param plaintext the candidate password
   * @param hash      the stored hash
   * @return true if the password matches
   */
  boolean verify(String plaintext, String hash);
}
