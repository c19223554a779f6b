package com.codeheadsystems.jwtdown.server.auth;

import com.auth0.jwt.algorithms.Algorithm;
import java.util.Locale;

/**
 * HMAC signing algorithms a {@link TokenCodec} can be configured with.
 */
public enum HmacAlgorithm {

  HS256 {
    @Override
    Algorithm create(byte[] secret) {
      return Algorithm.HMAC256(secret);
    }
  },
  HS384 {
    @Override
    Algorithm create(byte[] secret) {
      return Algorithm.HMAC384(secret);
    }
  },
  HS512 {
    @Override
    Algorithm create(byte[] secret) {
      return Algorithm.HMAC512(secret);
    }
  };

  abstract Algorithm create(byte[] secret);

  /**
   * Resolves a JOSE algorithm identifier such as {@code HS256}.
   *
   * @param name the identifier, case-insensitive
   * @return the algorithm
   * @throws IllegalArgumentException if the identifier is not an HMAC algorithm
   */
  public static HmacAlgorithm fromName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Signing algorithm must be configured");
    }
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unsupported signing algorithm: " + name, e);
    }
  }
}
