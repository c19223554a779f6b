package com.codeheadsystems.jwtdown.server.cookie;

import java.util.Locale;

/**
 * Values of the {@code SameSite} cookie attribute.
 */
public enum SameSite {

  STRICT("Strict"),
  LAX("Lax"),
  NONE("None");

  private final String attributeValue;

  SameSite(String attributeValue) {
    this.attributeValue = attributeValue;
  }

  /**
   * The value as written in a {@code Set-Cookie} header.
   *
   * @return the attribute value
   */
  public String attributeValue() {
    return attributeValue;
  }

  /**
   * Parses a configured value, case-insensitive.
   *
   * @param value e.g. {@code lax}
   * @return the SameSite value
   */
  public static SameSite fromName(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("SameSite value must be configured");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unsupported SameSite value: " + value, e);
    }
  }
}
