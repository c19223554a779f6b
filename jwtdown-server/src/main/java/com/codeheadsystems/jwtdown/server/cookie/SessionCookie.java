package com.codeheadsystems.jwtdown.server.cookie;

import java.time.Duration;

/**
 * Framework-neutral description of the token cookie to set or clear.
 *
 * @param name     cookie name
 * @param value    token, or empty when clearing
 * @param sameSite SameSite attribute
 * @param secure   whether the Secure attribute is set
 * @param httpOnly whether the HttpOnly attribute is set
 * @param path     cookie path
 * @param maxAge   Max-Age, or null for a browser-session cookie; zero deletes the cookie
 */
public record SessionCookie(
    String name,
    String value,
    SameSite sameSite,
    boolean secure,
    boolean httpOnly,
    String path,
    Duration maxAge) {

  /**
   * Whether this cookie instructs the browser to delete it.
   *
   * @return true for a clearing cookie
   */
  public boolean isDeletion() {
    return maxAge != null && maxAge.isZero();
  }

  @Override
  public String toString() {
    return "SessionCookie[name=" + name + ", sameSite=" + sameSite + ", secure=" + secure
        + ", deletion=" + isDeletion() + "]";
  }
}
