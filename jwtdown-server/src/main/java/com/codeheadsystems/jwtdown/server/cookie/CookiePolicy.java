package com.codeheadsystems.jwtdown.server.cookie;

import java.time.Duration;

/**
 * Decides the attributes of the token cookie from the request's {@code Origin} header.
 * <p>
 * Requests from a local development origin (one whose {@code Origin} contains the development
 * marker, {@code localhost} by default) get a non-secure cookie with the development SameSite
 * value so plain-HTTP front ends work. Every other request gets a Secure cookie with the
 * cross-site SameSite value. The cookie is always HttpOnly with path {@code /}.
 */
public class CookiePolicy {

  /**
   * Default cookie name.
   */
  public static final String DEFAULT_COOKIE_NAME = "jwtdown_access_token";

  /**
   * Default development marker.
   */
  public static final String DEFAULT_DEVELOPMENT_ORIGIN_MARKER = "localhost";

  private static final String PATH = "/";

  private final String cookieName;
  private final String developmentOriginMarker;
  private final SameSite developmentSameSite;
  private final SameSite crossSiteSameSite;

  /**
   * Creates a policy with the default name, marker and SameSite values.
   * <p>
   * Non-development origins get {@code SameSite=None; Secure}, not {@code Strict}; use the
   * four-argument constructor with {@link SameSite#STRICT} for single-site deployments.
   */
  public CookiePolicy() {
    this(DEFAULT_COOKIE_NAME, DEFAULT_DEVELOPMENT_ORIGIN_MARKER, SameSite.LAX, SameSite.NONE);
  }

  /**
   * Instantiates a new Cookie policy.
   *
   * @param cookieName              the cookie name
   * @param developmentOriginMarker substring of the Origin header marking local development
   * @param developmentSameSite     SameSite for development origins
   * @param crossSiteSameSite       SameSite for all other origins
   */
  public CookiePolicy(String cookieName, String developmentOriginMarker,
                      SameSite developmentSameSite, SameSite crossSiteSameSite) {
    if (cookieName == null || cookieName.isBlank()) {
      throw new IllegalArgumentException("Cookie name must be configured");
    }
    if (developmentOriginMarker == null || developmentOriginMarker.isEmpty()) {
      throw new IllegalArgumentException("Development origin marker must be configured");
    }
    this.cookieName = cookieName;
    this.developmentOriginMarker = developmentOriginMarker;
    this.developmentSameSite = developmentSameSite;
    this.crossSiteSameSite = crossSiteSameSite;
  }

  /**
   * The name of the token cookie.
   *
   * @return the cookie name
   */
  public String cookieName() {
    return cookieName;
  }

  /**
   * Whether an Origin header value marks a local development front end.
   *
   * @param origin the Origin header, may be null
   * @return true for a development origin
   */
  public boolean isDevelopmentOrigin(String origin) {
    return origin != null && origin.contains(developmentOriginMarker);
  }

  /**
   * The cookie carrying a freshly issued token.
   *
   * @param token  the token
   * @param origin the Origin header, may be null
   * @return the cookie to set
   */
  public SessionCookie issue(String token, String origin) {
    return build(token, origin, null);
  }

  /**
   * The cookie that deletes the token cookie, using the same attributes it was set with.
   *
   * @param origin the Origin header, may be null
   * @return the cookie to set
   */
  public SessionCookie clear(String origin) {
    return build("", origin, Duration.ZERO);
  }

  private SessionCookie build(String value, String origin, Duration maxAge) {
    boolean development = isDevelopmentOrigin(origin);
    return new SessionCookie(
        cookieName,
        value,
        development ? developmentSameSite : crossSiteSameSite,
        !development,
        true,
        PATH,
        maxAge);
  }
}
