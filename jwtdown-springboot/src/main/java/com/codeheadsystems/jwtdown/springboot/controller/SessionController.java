package com.codeheadsystems.jwtdown.springboot.controller;

import com.codeheadsystems.jwtdown.model.AccessTokenResponse;
import com.codeheadsystems.jwtdown.model.CookieTokenResponse;
import com.codeheadsystems.jwtdown.model.ErrorResponse;
import com.codeheadsystems.jwtdown.model.SignupRequest;
import com.codeheadsystems.jwtdown.model.UserResponse;
import com.codeheadsystems.jwtdown.model.ValidateTokenRequest;
import com.codeheadsystems.jwtdown.server.auth.InvalidSignatureException;
import com.codeheadsystems.jwtdown.server.auth.UnauthenticatedException;
import com.codeheadsystems.jwtdown.server.cookie.SessionCookie;
import com.codeheadsystems.jwtdown.server.manager.LoginResult;
import com.codeheadsystems.jwtdown.server.manager.SessionManager;
import com.codeheadsystems.jwtdown.server.store.DuplicateUserException;
import com.codeheadsystems.jwtdown.springboot.security.BearerChallengeEntryPoint;
import com.codeheadsystems.jwtdown.springboot.security.JwtdownPrincipal;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.WebUtils;

@RestController
public class SessionController {

  private static final Logger log = LoggerFactory.getLogger(SessionController.class);

  private final SessionManager sessionManager;

  public SessionController(SessionManager sessionManager) {
    this.sessionManager = sessionManager;
  }

  @PostMapping(path = "/token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
  public ResponseEntity<AccessTokenResponse> login(
      @RequestParam("username") String username,
      @RequestParam("password") String password,
      @RequestHeader(value = HttpHeaders.ORIGIN, required = false) String origin) {
    LoginResult result = sessionManager.login(username, password, origin);
    return ResponseEntity.ok()
        .header(HttpHeaders.SET_COOKIE, toResponseCookie(result.cookie()).toString())
        .body(result.body());
  }

  // No cookie means 200 with no body.
  @GetMapping("/token")
  public CookieTokenResponse readToken(HttpServletRequest request) {
    Cookie cookie = WebUtils.getCookie(request, sessionManager.cookieName());
    return sessionManager.readToken(cookie == null ? null : cookie.getValue()).orElse(null);
  }

  @PostMapping("/api/users")
  public ResponseEntity<Void> signup(@RequestBody SignupRequest request) {
    sessionManager.signup(request);
    return ResponseEntity.ok().build();
  }

  @GetMapping("/users/me")
  public UserResponse currentUser(@AuthenticationPrincipal JwtdownPrincipal principal) {
    return sessionManager.currentUser(principal.user());
  }

  @PostMapping("/token/validate")
  public ResponseEntity<?> validate(@RequestBody ValidateTokenRequest request) {
    try {
      return ResponseEntity.ok(sessionManager.validate(request.token()));
    } catch (InvalidSignatureException e) {
      return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
          .body(new ErrorResponse(InvalidSignatureException.MESSAGE));
    }
  }

  @DeleteMapping("/token")
  public ResponseEntity<Void> logout(
      @RequestHeader(value = HttpHeaders.ORIGIN, required = false) String origin) {
    SessionCookie cookie = sessionManager.logout(origin);
    return ResponseEntity.ok()
        .header(HttpHeaders.SET_COOKIE, toResponseCookie(cookie).toString())
        .build();
  }

  @ExceptionHandler(UnauthenticatedException.class)
  public ResponseEntity<ErrorResponse> handleUnauthenticated(UnauthenticatedException e) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .header(HttpHeaders.WWW_AUTHENTICATE, BearerChallengeEntryPoint.CHALLENGE)
        .body(new ErrorResponse(UnauthenticatedException.MESSAGE));
  }

  @ExceptionHandler(DuplicateUserException.class)
  public ResponseEntity<ErrorResponse> handleDuplicateUser(DuplicateUserException e) {
    log.debug("signup rejected: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ErrorResponse("Username already exists"));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
    return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
  }

  private static ResponseCookie toResponseCookie(SessionCookie cookie) {
    ResponseCookie.ResponseCookieBuilder builder = ResponseCookie.from(cookie.name(), cookie.value())
        .httpOnly(cookie.httpOnly())
        .secure(cookie.secure())
        .sameSite(cookie.sameSite().attributeValue())
        .path(cookie.path());
    if (cookie.maxAge() != null) {
      builder.maxAge(cookie.maxAge());
    }
    return builder.build();
  }
}
