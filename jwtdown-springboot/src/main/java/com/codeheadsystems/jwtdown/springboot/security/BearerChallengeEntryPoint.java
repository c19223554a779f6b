package com.codeheadsystems.jwtdown.springboot.security;

import com.codeheadsystems.jwtdown.model.ErrorResponse;
import com.codeheadsystems.jwtdown.server.auth.UnauthenticatedException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

/**
 * Answers unauthenticated requests to protected routes with 401, a {@code Bearer} challenge and
 * the same body the login endpoint returns on failure.
 */
public class BearerChallengeEntryPoint implements AuthenticationEntryPoint {

  /**
   * The {@code WWW-Authenticate} challenge.
   */
  public static final String CHALLENGE = "Bearer";

  private final ObjectMapper objectMapper;

  public BearerChallengeEntryPoint(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public void commence(HttpServletRequest request, HttpServletResponse response,
                       AuthenticationException authException) throws IOException {
    response.setStatus(HttpStatus.UNAUTHORIZED.value());
    response.setHeader(HttpHeaders.WWW_AUTHENTICATE, CHALLENGE);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(),
        new ErrorResponse(UnauthenticatedException.MESSAGE));
  }
}
