package com.codeheadsystems.jwtdown.springboot.security;

import com.codeheadsystems.jwtdown.server.auth.IdentityResolver;
import com.codeheadsystems.jwtdown.server.auth.UnauthenticatedException;
import com.codeheadsystems.jwtdown.server.store.UserRecord;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates requests from the bearer header or, failing that, the token cookie.
 * <p>
 * Requests that cannot be resolved pass through unauthenticated; protected routes then reject
 * them through the entry point.
 */
public class JwtAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

  private final IdentityResolver<HttpServletRequest> identityResolver;

  /**
   * Instantiates a new Jwt authentication filter.
   *
   * @param identityResolver the identity resolver
   */
  public JwtAuthenticationFilter(IdentityResolver<HttpServletRequest> identityResolver) {
    this.identityResolver = identityResolver;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    if (identityResolver.selectToken(request).isPresent()) {
      try {
        UserRecord user = identityResolver.resolve(request);
        UsernamePasswordAuthenticationToken auth =
            new UsernamePasswordAuthenticationToken(new JwtdownPrincipal(user), null, List.of());
        SecurityContextHolder.getContext().setAuthentication(auth);
      } catch (UnauthenticatedException e) {
        log.debug("Request token rejected for {}", request.getRequestURI());
      }
    }
    filterChain.doFilter(request, response);
  }
}
