package com.codeheadsystems.jwtdown.springboot.config;

import com.codeheadsystems.jwtdown.server.auth.BcryptPasswordHasher;
import com.codeheadsystems.jwtdown.server.auth.CredentialVerifier;
import com.codeheadsystems.jwtdown.server.auth.HmacAlgorithm;
import com.codeheadsystems.jwtdown.server.auth.IdentityResolver;
import com.codeheadsystems.jwtdown.server.auth.PasswordHasher;
import com.codeheadsystems.jwtdown.server.auth.TokenCodec;
import com.codeheadsystems.jwtdown.server.auth.TokenSources;
import com.codeheadsystems.jwtdown.server.cookie.CookiePolicy;
import com.codeheadsystems.jwtdown.server.cookie.SameSite;
import com.codeheadsystems.jwtdown.server.manager.SessionManager;
import com.codeheadsystems.jwtdown.server.store.InMemoryUserStore;
import com.codeheadsystems.jwtdown.server.store.UserStore;
import com.codeheadsystems.jwtdown.springboot.controller.SessionController;
import com.codeheadsystems.jwtdown.springboot.security.JwtdownSecurityConfig;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.security.servlet.SecurityAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.web.util.WebUtils;

@AutoConfiguration(before = SecurityAutoConfiguration.class)
@EnableConfigurationProperties(JwtdownProperties.class)
@Import({JwtdownSecurityConfig.class, SessionController.class})
public class JwtdownAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(JwtdownAutoConfiguration.class);
  private static final String UNRESOLVED_PLACEHOLDER = "${";

  /**
   * Default {@link SecureRandom} instance used for password salts.  Override this bean to supply
   * a custom implementation:
   * <pre>{@code
   *   @Bean
   *   public SecureRandom secureRandom() {
   *     return SecureRandom.getInstance("NativePRNG");
   *   }
   * }</pre>
   */
  @Bean
  @ConditionalOnMissingBean
  public SecureRandom secureRandom() {
    return new SecureRandom();
  }

  @Bean
  @ConditionalOnMissingBean
  public UserStore userStore() {
    log.warn("Using in-memory user store. All accounts will be lost on restart. Do not use in production.");
    return new InMemoryUserStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public PasswordHasher passwordHasher(JwtdownProperties props, SecureRandom secureRandom) {
    return new BcryptPasswordHasher(secureRandom, props.getBcryptCost());
  }

  /**
   * The token codec.  Unlike the other defaults there is no random fallback: a missing secret
   * stops the application from starting.
   */
  @Bean
  @ConditionalOnMissingBean
  public TokenCodec tokenCodec(JwtdownProperties props) {
    String secretKey = props.getSecretKey();
    if (secretKey == null || secretKey.isEmpty()) {
      throw new IllegalStateException(
          "jwtdown.secret-key must be configured. "
              + "Generate a value with: openssl rand -hex 32");
    }
    if (secretKey.contains(UNRESOLVED_PLACEHOLDER)) {
      throw new IllegalStateException(
          "jwtdown.secret-key contains an unresolved placeholder; "
              + "set the referenced environment variable");
    }
    HmacAlgorithm algorithm = HmacAlgorithm.fromName(props.getAlgorithm());
    Duration lifetime = null;
    if (props.isEnforceExpiry()) {
      lifetime = Duration.ofMinutes(props.getAccessTokenExpireMinutes());
      log.info("Tokens expire after {} minutes", props.getAccessTokenExpireMinutes());
    }
    return new TokenCodec(secretKey.getBytes(StandardCharsets.UTF_8), algorithm, lifetime);
  }

  @Bean
  @ConditionalOnMissingBean
  public CredentialVerifier credentialVerifier(UserStore userStore, PasswordHasher passwordHasher) {
    return new CredentialVerifier(userStore, passwordHasher);
  }

  @Bean
  @ConditionalOnMissingBean
  public CookiePolicy cookiePolicy(JwtdownProperties props) {
    return new CookiePolicy(
        props.getCookieName(),
        props.getDevelopmentOriginMarker(),
        SameSite.fromName(props.getDevelopmentSameSite()),
        SameSite.fromName(props.getCrossSiteSameSite()));
  }

  /**
   * Header first, then cookie.
   */
  @Bean
  @ConditionalOnMissingBean
  public IdentityResolver<HttpServletRequest> identityResolver(CookiePolicy cookiePolicy,
                                                               TokenCodec tokenCodec,
                                                               UserStore userStore) {
    String cookieName = cookiePolicy.cookieName();
    return new IdentityResolver<>(
        List.of(
            TokenSources.bearerHeader(request -> request.getHeader(HttpHeaders.AUTHORIZATION)),
            TokenSources.cookie(request -> {
              Cookie cookie = WebUtils.getCookie(request, cookieName);
              return cookie == null ? null : cookie.getValue();
            })),
        tokenCodec,
        userStore);
  }

  @Bean
  @ConditionalOnMissingBean
  public SessionManager sessionManager(CredentialVerifier credentialVerifier, TokenCodec tokenCodec,
                                       PasswordHasher passwordHasher, UserStore userStore,
                                       CookiePolicy cookiePolicy) {
    return new SessionManager(credentialVerifier, tokenCodec, passwordHasher, userStore, cookiePolicy);
  }
}
