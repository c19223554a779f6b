package com.codeheadsystems.jwtdown.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTCreator;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.RegisteredClaims;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.auth0.jwt.interfaces.Verification;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes claims into signed compact JWTs and verifies them back.
 * <p>
 * Tokens are signed with an HMAC algorithm over a server-held secret that is fixed at
 * construction. Verification accepts only that algorithm, so unsigned ({@code alg: none}) or
 * differently signed tokens are rejected.
 * <p>
 * By default no expiry is attached and issued tokens stay valid until the secret changes. When a
 * lifetime is supplied, {@code exp} is added at issue time and enforced by {@link #verify(String)}.
 */
public class TokenCodec {

  private static final Logger log = LoggerFactory.getLogger(TokenCodec.class);
  private static final TypeReference<LinkedHashMap<String, Object>> CLAIMS_TYPE = new TypeReference<>() {
  };

  private static final Base64.Encoder SIGNATURE_ENCODER = Base64.getUrlEncoder().withoutPadding();

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final Duration lifetime;
  private final ObjectMapper objectMapper;

  /**
   * Creates a codec whose tokens never expire.
   *
   * @param secret        HMAC signing secret
   * @param hmacAlgorithm signing algorithm
   */
  public TokenCodec(byte[] secret, HmacAlgorithm hmacAlgorithm) {
    this(secret, hmacAlgorithm, null);
  }

  /**
   * Creates a codec.
   *
   * @param secret        HMAC signing secret
   * @param hmacAlgorithm signing algorithm
   * @param lifetime      token lifetime, or null to issue tokens without {@code exp}
   */
  public TokenCodec(byte[] secret, HmacAlgorithm hmacAlgorithm, Duration lifetime) {
    if (secret == null || secret.length == 0) {
      throw new IllegalArgumentException("Token signing secret must not be empty");
    }
    if (lifetime != null && (lifetime.isNegative() || lifetime.isZero())) {
      throw new IllegalArgumentException("Token lifetime must be positive");
    }
    this.algorithm = hmacAlgorithm.create(secret);
    this.lifetime = lifetime;
    Verification verification = JWT.require(algorithm);
    if (lifetime != null) {
      verification = verification.withClaimPresence(RegisteredClaims.EXPIRES_AT);
    }
    this.verifier = verification.build();
    this.objectMapper = new ObjectMapper();
  }

  /**
   * Signs the given claims. The map is used as the payload unchanged, apart from {@code exp}
   * when a lifetime is configured.
   *
   * @param claims payload claims
   * @return signed compact JWT
   */
  public String issue(Map<String, ?> claims) {
    JWTCreator.Builder builder = JWT.create().withPayload(claims);
    if (lifetime != null) {
      builder.withExpiresAt(Instant.now().plus(lifetime));
    }
    return builder.sign(algorithm);
  }

  /**
   * Signs a token carrying only the subject claim.
   *
   * @param subject the username
   * @return signed compact JWT
   */
  public String issueForSubject(String subject) {
    return issue(Map.of(RegisteredClaims.SUBJECT, subject));
  }

  /**
   * Verifies signature, algorithm and any registered time claims. The signature segment must be
   * canonically encoded.
   *
   * @param token compact JWT
   * @return the decoded payload
   * @throws InvalidSignatureException if the token does not verify for any reason
   */
  public Map<String, Object> verify(String token) {
    if (token == null || token.isBlank()) {
      throw new InvalidSignatureException();
    }
    try {
      DecodedJWT decoded = JWT.decode(token);
      requireCanonicalSignature(decoded);
      return claimsOf(verifier.verify(decoded));
    } catch (JWTVerificationException e) {
      log.debug("Token verification failed: {}", e.getClass().getSimpleName());
      throw new InvalidSignatureException();
    }
  }

  /**
   * Verifies only the signature and algorithm, ignoring {@code exp} and other registered claims.
   *
   * @param token compact JWT
   * @return the decoded payload
   * @throws InvalidSignatureException if the token is malformed or the signature does not match
   */
  public Map<String, Object> verifySignature(String token) {
    if (token == null || token.isBlank()) {
      throw new InvalidSignatureException();
    }
    try {
      DecodedJWT decoded = JWT.decode(token);
      requireCanonicalSignature(decoded);
      if (!algorithm.getName().equals(decoded.getAlgorithm())) {
        log.debug("Token signed with unexpected algorithm");
        throw new InvalidSignatureException();
      }
      algorithm.verify(decoded);
      return claimsOf(decoded);
    } catch (JWTVerificationException e) {
      log.debug("Token signature check failed: {}", e.getClass().getSimpleName());
      throw new InvalidSignatureException();
    }
  }

  /**
   * The JOSE identifier of the signing algorithm, e.g. {@code HS256}.
   *
   * @return the algorithm name
   */
  public String algorithmName() {
    return algorithm.getName();
  }

  // The base64url decoder ignores the unused low bits of the final character, so two spellings
  // of one signature would both verify. Only the spelling the encoder produces is accepted.
  private void requireCanonicalSignature(DecodedJWT decoded) {
    String signature = decoded.getSignature();
    try {
      byte[] raw = Base64.getUrlDecoder().decode(signature);
      if (!SIGNATURE_ENCODER.encodeToString(raw).equals(signature)) {
        log.debug("Token signature is not canonically encoded");
        throw new InvalidSignatureException();
      }
    } catch (IllegalArgumentException e) {
      log.debug("Token signature is not valid base64url");
      throw new InvalidSignatureException();
    }
  }

  private Map<String, Object> claimsOf(DecodedJWT decoded) {
    try {
      byte[] json = Base64.getUrlDecoder().decode(decoded.getPayload());
      return objectMapper.readValue(json, CLAIMS_TYPE);
    } catch (IOException | IllegalArgumentException e) {
      throw new InvalidSignatureException();
    }
  }
}
