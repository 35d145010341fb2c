package com.codeheadsystems.tollgate.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTCreator;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.AlgorithmMismatchException;
import com.auth0.jwt.exceptions.IncorrectClaimException;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.MissingClaimException;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.tollgate.server.config.AuthConfig;
import com.codeheadsystems.tollgate.server.config.ConfigurationException;
import com.codeheadsystems.tollgate.server.model.Role;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies HMAC-SHA256 signed JWT bearer tokens.
 * <p>
 * Every token carries a random 128-bit {@code jti} that correlates it with a session record.
 * This class is stateless with respect to sessions: it never touches the session store, so
 * {@link #verify(String)} only proves that the token is authentic and unexpired. Liveness is the
 * {@code AuthenticationGuard}'s job.
 */
public class TokenIssuer {

  private static final Logger log = LoggerFactory.getLogger(TokenIssuer.class);

  /**
   * HS256 keys shorter than the hash output weaken the MAC.
   */
  public static final int MIN_SECRET_BYTES = 32;
  public static final int TOKEN_ID_BYTES = 16;
  public static final Duration MIN_TOKEN_TTL = Duration.ofSeconds(1);

  static final String EMAIL_CLAIM = "email";
  static final String ROLE_CLAIM = "role";
  static final String NAME_CLAIM = "name";

  private static final HexFormat HEX = HexFormat.of();

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final String issuer;
  private final Duration tokenTtl;
  private final Clock clock;
  private final SecureRandom secureRandom;

  /**
   * Creates a new TokenIssuer using the system clock.
   *
   * @param config       the auth config
   * @param secureRandom source of token ids
   * @throws ConfigurationException if the signing secret is missing or too short, or the token
   *                                TTL is under one second
   */
  public TokenIssuer(AuthConfig config, SecureRandom secureRandom) {
    this(config, secureRandom, Clock.systemUTC());
  }

  /**
   * Creates a new TokenIssuer.
   *
   * @param config       the auth config
   * @param secureRandom source of token ids
   * @param clock        clock used for {@code iat} and {@code exp}
   * @throws ConfigurationException if the signing secret is missing or too short, or the token
   *                                TTL is under one second
   */
  public TokenIssuer(AuthConfig config, SecureRandom secureRandom, Clock clock) {
    if (config == null) {
      throw new ConfigurationException("Auth configuration is required");
    }
    String secret = config.signingSecret();
    if (secret == null || secret.isBlank()) {
      throw new ConfigurationException("JWT signing secret is not configured");
    }
    byte[] secretBytes = secret.getBytes(StandardCharsets.UTF_8);
    if (secretBytes.length < MIN_SECRET_BYTES) {
      throw new ConfigurationException(
          "JWT signing secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
    }
    if (config.tokenTtl() == null || config.tokenTtl().compareTo(MIN_TOKEN_TTL) < 0) {
      throw new ConfigurationException("Token expiry must be at least " + MIN_TOKEN_TTL.toSeconds()
          + " second, JWT timestamps have second precision");
    }
    if (config.issuer() == null || config.issuer().isBlank()) {
      throw new ConfigurationException("JWT issuer is not configured");
    }
    this.algorithm = Algorithm.HMAC256(secretBytes);
    this.verifier = JWT.require(algorithm).withIssuer(config.issuer()).build();
    this.issuer = config.issuer();
    this.tokenTtl = config.tokenTtl();
    this.clock = clock;
    this.secureRandom = secureRandom;
  }

  /**
   * Issues a token for a successfully authenticated user.
   *
   * @param subjectId   the user id, becomes {@code sub}
   * @param email       the user's email
   * @param displayName optional display name, becomes {@code name}
   * @param role        optional role, becomes {@code role}
   * @return the signed token and its id
   */
  public IssuedToken issue(String subjectId, String email, String displayName, Role role) {
    if (subjectId == null || subjectId.isBlank()) {
      throw new IllegalArgumentException("subjectId must not be blank");
    }
    String tokenId = newTokenId();
    // JWT timestamps have second precision; truncating keeps exp identical after a round trip.
    Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    Instant expiresAt = now.plus(tokenTtl);

    JWTCreator.Builder builder = JWT.create()
        .withIssuer(issuer)
        .withJWTId(tokenId)
        .withSubject(subjectId)
        .withIssuedAt(now)
        .withExpiresAt(expiresAt);
    if (email != null) {
      builder.withClaim(EMAIL_CLAIM, email);
    }
    if (displayName != null && !displayName.isBlank()) {
      builder.withClaim(NAME_CLAIM, displayName);
    }
    if (role != null) {
      builder.withClaim(ROLE_CLAIM, role.name());
    }
    String token = builder.sign(algorithm);
    log.debug("Issued JWT jti={} for subject={}", tokenId, subjectId);
    return new IssuedToken(token, tokenId, now, expiresAt);
  }

  /**
   * Issues a token without display name or role.
   *
   * @param subjectId the user id
   * @param email     the user's email
   * @return the signed token and its id
   */
  public IssuedToken issue(String subjectId, String email) {
    return issue(subjectId, email, null, null);
  }

  /**
   * Verifies signature, issuer and expiry. Never throws for bad input.
   *
   * @param token compact JWT, may be null
   * @return the payload, or the reason verification failed
   */
  public TokenVerification verify(String token) {
    if (token == null || token.isBlank()) {
      return TokenVerification.invalid(VerificationFailure.MALFORMED);
    }
    try {
      DecodedJWT decoded = verifier.verify(token);
      String subject = decoded.getSubject();
      if (subject == null || subject.isBlank()) {
        log.debug("JWT rejected: subject missing");
        return TokenVerification.invalid(VerificationFailure.MALFORMED);
      }
      Role role = null;
      String roleClaim = decoded.getClaim(ROLE_CLAIM).asString();
      if (roleClaim != null) {
        Optional<Role> parsed = Role.fromClaim(roleClaim);
        if (parsed.isEmpty()) {
          log.debug("JWT rejected: unknown role claim");
          return TokenVerification.invalid(VerificationFailure.INVALID_CLAIM);
        }
        role = parsed.get();
      }
      return TokenVerification.valid(new TokenPayload(
          subject,
          decoded.getClaim(EMAIL_CLAIM).asString(),
          decoded.getId(),
          role,
          decoded.getClaim(NAME_CLAIM).asString(),
          decoded.getIssuedAtAsInstant(),
          decoded.getExpiresAtAsInstant()));
    } catch (TokenExpiredException e) {
      return failed(VerificationFailure.EXPIRED, e);
    } catch (SignatureVerificationException | AlgorithmMismatchException e) {
      return failed(VerificationFailure.BAD_SIGNATURE, e);
    } catch (JWTDecodeException e) {
      return failed(VerificationFailure.MALFORMED, e);
    } catch (IncorrectClaimException | MissingClaimException e) {
      return failed(VerificationFailure.INVALID_CLAIM, e);
    } catch (JWTVerificationException e) {
      return failed(VerificationFailure.BAD_SIGNATURE, e);
    } catch (RuntimeException e) {
      // java-jwt decodes exp/iat into Instants before checking the signature.
      return failed(VerificationFailure.MALFORMED, e);
    }
  }

  private String newTokenId() {
    byte[] bytes = new byte[TOKEN_ID_BYTES];
    secureRandom.nextBytes(bytes);
    return HEX.formatHex(bytes);
  }

  private static TokenVerification failed(VerificationFailure failure, RuntimeException e) {
    log.debug("JWT verification failed ({}): {}", failure, e.getMessage());
    return TokenVerification.invalid(failure);
  }
}
