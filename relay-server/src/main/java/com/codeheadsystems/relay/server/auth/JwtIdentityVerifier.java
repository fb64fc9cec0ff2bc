package com.codeheadsystems.relay.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTCreator;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.Claim;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.auth0.jwt.interfaces.Verification;
import com.codeheadsystems.relay.model.IdentityClaims;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies HMAC-SHA256 signed JWT bearer tokens and extracts the relay identity from them.
 * <p>
 * A token is accepted when its signature matches the configured secret, it has not expired,
 * and it carries an {@code email} claim plus an {@code id} claim (or a subject to fall back
 * on). When an issuer is configured, the token's {@code iss} claim must match it.
 * <p>
 * The same secret is used to issue tokens via {@link #issueToken}, which exists for developer
 * tooling and tests; production tokens are normally minted by the account service that shares
 * the secret.
 */
public class JwtIdentityVerifier implements IdentityVerifier {

  private static final Logger log = LoggerFactory.getLogger(JwtIdentityVerifier.class);

  static final String CLAIM_ID = "id";
  static final String CLAIM_EMAIL = "email";
  static final String CLAIM_ROLE = "role";

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final String issuer;
  private final long ttlSeconds;

  /**
   * Creates a new JwtIdentityVerifier.
   *
   * @param secret     HMAC-SHA256 signing secret
   * @param issuer     required issuer claim, or null / empty to accept any issuer
   * @param ttlSeconds time-to-live of tokens produced by {@link #issueToken}
   */
  public JwtIdentityVerifier(byte[] secret, String issuer, long ttlSeconds) {
    if (secret == null || secret.length == 0) {
      throw new IllegalArgumentException("JWT secret must not be empty");
    }
    this.algorithm = Algorithm.HMAC256(secret);
    this.issuer = issuer == null || issuer.isEmpty() ? null : issuer;
    Verification verification = JWT.require(algorithm);
    if (this.issuer != null) {
      verification = verification.withIssuer(this.issuer);
    }
    this.verifier = verification.build();
    this.ttlSeconds = ttlSeconds;
  }

  @Override
  public IdentityClaims verify(String credential) throws AuthenticationFailedException {
    if (credential == null || credential.isBlank()) {
      throw new AuthenticationFailedException("Missing token");
    }
    DecodedJWT decoded;
    try {
      decoded = verifier.verify(credential);
    } catch (JWTVerificationException e) {
      log.debug("JWT verification failed: {}", e.getMessage());
      throw new AuthenticationFailedException("Invalid or expired token", e);
    }

    String email = claimAsString(decoded.getClaim(CLAIM_EMAIL));
    if (email == null || email.isBlank()) {
      log.debug("JWT jti={} has no email claim", decoded.getId());
      throw new AuthenticationFailedException("Token has no email claim");
    }
    String id = claimAsString(decoded.getClaim(CLAIM_ID));
    if (id == null || id.isBlank()) {
      id = decoded.getSubject();
    }
    if (id == null || id.isBlank()) {
      log.debug("JWT jti={} has neither an id claim nor a subject", decoded.getId());
      throw new AuthenticationFailedException("Token has no id claim");
    }
    return new IdentityClaims(id, email, claimAsString(decoded.getClaim(CLAIM_ROLE)));
  }

  /**
   * Issues a token carrying the given claims.
   *
   * @param claims the identity to encode
   * @return signed JWT string
   */
  public String issueToken(IdentityClaims claims) {
    Instant now = Instant.now();
    JWTCreator.Builder builder = JWT.create()
        .withJWTId(UUID.randomUUID().toString())
        .withSubject(claims.id())
        .withClaim(CLAIM_ID, claims.id())
        .withClaim(CLAIM_EMAIL, claims.email())
        .withIssuedAt(now)
        .withExpiresAt(now.plusSeconds(ttlSeconds));
    if (claims.role() != null) {
      builder.withClaim(CLAIM_ROLE, claims.role());
    }
    if (issuer != null) {
      builder.withIssuer(issuer);
    }
    String token = builder.sign(algorithm);
    log.debug("Issued JWT for {}", claims.email());
    return token;
  }

  // Numeric ids are common in tokens minted by other services.
  private static String claimAsString(Claim claim) {
    if (claim == null || claim.isMissing() || claim.isNull()) {
      return null;
    }
    String value = claim.asString();
    if (value != null) {
      return value;
    }
    Long number = claim.asLong();
    return number == null ? null : number.toString();
  }
}
