package com.ontologymarket.auth.service;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.ontologymarket.auth.config.AuthConfiguration;
import com.ontologymarket.auth.model.CallerIdentity;
import com.ontologymarket.auth.model.RejectionReason;
import com.ontologymarket.auth.model.VerificationOutcome;
import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies identity-provider ID tokens carried in an {@code Authorization: Bearer} header.
 *
 * <p>Checks run in a fixed order: header shape, token structure, signature, validity window,
 * issuer, audience, subject, and finally the verified-email flag. The first failing check decides
 * the rejection reason. Only the reason leaves this class; failure details are logged at debug.
 */
public class TokenVerifier {

  private static final Logger logger = LoggerFactory.getLogger(TokenVerifier.class);
  private static final String BEARER_PREFIX = "Bearer ";
  private static final int MAX_SUBJECT_LENGTH = 128;

  private final AuthConfiguration configuration;
  private final SigningKeyCache signingKeyCache;
  private final Clock clock;

  public TokenVerifier(
      AuthConfiguration configuration, SigningKeyCache signingKeyCache, Clock clock) {
    this.configuration = configuration;
    this.signingKeyCache = signingKeyCache;
    this.clock = clock;
  }

  /**
   * Verifies the raw {@code Authorization} header value.
   *
   * @throws SigningKeyUnavailableException if no signing keys could ever be fetched
   */
  public VerificationOutcome verify(String authorizationHeader) {
    if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
      return VerificationOutcome.rejected(RejectionReason.MISSING_CREDENTIAL);
    }
    final String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
    if (token.isEmpty()) {
      return VerificationOutcome.rejected(RejectionReason.MISSING_CREDENTIAL);
    }

    final SignedJWT jwt;
    final JWTClaimsSet claims;
    try {
      jwt = SignedJWT.parse(token);
      claims = jwt.getJWTClaimsSet();
    } catch (ParseException ex) {
      logger.debug("token is not a signed JWT: {}", ex.getMessage());
      return VerificationOutcome.rejected(RejectionReason.MALFORMED_CREDENTIAL);
    }
    final JWSHeader header = jwt.getHeader();
    if (!JWSAlgorithm.RS256.equals(header.getAlgorithm()) || isBlank(header.getKeyID())) {
      logger.debug("token header rejected alg={} kid={}", header.getAlgorithm(), header.getKeyID());
      return VerificationOutcome.rejected(RejectionReason.MALFORMED_CREDENTIAL);
    }

    if (!hasValidSignature(jwt, header.getKeyID())) {
      return VerificationOutcome.rejected(RejectionReason.INVALID_SIGNATURE);
    }
    if (!withinValidityWindow(claims)) {
      return VerificationOutcome.rejected(RejectionReason.EXPIRED);
    }
    if (!configuration.expectedIssuer().equals(claims.getIssuer())) {
      logger.debug("token issuer mismatch iss={}", claims.getIssuer());
      return VerificationOutcome.rejected(RejectionReason.WRONG_ISSUER);
    }
    final List<String> audience = claims.getAudience();
    if (audience.stream().noneMatch(configuration.acceptedAudiences()::contains)) {
      logger.debug("token audience mismatch aud={}", audience);
      return VerificationOutcome.rejected(RejectionReason.WRONG_AUDIENCE);
    }
    final String subject = claims.getSubject();
    if (isBlank(subject) || subject.length() > MAX_SUBJECT_LENGTH) {
      return VerificationOutcome.rejected(RejectionReason.MALFORMED_CREDENTIAL);
    }

    final String email;
    try {
      email = claims.getStringClaim("email");
    } catch (ParseException ex) {
      return VerificationOutcome.rejected(RejectionReason.MALFORMED_CREDENTIAL);
    }
    final boolean emailVerified = Boolean.TRUE.equals(claims.getClaim("email_verified"));
    if (configuration.requireVerifiedEmail() && email != null && !emailVerified) {
      return VerificationOutcome.rejected(RejectionReason.UNVERIFIED_EMAIL);
    }
    return VerificationOutcome.verified(
        CallerIdentity.verifiedToken(subject, email, emailVerified));
  }

  private boolean hasValidSignature(SignedJWT jwt, String kid) {
    final Optional<RSAKey> key = signingKeyCache.find(kid);
    if (key.isEmpty()) {
      logger.debug("no signing key for kid={}", kid);
      return false;
    }
    try {
      return jwt.verify(new RSASSAVerifier(key.get()));
    } catch (JOSEException ex) {
      logger.debug("signature check failed kid={}: {}", kid, ex.getMessage());
      return false;
    }
  }

  private boolean withinValidityWindow(JWTClaimsSet claims) {
    final Instant now = clock.instant();
    final Date expiresAt = claims.getExpirationTime();
    if (expiresAt == null || now.isAfter(expiresAt.toInstant().plus(configuration.clockSkew()))) {
      return false;
    }
    final Date issuedAt = claims.getIssueTime();
    return issuedAt == null || !issuedAt.toInstant().isAfter(now.plus(configuration.clockSkew()));
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
