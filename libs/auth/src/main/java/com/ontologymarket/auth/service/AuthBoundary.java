package com.ontologymarket.auth.service;

import com.ontologymarket.auth.config.AuthConfiguration;
import com.ontologymarket.auth.model.CallerIdentity;
import com.ontologymarket.auth.model.InboundRequest;
import com.ontologymarket.auth.model.VerificationOutcome;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides who is calling. The dev bypass gate is consulted only when bypass was enabled at
 * startup; otherwise the token verifier is the sole authority.
 */
public class AuthBoundary {

  private static final Logger logger = LoggerFactory.getLogger(AuthBoundary.class);

  private final boolean bypassEnabled;
  private final DevBypassGate devBypassGate;
  private final TokenVerifier tokenVerifier;

  public AuthBoundary(
      AuthConfiguration configuration, DevBypassGate devBypassGate, TokenVerifier tokenVerifier) {
    this.bypassEnabled = configuration.bypass().enabled();
    this.devBypassGate = devBypassGate;
    this.tokenVerifier = tokenVerifier;
  }

  /**
   * Authenticates one request. Calling it twice with the same input gives the same outcome.
   *
   * @throws SigningKeyUnavailableException if token verification cannot obtain signing keys
   */
  public VerificationOutcome authenticate(InboundRequest request) {
    if (bypassEnabled) {
      final Optional<CallerIdentity> bypassIdentity = devBypassGate.resolve(request);
      if (bypassIdentity.isPresent()) {
        logger.debug("caller resolved by dev bypass subject={}", bypassIdentity.get().subject());
        return VerificationOutcome.verified(bypassIdentity.get());
      }
    }

    final VerificationOutcome outcome = tokenVerifier.verify(request.authorization());
    if (outcome instanceof VerificationOutcome.Verified verified) {
      logger.debug("caller verified subject={}", verified.identity().subject());
    } else if (outcome instanceof VerificationOutcome.Rejected rejected) {
      logger.warn("authentication rejected reason={}", rejected.reason().code());
    }
    return outcome;
  }
}
