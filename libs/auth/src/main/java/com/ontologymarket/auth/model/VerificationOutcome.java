package com.ontologymarket.auth.model;

import java.util.Objects;

/** Result of authenticating one request: either a caller identity or a rejection reason. */
public sealed interface VerificationOutcome
    permits VerificationOutcome.Verified, VerificationOutcome.Rejected {

  static VerificationOutcome verified(CallerIdentity identity) {
    return new Verified(identity);
  }

  static VerificationOutcome rejected(RejectionReason reason) {
    return new Rejected(reason);
  }

  default boolean isVerified() {
    return this instanceof Verified;
  }

  record Verified(CallerIdentity identity) implements VerificationOutcome {
    public Verified {
      Objects.requireNonNull(identity, "identity is required");
    }
  }

  record Rejected(RejectionReason reason) implements VerificationOutcome {
    public Rejected {
      Objects.requireNonNull(reason, "reason is required");
    }
  }
}
