package com.ontologymarket.auth.model;

/**
 * Why a credential was refused. The {@link #code()} is the only detail that ever leaves the
 * process; cryptographic failure details stay in the server logs.
 */
public enum RejectionReason {
  MISSING_CREDENTIAL("missing-credential"),
  MALFORMED_CREDENTIAL("malformed-credential"),
  INVALID_SIGNATURE("invalid-signature"),
  EXPIRED("expired"),
  WRONG_AUDIENCE("wrong-audience"),
  WRONG_ISSUER("wrong-issuer"),
  UNVERIFIED_EMAIL("unverified-email");

  private final String code;

  RejectionReason(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
