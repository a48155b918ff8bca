package com.ontologymarket.auth.service;

/**
 * No signing keys could be obtained. This is a collaborator failure, not a verdict on the caller's
 * credential.
 */
public class SigningKeyUnavailableException extends RuntimeException {

  public SigningKeyUnavailableException(String message) {
    super(message);
  }

  public SigningKeyUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
