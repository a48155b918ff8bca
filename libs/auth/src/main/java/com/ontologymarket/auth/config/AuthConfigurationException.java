package com.ontologymarket.auth.config;

/** Raised while resolving auth configuration; the process must not start serving requests. */
public class AuthConfigurationException extends RuntimeException {

  public AuthConfigurationException(String message) {
    super(message);
  }

  public AuthConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
