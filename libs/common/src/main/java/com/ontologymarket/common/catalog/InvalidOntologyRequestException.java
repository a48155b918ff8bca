package com.ontologymarket.common.catalog;

public class InvalidOntologyRequestException extends RuntimeException {

  public InvalidOntologyRequestException(String message) {
    super(message);
  }

  public InvalidOntologyRequestException(String message, Throwable cause) {
    super(message, cause);
  }
}
