package com.ontologymarket.marketplace_api.api;

import com.ontologymarket.auth.web.ApiErrorResponse;
import com.ontologymarket.common.catalog.InvalidOntologyRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class MarketplaceApiExceptionHandler {

  private static final Logger logger =
      LoggerFactory.getLogger(MarketplaceApiExceptionHandler.class);

  @ExceptionHandler(InvalidOntologyRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidOntologyRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("MARKETPLACE_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("MARKETPLACE_BAD_REQUEST", "request body could not be read"));
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex) {
    return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
        .headers(ex.getHeaders())
        .body(new ApiErrorResponse("METHOD_NOT_ALLOWED", "method not allowed"));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("request failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("MARKETPLACE_INTERNAL_ERROR", "an unexpected error occurred"));
  }
}
