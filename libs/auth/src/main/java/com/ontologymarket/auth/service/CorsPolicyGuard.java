package com.ontologymarket.auth.service;

import com.ontologymarket.auth.config.AuthConfiguration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;

/**
 * Applies the marketplace CORS policy. Origins are compared exactly as sent: no case folding, no
 * default-port stripping, no trailing-slash handling.
 */
public class CorsPolicyGuard {

  private static final Logger logger = LoggerFactory.getLogger(CorsPolicyGuard.class);

  private final AuthConfiguration.Cors policy;
  private final Map<String, String> commonHeaders;

  public CorsPolicyGuard(AuthConfiguration.Cors policy) {
    this.policy = policy;
    final Map<String, String> headers = new LinkedHashMap<>();
    headers.put(
        HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, String.join(", ", policy.allowedMethods()));
    headers.put(
        HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS, String.join(", ", policy.allowedHeaders()));
    headers.put(
        HttpHeaders.ACCESS_CONTROL_MAX_AGE, Long.toString(policy.maxAge().toSeconds()));
    this.commonHeaders = Map.copyOf(headers);
  }

  /**
   * Evaluates the {@code Origin} header value.
   *
   * @param origin header value, or {@code null} when the request carried none
   */
  public CorsDecision evaluate(String origin) {
    if (origin == null) {
      // same-origin or non-browser caller
      return new CorsDecision.Allowed(commonHeaders);
    }
    if (policy.allowsAnyOrigin()) {
      return allowed(AuthConfiguration.Cors.WILDCARD, false);
    }
    if (policy.allowedOrigins().contains(origin)) {
      return allowed(origin, true);
    }
    logger.warn("cors origin rejected origin={}", origin);
    return new CorsDecision.Rejected(origin);
  }

  private CorsDecision allowed(String allowOrigin, boolean varyByOrigin) {
    final Map<String, String> headers = new LinkedHashMap<>(commonHeaders);
    headers.put(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, allowOrigin);
    if (varyByOrigin) {
      headers.put(HttpHeaders.VARY, HttpHeaders.ORIGIN);
    }
    return new CorsDecision.Allowed(headers);
  }
}
