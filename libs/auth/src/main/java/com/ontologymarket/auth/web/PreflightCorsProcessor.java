package com.ontologymarket.auth.web;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsProcessor;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Routes the preflight requests Spring MVC answers on its own through {@link EndpointGuard}, so
 * preflights follow the same CORS policy as every other request. Non-preflight requests pass
 * untouched; the guard handles them inside each controller.
 */
public class PreflightCorsProcessor implements CorsProcessor {

  private static final String UNKNOWN_ENDPOINT = "unknown";

  private final ObjectProvider<EndpointGuard> endpointGuard;

  public PreflightCorsProcessor(ObjectProvider<EndpointGuard> endpointGuard) {
    this.endpointGuard = endpointGuard;
  }

  @Override
  public boolean processRequest(
      CorsConfiguration configuration, HttpServletRequest request, HttpServletResponse response)
      throws IOException {
    if (!CorsUtils.isPreFlightRequest(request)) {
      return true;
    }
    return endpointGuard.getObject().answerPreflight(endpointName(request), request, response);
  }

  private String endpointName(HttpServletRequest request) {
    final Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
    if (pattern == null) {
      return UNKNOWN_ENDPOINT;
    }
    final String path = pattern.toString();
    return path.startsWith("/") ? path.substring(1) : path;
  }
}
