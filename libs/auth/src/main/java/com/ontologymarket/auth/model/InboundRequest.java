package com.ontologymarket.auth.model;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;

/**
 * The request inputs the auth boundary looks at, detached from the servlet API so the boundary
 * behaves the same behind any deployment topology.
 */
public record InboundRequest(String method, String origin, String authorization, String devEmail) {

  public static final String DEV_EMAIL_HEADER = "X-Dev-Email";

  public static InboundRequest from(HttpServletRequest request) {
    return new InboundRequest(
        request.getMethod(),
        request.getHeader(HttpHeaders.ORIGIN),
        request.getHeader(HttpHeaders.AUTHORIZATION),
        request.getHeader(DEV_EMAIL_HEADER));
  }

  public boolean isOptions() {
    return "OPTIONS".equalsIgnoreCase(method);
  }
}
