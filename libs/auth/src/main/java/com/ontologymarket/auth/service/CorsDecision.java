package com.ontologymarket.auth.service;

import jakarta.servlet.http.HttpServletResponse;
import java.util.Map;

/** Verdict of the CORS policy for one request origin. */
public sealed interface CorsDecision permits CorsDecision.Allowed, CorsDecision.Rejected {

  /** The origin may call; {@code headers} are added to every response for this request. */
  record Allowed(Map<String, String> headers) implements CorsDecision {

    public Allowed {
      headers = Map.copyOf(headers);
    }

    public void applyTo(HttpServletResponse response) {
      headers.forEach(response::setHeader);
    }
  }

  record Rejected(String origin) implements CorsDecision {}
}
