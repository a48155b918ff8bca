package com.ontologymarket.auth.web;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.StringJoiner;
import org.springframework.http.HttpMethod;

/**
 * What an endpoint accepts. {@code OPTIONS} is always accepted for preflight handling.
 *
 * @param name endpoint name used in logs and metric tags
 * @param allowedMethods methods the endpoint serves besides {@code OPTIONS}
 */
public record EndpointPolicy(String name, Set<HttpMethod> allowedMethods) {

  public EndpointPolicy {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name is required");
    }
    allowedMethods = Set.copyOf(allowedMethods);
  }

  public static EndpointPolicy of(String name, HttpMethod... methods) {
    return new EndpointPolicy(name, Set.of(methods));
  }

  public boolean permits(String method) {
    if (method == null || method.isBlank()) {
      return false;
    }
    final HttpMethod httpMethod = HttpMethod.valueOf(method.toUpperCase(Locale.ROOT));
    return HttpMethod.OPTIONS.equals(httpMethod) || allowedMethods.contains(httpMethod);
  }

  /** Value for the {@code Allow} header of a 405 response. */
  public String allowHeader() {
    final Set<String> ordered = new LinkedHashSet<>();
    for (HttpMethod candidate : HttpMethod.values()) {
      if (allowedMethods.contains(candidate)) {
        ordered.add(candidate.name());
      }
    }
    ordered.add(HttpMethod.OPTIONS.name());
    final StringJoiner allow = new StringJoiner(", ");
    ordered.forEach(allow::add);
    return allow.toString();
  }
}
