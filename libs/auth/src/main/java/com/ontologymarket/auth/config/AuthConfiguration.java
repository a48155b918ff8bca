package com.ontologymarket.auth.config;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Process-wide auth settings, resolved once at startup and never mutated afterwards. Every auth
 * component receives it through its constructor.
 */
public record AuthConfiguration(
    String projectId,
    Set<String> acceptedAudiences,
    String expectedIssuer,
    ServiceAccountCredentials serviceAccount,
    Duration clockSkew,
    boolean requireVerifiedEmail,
    Bypass bypass,
    Cors cors,
    SigningKeys signingKeys) {

  public AuthConfiguration {
    Objects.requireNonNull(projectId, "projectId is required");
    acceptedAudiences = Set.copyOf(acceptedAudiences);
    Objects.requireNonNull(expectedIssuer, "expectedIssuer is required");
    clockSkew = clockSkew == null ? Duration.ZERO : clockSkew;
    bypass = bypass == null ? Bypass.disabled() : bypass;
    Objects.requireNonNull(cors, "cors is required");
    Objects.requireNonNull(signingKeys, "signingKeys is required");
  }

  public record Bypass(boolean enabled, String defaultEmail) {

    public Bypass {
      defaultEmail = defaultEmail == null || defaultEmail.isBlank() ? null : defaultEmail.trim();
    }

    public static Bypass disabled() {
      return new Bypass(false, null);
    }
  }

  public record Cors(
      Set<String> allowedOrigins,
      List<String> allowedMethods,
      List<String> allowedHeaders,
      Duration maxAge) {

    public static final String WILDCARD = "*";

    public Cors {
      allowedOrigins = Set.copyOf(allowedOrigins);
      allowedMethods = List.copyOf(allowedMethods);
      allowedHeaders = List.copyOf(allowedHeaders);
      Objects.requireNonNull(maxAge, "maxAge is required");
    }

    public boolean allowsAnyOrigin() {
      return allowedOrigins.contains(WILDCARD);
    }
  }

  public record SigningKeys(URI jwksUri, Duration ttl, Duration minRefreshInterval) {

    public SigningKeys {
      Objects.requireNonNull(jwksUri, "jwksUri is required");
      Objects.requireNonNull(ttl, "ttl is required");
      Objects.requireNonNull(minRefreshInterval, "minRefreshInterval is required");
    }
  }
}
