/*
 * どこで: libs/auth の設定バインド
 * 何を: marketplace.auth.* (プロジェクトID候補/サービスアカウントJSON/バイパス/CORS/署名鍵) を保持する
 * なぜ: 環境変数で関数ごとに調整しつつ、起動時に不正値を検出するため
 */
package com.ontologymarket.auth.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "marketplace.auth")
@Validated
public record AuthProperties(
    List<String> projectIdEnvNames,
    String serviceAccountJson,
    List<String> additionalAudiences,
    String issuerPrefix,
    Duration clockSkew,
    Boolean requireVerifiedEmail,
    @Valid Bypass bypass,
    @Valid Cors cors,
    @Valid SigningKeys signingKeys) {

  public static final List<String> DEFAULT_PROJECT_ID_ENV_NAMES =
      List.of("FIREBASE_PROJECT_ID", "GOOGLE_CLOUD_PROJECT", "GCLOUD_PROJECT", "GCP_PROJECT");
  public static final String DEFAULT_ISSUER_PREFIX = "https://securetoken.google.com/";

  public AuthProperties {
    projectIdEnvNames =
        projectIdEnvNames == null || projectIdEnvNames.isEmpty()
            ? DEFAULT_PROJECT_ID_ENV_NAMES
            : List.copyOf(projectIdEnvNames);
    serviceAccountJson = serviceAccountJson == null ? "" : serviceAccountJson;
    additionalAudiences =
        additionalAudiences == null ? List.of() : List.copyOf(additionalAudiences);
    issuerPrefix =
        issuerPrefix == null || issuerPrefix.isBlank() ? DEFAULT_ISSUER_PREFIX : issuerPrefix;
    clockSkew = clockSkew == null ? Duration.ZERO : clockSkew;
    requireVerifiedEmail = requireVerifiedEmail == null || requireVerifiedEmail;
    bypass = bypass == null ? new Bypass(false, null) : bypass;
    cors = cors == null ? new Cors(null, null, null, null) : cors;
    signingKeys = signingKeys == null ? new SigningKeys(null, null, null, null, null) : signingKeys;
  }

  @AssertTrue(message = "marketplace.auth.clock-skew must not be negative")
  public boolean isClockSkewValid() {
    return clockSkew != null && !clockSkew.isNegative();
  }

  public record Bypass(boolean enabled, String defaultEmail) {}

  public record Cors(
      List<String> allowedOrigins,
      List<String> allowedMethods,
      List<String> allowedHeaders,
      Duration maxAge) {

    public Cors {
      allowedOrigins =
          allowedOrigins == null || allowedOrigins.isEmpty()
              ? List.of("*")
              : List.copyOf(allowedOrigins);
      allowedMethods =
          allowedMethods == null || allowedMethods.isEmpty()
              ? List.of("GET", "POST", "DELETE", "OPTIONS")
              : List.copyOf(allowedMethods);
      allowedHeaders =
          allowedHeaders == null || allowedHeaders.isEmpty()
              ? List.of("Authorization", "Content-Type", "X-Dev-Email")
              : List.copyOf(allowedHeaders);
      maxAge = maxAge == null ? Duration.ofHours(1) : maxAge;
    }

    @AssertTrue(message = "marketplace.auth.cors.max-age must not be negative")
    public boolean isMaxAgeValid() {
      return maxAge != null && !maxAge.isNegative();
    }
  }

  public record SigningKeys(
      URI jwksUri,
      Duration ttl,
      Duration minRefreshInterval,
      Duration connectTimeout,
      Duration readTimeout) {

    public static final URI DEFAULT_JWKS_URI =
        URI.create(
            "https://www.googleapis.com/service_accounts/v1/jwk/securetoken@system.gserviceaccount.com");

    public SigningKeys {
      jwksUri = jwksUri == null ? DEFAULT_JWKS_URI : jwksUri;
      ttl = ttl == null ? Duration.ofMinutes(5) : ttl;
      minRefreshInterval = minRefreshInterval == null ? Duration.ofSeconds(30) : minRefreshInterval;
      connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
      readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
    }

    @AssertTrue(message = "marketplace.auth.signing-keys durations must be positive")
    public boolean isDurationsPositive() {
      return isPositive(ttl)
          && isPositive(minRefreshInterval)
          && isPositive(connectTimeout)
          && isPositive(readTimeout);
    }

    private static boolean isPositive(Duration duration) {
      // Duration には @Positive が使えないため明示的に弾く。
      return duration != null && !duration.isZero() && !duration.isNegative();
    }
  }
}
