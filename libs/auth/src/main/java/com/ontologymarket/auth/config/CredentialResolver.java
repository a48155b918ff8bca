package com.ontologymarket.auth.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the immutable {@link AuthConfiguration} from bound properties and the process
 * environment. Runs once per process; any failure aborts startup.
 */
public class CredentialResolver {

  private static final Logger logger = LoggerFactory.getLogger(CredentialResolver.class);

  private final ObjectMapper objectMapper;

  public CredentialResolver(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Resolves the configuration.
   *
   * @param properties bound {@code marketplace.auth.*} properties
   * @param environment lookup for raw configuration names such as {@code FIREBASE_PROJECT_ID}
   * @throws AuthConfigurationException if no project id is resolvable or the service-account JSON
   *     is malformed
   */
  public AuthConfiguration resolve(
      AuthProperties properties, Function<String, String> environment) {
    final ServiceAccountCredentials serviceAccount =
        parseServiceAccount(properties.serviceAccountJson());
    final String projectId =
        resolveProjectId(properties.projectIdEnvNames(), environment, serviceAccount);

    final Set<String> audiences = new LinkedHashSet<>();
    audiences.add(projectId);
    properties.additionalAudiences().stream()
        .filter(Objects::nonNull)
        .map(String::trim)
        .filter(audience -> !audience.isEmpty())
        .forEach(audiences::add);

    final AuthConfiguration configuration =
        new AuthConfiguration(
            projectId,
            audiences,
            properties.issuerPrefix() + projectId,
            serviceAccount,
            properties.clockSkew(),
            properties.requireVerifiedEmail(),
            new AuthConfiguration.Bypass(
                properties.bypass().enabled(), properties.bypass().defaultEmail()),
            toCors(properties.cors()),
            new AuthConfiguration.SigningKeys(
                properties.signingKeys().jwksUri(),
                properties.signingKeys().ttl(),
                properties.signingKeys().minRefreshInterval()));

    logger.info(
        "auth configuration resolved projectId={} audiences={} serviceAccount={} bypassEnabled={}"
            + " corsOrigins={}",
        projectId,
        configuration.acceptedAudiences(),
        serviceAccount == null ? "none" : serviceAccount.clientEmail(),
        configuration.bypass().enabled(),
        configuration.cors().allowedOrigins());
    if (configuration.bypass().enabled()) {
      logger.warn(
          "dev auth bypass is enabled; requests carrying {} or the default email skip token"
              + " verification",
          "X-Dev-Email");
    }
    return configuration;
  }

  private ServiceAccountCredentials parseServiceAccount(String json) {
    if (json == null || json.isBlank()) {
      return null;
    }
    final ServiceAccountCredentials credentials;
    try {
      credentials = objectMapper.readValue(json, ServiceAccountCredentials.class);
    } catch (JsonProcessingException ex) {
      throw new AuthConfigurationException("service account credential JSON is malformed", ex);
    }
    if (credentials == null
        || !ServiceAccountCredentials.SERVICE_ACCOUNT_TYPE.equals(credentials.type())
        || isBlank(credentials.clientEmail())) {
      throw new AuthConfigurationException(
          "service account credential JSON is not a service account document");
    }
    return credentials;
  }

  private String resolveProjectId(
      List<String> candidateNames,
      Function<String, String> environment,
      ServiceAccountCredentials serviceAccount) {
    for (String name : candidateNames) {
      final String value = environment.apply(name);
      if (!isBlank(value)) {
        logger.debug("project id resolved from {}", name);
        return value.trim();
      }
    }
    if (serviceAccount != null && !isBlank(serviceAccount.projectId())) {
      logger.debug("project id resolved from service account document");
      return serviceAccount.projectId().trim();
    }
    throw new AuthConfigurationException(
        "no project id configured; set one of " + candidateNames + " or provide a service account");
  }

  private AuthConfiguration.Cors toCors(AuthProperties.Cors cors) {
    return new AuthConfiguration.Cors(
        normalize(cors.allowedOrigins()),
        List.copyOf(normalize(cors.allowedMethods())),
        List.copyOf(normalize(cors.allowedHeaders())),
        cors.maxAge());
  }

  private Set<String> normalize(List<String> values) {
    final Set<String> normalized = new LinkedHashSet<>();
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        normalized.add(value.trim());
      }
    }
    return normalized;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
