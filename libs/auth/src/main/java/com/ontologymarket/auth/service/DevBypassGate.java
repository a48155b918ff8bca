package com.ontologymarket.auth.service;

import com.ontologymarket.auth.config.AuthConfiguration;
import com.ontologymarket.auth.model.CallerIdentity;
import com.ontologymarket.auth.model.InboundRequest;
import java.util.Optional;
import lombok.RequiredArgsConstructor;

/**
 * Development-only identity source. Trusts the {@code X-Dev-Email} header, or a configured default
 * email, without any verification.
 */
@RequiredArgsConstructor
public class DevBypassGate {

  private final AuthConfiguration.Bypass settings;

  /**
   * Resolves a bypass identity for the request.
   *
   * @throws IllegalStateException if bypass is not enabled
   */
  public Optional<CallerIdentity> resolve(InboundRequest request) {
    if (!settings.enabled()) {
      throw new IllegalStateException("dev bypass gate consulted while bypass is disabled");
    }
    final String headerEmail = request.devEmail();
    if (headerEmail != null && !headerEmail.isBlank()) {
      return Optional.of(CallerIdentity.devBypass(headerEmail.trim()));
    }
    return Optional.ofNullable(settings.defaultEmail()).map(CallerIdentity::devBypass);
  }
}
