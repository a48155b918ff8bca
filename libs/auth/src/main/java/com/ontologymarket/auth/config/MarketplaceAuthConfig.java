/*
 * どこで: libs/auth の Spring 設定
 * 何を: 認証境界一式 (資格情報解決/トークン検証/バイパス/CORS/入口ガード) を Bean として組み立てる
 * なぜ: 各関数アプリが @Import するだけで同じ境界を自前で持てるようにするため
 */
package com.ontologymarket.auth.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ontologymarket.auth.service.AuthBoundary;
import com.ontologymarket.auth.service.AuthMetrics;
import com.ontologymarket.auth.service.CorsPolicyGuard;
import com.ontologymarket.auth.service.DevBypassGate;
import com.ontologymarket.auth.service.JwksSigningKeySource;
import com.ontologymarket.auth.service.SigningKeyCache;
import com.ontologymarket.auth.service.SigningKeySource;
import com.ontologymarket.auth.service.TokenVerifier;
import com.ontologymarket.auth.web.EndpointGuard;
import com.ontologymarket.auth.web.PreflightCorsProcessor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.web.servlet.WebMvcRegistrations;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

@Configuration
@EnableConfigurationProperties(AuthProperties.class)
public class MarketplaceAuthConfig {

  @Bean
  AuthConfiguration authConfiguration(
      AuthProperties properties, Environment environment, ObjectMapper objectMapper) {
    return new CredentialResolver(objectMapper).resolve(properties, environment::getProperty);
  }

  @Bean
  AuthMetrics authMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
    // Actuator が無い構成 (スライステスト等) では単独レジストリに記録する。
    return new AuthMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
  }

  @Bean
  SigningKeySource signingKeySource(
      AuthProperties properties, ObjectProvider<RestClient.Builder> restClientBuilder) {
    final AuthProperties.SigningKeys settings = properties.signingKeys();
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(settings.connectTimeout());
    requestFactory.setReadTimeout(settings.readTimeout());
    final RestClient restClient =
        restClientBuilder
            .getIfAvailable(RestClient::builder)
            .requestFactory(requestFactory)
            .build();
    return new JwksSigningKeySource(restClient, settings.jwksUri());
  }

  @Bean
  SigningKeyCache signingKeyCache(
      SigningKeySource signingKeySource,
      AuthConfiguration authConfiguration,
      AuthMetrics authMetrics,
      Clock clock) {
    return new SigningKeyCache(
        signingKeySource, authConfiguration.signingKeys(), authMetrics, clock);
  }

  @Bean
  TokenVerifier tokenVerifier(
      AuthConfiguration authConfiguration, SigningKeyCache signingKeyCache, Clock clock) {
    return new TokenVerifier(authConfiguration, signingKeyCache, clock);
  }

  @Bean
  DevBypassGate devBypassGate(AuthConfiguration authConfiguration) {
    return new DevBypassGate(authConfiguration.bypass());
  }

  @Bean
  AuthBoundary authBoundary(
      AuthConfiguration authConfiguration,
      DevBypassGate devBypassGate,
      TokenVerifier tokenVerifier) {
    return new AuthBoundary(authConfiguration, devBypassGate, tokenVerifier);
  }

  @Bean
  CorsPolicyGuard corsPolicyGuard(AuthConfiguration authConfiguration) {
    return new CorsPolicyGuard(authConfiguration.cors());
  }

  @Bean
  EndpointGuard endpointGuard(
      CorsPolicyGuard corsPolicyGuard,
      AuthBoundary authBoundary,
      AuthMetrics authMetrics,
      ObjectMapper objectMapper) {
    return new EndpointGuard(corsPolicyGuard, authBoundary, authMetrics, objectMapper);
  }

  @Bean
  WebMvcRegistrations preflightWebMvcRegistrations(ObjectProvider<EndpointGuard> endpointGuard) {
    return new WebMvcRegistrations() {
      @Override
      public RequestMappingHandlerMapping getRequestMappingHandlerMapping() {
        final RequestMappingHandlerMapping mapping = new RequestMappingHandlerMapping();
        mapping.setCorsProcessor(new PreflightCorsProcessor(endpointGuard));
        return mapping;
      }
    };
  }
}
