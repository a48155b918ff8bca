/*
 * どこで: libs/auth サービス層
 * 何を: 認証結果・CORS 拒否・署名鍵取得の結果をメトリクスとして記録する
 * なぜ: 関数単位でデプロイしても、拒否理由の増加や鍵取得失敗を Prometheus から観測できるようにするため
 */
package com.ontologymarket.auth.service;

import com.ontologymarket.auth.model.IdentitySource;
import com.ontologymarket.auth.model.RejectionReason;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class AuthMetrics {

  private static final String METRIC_AUTH_OUTCOME_TOTAL = "marketplace.auth.outcome.total";
  private static final String METRIC_CORS_REJECTED_TOTAL = "marketplace.cors.rejected.total";
  private static final String METRIC_SIGNING_KEYS_REFRESH_TOTAL =
      "marketplace.auth.signing_keys.refresh.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> outcomeCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> corsRejectedCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> refreshCounters = new ConcurrentHashMap<>();

  public AuthMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordVerified(String endpoint, IdentitySource source) {
    recordOutcome(endpoint, "verified", source.code());
  }

  public void recordRejected(String endpoint, RejectionReason reason) {
    recordOutcome(endpoint, "rejected", reason.code());
  }

  public void recordUnavailable(String endpoint) {
    recordOutcome(endpoint, "unavailable", "signing-keys");
  }

  public void recordCorsRejected(String endpoint) {
    corsRejectedCounters
        .computeIfAbsent(
            endpoint,
            ignored ->
                Counter.builder(METRIC_CORS_REJECTED_TOTAL)
                    .description("Requests refused because of a disallowed origin")
                    .tags(Tags.of("endpoint", endpoint))
                    .register(meterRegistry))
        .increment();
  }

  public void recordSigningKeyRefresh(String result) {
    refreshCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_SIGNING_KEYS_REFRESH_TOTAL)
                    .description("Signing key set fetch attempts")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  private void recordOutcome(String endpoint, String result, String detail) {
    final String key = endpoint + "|" + result + "|" + detail;
    outcomeCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_AUTH_OUTCOME_TOTAL)
                    .description("Authentication outcomes per endpoint")
                    .tags(Tags.of("endpoint", endpoint, "result", result, "detail", detail))
                    .register(meterRegistry))
        .increment();
  }
}
