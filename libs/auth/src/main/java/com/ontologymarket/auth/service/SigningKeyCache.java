/*
 * どこで: libs/auth サービス層
 * 何を: 署名鍵セットをプロセス内で共有キャッシュし、TTL 切れと未知 kid で再取得する
 * なぜ: リクエスト毎の鍵取得を避けつつ、鍵ローテーションに追従するため
 */
package com.ontologymarket.auth.service;

import com.google.common.annotations.VisibleForTesting;
import com.nimbusds.jose.jwk.RSAKey;
import com.ontologymarket.auth.config.AuthConfiguration;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide signing key cache.
 *
 * <p>The key set is an immutable snapshot swapped atomically. Concurrent refreshes may overlap;
 * the last successful fetch wins. A failed fetch keeps the previous snapshot and only raises
 * {@link SigningKeyUnavailableException} when no snapshot was ever obtained.
 */
public class SigningKeyCache {

  private static final Logger logger = LoggerFactory.getLogger(SigningKeyCache.class);

  private final SigningKeySource source;
  private final AuthConfiguration.SigningKeys settings;
  private final AuthMetrics metrics;
  private final Clock clock;
  private final AtomicReference<Snapshot> snapshot = new AtomicReference<>();
  private final AtomicReference<Instant> unknownKidRefreshAllowedAfter =
      new AtomicReference<>(Instant.MIN);

  public SigningKeyCache(
      SigningKeySource source,
      AuthConfiguration.SigningKeys settings,
      AuthMetrics metrics,
      Clock clock) {
    this.source = source;
    this.settings = settings;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * Looks up the signing key for {@code kid}, refreshing the key set when it is stale or when the
   * key id is unknown and the unknown-kid refresh is not throttled.
   *
   * @throws SigningKeyUnavailableException if no key set has ever been fetched
   */
  public Optional<RSAKey> find(String kid) {
    final Instant now = clock.instant();
    Snapshot current = snapshot.get();
    boolean refreshed = false;
    if (current == null || !now.isBefore(current.expiresAt())) {
      current = refresh(current, now);
      refreshed = true;
    }

    final RSAKey key = current.keys().get(kid);
    if (key != null || refreshed || !claimUnknownKidRefresh(now)) {
      return Optional.ofNullable(key);
    }
    logger.info("signing key id not cached; refreshing kid={}", kid);
    return Optional.ofNullable(refresh(current, now).keys().get(kid));
  }

  @VisibleForTesting
  int cachedKeyCount() {
    final Snapshot current = snapshot.get();
    return current == null ? 0 : current.keys().size();
  }

  private boolean claimUnknownKidRefresh(Instant now) {
    final Instant allowedAfter = unknownKidRefreshAllowedAfter.get();
    if (now.isBefore(allowedAfter)) {
      return false;
    }
    return unknownKidRefreshAllowedAfter.compareAndSet(
        allowedAfter, now.plus(settings.minRefreshInterval()));
  }

  private Snapshot refresh(Snapshot previous, Instant now) {
    try {
      final Snapshot fetched = new Snapshot(source.fetch(), now.plus(settings.ttl()));
      snapshot.set(fetched);
      metrics.recordSigningKeyRefresh("success");
      logger.info("signing keys refreshed keys={}", fetched.keys().size());
      return fetched;
    } catch (SigningKeyUnavailableException ex) {
      metrics.recordSigningKeyRefresh("failure");
      if (previous == null) {
        logger.error("signing keys unavailable and no cached key set exists", ex);
        throw ex;
      }
      logger.warn("signing key refresh failed; keeping cached key set", ex);
      // 取得元が落ちている間は最小間隔ごとにだけ再試行する。
      final Snapshot stale =
          new Snapshot(previous.keys(), now.plus(settings.minRefreshInterval()));
      snapshot.compareAndSet(previous, stale);
      return stale;
    }
  }

  private record Snapshot(Map<String, RSAKey> keys, Instant expiresAt) {
    private Snapshot {
      keys = Map.copyOf(keys);
    }
  }
}
