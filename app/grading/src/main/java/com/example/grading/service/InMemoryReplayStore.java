/*
 * どこで: Grading サービス層
 * 何を: プロセス内の ConcurrentHashMap でリプレイ判定キーを保持する
 * なぜ: 単一インスタンス運用やテストで Redis なしに同じ判定を行うため
 */
package com.example.grading.service;

import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "grading.replay.store", havingValue = "memory")
public class InMemoryReplayStore implements ReplayStore {

  private final ConcurrentMap<String, Instant> entries = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryReplayStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public boolean putIfAbsent(String key, Duration ttl) {
    final Instant now = Instant.now(clock);
    final Instant expiresAt = now.plus(ttl);
    // compute はキー単位で原子的に実行されるため、期限切れ判定と上書きが競合しない
    final boolean[] accepted = {false};
    entries.compute(
        key,
        (ignored, current) -> {
          if (current == null || !current.isAfter(now)) {
            accepted[0] = true;
            return expiresAt;
          }
          return current;
        });
    return accepted[0];
  }

  @Scheduled(fixedDelayString = "${grading.replay.sweep-interval:60s}")
  public void evictExpired() {
    final Instant now = Instant.now(clock);
    entries.entrySet().removeIf(entry -> !entry.getValue().isAfter(now));
  }

  @VisibleForTesting
  int size() {
    return entries.size();
  }
}
