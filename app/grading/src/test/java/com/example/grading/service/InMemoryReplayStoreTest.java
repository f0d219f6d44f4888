/*
 * どこで: プロセス内リプレイストアのユニットテスト
 * 何を: TTL 内の重複拒否と期限切れ後の再受理/掃除を検証する
 * なぜ: Redis なし構成でも SET NX EX と同じ意味で動くことを保証するため
 */
package com.example.grading.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class InMemoryReplayStoreTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");

  private final MutableClock clock = new MutableClock(FIXED_NOW);
  private final InMemoryReplayStore store = new InMemoryReplayStore(clock);

  @Test
  void putIfAbsentRejectsDuplicateWithinTtl() {
    assertThat(store.putIfAbsent("k1", Duration.ofSeconds(60))).isTrue();
    assertThat(store.putIfAbsent("k1", Duration.ofSeconds(60))).isFalse();
    assertThat(store.putIfAbsent("k2", Duration.ofSeconds(60))).isTrue();
  }

  @Test
  void expiredKeyCanBeStoredAgain() {
    assertThat(store.putIfAbsent("k1", Duration.ofSeconds(60))).isTrue();

    clock.advance(Duration.ofSeconds(61));

    assertThat(store.putIfAbsent("k1", Duration.ofSeconds(60))).isTrue();
  }

  @Test
  void evictExpiredRemovesOnlyExpiredEntries() {
    store.putIfAbsent("short", Duration.ofSeconds(10));
    store.putIfAbsent("long", Duration.ofSeconds(600));

    clock.advance(Duration.ofSeconds(11));
    store.evictExpired();

    assertThat(store.size()).isEqualTo(1);
    assertThat(store.putIfAbsent("long", Duration.ofSeconds(600))).isFalse();
  }

  private static final class MutableClock extends Clock {

    private Instant now;

    private MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
