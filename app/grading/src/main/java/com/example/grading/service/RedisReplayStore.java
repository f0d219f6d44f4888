/*
 * どこで: Grading サービス層
 * 何を: Redis の SET NX EX でリプレイ判定キーを登録する
 * なぜ: 複数レプリカに同じ Webhook が同時配送されても 1 件だけ受理するため
 */
package com.example.grading.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "grading.replay.store", havingValue = "redis", matchIfMissing = true)
public class RedisReplayStore implements ReplayStore {

  private static final String MARKER = "1";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  public RedisReplayStore(StringRedisTemplate redisTemplate) {
    this.redisTemplate = redisTemplate;
  }

  @Override
  public boolean putIfAbsent(String key, Duration ttl) {
    final Boolean stored = redisTemplate.opsForValue().setIfAbsent(key, MARKER, ttl);
    // パイプライン/トランザクション中は null が返るため、受理扱いにしない
    return Boolean.TRUE.equals(stored);
  }
}
