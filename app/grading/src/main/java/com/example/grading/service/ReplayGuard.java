/*
 * どこで: Grading サービス層
 * 何を: タイムスタンプの鮮度と (submission_id, timestamp) の重複を判定する
 * なぜ: 正規の署名付きメッセージの再送で採点が再適用されるのを防ぐため
 */
package com.example.grading.service;

import com.example.grading.config.ReplayProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ReplayGuard {

  private static final Logger logger = LoggerFactory.getLogger(ReplayGuard.class);
  static final Duration DEFAULT_MAX_AGE = Duration.ofSeconds(300);
  private static final String DEFAULT_KEY_PREFIX = "grading:replay:";

  private final ReplayStore replayStore;
  private final ReplayProperties properties;
  private final Clock clock;

  public boolean acceptOnce(long submissionId, Instant timestamp) {
    return acceptOnce(submissionId, timestamp, maxAge());
  }

  public boolean acceptOnce(long submissionId, Instant timestamp, Duration maxAge) {
    final Instant now = Instant.now(clock);
    final Duration age = Duration.between(timestamp, now).abs();
    if (age.compareTo(maxAge) > 0) {
      // 古すぎる/未来すぎるものは履歴に関係なく拒否し、ストアにも書かない
      logger.info(
          "webhook rejected as stale submissionId={} timestamp={} ageSeconds={}",
          submissionId,
          timestamp,
          age.toSeconds());
      return false;
    }
    final boolean accepted = replayStore.putIfAbsent(key(submissionId, timestamp), maxAge);
    if (!accepted) {
      logger.info(
          "webhook rejected as duplicate submissionId={} timestamp={}", submissionId, timestamp);
    }
    return accepted;
  }

  String key(long submissionId, Instant timestamp) {
    final String prefix =
        properties.keyPrefix() == null || properties.keyPrefix().isBlank()
            ? DEFAULT_KEY_PREFIX
            : properties.keyPrefix();
    // Instant#toString で表記ゆれ(+00:00 と Z など)を正規化する
    return prefix + submissionId + ":" + timestamp;
  }

  private Duration maxAge() {
    return properties.window() == null ? DEFAULT_MAX_AGE : properties.window();
  }
}
