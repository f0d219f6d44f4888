/*
 * どこで: Grading サービス層
 * 何を: PENDING の採点通知を送信し、失敗時はバックオフ付きで再送/打ち切りする
 * なぜ: 採点確定後の通知を Webhook 応答から切り離して確実に届けるため
 */
package com.example.grading.service;

import com.example.grading.config.NotificationDeliveryProperties;
import com.example.grading.model.NotificationRecord;
import com.example.grading.repository.NotificationRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationDeliveryService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDeliveryService.class);

  private final NotificationRepository notificationRepository;
  private final NotificationSender sender;
  private final NotificationDeliveryProperties properties;
  private final GradingMetrics metrics;
  private final Clock clock;

  public int processPendingBatch() {
    final Instant now = Instant.now(clock);
    final String lockedBy = WorkerIds.resolve();
    // claim は単一 SQL で行い、送信 IO を長期トランザクションに載せない
    final List<NotificationRecord> claimed =
        notificationRepository.claimPendingForUpdate(
            properties.batchSize(), now, now.plus(properties.lease()), lockedBy);
    int sent = 0;
    for (NotificationRecord record : claimed) {
      try {
        sender.send(record);
        final int updated =
            notificationRepository.markSent(record.notificationId(), Instant.now(clock), lockedBy);
        if (updated == 0) {
          logger.warn(
              "grade notification sent but lock was lost id={} submissionId={}",
              record.notificationId(),
              record.submissionId());
        }
        metrics.recordNotificationDelivery("sent");
        sent++;
      } catch (RuntimeException ex) {
        handleFailure(record, ex, now, lockedBy);
      }
    }
    return sent;
  }

  @VisibleForTesting
  void handleFailure(NotificationRecord record, RuntimeException ex, Instant now, String lockedBy) {
    final int nextAttempt = record.attemptCount() + 1;
    if (nextAttempt >= properties.maxAttempts()) {
      final int updated =
          notificationRepository.markRetry(
              record.notificationId(), nextAttempt, null, true, lockedBy);
      if (updated == 0) {
        logger.warn(
            "grade notification give-up skipped because lock was lost id={}",
            record.notificationId());
        return;
      }
      metrics.recordNotificationDelivery("failed");
      logger.warn(
          "grade notification failed permanently id={} attempts={}",
          record.notificationId(),
          nextAttempt,
          ex);
      return;
    }
    final Instant nextRetryAt = now.plus(computeBackoffDuration(nextAttempt));
    final int updated =
        notificationRepository.markRetry(
            record.notificationId(), nextAttempt, nextRetryAt, false, lockedBy);
    if (updated == 0) {
      logger.warn(
          "grade notification retry skipped because lock was lost id={} attempt={}",
          record.notificationId(),
          nextAttempt);
      return;
    }
    metrics.recordNotificationDelivery("retry");
    logger.warn(
        "grade notification retry scheduled id={} attempt={} nextRetryAt={}",
        record.notificationId(),
        nextAttempt,
        nextRetryAt,
        ex);
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), (attempt - 1));
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    return Duration.ofMillis(Math.max(properties.backoffMin().toMillis(), backoffMillis));
  }
}
