/*
 * どこで: Grading サービス層
 * 何を: PENDING の失敗 Webhook を claim し、共通パイプラインで再処理する
 * なぜ: 一時障害で失敗した採点を上限付きで自動回復させるため
 */
package com.example.grading.service;

import com.example.grading.config.AutograderWebhookProperties;
import com.example.grading.config.RetryProperties;
import com.example.grading.model.DeliverySource;
import com.example.grading.model.FailedWebhookRecord;
import com.example.grading.model.FailedWebhookStatus;
import com.example.grading.model.RetryBatchResult;
import com.example.grading.model.WebhookError;
import com.example.grading.model.WebhookErrorKind;
import com.example.grading.model.WebhookResult;
import com.example.grading.repository.FailedWebhookRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RetryScheduler {

  private static final Logger logger = LoggerFactory.getLogger(RetryScheduler.class);
  static final int MAX_BATCH_SIZE = 1000;

  private final FailedWebhookRepository failedWebhookRepository;
  private final GradeWebhookProcessor processor;
  private final RetryProperties retryProperties;
  private final AutograderWebhookProperties webhookProperties;
  private final GradingMetrics metrics;
  private final Clock clock;

  public RetryBatchResult runBatch() {
    return runBatch(retryProperties.maxRetries(), retryProperties.batchSize());
  }

  public RetryBatchResult runBatch(int maxRetries, int batchSize) {
    if (maxRetries < 1) {
      throw new IllegalArgumentException("max_retries must be greater than 0");
    }
    if (batchSize < 1 || batchSize > MAX_BATCH_SIZE) {
      throw new IllegalArgumentException("batch_size must be between 1 and " + MAX_BATCH_SIZE);
    }
    final Instant now = Instant.now(clock);
    final String lockedBy = resolveLockedBy();
    // PENDING → PROCESSING を単一 SQL で行い、複数レプリカでの二重処理を防ぐ
    final List<FailedWebhookRecord> claimed =
        failedWebhookRepository.claimPendingForUpdate(
            batchSize, maxRetries, now, now.plus(retryProperties.lease()), lockedBy);
    if (claimed.isEmpty()) {
      refreshPendingGauge();
      return RetryBatchResult.empty();
    }

    int succeeded = 0;
    int rescheduled = 0;
    int failed = 0;
    int lockLost = 0;
    for (FailedWebhookRecord record : claimed) {
      final WebhookResult result = replay(record);
      final Instant finishedAt = Instant.now(clock);
      if (result instanceof WebhookResult.Success) {
        if (failedWebhookRepository.markSuccess(record.id(), finishedAt, lockedBy) == 0) {
          lockLost++;
          logger.warn("failed webhook replayed but lock was lost id={}", record.id());
          continue;
        }
        succeeded++;
        metrics.recordRetryResult("success");
        logger.info(
            "failed webhook replayed id={} submissionId={} attempt={}",
            record.id(),
            record.submissionId(),
            record.retryCount() + 1);
        continue;
      }

      final WebhookError error = ((WebhookResult.Failure) result).error();
      final int nextRetryCount = record.retryCount() + 1;
      final boolean terminal = !error.retryable() || nextRetryCount >= maxRetries;
      final int updated =
          failedWebhookRepository.markRetry(
              record.id(),
              nextRetryCount,
              error.kind(),
              WorkerIds.truncate(error.message(), webhookProperties.errorMessageMaxLength()),
              terminal,
              finishedAt,
              lockedBy);
      if (updated == 0) {
        lockLost++;
        logger.warn("failed webhook retry update skipped because lock was lost id={}", record.id());
        continue;
      }
      if (terminal) {
        failed++;
        metrics.recordRetryResult("failed");
        logger.warn(
            "failed webhook gave up id={} submissionId={} retryCount={} kind={}",
            record.id(),
            record.submissionId(),
            nextRetryCount,
            error.kind());
      } else {
        rescheduled++;
        metrics.recordRetryResult("rescheduled");
        logger.warn(
            "failed webhook retry rescheduled id={} submissionId={} retryCount={} kind={}",
            record.id(),
            record.submissionId(),
            nextRetryCount,
            error.kind());
      }
    }
    refreshPendingGauge();
    final RetryBatchResult summary =
        new RetryBatchResult(claimed.size(), succeeded, rescheduled, failed, lockLost);
    logger.info("failed webhook retry batch finished summary={}", summary);
    return summary;
  }

  private WebhookResult replay(FailedWebhookRecord record) {
    try {
      return processor.process(record.rawPayload(), DeliverySource.RETRY, record.remoteIp());
    } catch (RuntimeException ex) {
      // 1 件の想定外例外でバッチ全体の claim を放置しない
      logger.error("failed webhook replay threw id={}", record.id(), ex);
      return WebhookResult.failure(
          record.submissionId(),
          WebhookErrorKind.UNEXPECTED,
          ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }
  }

  private void refreshPendingGauge() {
    try {
      metrics.updateFailedWebhookPending(
          failedWebhookRepository.countByStatus(FailedWebhookStatus.PENDING));
    } catch (RuntimeException ex) {
      logger.warn("failed webhook pending count refresh failed", ex);
    }
  }

  @VisibleForTesting
  String resolveLockedBy() {
    return WorkerIds.resolve();
  }
}
