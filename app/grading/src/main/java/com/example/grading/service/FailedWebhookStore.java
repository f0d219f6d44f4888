/*
 * どこで: Grading サービス層
 * 何を: 署名検証後に失敗した Webhook を failed_webhooks へ永続化する
 * なぜ: 一時障害を自動再処理へ回し、恒久的な失敗もフォレンジック用に残すため
 */
package com.example.grading.service;

import com.example.grading.config.AutograderWebhookProperties;
import com.example.grading.model.FailedWebhookRecord;
import com.example.grading.model.FailedWebhookStatus;
import com.example.grading.model.WebhookError;
import com.example.grading.repository.FailedWebhookRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class FailedWebhookStore {

  private static final Logger logger = LoggerFactory.getLogger(FailedWebhookStore.class);

  private final FailedWebhookRepository failedWebhookRepository;
  private final AutograderWebhookProperties properties;
  private final Clock clock;

  // 再処理対象は PENDING、同じ入力で必ず再失敗する分類は FAILED で記録のみ行う
  public Optional<UUID> recordFailure(
      String rawPayload, Long submissionId, WebhookError error, String remoteIp) {
    final Instant now = Instant.now(clock);
    final FailedWebhookStatus status =
        error.retryable() ? FailedWebhookStatus.PENDING : FailedWebhookStatus.FAILED;
    final FailedWebhookRecord record =
        new FailedWebhookRecord(
            UUID.randomUUID(),
            submissionId,
            rawPayload == null ? "" : rawPayload,
            error.kind(),
            WorkerIds.truncate(error.message(), properties.errorMessageMaxLength()),
            remoteIp,
            status,
            0,
            null,
            null,
            null,
            now,
            now);
    try {
      failedWebhookRepository.insert(record);
      logger.warn(
          "failed webhook recorded id={} submissionId={} kind={} status={}",
          record.id(),
          submissionId,
          error.kind(),
          status);
      return Optional.of(record.id());
    } catch (RuntimeException ex) {
      // 記録自体が失敗した場合は送信側の再送に委ねる
      logger.error(
          "failed webhook could not be stored submissionId={} kind={} payloadLength={}",
          submissionId,
          error.kind(),
          record.rawPayload().length(),
          ex);
      return Optional.empty();
    }
  }
}
