/*
 * どこで: Grading API レスポンス
 * 何を: 失敗 Webhook 一覧の要素
 * なぜ: 再処理状況と失敗理由を確認できるようにするため(本文は返さない)
 */
package com.example.grading.api.response;

import com.example.grading.model.FailedWebhookRecord;
import com.example.grading.model.FailedWebhookStatus;
import com.example.grading.model.WebhookErrorKind;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FailedWebhookSummary(
    UUID id,
    Long submissionId,
    WebhookErrorKind errorKind,
    String errorMessage,
    String remoteIp,
    FailedWebhookStatus status,
    int retryCount,
    Instant createdAt,
    Instant updatedAt) {

  public static FailedWebhookSummary from(FailedWebhookRecord record) {
    return new FailedWebhookSummary(
        record.id(),
        record.submissionId(),
        record.errorKind(),
        record.errorMessage(),
        record.remoteIp(),
        record.status(),
        record.retryCount(),
        record.createdAt(),
        record.updatedAt());
  }
}
