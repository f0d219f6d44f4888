/*
 * どこで: Grading API レスポンス
 * 何を: 採点通知 outbox の要素
 * なぜ: 送信状態と内容を確認できるようにするため
 */
package com.example.grading.api.response;

import com.example.grading.model.NotificationRecord;
import com.example.grading.model.NotificationStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationSummary(
    UUID notificationId,
    Long submissionId,
    String subject,
    String body,
    NotificationStatus status,
    int attemptCount,
    Instant createdAt,
    Instant sentAt) {

  public static NotificationSummary from(NotificationRecord record) {
    return new NotificationSummary(
        record.notificationId(),
        record.submissionId(),
        record.subject(),
        record.body(),
        record.status(),
        record.attemptCount(),
        record.createdAt(),
        record.sentAt());
  }
}
