/*
 * どこで: Grading ドメインモデル
 * 何を: notifications テーブル(outbox)のスナップショット
 * なぜ: 採点直後の enqueue と非同期配信で共通化するため
 */
package com.example.grading.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationRecord(
        UUID notificationId,
        Long submissionId,
        String recipientId,
        String subject,
        String body,
        NotificationStatus status,
        String lockedBy,
        Instant lockedAt,
        Instant leaseUntil,
        int attemptCount,
        Instant nextRetryAt,
        Instant createdAt,
        Instant sentAt) {
}
