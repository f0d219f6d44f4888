/*
 * どこで: Grading ドメインモデル
 * 何を: failed_webhooks テーブルのスナップショット
 * なぜ: 再処理ワーカーとデバッグ API で共通化するため
 */
package com.example.grading.model;

import java.time.Instant;
import java.util.UUID;

public record FailedWebhookRecord(
    UUID id,
    Long submissionId,
    String rawPayload,
    WebhookErrorKind errorKind,
    String errorMessage,
    String remoteIp,
    FailedWebhookStatus status,
    int retryCount,
    String lockedBy,
    Instant lockedAt,
    Instant leaseUntil,
    Instant createdAt,
    Instant updatedAt) {}
