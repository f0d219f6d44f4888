/*
 * どこで: Grading ドメインモデル
 * 何を: grading_audit テーブルの1行
 * なぜ: 監査参照 API へ詳細 JSON をそのまま返すため
 */
package com.example.grading.model;

import java.time.Instant;
import java.util.UUID;

public record AuditEntry(
    UUID auditId,
    Long submissionId,
    AuditEventType eventType,
    String detailsJson,
    Instant createdAt,
    String createdBy) {}
