/*
 * どこで: Grading API レスポンス
 * 何を: 監査ログ 1 件の参照用表現
 * なぜ: details を文字列ではなく JSON として返すため
 */
package com.example.grading.api.response;

import com.example.grading.model.AuditEventType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditEntryResponse(
    UUID auditId,
    AuditEventType eventType,
    JsonNode details,
    Instant createdAt,
    String createdBy) {}
