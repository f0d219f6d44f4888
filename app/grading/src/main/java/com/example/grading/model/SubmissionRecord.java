/*
 * どこで: Grading ドメインモデル
 * 何を: submissions テーブルのスナップショット
 * なぜ: 採点書き込みとデバッグ参照で共通化するため
 */
package com.example.grading.model;

import java.math.BigDecimal;
import java.time.Instant;

public record SubmissionRecord(
    long submissionId,
    String studentId,
    Integer score,
    BigDecimal maxScore,
    String feedback,
    SubmissionStatus status,
    Instant gradedAt,
    Instant submittedAt,
    Instant updatedAt) {}
