/*
 * どこで: Grading API レスポンス
 * 何を: 提出物の採点状態
 * なぜ: 採点反映を動作確認で参照できるようにするため
 */
package com.example.grading.api.response;

import com.example.grading.model.SubmissionRecord;
import com.example.grading.model.SubmissionStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubmissionSummary(
    long submissionId,
    String studentId,
    SubmissionStatus status,
    Integer score,
    BigDecimal maxScore,
    String feedback,
    Instant gradedAt) {

  public static SubmissionSummary from(SubmissionRecord record) {
    return new SubmissionSummary(
        record.submissionId(),
        record.studentId(),
        record.status(),
        record.score(),
        record.maxScore(),
        record.feedback(),
        record.gradedAt());
  }
}
