/*
 * どこで: Grading API レスポンス
 * 何を: 採点 Webhook 成功時の応答
 * なぜ: 送信側が確定した点数を確認できるようにするため
 */
package com.example.grading.api.response;

import com.example.grading.model.GradeResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WebhookResponse(boolean success, long submissionId, int score, String message) {

  public static WebhookResponse applied(GradeResult grade) {
    return new WebhookResponse(true, grade.submissionId(), grade.score(), "grade applied");
  }
}
