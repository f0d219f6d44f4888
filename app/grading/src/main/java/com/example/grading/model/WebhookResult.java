/*
 * どこで: Grading ドメインモデル
 * 何を: パイプライン 1 回分の結果(成功/失敗)
 * なぜ: HTTP 受信と再処理ワーカーが同じ結果型で分岐できるようにするため
 */
package com.example.grading.model;

public sealed interface WebhookResult permits WebhookResult.Success, WebhookResult.Failure {

  record Success(GradeResult grade, boolean notified) implements WebhookResult {}

  // submissionId はペイロードから取り出せなかった場合 null
  record Failure(Long submissionId, WebhookError error) implements WebhookResult {}

  static WebhookResult failure(Long submissionId, WebhookErrorKind kind, String message) {
    return new Failure(submissionId, WebhookError.of(kind, message));
  }
}
