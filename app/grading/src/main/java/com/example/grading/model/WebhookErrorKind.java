/*
 * どこで: Grading ドメインモデル
 * 何を: Webhook 処理の失敗分類
 * なぜ: 応答ステータスと自動再処理の可否を分類ごとに固定するため
 */
package com.example.grading.model;

public enum WebhookErrorKind {
  SIGNATURE(false),
  MALFORMED(false),
  REPLAY(false),
  VALIDATION(false),
  NOT_FOUND(false),
  PERSISTENCE(true),
  UNEXPECTED(true);

  private final boolean retryable;

  WebhookErrorKind(boolean retryable) {
    this.retryable = retryable;
  }

  // 同一ペイロードで再実行しても結果が変わらない分類は false
  public boolean retryable() {
    return retryable;
  }
}
