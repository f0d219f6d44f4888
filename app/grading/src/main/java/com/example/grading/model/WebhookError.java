/*
 * どこで: Grading ドメインモデル
 * 何を: 型付きの失敗情報
 * なぜ: 例外による制御フローをやめ、失敗分類を網羅的に扱えるようにするため
 */
package com.example.grading.model;

import java.util.List;
import java.util.stream.Collectors;

public record WebhookError(WebhookErrorKind kind, String message, List<FieldViolation> violations) {

  public WebhookError {
    violations = violations == null ? List.of() : List.copyOf(violations);
  }

  public static WebhookError of(WebhookErrorKind kind, String message) {
    return new WebhookError(kind, message, List.of());
  }

  public static WebhookError validation(List<FieldViolation> violations) {
    final String message =
        violations.stream().map(FieldViolation::toString).collect(Collectors.joining("; "));
    return new WebhookError(WebhookErrorKind.VALIDATION, message, violations);
  }

  public boolean retryable() {
    return kind.retryable();
  }
}
