/*
 * どこで: Grading ドメインモデル
 * 何を: ペイロード検証の結果(イベントまたは違反一覧)
 * なぜ: 検証を副作用なしの純粋関数として扱うため
 */
package com.example.grading.model;

import java.util.List;

public record ValidationOutcome(WebhookEvent event, List<FieldViolation> violations) {

  public ValidationOutcome {
    violations = violations == null ? List.of() : List.copyOf(violations);
  }

  public static ValidationOutcome valid(WebhookEvent event) {
    return new ValidationOutcome(event, List.of());
  }

  public static ValidationOutcome invalid(List<FieldViolation> violations) {
    return new ValidationOutcome(null, violations);
  }

  public boolean isValid() {
    return event != null && violations.isEmpty();
  }
}
