/*
 * どこで: Grading API
 * 何を: エラーレスポンスの共通フォーマットを定義する
 * なぜ: 送信側がエラー原因と違反フィールドを識別しやすくするため
 */
package com.example.grading.api;

import com.example.grading.model.FieldViolation;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ApiErrorResponse(ApiErrorCode code, String message, List<FieldViolation> violations) {

  public ApiErrorResponse {
    violations = violations == null ? List.of() : List.copyOf(violations);
  }

  public ApiErrorResponse(ApiErrorCode code, String message) {
    this(code, message, List.of());
  }
}
