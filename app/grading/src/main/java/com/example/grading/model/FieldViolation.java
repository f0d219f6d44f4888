/*
 * どこで: Grading ドメインモデル
 * 何を: 入力検証違反 1 件(フィールドと理由)
 * なぜ: 送信側へ全違反をまとめて返すため
 */
package com.example.grading.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FieldViolation(String field, String reason) {

  @Override
  public String toString() {
    return field + ": " + reason;
  }
}
