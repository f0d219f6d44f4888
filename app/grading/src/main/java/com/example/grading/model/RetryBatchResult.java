/*
 * どこで: Grading ドメインモデル
 * 何を: 再処理バッチ 1 回分の集計
 * なぜ: 外部スケジューラとログで処理件数を確認できるようにするため
 */
package com.example.grading.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RetryBatchResult(
    int claimed, int succeeded, int rescheduled, int failed, int lockLost) {

  public static RetryBatchResult empty() {
    return new RetryBatchResult(0, 0, 0, 0, 0);
  }
}
