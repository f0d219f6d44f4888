/*
 * どこで: Grading API レスポンス
 * 何を: 状態別の失敗 Webhook 一覧
 * なぜ: デバッグ API の構造を固定するため
 */
package com.example.grading.api.response;

import com.example.grading.model.FailedWebhookStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FailedWebhooksResponse(FailedWebhookStatus status, List<FailedWebhookSummary> items) {
  public FailedWebhooksResponse {
    if (items != null) {
      items = Collections.unmodifiableList(new ArrayList<>(items));
    }
  }

  @Override
  public List<FailedWebhookSummary> items() {
    if (items == null) {
      return null;
    }
    return Collections.unmodifiableList(new ArrayList<>(items));
  }
}
