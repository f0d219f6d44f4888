/*
 * どこで: Grading API レスポンス
 * 何を: 提出物ごとの監査ログ一覧
 * なぜ: 外部の監視ツールから採点経緯を参照できるようにするため
 */
package com.example.grading.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditTrailResponse(long submissionId, List<AuditEntryResponse> entries) {
  public AuditTrailResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを防御的コピーして不変化する
    if (entries != null) {
      entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }
  }

  @Override
  public List<AuditEntryResponse> entries() {
    if (entries == null) {
      return null;
    }
    return Collections.unmodifiableList(new ArrayList<>(entries));
  }
}
