/*
 * どこで: 共通ユーティリティ
 * 何を: リクエスト/ワーカー識別子を発行する
 * なぜ: ログ相関 ID の生成方法を全モジュールで揃えるため
 */
package com.example.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  // 呼び出し元ヘッダが空なら新規発行する
  public static String orNew(String candidate) {
    if (candidate == null || candidate.isBlank()) {
      return newTraceId();
    }
    return candidate.trim();
  }
}
