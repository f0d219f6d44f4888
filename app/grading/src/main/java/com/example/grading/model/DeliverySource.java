/*
 * どこで: Grading ドメインモデル
 * 何を: パイプラインの起動元
 * なぜ: 初回受信と再処理でリプレイ判定と監査内容を切り替えるため
 */
package com.example.grading.model;

public enum DeliverySource {
  WEBHOOK,
  RETRY
}
