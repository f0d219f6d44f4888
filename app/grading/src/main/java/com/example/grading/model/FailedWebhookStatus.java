/*
 * どこで: Grading ドメインモデル
 * 何を: 失敗 Webhook の再処理状態
 * なぜ: claim 〜 終端までの状態遷移を DB と揃えるため
 */
package com.example.grading.model;

public enum FailedWebhookStatus {
  PENDING,
  PROCESSING,
  SUCCESS,
  FAILED
}
