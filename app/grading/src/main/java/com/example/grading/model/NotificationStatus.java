/*
 * どこで: Grading ドメインモデル
 * 何を: 採点通知 outbox の状態
 * なぜ: DB と配信ワーカーの状態を一致させるため
 */
package com.example.grading.model;

public enum NotificationStatus {
  PENDING,
  PROCESSING,
  SENT,
  FAILED
}
