/*
 * どこで: Grading ドメインモデル
 * 何を: 監査ログのイベント種別
 * なぜ: 自由文字列を排除し、監査証跡を機械的に検証できるようにするため
 */
package com.example.grading.model;

public enum AuditEventType {
  RECEIVED,
  SIGNATURE_VERIFIED,
  VALIDATED,
  GRADE_APPLIED,
  NOTIFICATION_SENT,
  ERROR
}
