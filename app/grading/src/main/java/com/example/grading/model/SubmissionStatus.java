/*
 * どこで: Grading ドメインモデル
 * 何を: 提出物の採点状態を表す列挙
 * なぜ: DB の CHECK 制約と処理ロジックの状態を一致させるため
 */
package com.example.grading.model;

public enum SubmissionStatus {
  SUBMITTED,
  GRADED
}
