/*
 * どこで: Grading ドメインモデル
 * 何を: 採点書き込み後の確定値
 * なぜ: HTTP 応答・通知・監査で同じ値を参照するため
 */
package com.example.grading.model;

import java.math.BigDecimal;

public record GradeResult(
    long submissionId,
    String studentId,
    int score,
    BigDecimal maxScore,
    BigDecimal percentage) {}
