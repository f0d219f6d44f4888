/*
 * どこで: Grading ドメインモデル
 * 何を: 検証済みの採点 Webhook ペイロード
 * なぜ: 検証を通過した値だけを採点処理へ渡すため
 */
package com.example.grading.model;

import java.math.BigDecimal;
import java.time.Instant;

// maxScore / feedback は送信側が省略できるため null を許容する
public record WebhookEvent(
    long submissionId,
    BigDecimal score,
    BigDecimal maxScore,
    String feedback,
    Instant timestamp) {}
