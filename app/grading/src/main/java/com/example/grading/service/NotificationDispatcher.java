/*
 * どこで: Grading サービス層
 * 何を: 採点結果から学生向けメッセージを組み立てて投入する
 * なぜ: 採点確定後の通知失敗で Webhook 全体を失敗扱いにしないため
 */
package com.example.grading.service;

import com.example.grading.config.NotificationProperties;
import com.example.grading.model.GradeResult;
import com.google.common.annotations.VisibleForTesting;
import java.math.BigDecimal;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);
  private static final int DEFAULT_PREVIEW_LENGTH = 200;
  private static final String ELLIPSIS = "...";

  private final NotificationService notificationService;
  private final NotificationProperties properties;

  // 通知の成否を返すが、失敗は WARN ログに留めて呼び出し元へ伝播しない
  public boolean notify(GradeResult result, String feedback) {
    try {
      notificationService.enqueue(
          result.studentId(), subject(result), body(result, feedback), result.submissionId());
      return true;
    } catch (RuntimeException ex) {
      logger.warn(
          "grade notification failed submissionId={} recipient={}",
          result.submissionId(),
          result.studentId(),
          ex);
      return false;
    }
  }

  @VisibleForTesting
  String subject(GradeResult result) {
    return "Submission #" + result.submissionId() + " has been graded";
  }

  @VisibleForTesting
  String body(GradeResult result, String feedback) {
    final StringBuilder builder = new StringBuilder();
    builder
        .append("Your submission #")
        .append(result.submissionId())
        .append(" scored ")
        .append(result.score())
        .append(" / ")
        .append(plain(result.maxScore()))
        .append(" (")
        .append(plain(result.percentage()))
        .append("%).");
    final String preview = truncate(feedback);
    if (preview != null) {
      builder.append("\n\nFeedback: ").append(preview);
    }
    return builder.toString();
  }

  @VisibleForTesting
  String truncate(String feedback) {
    if (feedback == null || feedback.isBlank()) {
      return null;
    }
    final String trimmed = feedback.strip();
    final int limit =
        properties.feedbackPreviewLength() > 0
            ? properties.feedbackPreviewLength()
            : DEFAULT_PREVIEW_LENGTH;
    // 上限はコードポイント数で数え、サロゲートペアを分断しない
    if (trimmed.codePointCount(0, trimmed.length()) <= limit) {
      return trimmed;
    }
    return trimmed.substring(0, trimmed.offsetByCodePoints(0, limit)) + ELLIPSIS;
  }

  private String plain(BigDecimal value) {
    return value.stripTrailingZeros().toPlainString();
  }
}
