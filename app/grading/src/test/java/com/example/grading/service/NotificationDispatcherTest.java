/*
 * どこで: 採点通知組み立てのユニットテスト
 * 何を: 件名/本文の書式、フィードバックの切り詰め、失敗時の握りつぶしを検証する
 * なぜ: 通知失敗が採点結果に波及しないことを保証するため
 */
package com.example.grading.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.grading.config.NotificationProperties;
import com.example.grading.model.GradeResult;
import java.math.BigDecimal;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationDispatcherTest {

  private static final GradeResult RESULT =
      new GradeResult(42L, "student-1", 88, new BigDecimal("100.00"), new BigDecimal("88.00"));

  @Mock private NotificationService notificationService;

  private NotificationDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    dispatcher = new NotificationDispatcher(notificationService, new NotificationProperties(10));
  }

  @Test
  void notifyEnqueuesMessageForStudent() {
    when(notificationService.enqueue(anyString(), anyString(), anyString(), any()))
        .thenReturn(UUID.randomUUID());

    final boolean notified = dispatcher.notify(RESULT, "Nice work");

    assertThat(notified).isTrue();
    verify(notificationService)
        .enqueue(
            eq("student-1"),
            eq("Submission #42 has been graded"),
            eq("Your submission #42 scored 88 / 100 (88%).\n\nFeedback: Nice work"),
            eq(42L));
  }

  @Test
  void notifyReturnsFalseWhenEnqueueFails() {
    when(notificationService.enqueue(anyString(), anyString(), anyString(), any()))
        .thenThrow(new IllegalStateException("outbox down"));

    assertThat(dispatcher.notify(RESULT, null)).isFalse();
  }

  @Test
  void bodyOmitsFeedbackSectionWhenBlank() {
    assertThat(dispatcher.body(RESULT, "  "))
        .isEqualTo("Your submission #42 scored 88 / 100 (88%).");
  }

  @Test
  void truncateAppliesPreviewLength() {
    assertThat(dispatcher.truncate("0123456789abc")).isEqualTo("0123456789...");
    assertThat(dispatcher.truncate(" 0123456789 ")).isEqualTo("0123456789");
  }

  @Test
  void truncateCountsCodePointsAndKeepsSurrogatePairsWhole() {
    final String emoji = "\uD83C\uDF89";
    final String feedback = "great " + emoji + emoji + emoji + "!!";

    final String preview = dispatcher.truncate(feedback);

    assertThat(preview).isEqualTo("great " + emoji + emoji + emoji + "!...");
    assertThat(dispatcher.truncate("a" + emoji.repeat(10)))
        .isEqualTo("a" + emoji.repeat(9) + "...");
    assertThat(dispatcher.truncate(emoji.repeat(10))).isEqualTo(emoji.repeat(10));
  }

  @Test
  void bodyKeepsFractionalMaxScoreAndPercentage() {
    final GradeResult fractional =
        new GradeResult(5L, "s", 33, new BigDecimal("99.50"), new BigDecimal("33.17"));

    assertThat(dispatcher.body(fractional, null))
        .isEqualTo("Your submission #5 scored 33 / 99.5 (33.17%).");
  }
}
