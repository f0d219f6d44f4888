/*
 * どこで: 監査記録のユニットテスト
 * 何を: 監査行の内容と、書き込み失敗時に例外を伝播しないことを検証する
 * なぜ: 監査は診断用であり Webhook 処理を止めない契約を固定するため
 */
package com.example.grading.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import com.example.grading.config.AuditProperties;
import com.example.grading.model.AuditEventType;
import com.example.grading.repository.GradingAuditRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class AuditTrailRecorderTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");

  @Mock private GradingAuditRepository auditRepository;

  private AuditTrailRecorder recorder;

  @BeforeEach
  void setUp() {
    recorder =
        new AuditTrailRecorder(
            auditRepository,
            new ObjectMapper(),
            new AuditProperties("autograder-webhook"),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void recordSerializesDetailsAndStampsActor() {
    recorder.record(42L, AuditEventType.GRADE_APPLIED, Map.of("score", 88));

    final ArgumentCaptor<String> detailsCaptor = ArgumentCaptor.forClass(String.class);
    verify(auditRepository)
        .insert(
            any(UUID.class),
            eq(42L),
            eq(AuditEventType.GRADE_APPLIED),
            detailsCaptor.capture(),
            eq(FIXED_NOW),
            eq("autograder-webhook"));
    assertThat(detailsCaptor.getValue()).isEqualTo("{\"score\":88}");
  }

  @Test
  void recordAcceptsNullSubmissionAndDetails() {
    recorder.record(null, AuditEventType.ERROR, null);

    verify(auditRepository)
        .insert(any(UUID.class), eq(null), eq(AuditEventType.ERROR), eq("{}"), any(), anyString());
  }

  @Test
  void recordSwallowsRepositoryFailure() {
    doThrow(new DataAccessResourceFailureException("db down"))
        .when(auditRepository)
        .insert(any(), any(), any(), any(), any(), any());

    assertThatCode(() -> recorder.record(42L, AuditEventType.RECEIVED, Map.of()))
        .doesNotThrowAnyException();
  }
}
