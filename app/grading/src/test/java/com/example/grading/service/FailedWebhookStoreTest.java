/*
 * どこで: 失敗 Webhook 記録のユニットテスト
 * 何を: 失敗分類ごとの初期ステータスとメッセージ切り詰めを検証する
 * なぜ: 再処理しても結果が変わらない失敗を自動再処理へ回さないため
 */
package com.example.grading.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.grading.config.AutograderWebhookProperties;
import com.example.grading.model.FailedWebhookRecord;
import com.example.grading.model.FailedWebhookStatus;
import com.example.grading.model.WebhookError;
import com.example.grading.model.WebhookErrorKind;
import com.example.grading.repository.FailedWebhookRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class FailedWebhookStoreTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");

  @Mock private FailedWebhookRepository failedWebhookRepository;

  private FailedWebhookStore store;

  @BeforeEach
  void setUp() {
    store =
        new FailedWebhookStore(
            failedWebhookRepository,
            new AutograderWebhookProperties("secret", Duration.ofSeconds(30), 10),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void retryableFailureIsStoredAsPending() {
    final Optional<UUID> id =
        store.recordFailure(
            "{}", 42L, WebhookError.of(WebhookErrorKind.PERSISTENCE, "db down"), "10.0.0.1");

    final FailedWebhookRecord record = captureInserted();
    assertThat(id).contains(record.id());
    assertThat(record.status()).isEqualTo(FailedWebhookStatus.PENDING);
    assertThat(record.retryCount()).isZero();
    assertThat(record.submissionId()).isEqualTo(42L);
    assertThat(record.remoteIp()).isEqualTo("10.0.0.1");
    assertThat(record.createdAt()).isEqualTo(FIXED_NOW);
  }

  @Test
  void permanentFailureIsStoredAsFailedWithTruncatedMessage() {
    store.recordFailure(
        "{}", 42L, WebhookError.of(WebhookErrorKind.NOT_FOUND, "submission 42 not found"), null);

    final FailedWebhookRecord record = captureInserted();
    assertThat(record.status()).isEqualTo(FailedWebhookStatus.FAILED);
    assertThat(record.errorMessage()).isEqualTo("submission");
  }

  @Test
  void storageFailureReturnsEmpty() {
    when(failedWebhookRepository.insert(any()))
        .thenThrow(new DataAccessResourceFailureException("db down"));

    final Optional<UUID> id =
        store.recordFailure(
            null, null, WebhookError.of(WebhookErrorKind.UNEXPECTED, "boom"), null);

    assertThat(id).isEmpty();
  }

  private FailedWebhookRecord captureInserted() {
    final ArgumentCaptor<FailedWebhookRecord> captor =
        ArgumentCaptor.forClass(FailedWebhookRecord.class);
    verify(failedWebhookRepository).insert(captor.capture());
    return captor.getValue();
  }
}
