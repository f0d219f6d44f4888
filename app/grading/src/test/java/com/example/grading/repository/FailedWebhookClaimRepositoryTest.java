/*
 * どこで: Grading テスト
 * 何を: failed_webhooks の claim/lease/条件付き確定を Postgres 上で検証する
 * なぜ: UPDATE ... RETURNING + SKIP LOCKED の挙動を統合テストで確認するため
 */
package com.example.grading.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.grading.AbstractPostgresContainerTest;
import com.example.grading.model.FailedWebhookRecord;
import com.example.grading.model.FailedWebhookStatus;
import com.example.grading.model.WebhookErrorKind;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class FailedWebhookClaimRepositoryTest extends AbstractPostgresContainerTest {

  private static final Duration LEASE = Duration.ofMinutes(5);

  @Autowired private FailedWebhookRepository failedWebhookRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM failed_webhooks", new MapSqlParameterSource());
  }

  @Test
  void claimMovesPendingToProcessingWithLock() {
    final Instant now = Instant.now();
    final FailedWebhookRecord record = insert(FailedWebhookStatus.PENDING, 0, null, null, now);

    final Instant leaseUntil = now.plus(LEASE);
    final List<FailedWebhookRecord> claimed =
        failedWebhookRepository.claimPendingForUpdate(10, 3, now, leaseUntil, "test-host");

    assertThat(claimed).hasSize(1);
    final FailedWebhookRecord claimedRecord = claimed.get(0);
    assertThat(claimedRecord.id()).isEqualTo(record.id());
    assertThat(claimedRecord.status()).isEqualTo(FailedWebhookStatus.PROCESSING);
    assertThat(claimedRecord.lockedBy()).isEqualTo("test-host");
    assertThat(claimedRecord.rawPayload()).isEqualTo(record.rawPayload());
    assertInstantCloseToMicros(leaseUntil, claimedRecord.leaseUntil());

    // claim 済みで lease 内の行は二重に取得されない
    assertThat(failedWebhookRepository.claimPendingForUpdate(10, 3, now, leaseUntil, "other"))
        .isEmpty();
  }

  @Test
  void claimRecoversExpiredProcessing() {
    final Instant now = Instant.now();
    final Instant expiredLease = now.minus(LEASE);
    insert(FailedWebhookStatus.PROCESSING, 1, "old-host", expiredLease, now);

    final List<FailedWebhookRecord> claimed =
        failedWebhookRepository.claimPendingForUpdate(10, 3, now, now.plus(LEASE), "new-host");

    assertThat(claimed)
        .singleElement()
        .extracting(FailedWebhookRecord::lockedBy)
        .isEqualTo("new-host");
  }

  @Test
  void claimSkipsRecordsAtRetryLimitAndTerminalRecords() {
    final Instant now = Instant.now();
    insert(FailedWebhookStatus.PENDING, 3, null, null, now);
    insert(FailedWebhookStatus.FAILED, 0, null, null, now);
    insert(FailedWebhookStatus.SUCCESS, 0, null, null, now);

    assertThat(failedWebhookRepository.claimPendingForUpdate(10, 3, now, now.plus(LEASE), "h"))
        .isEmpty();
  }

  @Test
  void claimRespectsLimitInCreationOrder() {
    final Instant now = Instant.now();
    final FailedWebhookRecord oldest =
        insert(FailedWebhookStatus.PENDING, 0, null, null, now.minusSeconds(30));
    insert(FailedWebhookStatus.PENDING, 0, null, null, now);

    final List<FailedWebhookRecord> claimed =
        failedWebhookRepository.claimPendingForUpdate(1, 3, now, now.plus(LEASE), "h");

    assertThat(claimed).extracting(FailedWebhookRecord::id).containsExactly(oldest.id());
  }

  @Test
  void terminalUpdatesRequireLockOwnership() {
    final Instant now = Instant.now();
    final FailedWebhookRecord record = insert(FailedWebhookStatus.PENDING, 0, null, null, now);
    failedWebhookRepository.claimPendingForUpdate(10, 3, now, now.plus(LEASE), "owner");

    assertThat(failedWebhookRepository.markSuccess(record.id(), now, "intruder")).isZero();
    assertThat(
            failedWebhookRepository.markRetry(
                record.id(), 1, WebhookErrorKind.PERSISTENCE, "db down", false, now, "owner"))
        .isEqualTo(1);

    final FailedWebhookRecord updated = failedWebhookRepository.findBySubmissionId(42L).get(0);
    assertThat(updated.status()).isEqualTo(FailedWebhookStatus.PENDING);
    assertThat(updated.retryCount()).isEqualTo(1);
    assertThat(updated.lockedBy()).isNull();
    assertThat(failedWebhookRepository.countByStatus(FailedWebhookStatus.PENDING)).isEqualTo(1);
  }

  private FailedWebhookRecord insert(
      FailedWebhookStatus status,
      int retryCount,
      String lockedBy,
      Instant leaseUntil,
      Instant createdAt) {
    final FailedWebhookRecord record =
        new FailedWebhookRecord(
            UUID.randomUUID(),
            42L,
            "{\"submission_id\":42}",
            WebhookErrorKind.PERSISTENCE,
            "db down",
            "10.0.0.1",
            status,
            retryCount,
            lockedBy,
            leaseUntil,
            leaseUntil,
            createdAt,
            createdAt);
    failedWebhookRepository.insert(record);
    return record;
  }

  private void assertInstantCloseToMicros(Instant expected, Instant actual) {
    final Duration delta = Duration.between(expected, actual).abs();
    assertThat(delta).isLessThanOrEqualTo(ChronoUnit.MICROS.getDuration());
  }
}
