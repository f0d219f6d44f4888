/*
 * どこで: Grading データアクセス
 * 何を: 採点通知 outbox(notifications)の登録/claim/更新を担う
 * なぜ: 採点確定と通知送信を分離し、送信失敗を非同期に再送するため
 */
package com.example.grading.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.grading.model.NotificationRecord;
import com.example.grading.model.NotificationStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(NotificationRecord record) {
    final String sql =
        """
        INSERT INTO notifications (
          notification_id,
          submission_id,
          recipient_id,
          subject,
          body,
          status,
          locked_by,
          locked_at,
          lease_until,
          attempt_count,
          next_retry_at,
          created_at,
          sent_at
        ) VALUES (
          :notificationId,
          :submissionId,
          :recipientId,
          :subject,
          :body,
          :status,
          :lockedBy,
          :lockedAt,
          :leaseUntil,
          :attemptCount,
          :nextRetryAt,
          :createdAt,
          :sentAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("submissionId", record.submissionId(), Types.BIGINT)
            .addValue("recipientId", record.recipientId())
            .addValue("subject", record.subject())
            .addValue("body", record.body())
            .addValue("status", record.status().name())
            .addValue("lockedBy", record.lockedBy())
            .addValue("lockedAt", toTimestamp(record.lockedAt()))
            .addValue("leaseUntil", toTimestamp(record.leaseUntil()))
            .addValue("attemptCount", record.attemptCount())
            .addValue("nextRetryAt", toTimestamp(record.nextRetryAt()))
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("sentAt", toTimestamp(record.sentAt()));
    jdbcTemplate.update(sql, params);
    return record.notificationId();
  }

  public List<NotificationRecord> findByRecipientId(String recipientId) {
    final String sql =
        """
        SELECT notification_id, submission_id, recipient_id, subject, body, status,
               locked_by, locked_at, lease_until,
               attempt_count, next_retry_at, created_at, sent_at
        FROM notifications
        WHERE recipient_id = :recipientId
        ORDER BY created_at DESC
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("recipientId", recipientId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<NotificationRecord> claimPendingForUpdate(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    // 送信待ちと lease 切れの PROCESSING をまとめて claim する
    final String sql =
        """
        WITH cte AS (
          SELECT notification_id
          FROM notifications
          WHERE (
            status = 'PENDING'
            AND (next_retry_at IS NULL OR next_retry_at <= :now)
          )
          OR (
            status = 'PROCESSING'
            AND (lease_until IS NULL OR lease_until <= :now)
          )
          ORDER BY created_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE notifications n
        SET status = 'PROCESSING',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil
        FROM cte
        WHERE n.notification_id = cte.notification_id
        RETURNING n.notification_id, n.submission_id, n.recipient_id, n.subject, n.body,
                  n.status, n.locked_by, n.locked_at, n.lease_until,
                  n.attempt_count, n.next_retry_at, n.created_at, n.sent_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markSent(UUID notificationId, Instant sentAt, String lockedBy) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'SENT',
            sent_at = :sentAt,
            next_retry_at = NULL,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE notification_id = :notificationId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("notificationId", notificationId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markRetry(
      UUID notificationId, int attemptCount, Instant nextRetryAt, boolean failed, String lockedBy) {
    final String sql =
        """
        UPDATE notifications
        SET status = :status,
            attempt_count = :attemptCount,
            next_retry_at = :nextRetryAt,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE notification_id = :notificationId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", failed ? "FAILED" : "PENDING")
            .addValue("attemptCount", attemptCount)
            .addValue("nextRetryAt", failed ? null : toTimestamp(nextRetryAt))
            .addValue("notificationId", notificationId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int deleteSentOrFailedOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM notifications
        WHERE created_at < :threshold
          AND status IN ('SENT', 'FAILED')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  public int countByStatus(NotificationStatus status) {
    final String sql = "SELECT COUNT(*) FROM notifications WHERE status = :status";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("status", status.name());
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final long rawSubmissionId = rs.getLong("submission_id");
    final Long submissionId = rs.wasNull() ? null : rawSubmissionId;
    return new NotificationRecord(
        UUID.fromString(rs.getString("notification_id")),
        submissionId,
        rs.getString("recipient_id"),
        rs.getString("subject"),
        rs.getString("body"),
        NotificationStatus.valueOf(rs.getString("status")),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("locked_at")),
        toInstant(rs.getTimestamp("lease_until")),
        rs.getInt("attempt_count"),
        toInstant(rs.getTimestamp("next_retry_at")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("sent_at")));
  }
}
