/*
 * どこで: Grading データアクセス
 * 何を: failed_webhooks テーブルの登録/claim/終端更新を担う
 * なぜ: 複数レプリカの再処理ワーカーが同じ記録を二重処理しないようにするため
 */
package com.example.grading.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.grading.model.FailedWebhookRecord;
import com.example.grading.model.FailedWebhookStatus;
import com.example.grading.model.WebhookErrorKind;
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
public class FailedWebhookRepository {

  private static final String COLUMNS =
      """
      id, submission_id, raw_payload, error_kind, error_message, remote_ip, status,
      retry_count, locked_by, locked_at, lease_until, created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(FailedWebhookRecord record) {
    final String sql =
        """
        INSERT INTO failed_webhooks (
          id, submission_id, raw_payload, error_kind, error_message, remote_ip, status,
          retry_count, locked_by, locked_at, lease_until, created_at, updated_at
        ) VALUES (
          :id, :submissionId, :rawPayload, :errorKind, :errorMessage, :remoteIp, :status,
          :retryCount, :lockedBy, :lockedAt, :leaseUntil, :createdAt, :updatedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", record.id())
            .addValue("submissionId", record.submissionId(), Types.BIGINT)
            .addValue("rawPayload", record.rawPayload())
            .addValue("errorKind", record.errorKind().name())
            .addValue("errorMessage", record.errorMessage())
            .addValue("remoteIp", record.remoteIp())
            .addValue("status", record.status().name())
            .addValue("retryCount", record.retryCount())
            .addValue("lockedBy", record.lockedBy())
            .addValue("lockedAt", toTimestamp(record.lockedAt()))
            .addValue("leaseUntil", toTimestamp(record.leaseUntil()))
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    jdbcTemplate.update(sql, params);
    return record.id();
  }

  public List<FailedWebhookRecord> claimPendingForUpdate(
      int limit, int maxRetries, Instant now, Instant leaseUntil, String lockedBy) {
    // PENDING と lease 切れの PROCESSING を古い順に単一 SQL で claim する
    final String sql =
        """
        WITH cte AS (
          SELECT id
          FROM failed_webhooks
          WHERE retry_count < :maxRetries
            AND (
              status = 'PENDING'
              OR (status = 'PROCESSING' AND (lease_until IS NULL OR lease_until <= :now))
            )
          ORDER BY created_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE failed_webhooks f
        SET status = 'PROCESSING',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil,
            updated_at = :now
        FROM cte
        WHERE f.id = cte.id
        RETURNING f.id, f.submission_id, f.raw_payload, f.error_kind, f.error_message,
                  f.remote_ip, f.status, f.retry_count, f.locked_by, f.locked_at,
                  f.lease_until, f.created_at, f.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("maxRetries", maxRetries)
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markSuccess(UUID id, Instant now, String lockedBy) {
    final String sql =
        """
        UPDATE failed_webhooks
        SET status = 'SUCCESS',
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL,
            updated_at = :now
        WHERE id = :id
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("id", id)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markRetry(
      UUID id,
      int retryCount,
      WebhookErrorKind errorKind,
      String errorMessage,
      boolean failed,
      Instant now,
      String lockedBy) {
    final String sql =
        """
        UPDATE failed_webhooks
        SET status = :status,
            retry_count = :retryCount,
            error_kind = :errorKind,
            error_message = :errorMessage,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL,
            updated_at = :now
        WHERE id = :id
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", failed ? "FAILED" : "PENDING")
            .addValue("retryCount", retryCount)
            .addValue("errorKind", errorKind.name())
            .addValue("errorMessage", errorMessage)
            .addValue("now", toTimestamp(now))
            .addValue("id", id)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public List<FailedWebhookRecord> findByStatus(FailedWebhookStatus status, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM failed_webhooks
            WHERE status = :status
            ORDER BY created_at DESC
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("status", status.name()).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<FailedWebhookRecord> findBySubmissionId(long submissionId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM failed_webhooks
            WHERE submission_id = :submissionId
            ORDER BY created_at
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("submissionId", submissionId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countByStatus(FailedWebhookStatus status) {
    final String sql = "SELECT COUNT(*) FROM failed_webhooks WHERE status = :status";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("status", status.name());
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public int deleteTerminalOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM failed_webhooks
        WHERE created_at < :threshold
          AND status IN ('SUCCESS', 'FAILED')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  public int countStaleActive(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM failed_webhooks
        WHERE created_at < :threshold
          AND status IN ('PENDING', 'PROCESSING')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private FailedWebhookRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final long rawSubmissionId = rs.getLong("submission_id");
    final Long submissionId = rs.wasNull() ? null : rawSubmissionId;
    return new FailedWebhookRecord(
        UUID.fromString(rs.getString("id")),
        submissionId,
        rs.getString("raw_payload"),
        WebhookErrorKind.valueOf(rs.getString("error_kind")),
        rs.getString("error_message"),
        rs.getString("remote_ip"),
        FailedWebhookStatus.valueOf(rs.getString("status")),
        rs.getInt("retry_count"),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("locked_at")),
        toInstant(rs.getTimestamp("lease_until")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
