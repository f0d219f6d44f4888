/*
 * どこで: Grading データアクセス
 * 何を: grading_audit テーブルへの追記と参照を担う
 * なぜ: 監査証跡を追記専用で保持し、外部ツールから参照できるようにするため
 */
package com.example.grading.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.grading.model.AuditEntry;
import com.example.grading.model.AuditEventType;
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
public class GradingAuditRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  // 更新/削除メソッドは持たない(DB トリガでも拒否される)
  public void insert(
      UUID auditId,
      Long submissionId,
      AuditEventType eventType,
      String detailsJson,
      Instant createdAt,
      String createdBy) {
    final String sql =
        """
        INSERT INTO grading_audit (
          audit_id, submission_id, event_type, details, created_at, created_by
        ) VALUES (
          :auditId, :submissionId, :eventType, :details::jsonb, :createdAt, :createdBy
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("auditId", auditId)
            .addValue("submissionId", submissionId, Types.BIGINT)
            .addValue("eventType", eventType.name())
            .addValue("details", detailsJson)
            .addValue("createdAt", toTimestamp(createdAt))
            .addValue("createdBy", createdBy);
    jdbcTemplate.update(sql, params);
  }

  public List<AuditEntry> findBySubmissionId(long submissionId) {
    final String sql =
        """
        SELECT audit_id, submission_id, event_type, details::text AS details_text,
               created_at, created_by
        FROM grading_audit
        WHERE submission_id = :submissionId
        ORDER BY audit_seq
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("submissionId", submissionId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private AuditEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
    final long rawSubmissionId = rs.getLong("submission_id");
    final Long submissionId = rs.wasNull() ? null : rawSubmissionId;
    return new AuditEntry(
        UUID.fromString(rs.getString("audit_id")),
        submissionId,
        AuditEventType.valueOf(rs.getString("event_type")),
        rs.getString("details_text"),
        toInstant(rs.getTimestamp("created_at")),
        rs.getString("created_by"));
  }
}
