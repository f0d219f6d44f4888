/*
 * どこで: Grading データアクセス
 * 何を: submissions テーブルの取得/行ロック/採点更新を担う
 * なぜ: 採点書き込みを 1 行ロック下の単一 UPDATE に閉じ込めるため
 */
package com.example.grading.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.grading.model.SubmissionRecord;
import com.example.grading.model.SubmissionStatus;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class SubmissionRepository {

  private static final String COLUMNS =
      """
      submission_id, student_id, score, max_score, feedback, status,
      graded_at, submitted_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(SubmissionRecord record) {
    final String sql =
        """
        INSERT INTO submissions (
          submission_id, student_id, score, max_score, feedback, status,
          graded_at, submitted_at, updated_at
        ) VALUES (
          :submissionId, :studentId, :score, :maxScore, :feedback, :status,
          :gradedAt, :submittedAt, :updatedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("submissionId", record.submissionId())
            .addValue("studentId", record.studentId())
            .addValue("score", record.score())
            .addValue("maxScore", record.maxScore())
            .addValue("feedback", record.feedback())
            .addValue("status", record.status().name())
            .addValue("gradedAt", toTimestamp(record.gradedAt()))
            .addValue("submittedAt", toTimestamp(record.submittedAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    jdbcTemplate.update(sql, params);
  }

  public Optional<SubmissionRecord> findById(long submissionId) {
    final String sql = "SELECT " + COLUMNS + " FROM submissions WHERE submission_id = :submissionId";
    return querySingle(sql, submissionId);
  }

  // 呼び出し側のトランザクション終了まで行ロックを保持する
  public Optional<SubmissionRecord> findByIdForUpdate(long submissionId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM submissions WHERE submission_id = :submissionId FOR UPDATE";
    return querySingle(sql, submissionId);
  }

  public int applyGrade(
      long submissionId, int score, BigDecimal maxScore, String feedback, Instant gradedAt) {
    final String sql =
        """
        UPDATE submissions
        SET score = :score,
            max_score = :maxScore,
            feedback = :feedback,
            status = 'GRADED',
            graded_at = :gradedAt,
            updated_at = :gradedAt
        WHERE submission_id = :submissionId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("score", score)
            .addValue("maxScore", maxScore)
            .addValue("feedback", feedback)
            .addValue("gradedAt", toTimestamp(gradedAt))
            .addValue("submissionId", submissionId);
    return jdbcTemplate.update(sql, params);
  }

  private Optional<SubmissionRecord> querySingle(String sql, long submissionId) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("submissionId", submissionId);
    final List<SubmissionRecord> rows = jdbcTemplate.query(sql, params, this::mapRow);
    return rows.stream().findFirst();
  }

  private SubmissionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    // getInt は NULL を 0 で返すため wasNull で区別する
    final int rawScore = rs.getInt("score");
    final Integer score = rs.wasNull() ? null : rawScore;
    return new SubmissionRecord(
        rs.getLong("submission_id"),
        rs.getString("student_id"),
        score,
        rs.getBigDecimal("max_score"),
        rs.getString("feedback"),
        SubmissionStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("graded_at")),
        toInstant(rs.getTimestamp("submitted_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
