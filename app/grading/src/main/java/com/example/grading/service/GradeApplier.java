/*
 * どこで: Grading サービス層
 * 何を: 提出物の行ロック下で採点結果を書き込む
 * なぜ: 異なるタイムスタンプの採点が並行しても書き込みが混ざらないようにするため
 */
package com.example.grading.service;

import com.example.grading.config.AutograderWebhookProperties;
import com.example.grading.model.FieldViolation;
import com.example.grading.model.GradeResult;
import com.example.grading.model.SubmissionRecord;
import com.example.grading.model.SubmissionStatus;
import com.example.grading.repository.SubmissionRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Component
public class GradeApplier {

  private static final Logger logger = LoggerFactory.getLogger(GradeApplier.class);
  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private final SubmissionRepository submissionRepository;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public GradeApplier(
      SubmissionRepository submissionRepository,
      PlatformTransactionManager transactionManager,
      AutograderWebhookProperties properties,
      Clock clock) {
    this.submissionRepository = submissionRepository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    // パイプライン全体の予算を超えて行ロックを握り続けない
    this.transactionTemplate.setTimeout((int) properties.transactionTimeout().toSeconds());
    this.clock = clock;
  }

  // 冪等性は ReplayGuard 側で担保する。別タイムスタンプの再採点は後勝ち
  public GradeResult apply(long submissionId, BigDecimal score, BigDecimal maxScore, String feedback) {
    return transactionTemplate.execute(
        status -> applyLocked(submissionId, score, maxScore, feedback));
  }

  private GradeResult applyLocked(
      long submissionId, BigDecimal score, BigDecimal maxScore, String feedback) {
    final SubmissionRecord submission =
        submissionRepository
            .findByIdForUpdate(submissionId)
            .orElseThrow(() -> new SubmissionNotFoundException(submissionId));

    final BigDecimal effectiveMax = resolveMaxScore(maxScore, submission);
    final int roundedScore = roundScore(score, effectiveMax);
    final Instant now = Instant.now(clock);
    submissionRepository.applyGrade(submissionId, roundedScore, effectiveMax, feedback, now);

    final BigDecimal percentage = percentage(roundedScore, effectiveMax);
    logger.info(
        "grade applied submissionId={} score={} maxScore={} percentage={} regrade={}",
        submissionId,
        roundedScore,
        effectiveMax,
        percentage,
        submission.status() == SubmissionStatus.GRADED);
    return new GradeResult(
        submissionId, submission.studentId(), roundedScore, effectiveMax, percentage);
  }

  private BigDecimal resolveMaxScore(BigDecimal maxScore, SubmissionRecord submission) {
    final BigDecimal candidate = maxScore != null ? maxScore : submission.maxScore();
    // submissions.max_score は NUMERIC(10, 2)
    final BigDecimal normalized = candidate.setScale(2, RoundingMode.HALF_UP);
    if (normalized.signum() <= 0) {
      throw new ScoreOutOfRangeException(
          new FieldViolation(PayloadValidator.FIELD_MAX_SCORE, "must be greater than 0"));
    }
    return normalized;
  }

  static int roundScore(BigDecimal score, BigDecimal maxScore) {
    if (score.compareTo(maxScore) > 0) {
      throw new ScoreOutOfRangeException(
          new FieldViolation(PayloadValidator.FIELD_SCORE, "must not exceed max_score"));
    }
    final BigDecimal rounded = score.setScale(0, RoundingMode.HALF_UP);
    if (rounded.compareTo(maxScore) > 0) {
      // 例: 99.6 / 99.5 は四捨五入で満点を超えるため満点の整数部に丸める
      return maxScore.setScale(0, RoundingMode.FLOOR).intValueExact();
    }
    return rounded.intValueExact();
  }

  static BigDecimal percentage(int score, BigDecimal maxScore) {
    return BigDecimal.valueOf(score)
        .multiply(HUNDRED)
        .divide(maxScore, 2, RoundingMode.HALF_UP);
  }
}
