/*
 * どこで: Grading サービス層
 * 何を: 検証 → リプレイ判定 → 採点 → 通知の共通パイプラインを実行する
 * なぜ: HTTP 受信と再処理ワーカーが同じ入口を通り、結果を型付きで受け取れるようにするため
 */
package com.example.grading.service;

import com.example.grading.model.AuditEventType;
import com.example.grading.model.DeliverySource;
import com.example.grading.model.FieldViolation;
import com.example.grading.model.GradeResult;
import com.example.grading.model.ValidationOutcome;
import com.example.grading.model.WebhookError;
import com.example.grading.model.WebhookErrorKind;
import com.example.grading.model.WebhookEvent;
import com.example.grading.model.WebhookResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

@Service
public class GradeWebhookProcessor {

  private static final Logger logger = LoggerFactory.getLogger(GradeWebhookProcessor.class);

  private final PayloadValidator validator;
  private final ReplayGuard replayGuard;
  private final GradeApplier gradeApplier;
  private final NotificationDispatcher notificationDispatcher;
  private final AuditTrailRecorder auditTrailRecorder;
  private final GradingMetrics metrics;
  private final ObjectReader payloadReader;

  public GradeWebhookProcessor(
      PayloadValidator validator,
      ReplayGuard replayGuard,
      GradeApplier gradeApplier,
      NotificationDispatcher notificationDispatcher,
      AuditTrailRecorder auditTrailRecorder,
      GradingMetrics metrics,
      ObjectMapper objectMapper) {
    this.validator = validator;
    this.replayGuard = replayGuard;
    this.gradeApplier = gradeApplier;
    this.notificationDispatcher = notificationDispatcher;
    this.auditTrailRecorder = auditTrailRecorder;
    this.metrics = metrics;
    // 小数は double を経由させず BigDecimal で読む
    this.payloadReader = objectMapper.reader(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
  }

  // 呼び出し元は署名検証済み(WEBHOOK)か、署名検証済みで保存された記録(RETRY)に限る
  public WebhookResult process(String rawPayload, DeliverySource source, String remoteIp) {
    final JsonNode payload;
    try {
      payload = payloadReader.readTree(rawPayload == null ? "" : rawPayload);
    } catch (JsonProcessingException ex) {
      final WebhookError error =
          WebhookError.of(WebhookErrorKind.MALFORMED, "request body is not valid JSON");
      return fail(null, "parse", error);
    }

    final Long submissionId = validator.peekSubmissionId(payload);
    auditTrailRecorder.record(
        submissionId,
        AuditEventType.RECEIVED,
        details("source", sourceName(source), "remote_ip", remoteIp));

    final ValidationOutcome outcome = validator.validate(payload);
    if (!outcome.isValid()) {
      recordSignatureVerified(submissionId, source);
      return fail(submissionId, "validation", WebhookError.validation(outcome.violations()));
    }
    final WebhookEvent event = outcome.event();

    // 再処理は初回受信時に判定済みのため、リプレイ判定は HTTP 受信時だけ行う
    if (source == DeliverySource.WEBHOOK) {
      final boolean accepted;
      try {
        accepted = replayGuard.acceptOnce(event.submissionId(), event.timestamp());
      } catch (DataAccessException ex) {
        logger.warn(
            "replay check failed by store error submissionId={}", event.submissionId(), ex);
        recordSignatureVerified(event.submissionId(), source);
        return fail(
            event.submissionId(),
            "replay",
            WebhookError.of(WebhookErrorKind.PERSISTENCE, describe(ex)));
      } catch (RuntimeException ex) {
        logger.error("replay check failed unexpectedly submissionId={}", event.submissionId(), ex);
        recordSignatureVerified(event.submissionId(), source);
        return fail(
            event.submissionId(),
            "replay",
            WebhookError.of(WebhookErrorKind.UNEXPECTED, describe(ex)));
      }
      // 重複は RECEIVED だけを残して打ち切る
      if (!accepted) {
        metrics.recordReplayRejected();
        return WebhookResult.failure(
            event.submissionId(),
            WebhookErrorKind.REPLAY,
            "webhook was already processed or is outside the accepted time window");
      }
    }
    recordSignatureVerified(event.submissionId(), source);
    auditTrailRecorder.record(
        event.submissionId(),
        AuditEventType.VALIDATED,
        details(
            "score", event.score(),
            "max_score", event.maxScore(),
            "timestamp", event.timestamp().toString()));

    final GradeResult grade;
    try {
      grade =
          gradeApplier.apply(
              event.submissionId(), event.score(), event.maxScore(), event.feedback());
    } catch (SubmissionNotFoundException ex) {
      return fail(
          event.submissionId(),
          "apply",
          WebhookError.of(WebhookErrorKind.NOT_FOUND, ex.getMessage()));
    } catch (ScoreOutOfRangeException ex) {
      return fail(
          event.submissionId(), "apply", WebhookError.validation(List.of(ex.violation())));
    } catch (DataAccessException | TransactionException ex) {
      logger.warn(
          "grade apply failed by persistence error submissionId={}", event.submissionId(), ex);
      return fail(
          event.submissionId(),
          "apply",
          WebhookError.of(WebhookErrorKind.PERSISTENCE, describe(ex)));
    } catch (RuntimeException ex) {
      logger.error("grade apply failed unexpectedly submissionId={}", event.submissionId(), ex);
      return fail(
          event.submissionId(),
          "apply",
          WebhookError.of(WebhookErrorKind.UNEXPECTED, describe(ex)));
    }
    auditTrailRecorder.record(
        grade.submissionId(),
        AuditEventType.GRADE_APPLIED,
        details(
            "score", grade.score(),
            "max_score", grade.maxScore(),
            "percentage", grade.percentage(),
            "source", sourceName(source)));

    final boolean notified = notificationDispatcher.notify(grade, event.feedback());
    if (notified) {
      auditTrailRecorder.record(
          grade.submissionId(),
          AuditEventType.NOTIFICATION_SENT,
          details("recipient_id", grade.studentId()));
    } else {
      // 採点はコミット済みのため成功として扱い、通知失敗だけを監査に残す
      auditTrailRecorder.record(
          grade.submissionId(),
          AuditEventType.ERROR,
          details("stage", "notification", "kind", "NOTIFICATION_FAILED"));
    }
    return new WebhookResult.Success(grade, notified);
  }

  private void recordSignatureVerified(Long submissionId, DeliverySource source) {
    if (source == DeliverySource.WEBHOOK) {
      auditTrailRecorder.record(
          submissionId,
          AuditEventType.SIGNATURE_VERIFIED,
          details("algorithm", SignatureVerifier.ALGORITHM));
    }
  }

  private WebhookResult fail(Long submissionId, String stage, WebhookError error) {
    final Map<String, Object> errorDetails =
        details("stage", stage, "kind", error.kind().name(), "message", error.message());
    if (!error.violations().isEmpty()) {
      errorDetails.put("violations", error.violations().stream().map(this::toMap).toList());
    }
    auditTrailRecorder.record(submissionId, AuditEventType.ERROR, errorDetails);
    return new WebhookResult.Failure(submissionId, error);
  }

  private Map<String, Object> toMap(FieldViolation violation) {
    return details("field", violation.field(), "reason", violation.reason());
  }

  private String describe(RuntimeException ex) {
    return ex.getClass().getSimpleName() + ": " + ex.getMessage();
  }

  private String sourceName(DeliverySource source) {
    return source.name().toLowerCase(Locale.ROOT);
  }

  // 値に null を許容したいので Map.of は使わない
  private static Map<String, Object> details(Object... keyValues) {
    final Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i + 1 < keyValues.length; i += 2) {
      map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
    }
    return map;
  }
}
