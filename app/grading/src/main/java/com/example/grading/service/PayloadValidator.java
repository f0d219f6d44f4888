/*
 * どこで: Grading サービス層
 * 何を: 採点 Webhook ペイロードの構造と数値範囲を検証する
 * なぜ: 不正値を採点書き込み前にすべて洗い出し、違反を一括で返すため
 */
package com.example.grading.service;

import com.example.grading.model.FieldViolation;
import com.example.grading.model.ValidationOutcome;
import com.example.grading.model.WebhookEvent;
import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class PayloadValidator {

  public static final BigDecimal MAX_SCORE_CEILING = new BigDecimal("10000");

  static final String FIELD_SUBMISSION_ID = "submission_id";
  static final String FIELD_SCORE = "score";
  static final String FIELD_MAX_SCORE = "max_score";
  static final String FIELD_FEEDBACK = "feedback";
  static final String FIELD_TIMESTAMP = "timestamp";

  // 副作用なし。違反は 1 件目で止めずにすべて集める
  public ValidationOutcome validate(JsonNode payload) {
    final List<FieldViolation> violations = new ArrayList<>();
    if (payload == null || !payload.isObject()) {
      violations.add(new FieldViolation("body", "must be a JSON object"));
      return ValidationOutcome.invalid(violations);
    }

    final Long submissionId = readSubmissionId(payload, violations);
    final Instant timestamp = readTimestamp(payload, violations);
    final BigDecimal score = readNumber(payload, FIELD_SCORE, true, violations);
    final BigDecimal maxScore = readNumber(payload, FIELD_MAX_SCORE, false, violations);
    final String feedback = readFeedback(payload, violations);

    if (score != null && score.signum() < 0) {
      violations.add(new FieldViolation(FIELD_SCORE, "must be greater than or equal to 0"));
    }
    if (maxScore != null) {
      if (maxScore.signum() <= 0) {
        violations.add(new FieldViolation(FIELD_MAX_SCORE, "must be greater than 0"));
      } else if (maxScore.compareTo(MAX_SCORE_CEILING) > 0) {
        violations.add(
            new FieldViolation(FIELD_MAX_SCORE, "must be less than or equal to 10000"));
      }
    }
    if (score != null && maxScore != null && score.compareTo(maxScore) > 0) {
      violations.add(new FieldViolation(FIELD_SCORE, "must not exceed max_score"));
    }

    if (!violations.isEmpty()) {
      return ValidationOutcome.invalid(violations);
    }
    return ValidationOutcome.valid(
        new WebhookEvent(submissionId, score, maxScore, feedback, timestamp));
  }

  // 検証前でも監査/失敗記録に紐付けられるよう、取れる範囲で submission_id を取り出す
  public Long peekSubmissionId(JsonNode payload) {
    if (payload == null || !payload.isObject()) {
      return null;
    }
    final JsonNode node = payload.get(FIELD_SUBMISSION_ID);
    if (node != null && node.isIntegralNumber() && node.canConvertToLong()) {
      return node.longValue();
    }
    return null;
  }

  private Long readSubmissionId(JsonNode payload, List<FieldViolation> violations) {
    final JsonNode node = payload.get(FIELD_SUBMISSION_ID);
    if (isMissing(node)) {
      violations.add(new FieldViolation(FIELD_SUBMISSION_ID, "is required"));
      return null;
    }
    if (!node.isIntegralNumber() || !node.canConvertToLong() || node.longValue() <= 0) {
      violations.add(new FieldViolation(FIELD_SUBMISSION_ID, "must be a positive integer"));
      return null;
    }
    return node.longValue();
  }

  private Instant readTimestamp(JsonNode payload, List<FieldViolation> violations) {
    final JsonNode node = payload.get(FIELD_TIMESTAMP);
    if (isMissing(node)) {
      violations.add(new FieldViolation(FIELD_TIMESTAMP, "is required"));
      return null;
    }
    if (!node.isTextual()) {
      violations.add(new FieldViolation(FIELD_TIMESTAMP, "must be an ISO-8601 string"));
      return null;
    }
    try {
      return parseTimestamp(node.textValue());
    } catch (DateTimeParseException ex) {
      violations.add(new FieldViolation(FIELD_TIMESTAMP, "must be an ISO-8601 string"));
      return null;
    }
  }

  // オフセットなしの表記は UTC とみなす
  static Instant parseTimestamp(String text) {
    final TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parse(text.trim());
    if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
      return OffsetDateTime.from(parsed).toInstant();
    }
    return LocalDateTime.from(parsed).toInstant(ZoneOffset.UTC);
  }

  private BigDecimal readNumber(
      JsonNode payload, String field, boolean required, List<FieldViolation> violations) {
    final JsonNode node = payload.get(field);
    if (isMissing(node)) {
      if (required) {
        violations.add(new FieldViolation(field, "is required"));
      }
      return null;
    }
    if (node.isNumber()) {
      if ((node.isDouble() || node.isFloat()) && !Double.isFinite(node.doubleValue())) {
        violations.add(new FieldViolation(field, "must be numeric"));
        return null;
      }
      return node.decimalValue();
    }
    if (node.isTextual()) {
      try {
        return new BigDecimal(node.textValue().trim());
      } catch (NumberFormatException ex) {
        violations.add(new FieldViolation(field, "must be numeric"));
        return null;
      }
    }
    violations.add(new FieldViolation(field, "must be numeric"));
    return null;
  }

  private String readFeedback(JsonNode payload, List<FieldViolation> violations) {
    final JsonNode node = payload.get(FIELD_FEEDBACK);
    if (isMissing(node)) {
      return null;
    }
    if (!node.isTextual()) {
      violations.add(new FieldViolation(FIELD_FEEDBACK, "must be a string"));
      return null;
    }
    return node.textValue();
  }

  private boolean isMissing(JsonNode node) {
    return node == null || node.isNull() || node.isMissingNode();
  }
}
