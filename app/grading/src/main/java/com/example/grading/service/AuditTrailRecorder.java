/*
 * どこで: Grading サービス層
 * 何を: パイプラインの各段階を grading_audit へ追記する
 * なぜ: 採点結果の経緯を後から追跡できるようにするため。監査は診断用であり本処理を止めない
 */
package com.example.grading.service;

import com.example.grading.config.AuditProperties;
import com.example.grading.model.AuditEntry;
import com.example.grading.model.AuditEventType;
import com.example.grading.repository.GradingAuditRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AuditTrailRecorder {

  private static final Logger logger = LoggerFactory.getLogger(AuditTrailRecorder.class);
  private static final String DEFAULT_ACTOR = "autograder-webhook";

  private final GradingAuditRepository auditRepository;
  private final ObjectMapper objectMapper;
  private final AuditProperties properties;
  private final Clock clock;

  public void record(Long submissionId, AuditEventType eventType, Map<String, Object> details) {
    try {
      final Map<String, Object> safeDetails =
          details == null ? Map.of() : new LinkedHashMap<>(details);
      auditRepository.insert(
          UUID.randomUUID(),
          submissionId,
          eventType,
          objectMapper.writeValueAsString(safeDetails),
          Instant.now(clock),
          actor());
    } catch (JsonProcessingException | RuntimeException ex) {
      // 監査の失敗で Webhook 処理を失敗させない
      logger.warn(
          "audit record failed submissionId={} eventType={}", submissionId, eventType, ex);
    }
  }

  public List<AuditEntry> findBySubmissionId(long submissionId) {
    return auditRepository.findBySubmissionId(submissionId);
  }

  private String actor() {
    final String actor = properties.actor();
    return actor == null || actor.isBlank() ? DEFAULT_ACTOR : actor;
  }
}
