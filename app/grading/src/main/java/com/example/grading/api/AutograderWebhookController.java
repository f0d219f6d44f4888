/*
 * どこで: Grading API
 * 何を: 採点 Webhook の受信と監査ログ参照を提供する
 * なぜ: 外部採点サービスからの非同期結果を HTTP で受け付けるため
 */
package com.example.grading.api;

import com.example.grading.api.response.AuditEntryResponse;
import com.example.grading.api.response.AuditTrailResponse;
import com.example.grading.api.response.WebhookResponse;
import com.example.grading.config.ClientIps;
import com.example.grading.model.AuditEntry;
import com.example.grading.model.WebhookError;
import com.example.grading.model.WebhookResult;
import com.example.grading.service.AuditTrailRecorder;
import com.example.grading.service.WebhookIngestionService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.constraints.Positive;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/webhooks/autograder")
@RequiredArgsConstructor
@Validated
public class AutograderWebhookController {

  static final String SIGNATURE_HEADER = "X-Autograder-Signature";
  private static final String INTERNAL_ERROR_MESSAGE = "webhook could not be processed";

  private final WebhookIngestionService ingestionService;
  private final AuditTrailRecorder auditTrailRecorder;
  private final ObjectMapper objectMapper;

  // 署名は受信したままのバイト列で検証するため、本文は byte[] で受ける
  @PostMapping({"", "/"})
  public ResponseEntity<?> receive(
      @RequestHeader(name = SIGNATURE_HEADER, required = false) String signature,
      @RequestBody(required = false) byte[] body,
      HttpServletRequest request) {
    final WebhookResult result =
        ingestionService.ingest(
            body == null ? new byte[0] : body, signature, ClientIps.resolve(request));
    if (result instanceof WebhookResult.Success success) {
      return ResponseEntity.ok(WebhookResponse.applied(success.grade()));
    }
    return toErrorResponse(((WebhookResult.Failure) result).error());
  }

  @GetMapping("/audit/{submissionId}")
  public AuditTrailResponse audit(
      @PathVariable("submissionId") @Positive(message = "submissionId must be positive")
          long submissionId) {
    final List<AuditEntryResponse> entries =
        auditTrailRecorder.findBySubmissionId(submissionId).stream()
            .map(this::toResponse)
            .toList();
    return new AuditTrailResponse(submissionId, entries);
  }

  private ResponseEntity<ApiErrorResponse> toErrorResponse(WebhookError error) {
    return switch (error.kind()) {
      case SIGNATURE -> ResponseEntity.status(HttpStatus.UNAUTHORIZED)
          .body(new ApiErrorResponse(ApiErrorCode.SIGNATURE_INVALID, error.message()));
      case MALFORMED -> ResponseEntity.status(HttpStatus.BAD_REQUEST)
          .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, error.message()));
      case REPLAY -> ResponseEntity.status(HttpStatus.BAD_REQUEST)
          .body(new ApiErrorResponse(ApiErrorCode.REPLAY_REJECTED, error.message()));
      case VALIDATION -> ResponseEntity.status(HttpStatus.BAD_REQUEST)
          .body(
              new ApiErrorResponse(
                  ApiErrorCode.VALIDATION_FAILED, error.message(), error.violations()));
      case NOT_FOUND -> ResponseEntity.status(HttpStatus.NOT_FOUND)
          .body(new ApiErrorResponse(ApiErrorCode.SUBMISSION_NOT_FOUND, error.message()));
      // 再処理の有無や内部エラーの詳細は送信側へ返さない
      case PERSISTENCE, UNEXPECTED -> ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
          .body(new ApiErrorResponse(ApiErrorCode.PROCESSING_FAILED, INTERNAL_ERROR_MESSAGE));
    };
  }

  private AuditEntryResponse toResponse(AuditEntry entry) {
    try {
      final JsonNode details = objectMapper.readTree(entry.detailsJson());
      return new AuditEntryResponse(
          entry.auditId(), entry.eventType(), details, entry.createdAt(), entry.createdBy());
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("audit details parse failure id=" + entry.auditId(), ex);
    }
  }
}
