/*
 * どこで: Grading サービス層
 * 何を: 署名検証を行い、共通パイプラインへ渡し、失敗を記録する
 * なぜ: 認証境界を 1 か所に集約し、署名検証後の失敗を取りこぼさないため
 */
package com.example.grading.service;

import com.example.grading.config.AutograderWebhookProperties;
import com.example.grading.model.DeliverySource;
import com.example.grading.model.WebhookErrorKind;
import com.example.grading.model.WebhookResult;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class WebhookIngestionService {

  private static final Logger logger = LoggerFactory.getLogger(WebhookIngestionService.class);

  private final SignatureVerifier signatureVerifier;
  private final GradeWebhookProcessor processor;
  private final FailedWebhookStore failedWebhookStore;
  private final AutograderWebhookProperties properties;
  private final GradingMetrics metrics;

  public WebhookResult ingest(byte[] rawBody, String signature, String remoteIp) {
    final long startedAt = System.nanoTime();
    try {
      final WebhookResult result = authenticateAndProcess(rawBody, signature, remoteIp);
      metrics.recordWebhookResult(resultTag(result));
      return result;
    } finally {
      metrics.recordWebhookLatency(Duration.ofNanos(System.nanoTime() - startedAt));
    }
  }

  private WebhookResult authenticateAndProcess(byte[] rawBody, String signature, String remoteIp) {
    if (signature == null || signature.isBlank()) {
      // 未認証の本文はパースしない
      logger.warn("webhook rejected: signature header missing remoteIp={}", remoteIp);
      return WebhookResult.failure(
          null, WebhookErrorKind.SIGNATURE, "X-Autograder-Signature is required");
    }
    if (!signatureVerifier.verify(rawBody, signature, properties.secret())) {
      logger.warn(
          "webhook rejected: signature mismatch remoteIp={} bodyLength={}",
          remoteIp,
          rawBody == null ? 0 : rawBody.length);
      return WebhookResult.failure(null, WebhookErrorKind.SIGNATURE, "signature is invalid");
    }

    final String rawPayload = new String(rawBody, StandardCharsets.UTF_8);
    final WebhookResult result = processor.process(rawPayload, DeliverySource.WEBHOOK, remoteIp);
    if (result instanceof WebhookResult.Failure failure
        && failure.error().kind() != WebhookErrorKind.REPLAY) {
      failedWebhookStore.recordFailure(rawPayload, failure.submissionId(), failure.error(), remoteIp);
    }
    return result;
  }

  private String resultTag(WebhookResult result) {
    if (result instanceof WebhookResult.Failure failure) {
      return failure.error().kind().name().toLowerCase(Locale.ROOT);
    }
    return "success";
  }
}
