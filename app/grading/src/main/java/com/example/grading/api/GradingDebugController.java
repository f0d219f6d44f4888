/*
 * どこで: Grading デバッグ API
 * 何を: 提出物・失敗 Webhook・通知 outbox の状態を参照する
 * なぜ: 動作確認と障害調査時の可視化のため
 */
package com.example.grading.api;

import com.example.grading.api.response.FailedWebhookSummary;
import com.example.grading.api.response.FailedWebhooksResponse;
import com.example.grading.api.response.NotificationSummary;
import com.example.grading.api.response.SubmissionSummary;
import com.example.grading.model.FailedWebhookStatus;
import com.example.grading.repository.FailedWebhookRepository;
import com.example.grading.repository.NotificationRepository;
import com.example.grading.repository.SubmissionRepository;
import com.example.grading.service.SubmissionNotFoundException;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug/grading")
@RequiredArgsConstructor
@Validated
public class GradingDebugController {

  private final SubmissionRepository submissionRepository;
  private final FailedWebhookRepository failedWebhookRepository;
  private final NotificationRepository notificationRepository;

  @GetMapping("/submissions/{submissionId}")
  public SubmissionSummary submission(@PathVariable("submissionId") long submissionId) {
    return submissionRepository
        .findById(submissionId)
        .map(SubmissionSummary::from)
        .orElseThrow(() -> new SubmissionNotFoundException(submissionId));
  }

  @GetMapping("/failed-webhooks")
  public FailedWebhooksResponse failedWebhooks(
      @RequestParam(name = "status", defaultValue = "PENDING") FailedWebhookStatus status,
      @RequestParam(name = "limit", defaultValue = "50")
          @Min(value = 1, message = "limit must be greater than 0")
          @Max(value = 500, message = "limit must be less than or equal to 500")
          int limit) {
    final List<FailedWebhookSummary> items =
        failedWebhookRepository.findByStatus(status, limit).stream()
            .map(FailedWebhookSummary::from)
            .toList();
    return new FailedWebhooksResponse(status, items);
  }

  @GetMapping("/notifications/{recipientId}")
  public List<NotificationSummary> notifications(@PathVariable("recipientId") String recipientId) {
    return notificationRepository.findByRecipientId(recipientId).stream()
        .map(NotificationSummary::from)
        .toList();
  }
}
