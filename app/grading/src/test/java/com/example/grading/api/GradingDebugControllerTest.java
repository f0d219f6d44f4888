/*
 * どこで: Grading デバッグ API のテスト
 * 何を: 提出物・失敗 Webhook・通知の参照応答を検証する
 * なぜ: 障害調査時に生ペイロードを露出しないことを含め、参照形式を固定するため
 */
package com.example.grading.api;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.grading.model.FailedWebhookRecord;
import com.example.grading.model.FailedWebhookStatus;
import com.example.grading.model.SubmissionRecord;
import com.example.grading.model.SubmissionStatus;
import com.example.grading.model.WebhookErrorKind;
import com.example.grading.repository.FailedWebhookRepository;
import com.example.grading.repository.NotificationRepository;
import com.example.grading.repository.SubmissionRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest({GradingDebugController.class, StatusController.class})
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class GradingDebugControllerTest {

  private static final Instant NOW = Instant.parse("2026-01-17T00:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private SubmissionRepository submissionRepository;
  @MockitoBean private FailedWebhookRepository failedWebhookRepository;
  @MockitoBean private NotificationRepository notificationRepository;

  @Test
  void submissionReturnsGradeState() throws Exception {
    when(submissionRepository.findById(42L))
        .thenReturn(
            Optional.of(
                new SubmissionRecord(
                    42L,
                    "student-42",
                    88,
                    new BigDecimal("100.00"),
                    "Good",
                    SubmissionStatus.GRADED,
                    NOW,
                    NOW,
                    NOW)));

    mockMvc
        .perform(get("/debug/grading/submissions/42"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("GRADED"))
        .andExpect(jsonPath("$.score").value(88))
        .andExpect(jsonPath("$.student_id").value("student-42"));
  }

  @Test
  void unknownSubmissionReturns404() throws Exception {
    when(submissionRepository.findById(7L)).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/debug/grading/submissions/7"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("SUBMISSION_NOT_FOUND"));
  }

  @Test
  void failedWebhooksOmitRawPayload() throws Exception {
    final UUID id = UUID.randomUUID();
    when(failedWebhookRepository.findByStatus(FailedWebhookStatus.FAILED, 10))
        .thenReturn(
            List.of(
                new FailedWebhookRecord(
                    id,
                    42L,
                    "{\"secret\":\"payload\"}",
                    WebhookErrorKind.NOT_FOUND,
                    "submission 42 not found",
                    "10.0.0.1",
                    FailedWebhookStatus.FAILED,
                    0,
                    null,
                    null,
                    null,
                    NOW,
                    NOW)));

    mockMvc
        .perform(
            get("/debug/grading/failed-webhooks").param("status", "FAILED").param("limit", "10"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("FAILED"))
        .andExpect(jsonPath("$.items[0].id").value(id.toString()))
        .andExpect(jsonPath("$.items[0].error_kind").value("NOT_FOUND"))
        .andExpect(jsonPath("$.items[0].raw_payload").doesNotExist());
  }

  @Test
  void failedWebhooksDefaultToPending() throws Exception {
    when(failedWebhookRepository.findByStatus(FailedWebhookStatus.PENDING, 50))
        .thenReturn(List.of());

    mockMvc.perform(get("/debug/grading/failed-webhooks")).andExpect(status().isOk());

    verify(failedWebhookRepository).findByStatus(FailedWebhookStatus.PENDING, 50);
  }

  @Test
  void notificationsAreListedByRecipient() throws Exception {
    when(notificationRepository.findByRecipientId("student-42")).thenReturn(List.of());

    mockMvc
        .perform(get("/debug/grading/notifications/student-42"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(0));
  }

  @Test
  void rootReturnsStatusText() throws Exception {
    mockMvc
        .perform(get("/"))
        .andExpect(status().isOk())
        .andExpect(content().string("grading: ok"));
  }
}
