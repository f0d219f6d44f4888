/*
 * どこで: Grading サービス層
 * 何を: 通知を notifications outbox に PENDING で登録する
 * なぜ: 送信 IO を Webhook 応答から外し、配信ワーカーで再送できるようにするため
 */
package com.example.grading.service;

import com.example.grading.model.NotificationRecord;
import com.example.grading.model.NotificationStatus;
import com.example.grading.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class OutboxNotificationService implements NotificationService {

  private final NotificationRepository notificationRepository;
  private final Clock clock;

  @Override
  public UUID enqueue(String recipientId, String subject, String body, Long submissionId) {
    final Instant now = Instant.now(clock);
    return notificationRepository.insert(
        new NotificationRecord(
            UUID.randomUUID(),
            submissionId,
            recipientId,
            subject,
            body,
            NotificationStatus.PENDING,
            null,
            null,
            null,
            0,
            now,
            now,
            null));
  }
}
