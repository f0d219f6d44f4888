/*
 * どこで: Grading 通知配信ワーカー
 * 何を: スケジュールで採点通知 outbox の配信処理を起動する
 * なぜ: PENDING 通知を一定間隔で処理するため
 */
package com.example.grading.worker;

import com.example.grading.service.NotificationDeliveryService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "grading.notification.delivery.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class NotificationDeliveryWorker {

  private final NotificationDeliveryService deliveryService;

  @Scheduled(fixedDelayString = "${grading.notification.delivery.poll-interval}")
  public void run() {
    deliveryService.processPendingBatch();
  }
}
