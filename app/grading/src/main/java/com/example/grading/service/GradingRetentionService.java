/*
 * Where: Grading service layer
 * What: Applies retention policy for failed_webhooks and notifications
 * Why: Prevent unbounded growth while keeping the audit trail and anomalous pending records
 */
package com.example.grading.service;

import com.example.grading.config.GradingRetentionProperties;
import com.example.grading.repository.FailedWebhookRepository;
import com.example.grading.repository.NotificationRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class GradingRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(GradingRetentionService.class);

  private final FailedWebhookRepository failedWebhookRepository;
  private final NotificationRepository notificationRepository;
  private final GradingRetentionProperties properties;
  private final Clock clock;

  // grading_audit is append-only and never touched here
  public void cleanup() {
    final Instant threshold = Instant.now(clock).minus(Duration.ofDays(properties.retentionDays()));
    final int staleActiveCount = failedWebhookRepository.countStaleActive(threshold);
    if (staleActiveCount > 0) {
      logger.error(
          "grading retention found stale active failed webhooks count={} threshold={}",
          staleActiveCount,
          threshold);
    }
    final int deletedFailedWebhooks = failedWebhookRepository.deleteTerminalOlderThan(threshold);
    final int deletedNotifications = notificationRepository.deleteSentOrFailedOlderThan(threshold);
    logger.info(
        "grading retention cleanup deleted failedWebhooks={} notifications={} threshold={}",
        deletedFailedWebhooks,
        deletedNotifications,
        threshold);
  }
}
