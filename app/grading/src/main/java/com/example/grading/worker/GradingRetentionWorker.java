/*
 * Where: Grading cleanup worker
 * What: Triggers retention cleanup on a schedule
 * Why: Automate deletion without manual intervention
 */
package com.example.grading.worker;

import com.example.grading.service.GradingRetentionService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "grading.retention.enabled", havingValue = "true")
public class GradingRetentionWorker {

  private final GradingRetentionService retentionService;

  @Scheduled(fixedDelayString = "${grading.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
