/*
 * どこで: Grading 再処理ワーカー
 * 何を: スケジュールで失敗 Webhook の再処理バッチを起動する
 * なぜ: 外部 cron がない環境でも PENDING を一定間隔で回収するため
 */
package com.example.grading.worker;

import com.example.grading.service.RetryScheduler;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "grading.retry.enabled", havingValue = "true", matchIfMissing = true)
public class RetryWorker {

  private static final Logger logger = LoggerFactory.getLogger(RetryWorker.class);

  private final RetryScheduler retryScheduler;

  @Scheduled(fixedDelayString = "${grading.retry.poll-interval}")
  public void run() {
    try {
      retryScheduler.runBatch();
    } catch (RuntimeException ex) {
      // DB 断などは次回ポーリングで再試行する
      logger.warn("retry worker loop failed", ex);
    }
  }
}
