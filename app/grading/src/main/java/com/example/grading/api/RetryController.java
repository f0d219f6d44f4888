/*
 * どこで: Grading 内部 API
 * 何を: 外部スケジューラから再処理バッチを 1 回起動する
 * なぜ: cron 等の外部基盤で再処理の頻度と件数を制御できるようにするため
 */
package com.example.grading.api;

import com.example.grading.config.RetryProperties;
import com.example.grading.model.RetryBatchResult;
import com.example.grading.service.RetryScheduler;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/autograder")
@RequiredArgsConstructor
@Validated
public class RetryController {

  private final RetryScheduler retryScheduler;
  private final RetryProperties retryProperties;

  @PostMapping("/retries")
  public RetryBatchResult runRetries(
      @RequestParam(name = "max_retries", required = false)
          @Min(value = 1, message = "max_retries must be greater than 0")
          @Max(value = 100, message = "max_retries must be less than or equal to 100")
          Integer maxRetries,
      @RequestParam(name = "batch_size", required = false)
          @Min(value = 1, message = "batch_size must be greater than 0")
          @Max(value = 1000, message = "batch_size must be less than or equal to 1000")
          Integer batchSize) {
    // 未指定は設定値を使う
    return retryScheduler.runBatch(
        maxRetries == null ? retryProperties.maxRetries() : maxRetries,
        batchSize == null ? retryProperties.batchSize() : batchSize);
  }
}
