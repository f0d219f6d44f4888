/*
 * どこで: Grading サービス層
 * 何を: Webhook 処理結果/リプレイ拒否/再処理/通知配信のアプリ固有メトリクスを記録する
 * なぜ: 受信失敗や再処理滞留を Prometheus から直接観測できるようにするため
 */
package com.example.grading.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class GradingMetrics {

  private static final String METRIC_WEBHOOK_TOTAL = "grading.webhook.total";
  private static final String METRIC_WEBHOOK_LATENCY = "grading.webhook.latency";
  private static final String METRIC_REPLAY_REJECTED_TOTAL = "grading.replay.rejected.total";
  private static final String METRIC_RETRY_TOTAL = "grading.retry.total";
  private static final String METRIC_FAILED_WEBHOOK_PENDING = "grading.failed_webhook.pending";
  private static final String METRIC_NOTIFICATION_DELIVERY_TOTAL =
      "grading.notification.delivery.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger failedWebhookPending = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter replayRejectedCounter;
  private final Timer webhookLatencyTimer;

  public GradingMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_FAILED_WEBHOOK_PENDING, failedWebhookPending, AtomicInteger::get)
        .description("Current number of failed webhooks waiting for retry")
        .register(meterRegistry);
    this.replayRejectedCounter =
        Counter.builder(METRIC_REPLAY_REJECTED_TOTAL)
            .description("Total number of webhooks rejected as stale or duplicate")
            .register(meterRegistry);
    this.webhookLatencyTimer =
        Timer.builder(METRIC_WEBHOOK_LATENCY)
            .description("Webhook processing latency from receipt to response")
            .register(meterRegistry);
  }

  public void recordWebhookResult(String result) {
    increment(METRIC_WEBHOOK_TOTAL, "Autograder webhook outcomes", result);
  }

  public void recordWebhookLatency(Duration latency) {
    if (latency == null || latency.isNegative()) {
      return;
    }
    webhookLatencyTimer.record(latency);
  }

  public void recordReplayRejected() {
    replayRejectedCounter.increment();
  }

  public void recordRetryResult(String result) {
    increment(METRIC_RETRY_TOTAL, "Failed webhook retry outcomes", result);
  }

  public void recordNotificationDelivery(String result) {
    increment(METRIC_NOTIFICATION_DELIVERY_TOTAL, "Grade notification delivery outcomes", result);
  }

  public void updateFailedWebhookPending(int pendingCount) {
    failedWebhookPending.set(Math.max(pendingCount, 0));
  }

  private void increment(String name, String description, String result) {
    counters
        .computeIfAbsent(
            name + "|" + result,
            ignored ->
                Counter.builder(name)
                    .description(description)
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }
}
