/*
 * どこで: Grading 設定バインドのテスト
 * 何を: Duration/数値設定のバインドと Webhook シークレット必須チェックを検証する
 * なぜ: 設定ミスを起動時に検出し、シークレットがログへ出ないことを保証するため
 */
package com.example.grading.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class GradingPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
          .withUserConfiguration(TestConfiguration.class)
          .withPropertyValues(
              "grading.webhook.transaction-timeout=30s",
              "grading.webhook.error-message-max-length=1000",
              "grading.replay.store=memory",
              "grading.replay.window=300s",
              "grading.replay.key-prefix=grading:replay:",
              "grading.replay.sweep-interval=60s",
              "grading.retry.enabled=true",
              "grading.retry.poll-interval=5m",
              "grading.retry.max-retries=3",
              "grading.retry.batch-size=100",
              "grading.retry.lease=5m",
              "grading.notification.feedback-preview-length=200",
              "grading.notification.delivery.enabled=true",
              "grading.notification.delivery.poll-interval=5s",
              "grading.notification.delivery.batch-size=50",
              "grading.notification.delivery.max-attempts=10",
              "grading.notification.delivery.backoff-base=1s",
              "grading.notification.delivery.backoff-max=60s",
              "grading.notification.delivery.backoff-exponent-base=2.0",
              "grading.notification.delivery.backoff-jitter-min=0.5",
              "grading.notification.delivery.backoff-jitter-max=1.5",
              "grading.notification.delivery.backoff-min=1s",
              "grading.notification.delivery.lease=30s",
              "grading.retention.enabled=true",
              "grading.retention.retention-days=30",
              "grading.retention.cleanup-interval=1h",
              "grading.audit.actor=autograder-webhook");

  @Test
  void contextStartsAndBindsDurationFields() {
    contextRunner
        .withPropertyValues("grading.webhook.secret=s3cr3t")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final AutograderWebhookProperties webhook =
                  context.getBean(AutograderWebhookProperties.class);
              final ReplayProperties replay = context.getBean(ReplayProperties.class);
              final RetryProperties retry = context.getBean(RetryProperties.class);
              final NotificationDeliveryProperties delivery =
                  context.getBean(NotificationDeliveryProperties.class);
              final GradingRetentionProperties retention =
                  context.getBean(GradingRetentionProperties.class);

              assertThat(webhook.secret()).isEqualTo("s3cr3t");
              assertThat(webhook.toString()).doesNotContain("s3cr3t");
              assertThat(webhook.transactionTimeout()).isEqualTo(Duration.ofSeconds(30));
              assertThat(replay.window()).isEqualTo(Duration.ofMinutes(5));
              assertThat(retry.pollInterval()).isEqualTo(Duration.ofMinutes(5));
              assertThat(retry.maxRetries()).isEqualTo(3);
              assertThat(delivery.backoffMax()).isEqualTo(Duration.ofSeconds(60));
              assertThat(delivery.lease()).isEqualTo(Duration.ofSeconds(30));
              assertThat(retention.cleanupInterval()).isEqualTo(Duration.ofHours(1));
              assertThat(context.getBean(NotificationProperties.class).feedbackPreviewLength())
                  .isEqualTo(200);
              assertThat(context.getBean(AuditProperties.class).actor())
                  .isEqualTo("autograder-webhook");
            });
  }

  @Test
  void contextFailsWhenWebhookSecretIsMissing() {
    contextRunner.run(context -> assertThat(context).hasFailed());
  }

  @Configuration
  @EnableConfigurationProperties({
    AutograderWebhookProperties.class,
    ReplayProperties.class,
    RetryProperties.class,
    NotificationProperties.class,
    NotificationDeliveryProperties.class,
    GradingRetentionProperties.class,
    AuditProperties.class
  })
  static class TestConfiguration {
    // ApplicationContextRunner 用の最小構成
  }
}
