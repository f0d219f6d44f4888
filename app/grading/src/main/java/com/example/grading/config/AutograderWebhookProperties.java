/*
 * どこで: Grading アプリの設定バインド
 * 何を: Webhook 受信の共有シークレットと処理予算を保持する
 * なぜ: 秘密情報とタイムアウトをコードから外部化するため
 */
package com.example.grading.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "grading.webhook")
public record AutograderWebhookProperties(
    @NotBlank String secret,
    @NotNull Duration transactionTimeout,
    @Min(1) int errorMessageMaxLength) {

  @Override
  public String toString() {
    // シークレットをログや例外メッセージへ出さない
    return "AutograderWebhookProperties[secret=***, transactionTimeout="
        + transactionTimeout
        + ", errorMessageMaxLength="
        + errorMessageMaxLength
        + "]";
  }
}
