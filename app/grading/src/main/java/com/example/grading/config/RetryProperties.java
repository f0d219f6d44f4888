/*
 * どこで: Grading アプリの設定バインド
 * 何を: 失敗 Webhook 再処理のポーリング/上限/lease 設定を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.example.grading.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "grading.retry")
public record RetryProperties(
    boolean enabled,
    Duration pollInterval,
    int maxRetries,
    int batchSize,
    Duration lease) {}
