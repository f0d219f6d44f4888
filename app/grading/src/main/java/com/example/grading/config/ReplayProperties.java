/*
 * どこで: Grading アプリの設定バインド
 * 何を: リプレイ判定の保存先と受理ウィンドウを保持する
 * なぜ: 環境ごとに Redis / プロセス内ストアを切り替えるため
 */
package com.example.grading.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "grading.replay")
public record ReplayProperties(
    String store,
    Duration window,
    String keyPrefix,
    Duration sweepInterval) {}
