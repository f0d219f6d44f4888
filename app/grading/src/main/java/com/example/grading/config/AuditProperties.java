/*
 * どこで: Grading アプリの設定バインド
 * 何を: 監査ログの記録者名を保持する
 * なぜ: 複数の受信経路を created_by で区別できるようにするため
 */
package com.example.grading.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "grading.audit")
public record AuditProperties(String actor) {}
