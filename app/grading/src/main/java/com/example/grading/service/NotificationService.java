/*
 * どこで: Grading サービス層
 * 何を: 学生向け通知の投入口を抽象化する
 * なぜ: メール/プッシュ等の配送手段を採点処理から切り離すため
 */
package com.example.grading.service;

import java.util.UUID;

public interface NotificationService {
  UUID enqueue(String recipientId, String subject, String body, Long submissionId);
}
