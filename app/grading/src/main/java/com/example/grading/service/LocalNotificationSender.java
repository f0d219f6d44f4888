/*
 * どこで: Grading サービス層
 * 何を: 採点通知の送信を模擬する実装
 * なぜ: メール/プッシュ基盤なしで outbox の状態遷移を確認するため
 */
package com.example.grading.service;

import com.example.grading.model.NotificationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalNotificationSender implements NotificationSender {

    private static final Logger logger = LoggerFactory.getLogger(LocalNotificationSender.class);

    @Override
    public void send(NotificationRecord record) {
        // 本文には成績が含まれるためログへは出さない
        logger.info("grade notification simulated send id={} recipient={} submissionId={}",
                record.notificationId(),
                record.recipientId(),
                record.submissionId());
    }
}
