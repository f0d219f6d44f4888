/*
 * どこで: Grading サービス層
 * 何を: 採点通知の送信を抽象化する
 * なぜ: 実送信とテスト差し替えを容易にするため
 */
package com.example.grading.service;

import com.example.grading.model.NotificationRecord;

public interface NotificationSender {
    void send(NotificationRecord record);
}
