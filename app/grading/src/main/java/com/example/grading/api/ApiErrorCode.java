/*
 * どこで: Grading API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.grading.api;

public enum ApiErrorCode {
    BAD_REQUEST,
    SIGNATURE_INVALID,
    VALIDATION_FAILED,
    REPLAY_REJECTED,
    SUBMISSION_NOT_FOUND,
    PROCESSING_FAILED
}
