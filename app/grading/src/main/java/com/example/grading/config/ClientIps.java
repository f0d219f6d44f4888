/*
 * どこで: Grading Web 設定
 * 何を: プロキシ経由を考慮して呼び出し元 IP を解決する
 * なぜ: MDC と失敗 Webhook 記録で同じ IP を使うため
 */
package com.example.grading.config;

import jakarta.servlet.http.HttpServletRequest;

public final class ClientIps {
  private ClientIps() {}

  public static String resolve(HttpServletRequest request) {
    final String xForwardedFor = request.getHeader("X-Forwarded-For");
    if (xForwardedFor == null || xForwardedFor.isBlank()) {
      return request.getRemoteAddr();
    }
    // 先頭が元のクライアント
    final int commaIndex = xForwardedFor.indexOf(',');
    if (commaIndex < 0) {
      return xForwardedFor.trim();
    }
    return xForwardedFor.substring(0, commaIndex).trim();
  }
}
