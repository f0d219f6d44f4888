/*
 * どこで: Grading サービス補助
 * 何を: 受信した生バイト列の HMAC-SHA256 署名を検証する
 * なぜ: 再シリアライズではバイト配置が変わりうるため、受信したままの本文で認証するため
 */
package com.example.grading.service;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SignatureVerifier {

  private static final Logger logger = LoggerFactory.getLogger(SignatureVerifier.class);
  static final String ALGORITHM = "HmacSHA256";
  private static final String PREFIX = "sha256=";
  private static final int SIGNATURE_BYTES = 32;

  // 不一致・不正 hex・欠落はすべて false。例外は外へ出さない
  public boolean verify(byte[] rawBody, String signatureHex, String secret) {
    if (rawBody == null || isBlank(signatureHex) || isBlank(secret)) {
      return false;
    }
    final byte[] provided = decode(signatureHex);
    if (provided == null || provided.length != SIGNATURE_BYTES) {
      return false;
    }
    final byte[] expected = sign(rawBody, secret);
    if (expected == null) {
      return false;
    }
    return MessageDigest.isEqual(expected, provided);
  }

  public String signHex(byte[] rawBody, String secret) {
    final byte[] signature = sign(rawBody, secret);
    if (signature == null) {
      throw new IllegalStateException(ALGORITHM + " is not available");
    }
    return HexFormat.of().formatHex(signature);
  }

  private byte[] sign(byte[] rawBody, String secret) {
    try {
      final Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
      return mac.doFinal(rawBody);
    } catch (GeneralSecurityException ex) {
      logger.error("webhook signature computation failed algorithm={}", ALGORITHM, ex);
      return null;
    }
  }

  private byte[] decode(String signatureHex) {
    String normalized = signatureHex.trim().toLowerCase(Locale.ROOT);
    if (normalized.startsWith(PREFIX)) {
      normalized = normalized.substring(PREFIX.length());
    }
    try {
      return HexFormat.of().parseHex(normalized);
    } catch (IllegalArgumentException ex) {
      return null;
    }
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
