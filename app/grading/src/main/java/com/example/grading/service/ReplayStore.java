/*
 * どこで: Grading サービス層
 * 何を: TTL 付きキーの原子的な登録を抽象化する
 * なぜ: リプレイ判定をプロセス共有の可変状態に依存させず、保存先を差し替え可能にするため
 */
package com.example.grading.service;

import java.time.Duration;

public interface ReplayStore {

  /**
   * キーが存在しなければ ttl 付きで登録する。
   *
   * <p>判定と登録は 1 回の原子的操作で行うこと。既に存在した場合は false。
   */
  boolean putIfAbsent(String key, Duration ttl);
}
