/*
 * どこで: Grading サービス層
 * 何を: 提出物側の満点と突き合わせた結果、点数が範囲外であることを表す例外
 * なぜ: max_score 省略時の範囲判定は DB の値が必要で、ペイロード検証だけでは完結しないため
 */
package com.example.grading.service;

import com.example.grading.model.FieldViolation;

public class ScoreOutOfRangeException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final transient FieldViolation violation;

  public ScoreOutOfRangeException(FieldViolation violation) {
    super(violation.toString());
    this.violation = violation;
  }

  public FieldViolation violation() {
    return violation;
  }
}
