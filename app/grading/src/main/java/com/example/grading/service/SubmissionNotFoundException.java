/*
 * どこで: Grading サービス層
 * 何を: 採点対象の提出物が存在しないことを表す例外
 * なぜ: 存在しない提出物を暗黙に作成せず、404 として扱うため
 */
package com.example.grading.service;

public class SubmissionNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final long submissionId;

  public SubmissionNotFoundException(long submissionId) {
    super("submission not found: " + submissionId);
    this.submissionId = submissionId;
  }

  public long submissionId() {
    return submissionId;
  }
}
