/*
 * どこで: Dispatch エンジンのエラー定義
 * 何を: 呼び出し側へ返すエラー種別を列挙する
 * なぜ: 例外型に依存せず API 層が応答コードへ写像できるようにするため
 */
package com.fieldservice.dispatch.exception;

public enum DispatchErrorCode {
  BAD_REQUEST("bad_request"),
  NOT_FOUND("not_found"),
  FORBIDDEN("forbidden"),
  INVALID_TRANSITION("invalid_transition"),
  ALREADY_ASSIGNED("already_assigned");

  private final String metricTag;

  DispatchErrorCode(String metricTag) {
    this.metricTag = metricTag;
  }

  public String metricTag() {
    return metricTag;
  }
}
