/*
 * どこで: Dispatch エンジンのエラー定義
 * 何を: accept の取り合いに負けたことを表す
 * なぜ: 呼び出し側が汎用エラーと区別して一覧を再取得できるようにするため
 */
package com.fieldservice.dispatch.exception;

public class RequestAlreadyAssignedException extends DispatchException {

  public RequestAlreadyAssignedException(String requestId) {
    super(DispatchErrorCode.ALREADY_ASSIGNED, "request already assigned: " + requestId);
  }
}
