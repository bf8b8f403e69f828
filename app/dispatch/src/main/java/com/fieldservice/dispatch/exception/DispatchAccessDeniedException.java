/*
 * どこで: Dispatch エンジンのエラー定義
 * 何を: 操作者のロール/所有関係が遷移を許さないことを表す
 * なぜ: 状態不整合 (InvalidTransition) と区別して扱うため
 */
package com.fieldservice.dispatch.exception;

public class DispatchAccessDeniedException extends DispatchException {

  public DispatchAccessDeniedException(String message) {
    super(DispatchErrorCode.FORBIDDEN, message);
  }
}
