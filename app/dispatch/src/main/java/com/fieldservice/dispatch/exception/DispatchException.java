package com.fieldservice.dispatch.exception;

/** エンジンが同期的に返す型付き失敗の基底。内部でリトライはしない。 */
public abstract class DispatchException extends RuntimeException {

  private final DispatchErrorCode errorCode;

  protected DispatchException(DispatchErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  public DispatchErrorCode errorCode() {
    return errorCode;
  }
}
