package com.fieldservice.dispatch.exception;

public class RequestNotFoundException extends DispatchException {

  public RequestNotFoundException(String requestId) {
    super(DispatchErrorCode.NOT_FOUND, "request not found: " + requestId);
  }
}
