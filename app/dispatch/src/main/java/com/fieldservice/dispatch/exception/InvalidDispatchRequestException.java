package com.fieldservice.dispatch.exception;

public class InvalidDispatchRequestException extends DispatchException {

  public InvalidDispatchRequestException(String message) {
    super(DispatchErrorCode.BAD_REQUEST, message);
  }
}
