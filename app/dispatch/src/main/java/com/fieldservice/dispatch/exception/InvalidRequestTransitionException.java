package com.fieldservice.dispatch.exception;

import com.fieldservice.dispatch.model.RequestStatus;

public class InvalidRequestTransitionException extends DispatchException {

  public InvalidRequestTransitionException(String message) {
    super(DispatchErrorCode.INVALID_TRANSITION, message);
  }

  public InvalidRequestTransitionException(String requestId, String transition, RequestStatus status) {
    this("cannot " + transition + " request " + requestId + " in status " + status.name());
  }
}
