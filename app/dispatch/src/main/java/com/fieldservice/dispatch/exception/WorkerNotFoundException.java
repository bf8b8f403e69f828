package com.fieldservice.dispatch.exception;

public class WorkerNotFoundException extends DispatchException {

  public WorkerNotFoundException(String workerId) {
    super(DispatchErrorCode.NOT_FOUND, "worker not found: " + workerId);
  }
}
