package com.fieldservice.dispatch.model;

public enum LifecycleEventType {
  REQUEST_CREATED,
  REQUEST_ACCEPTED,
  REQUEST_STARTED,
  REQUEST_COMPLETED,
  REQUEST_CANCELLED
}
