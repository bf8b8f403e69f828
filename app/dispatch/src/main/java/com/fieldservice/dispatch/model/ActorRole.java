package com.fieldservice.dispatch.model;

public enum ActorRole {
  CUSTOMER,
  WORKER,
  ADMIN
}
