/*
 * どこで: Dispatch ドメインモデル
 * 何を: 遷移ごとの許可ロール・遷移元・遷移先・イベント種別をまとめる
 * なぜ: 遷移表を 1 箇所に集約し、操作ごとの判定の重複をなくすため
 */
package com.fieldservice.dispatch.model;

import java.util.EnumSet;
import java.util.Set;

public enum RequestTransition {
  ACCEPT(
      "accept",
      EnumSet.of(ActorRole.WORKER),
      EnumSet.of(RequestStatus.PENDING),
      RequestStatus.ACCEPTED,
      LifecycleEventType.REQUEST_ACCEPTED),
  START(
      "start",
      EnumSet.of(ActorRole.WORKER),
      EnumSet.of(RequestStatus.ACCEPTED),
      RequestStatus.IN_PROGRESS,
      LifecycleEventType.REQUEST_STARTED),
  COMPLETE(
      "complete",
      EnumSet.of(ActorRole.WORKER),
      EnumSet.of(RequestStatus.IN_PROGRESS),
      RequestStatus.COMPLETED,
      LifecycleEventType.REQUEST_COMPLETED),
  CANCEL(
      "cancel",
      EnumSet.of(ActorRole.CUSTOMER, ActorRole.WORKER, ActorRole.ADMIN),
      EnumSet.copyOf(RequestStatus.OPEN),
      RequestStatus.CANCELLED,
      LifecycleEventType.REQUEST_CANCELLED);

  private final String value;
  private final Set<ActorRole> allowedRoles;
  private final Set<RequestStatus> sources;
  private final RequestStatus target;
  private final LifecycleEventType eventType;

  RequestTransition(
      String value,
      Set<ActorRole> allowedRoles,
      Set<RequestStatus> sources,
      RequestStatus target,
      LifecycleEventType eventType) {
    this.value = value;
    this.allowedRoles = allowedRoles;
    this.sources = sources;
    this.target = target;
    this.eventType = eventType;
  }

  public String value() {
    return value;
  }

  public boolean permitsRole(ActorRole role) {
    return allowedRoles.contains(role);
  }

  public boolean permitsFrom(RequestStatus status) {
    return sources.contains(status);
  }

  public RequestStatus target() {
    return target;
  }

  public LifecycleEventType eventType() {
    return eventType;
  }
}
