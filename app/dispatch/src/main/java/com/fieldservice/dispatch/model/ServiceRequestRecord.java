/*
 * どこで: Dispatch ドメインモデル
 * 何を: service_requests のスナップショットを表す
 * なぜ: ストア実装 (JDBC / in-memory) と呼び出し側で同じ形を共有するため
 */
package com.fieldservice.dispatch.model;

import java.time.Instant;

/**
 * assignedWorkerId は ACCEPTED / IN_PROGRESS の間だけ設定される。
 * lastAssignedWorkerId は完了・取消後も監査用に残す。
 */
public record ServiceRequestRecord(
    String requestId,
    String referenceCode,
    String customerId,
    String title,
    String description,
    String category,
    RequestPriority priority,
    Coordinate location,
    String address,
    int estimatedDurationMinutes,
    RequestStatus status,
    String assignedWorkerId,
    String lastAssignedWorkerId,
    Instant createdAt,
    Instant acceptedAt,
    Instant startedAt,
    Instant completedAt,
    Instant cancelledAt,
    String cancelledBy,
    Instant updatedAt) {

  public static ServiceRequestRecord newPending(
      String requestId,
      String referenceCode,
      String customerId,
      NewServiceRequest command,
      Instant createdAt) {
    return new ServiceRequestRecord(
        requestId,
        referenceCode,
        customerId,
        command.title(),
        command.description(),
        command.category(),
        command.priority(),
        command.location(),
        command.address(),
        command.estimatedDurationMinutes(),
        RequestStatus.PENDING,
        null,
        null,
        createdAt,
        null,
        null,
        null,
        null,
        null,
        createdAt);
  }

  public ServiceRequestRecord accepted(String workerId, Instant at) {
    return new ServiceRequestRecord(
        requestId,
        referenceCode,
        customerId,
        title,
        description,
        category,
        priority,
        location,
        address,
        estimatedDurationMinutes,
        RequestStatus.ACCEPTED,
        workerId,
        workerId,
        createdAt,
        at,
        startedAt,
        completedAt,
        cancelledAt,
        cancelledBy,
        at);
  }

  public ServiceRequestRecord started(Instant at) {
    return new ServiceRequestRecord(
        requestId,
        referenceCode,
        customerId,
        title,
        description,
        category,
        priority,
        location,
        address,
        estimatedDurationMinutes,
        RequestStatus.IN_PROGRESS,
        assignedWorkerId,
        lastAssignedWorkerId,
        createdAt,
        acceptedAt,
        at,
        completedAt,
        cancelledAt,
        cancelledBy,
        at);
  }

  public ServiceRequestRecord completed(Instant at) {
    return new ServiceRequestRecord(
        requestId,
        referenceCode,
        customerId,
        title,
        description,
        category,
        priority,
        location,
        address,
        estimatedDurationMinutes,
        RequestStatus.COMPLETED,
        null,
        lastAssignedWorkerId,
        createdAt,
        acceptedAt,
        startedAt,
        at,
        cancelledAt,
        cancelledBy,
        at);
  }

  public ServiceRequestRecord cancelled(String actorId, Instant at) {
    return new ServiceRequestRecord(
        requestId,
        referenceCode,
        customerId,
        title,
        description,
        category,
        priority,
        location,
        address,
        estimatedDurationMinutes,
        RequestStatus.CANCELLED,
        null,
        lastAssignedWorkerId,
        createdAt,
        acceptedAt,
        startedAt,
        completedAt,
        at,
        actorId,
        at);
  }

  public boolean isAssignedTo(String workerId) {
    return assignedWorkerId != null && assignedWorkerId.equals(workerId);
  }
}
