/*
 * どこで: Dispatch ドメインモデル
 * 何を: workers のスナップショットを表す
 * なぜ: 稼働可否・位置・現在の割当をまとめて扱うため
 */
package com.fieldservice.dispatch.model;

import java.time.Instant;

/**
 * currentRequestId が設定されている間 available は常に false。
 * resumeAvailable は割当中に本人が切り替えた稼働可否で、割当解除時に available へ戻す値。
 */
public record WorkerRecord(
    String workerId,
    boolean available,
    Coordinate location,
    String currentRequestId,
    boolean resumeAvailable,
    double serviceRadiusKm,
    String category,
    long completedJobs,
    Instant lastAvailableAt,
    Instant updatedAt) {

  public boolean hasAssignment() {
    return currentRequestId != null;
  }

  public boolean isActive() {
    return available || hasAssignment();
  }
}
