/*
 * どこで: Dispatch ドメインモデル
 * 何を: 管理者向け集計値のスナップショットを表す
 * なぜ: 集計は都度計算し永続化しないため、結果を 1 つの値として返すため
 */
package com.fieldservice.dispatch.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record DispatchMetricsSnapshot(
    Map<RequestStatus, Long> countsByStatus,
    Map<RequestPriority, Long> countsByPriority,
    Duration averageTimeToAccept,
    long acceptedSampleSize,
    long activeWorkers,
    long openRequests,
    long openEmergencies,
    List<WorkerRanking> topWorkers,
    Instant generatedAt) {

  public DispatchMetricsSnapshot {
    countsByStatus = Map.copyOf(countsByStatus);
    countsByPriority = Map.copyOf(countsByPriority);
    topWorkers = List.copyOf(topWorkers);
  }

  public long count(RequestStatus status) {
    return countsByStatus.getOrDefault(status, 0L);
  }

  public long count(RequestPriority priority) {
    return countsByPriority.getOrDefault(priority, 0L);
  }
}
