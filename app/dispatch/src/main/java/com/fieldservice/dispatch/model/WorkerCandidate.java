package com.fieldservice.dispatch.model;

import java.util.Comparator;

public record WorkerCandidate(WorkerRecord worker, double distanceKm) {

  // 距離の昇順 → workerId
  public static final Comparator<WorkerCandidate> RANKING =
      Comparator.comparingDouble(WorkerCandidate::distanceKm)
          .thenComparing(WorkerCandidate::workerId);

  public String workerId() {
    return worker.workerId();
  }
}
