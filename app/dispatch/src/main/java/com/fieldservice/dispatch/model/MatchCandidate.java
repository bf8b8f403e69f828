package com.fieldservice.dispatch.model;

import java.util.Comparator;

public record MatchCandidate(ServiceRequestRecord request, double distanceKm) {

  // 優先度の降順 → 距離の昇順 → 作成日時の昇順 → requestId
  public static final Comparator<MatchCandidate> RANKING =
      Comparator.comparingInt((MatchCandidate candidate) -> candidate.request().priority().rank())
          .reversed()
          .thenComparingDouble(MatchCandidate::distanceKm)
          .thenComparing(candidate -> candidate.request().createdAt())
          .thenComparing(candidate -> candidate.request().requestId());

  public String requestId() {
    return request.requestId();
  }
}
