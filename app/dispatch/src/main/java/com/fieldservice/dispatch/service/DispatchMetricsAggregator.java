/*
 * どこで: Dispatch サービス層
 * 何を: ストアの現在値から管理者向けの件数/所要時間/稼働人数を計算する
 * なぜ: 集計を永続化せず都度計算することで、ストアと常に一致させるため
 */
package com.fieldservice.dispatch.service;

import com.fieldservice.dispatch.config.DispatchMatchingProperties;
import com.fieldservice.dispatch.model.Actor;
import com.fieldservice.dispatch.model.ActorRole;
import com.fieldservice.dispatch.model.DispatchMetricsSnapshot;
import com.fieldservice.dispatch.model.RequestPriority;
import com.fieldservice.dispatch.model.RequestStatisticsBucket;
import com.fieldservice.dispatch.model.RequestStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DispatchMetricsAggregator {

  private final RequestStore requestStore;
  private final WorkerRegistry workerRegistry;
  private final DispatchAuthorizationPolicy authorizationPolicy;
  private final DispatchMatchingProperties properties;
  private final Clock clock;

  /**
   * 役割: 管理者向け集計を返す。
   * 動作: 状態別/優先度別件数、受諾までの平均時間 (acceptedAt を持つ依頼のみ、無ければ 0)、
   * 稼働中の作業者数 (available または割当あり)、未完了件数、未完了の緊急件数、完了件数上位の作業者。
   * 前提: 操作者は管理者。
   */
  public DispatchMetricsSnapshot getMetrics(Actor actor) {
    authorizationPolicy.requireRole(actor, ActorRole.ADMIN, "getMetrics");
    final List<RequestStatisticsBucket> buckets = requestStore.statistics();
    final Map<RequestStatus, Long> byStatus = new EnumMap<>(RequestStatus.class);
    final Map<RequestPriority, Long> byPriority = new EnumMap<>(RequestPriority.class);
    for (RequestStatus status : RequestStatus.values()) {
      byStatus.put(status, 0L);
    }
    for (RequestPriority priority : RequestPriority.values()) {
      byPriority.put(priority, 0L);
    }
    long acceptedCount = 0;
    long totalMillisToAccept = 0;
    long openRequests = 0;
    long openEmergencies = 0;
    for (RequestStatisticsBucket bucket : buckets) {
      byStatus.merge(bucket.status(), bucket.count(), Long::sum);
      byPriority.merge(bucket.priority(), bucket.count(), Long::sum);
      acceptedCount += bucket.acceptedCount();
      totalMillisToAccept += bucket.totalMillisToAccept();
      if (RequestStatus.OPEN.contains(bucket.status())) {
        openRequests += bucket.count();
        if (bucket.priority() == RequestPriority.EMERGENCY) {
          openEmergencies += bucket.count();
        }
      }
    }
    final Duration averageTimeToAccept =
        acceptedCount == 0
            ? Duration.ZERO
            : Duration.ofMillis(Math.max(0, totalMillisToAccept / acceptedCount));
    return new DispatchMetricsSnapshot(
        byStatus,
        byPriority,
        averageTimeToAccept,
        acceptedCount,
        workerRegistry.countActiveWorkers(),
        openRequests,
        openEmergencies,
        workerRegistry.topWorkers(properties.topWorkers()),
        Instant.now(clock));
  }
}
