/*
 * どこで: Dispatch データアクセス (in-memory)
 * 何を: service_requests 相当をプロセス内 Map で保持する
 * なぜ: DB なしで起動する構成でも JDBC 実装と同じ条件付き遷移の意味を保つため
 */
package com.fieldservice.dispatch.repository;

import com.fieldservice.dispatch.geo.BoundingBox;
import com.fieldservice.dispatch.model.RequestPriority;
import com.fieldservice.dispatch.model.RequestStatisticsBucket;
import com.fieldservice.dispatch.model.RequestStatus;
import com.fieldservice.dispatch.model.ServiceRequestRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "dispatch.store.type", havingValue = "in-memory")
public class InMemoryServiceRequestRepository implements ServiceRequestRepository {

  private static final Comparator<ServiceRequestRecord> NEWEST_FIRST =
      Comparator.comparing(ServiceRequestRecord::createdAt)
          .reversed()
          .thenComparing(ServiceRequestRecord::requestId);

  private final ConcurrentMap<String, ServiceRequestRecord> requests = new ConcurrentHashMap<>();
  private final Set<String> referenceCodes = ConcurrentHashMap.newKeySet();

  @Override
  public boolean insert(ServiceRequestRecord record) {
    if (!referenceCodes.add(record.referenceCode())) {
      return false;
    }
    if (requests.putIfAbsent(record.requestId(), record) != null) {
      referenceCodes.remove(record.referenceCode());
      throw new DuplicateKeyException("request already exists: " + record.requestId());
    }
    return true;
  }

  @Override
  public Optional<ServiceRequestRecord> findById(String requestId) {
    return Optional.ofNullable(requests.get(requestId));
  }

  @Override
  public Optional<ServiceRequestRecord> claimPending(
      String requestId, String workerId, Instant acceptedAt) {
    return transition(
        requestId,
        current -> current.status() == RequestStatus.PENDING,
        current -> current.accepted(workerId, acceptedAt));
  }

  @Override
  public Optional<ServiceRequestRecord> markStarted(
      String requestId, String workerId, Instant startedAt) {
    return transition(
        requestId,
        current -> current.status() == RequestStatus.ACCEPTED && current.isAssignedTo(workerId),
        current -> current.started(startedAt));
  }

  @Override
  public Optional<ServiceRequestRecord> markCompleted(
      String requestId, String workerId, Instant completedAt) {
    return transition(
        requestId,
        current -> current.status() == RequestStatus.IN_PROGRESS && current.isAssignedTo(workerId),
        current -> current.completed(completedAt));
  }

  @Override
  public Optional<ServiceRequestRecord> markCancelled(
      String requestId, RequestStatus expectedStatus, String actorId, Instant cancelledAt) {
    return transition(
        requestId,
        current -> current.status() == expectedStatus,
        current -> current.cancelled(actorId, cancelledAt));
  }

  @Override
  public List<ServiceRequestRecord> findPendingWithin(BoundingBox box) {
    return requests.values().stream()
        .filter(record -> record.status() == RequestStatus.PENDING)
        .filter(
            record -> box.contains(record.location().latitude(), record.location().longitude()))
        .toList();
  }

  @Override
  public List<ServiceRequestRecord> findByCustomer(String customerId, Set<RequestStatus> statuses) {
    return filterAndSort(record -> customerId.equals(record.customerId()), statuses);
  }

  @Override
  public List<ServiceRequestRecord> findByWorker(String workerId, Set<RequestStatus> statuses) {
    return filterAndSort(record -> workerId.equals(record.lastAssignedWorkerId()), statuses);
  }

  @Override
  public List<RequestStatisticsBucket> summarizeStatistics() {
    final Map<RequestStatus, Map<RequestPriority, long[]>> totals =
        new EnumMap<>(RequestStatus.class);
    for (ServiceRequestRecord record : requests.values()) {
      // [件数, 受諾済み件数, 受諾までのミリ秒合計]
      final long[] bucket =
          totals
              .computeIfAbsent(record.status(), status -> new EnumMap<>(RequestPriority.class))
              .computeIfAbsent(record.priority(), priority -> new long[3]);
      bucket[0]++;
      if (record.acceptedAt() != null) {
        bucket[1]++;
        bucket[2] += Duration.between(record.createdAt(), record.acceptedAt()).toMillis();
      }
    }
    final List<RequestStatisticsBucket> buckets = new ArrayList<>();
    totals.forEach(
        (status, byPriority) ->
            byPriority.forEach(
                (priority, values) ->
                    buckets.add(
                        new RequestStatisticsBucket(
                            status, priority, values[0], values[1], values[2]))));
    return buckets;
  }

  private List<ServiceRequestRecord> filterAndSort(
      Predicate<ServiceRequestRecord> owner, Set<RequestStatus> statuses) {
    return requests.values().stream()
        .filter(owner)
        .filter(
            record -> statuses == null || statuses.isEmpty() || statuses.contains(record.status()))
        .sorted(NEWEST_FIRST)
        .toList();
  }

  // computeIfPresent はキー単位で直列化されるため、判定と更新の間に他の遷移は割り込まない
  private Optional<ServiceRequestRecord> transition(
      String requestId,
      Predicate<ServiceRequestRecord> condition,
      UnaryOperator<ServiceRequestRecord> update) {
    final AtomicReference<ServiceRequestRecord> updated = new AtomicReference<>();
    requests.computeIfPresent(
        requestId,
        (id, current) -> {
          if (!condition.test(current)) {
            return current;
          }
          final ServiceRequestRecord next = update.apply(current);
          updated.set(next);
          return next;
        });
    return Optional.ofNullable(updated.get());
  }
}
