/*
 * どこで: Dispatch データアクセス (in-memory)
 * 何を: workers 相当をプロセス内 Map で保持する
 * なぜ: 作業者単位の compute で JDBC 実装と同じ確保/解除の条件を再現するため
 */
package com.fieldservice.dispatch.repository;

import com.fieldservice.dispatch.geo.BoundingBox;
import com.fieldservice.dispatch.model.Coordinate;
import com.fieldservice.dispatch.model.WorkerRanking;
import com.fieldservice.dispatch.model.WorkerRecord;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "dispatch.store.type", havingValue = "in-memory")
public class InMemoryWorkerRepository implements WorkerRepository {

  private final ConcurrentMap<String, WorkerRecord> workers = new ConcurrentHashMap<>();

  @Override
  public Optional<WorkerRecord> findById(String workerId) {
    return Optional.ofNullable(workers.get(workerId));
  }

  @Override
  public WorkerRecord upsertProfile(
      String workerId, double serviceRadiusKm, String category, Instant updatedAt) {
    return workers.compute(
        workerId,
        (id, current) ->
            current == null
                ? new WorkerRecord(
                    id, false, null, null, false, serviceRadiusKm, category, 0, null, updatedAt)
                : new WorkerRecord(
                    id,
                    current.available(),
                    current.location(),
                    current.currentRequestId(),
                    current.resumeAvailable(),
                    serviceRadiusKm,
                    category,
                    current.completedJobs(),
                    current.lastAvailableAt(),
                    updatedAt));
  }

  @Override
  public WorkerRecord updateAvailability(
      String workerId,
      boolean available,
      Coordinate location,
      double defaultServiceRadiusKm,
      Instant updatedAt) {
    return workers.compute(
        workerId,
        (id, current) -> {
          if (current == null) {
            return new WorkerRecord(
                id,
                available,
                location,
                null,
                available,
                defaultServiceRadiusKm,
                null,
                0,
                available ? updatedAt : null,
                updatedAt);
          }
          final boolean effective = available && !current.hasAssignment();
          final Instant lastAvailableAt;
          if (!available) {
            lastAvailableAt = null;
          } else if (current.hasAssignment() || current.available()) {
            lastAvailableAt = current.lastAvailableAt();
          } else {
            lastAvailableAt = updatedAt;
          }
          return new WorkerRecord(
              id,
              effective,
              location == null ? current.location() : location,
              current.currentRequestId(),
              available,
              current.serviceRadiusKm(),
              current.category(),
              current.completedJobs(),
              lastAvailableAt,
              updatedAt);
        });
  }

  @Override
  public Optional<WorkerRecord> updateLocation(
      String workerId, Coordinate location, Instant updatedAt) {
    return Optional.ofNullable(
        workers.computeIfPresent(
            workerId,
            (id, current) ->
                new WorkerRecord(
                    id,
                    current.available(),
                    location,
                    current.currentRequestId(),
                    current.resumeAvailable(),
                    current.serviceRadiusKm(),
                    current.category(),
                    current.completedJobs(),
                    current.lastAvailableAt(),
                    updatedAt)));
  }

  @Override
  public Optional<WorkerRecord> reserve(String workerId, String requestId, Instant updatedAt) {
    final AtomicReference<WorkerRecord> reserved = new AtomicReference<>();
    workers.computeIfPresent(
        workerId,
        (id, current) -> {
          if (!current.available() || current.hasAssignment()) {
            return current;
          }
          final WorkerRecord next =
              new WorkerRecord(
                  id,
                  false,
                  current.location(),
                  requestId,
                  true,
                  current.serviceRadiusKm(),
                  current.category(),
                  current.completedJobs(),
                  current.lastAvailableAt(),
                  updatedAt);
          reserved.set(next);
          return next;
        });
    return Optional.ofNullable(reserved.get());
  }

  @Override
  public Optional<WorkerRecord> release(
      String workerId, String requestId, boolean completed, Instant updatedAt) {
    final AtomicReference<WorkerRecord> released = new AtomicReference<>();
    workers.computeIfPresent(
        workerId,
        (id, current) -> {
          if (!requestId.equals(current.currentRequestId())) {
            return current;
          }
          final WorkerRecord next =
              new WorkerRecord(
                  id,
                  current.resumeAvailable(),
                  current.location(),
                  null,
                  current.resumeAvailable(),
                  current.serviceRadiusKm(),
                  current.category(),
                  current.completedJobs() + (completed ? 1 : 0),
                  current.resumeAvailable()
                      ? Optional.ofNullable(current.lastAvailableAt()).orElse(updatedAt)
                      : null,
                  updatedAt);
          released.set(next);
          return next;
        });
    return Optional.ofNullable(released.get());
  }

  @Override
  public List<WorkerRecord> findAvailableWithin(BoundingBox box) {
    return workers.values().stream()
        .filter(worker -> worker.available() && !worker.hasAssignment())
        .filter(worker -> worker.location() != null)
        .filter(
            worker -> box.contains(worker.location().latitude(), worker.location().longitude()))
        .toList();
  }

  @Override
  public long countActive() {
    return workers.values().stream().filter(WorkerRecord::isActive).count();
  }

  @Override
  public List<WorkerRanking> findTopByCompletedJobs(int limit) {
    return workers.values().stream()
        .filter(worker -> worker.completedJobs() > 0)
        .sorted(
            Comparator.comparingLong(WorkerRecord::completedJobs)
                .reversed()
                .thenComparing(WorkerRecord::workerId))
        .limit(limit)
        .map(worker -> new WorkerRanking(worker.workerId(), worker.completedJobs()))
        .toList();
  }
}
