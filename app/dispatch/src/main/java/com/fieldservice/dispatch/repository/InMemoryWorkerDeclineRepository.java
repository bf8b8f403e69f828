package com.fieldservice.dispatch.repository;

import com.fieldservice.dispatch.model.WorkerDeclineRecord;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "dispatch.store.type", havingValue = "in-memory")
public class InMemoryWorkerDeclineRepository implements WorkerDeclineRepository {

  // workerId -> (requestId -> 辞退記録)
  private final ConcurrentMap<String, Map<String, WorkerDeclineRecord>> declines =
      new ConcurrentHashMap<>();

  @Override
  public void upsert(WorkerDeclineRecord record) {
    declines
        .computeIfAbsent(record.workerId(), workerId -> new ConcurrentHashMap<>())
        .put(record.requestId(), record);
  }

  @Override
  public Set<String> findRequestIdsByWorker(String workerId) {
    return Set.copyOf(declines.getOrDefault(workerId, Map.of()).keySet());
  }

  @Override
  public Set<String> findWorkerIdsByRequest(String requestId) {
    return declines.entrySet().stream()
        .filter(entry -> entry.getValue().containsKey(requestId))
        .map(Map.Entry::getKey)
        .collect(Collectors.toUnmodifiableSet());
  }

  @Override
  public List<WorkerDeclineRecord> findByWorker(String workerId) {
    return declines.getOrDefault(workerId, Map.of()).values().stream()
        .sorted(
            Comparator.comparing(WorkerDeclineRecord::declinedAt)
                .reversed()
                .thenComparing(WorkerDeclineRecord::requestId))
        .toList();
  }
}
