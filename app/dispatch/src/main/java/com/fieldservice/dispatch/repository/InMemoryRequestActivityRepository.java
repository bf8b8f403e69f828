package com.fieldservice.dispatch.repository;

import com.fieldservice.dispatch.model.RequestActivityRecord;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "dispatch.store.type", havingValue = "in-memory")
public class InMemoryRequestActivityRepository implements RequestActivityRepository {

  private final ConcurrentMap<String, List<RequestActivityRecord>> activities =
      new ConcurrentHashMap<>();

  @Override
  public void append(RequestActivityRecord record) {
    activities
        .computeIfAbsent(record.requestId(), requestId -> new CopyOnWriteArrayList<>())
        .add(record);
  }

  @Override
  public List<RequestActivityRecord> findByRequestId(String requestId) {
    return List.copyOf(activities.getOrDefault(requestId, List.of()));
  }
}
