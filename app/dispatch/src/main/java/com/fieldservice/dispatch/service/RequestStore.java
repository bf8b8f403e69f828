/*
 * どこで: Dispatch サービス層
 * 何を: 依頼と活動履歴の保存・条件付き遷移・参照をまとめる
 * なぜ: Coordinator/Matcher/集計がストア実装を意識せずに同じ依頼データを扱うため
 */
package com.fieldservice.dispatch.service;

import com.fieldservice.dispatch.exception.InvalidDispatchRequestException;
import com.fieldservice.dispatch.exception.RequestNotFoundException;
import com.fieldservice.dispatch.geo.BoundingBox;
import com.fieldservice.dispatch.model.NewServiceRequest;
import com.fieldservice.dispatch.model.RequestActivityRecord;
import com.fieldservice.dispatch.model.RequestStatisticsBucket;
import com.fieldservice.dispatch.model.RequestStatus;
import com.fieldservice.dispatch.model.ServiceRequestRecord;
import com.fieldservice.dispatch.repository.RequestActivityRepository;
import com.fieldservice.dispatch.repository.ServiceRequestRepository;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RequestStore {

  private static final Logger logger = LoggerFactory.getLogger(RequestStore.class);

  private static final int REFERENCE_CODE_LENGTH = 12;
  private static final int REFERENCE_CODE_ATTEMPTS = 5;
  private static final int MAX_TITLE_LENGTH = 200;
  private static final int MAX_ADDRESS_LENGTH = 255;
  static final int MAX_CATEGORY_LENGTH = 64;

  private final ServiceRequestRepository requestRepository;
  private final RequestActivityRepository activityRepository;

  /**
   * 役割: 新規依頼を PENDING で保存し、作成の履歴を残す。
   * 動作: requestId (UUID) と referenceCode (大文字 16 進 12 桁) を採番する。
   * referenceCode が他の依頼と衝突した場合は採番し直して保存する。
   * 前提: 操作者の権限確認は呼び出し側で済んでいること。
   */
  public ServiceRequestRecord create(String customerId, NewServiceRequest command, Instant now) {
    final NewServiceRequest normalized = validate(command);
    for (int attempt = 0; attempt < REFERENCE_CODE_ATTEMPTS; attempt++) {
      final ServiceRequestRecord record =
          ServiceRequestRecord.newPending(
              UUID.randomUUID().toString(), newReferenceCode(), customerId, normalized, now);
      if (requestRepository.insert(record)) {
        recordActivity(record.requestId(), customerId, "Request created", now);
        return record;
      }
      logger.debug(
          "reference code collision referenceCode={} attempt={}",
          record.referenceCode(),
          attempt + 1);
    }
    throw new IllegalStateException("failed to allocate a unique reference code");
  }

  public Optional<ServiceRequestRecord> find(String requestId) {
    if (requestId == null || requestId.isBlank()) {
      throw new InvalidDispatchRequestException("requestId is required");
    }
    return requestRepository.findById(requestId);
  }

  public ServiceRequestRecord require(String requestId) {
    return find(requestId).orElseThrow(() -> new RequestNotFoundException(requestId));
  }

  Optional<ServiceRequestRecord> claimPending(String requestId, String workerId, Instant at) {
    return requestRepository.claimPending(requestId, workerId, at);
  }

  Optional<ServiceRequestRecord> markStarted(String requestId, String workerId, Instant at) {
    return requestRepository.markStarted(requestId, workerId, at);
  }

  Optional<ServiceRequestRecord> markCompleted(String requestId, String workerId, Instant at) {
    return requestRepository.markCompleted(requestId, workerId, at);
  }

  Optional<ServiceRequestRecord> markCancelled(
      String requestId, RequestStatus expectedStatus, String actorId, Instant at) {
    return requestRepository.markCancelled(requestId, expectedStatus, actorId, at);
  }

  public void recordActivity(String requestId, String actorId, String message, Instant at) {
    activityRepository.append(new RequestActivityRecord(requestId, actorId, message, at));
  }

  public List<RequestActivityRecord> history(String requestId) {
    return activityRepository.findByRequestId(requestId);
  }

  public List<ServiceRequestRecord> findPendingWithin(BoundingBox box) {
    return requestRepository.findPendingWithin(box);
  }

  public List<ServiceRequestRecord> findByCustomer(String customerId, Set<RequestStatus> statuses) {
    return requestRepository.findByCustomer(customerId, statuses);
  }

  public List<ServiceRequestRecord> findByWorker(String workerId, Set<RequestStatus> statuses) {
    return requestRepository.findByWorker(workerId, statuses);
  }

  public List<RequestStatisticsBucket> statistics() {
    return requestRepository.summarizeStatistics();
  }

  private NewServiceRequest validate(NewServiceRequest command) {
    if (command == null) {
      throw new InvalidDispatchRequestException("request is required");
    }
    if (command.title() == null || command.title().isBlank()) {
      throw new InvalidDispatchRequestException("title is required");
    }
    if (command.priority() == null) {
      throw new InvalidDispatchRequestException("priority is required");
    }
    if (command.location() == null) {
      throw new InvalidDispatchRequestException("location is required");
    }
    if (command.estimatedDurationMinutes() <= 0) {
      throw new InvalidDispatchRequestException("estimated duration must be positive");
    }
    final String title = command.title().strip();
    final String category =
        command.category() == null || command.category().isBlank() ? null : command.category();
    final String address = command.address() == null ? "" : command.address();
    requireMaxLength("title", title, MAX_TITLE_LENGTH);
    requireMaxLength("category", category, MAX_CATEGORY_LENGTH);
    requireMaxLength("address", address, MAX_ADDRESS_LENGTH);
    return new NewServiceRequest(
        title,
        command.description() == null ? "" : command.description(),
        category,
        command.priority(),
        command.location(),
        address,
        command.estimatedDurationMinutes());
  }

  // 列の長さを超える値は DB 側の制約違反ではなく BAD_REQUEST として返す
  static void requireMaxLength(String field, String value, int maxLength) {
    if (value != null && value.length() > maxLength) {
      throw new InvalidDispatchRequestException(
          field + " must be at most " + maxLength + " characters");
    }
  }

  private static String newReferenceCode() {
    return UUID.randomUUID()
        .toString()
        .replace("-", "")
        .substring(0, REFERENCE_CODE_LENGTH)
        .toUpperCase(Locale.ROOT);
  }
}
