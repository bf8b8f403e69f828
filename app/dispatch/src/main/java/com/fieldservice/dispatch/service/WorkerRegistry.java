/*
 * どこで: Dispatch サービス層
 * 何を: 作業者の稼働可否・位置・割当を管理する
 * なぜ: available/location の書き手をここに限定し、割当に伴う変更も同じ経路で行うため
 */
package com.fieldservice.dispatch.service;

import com.fieldservice.dispatch.config.DispatchMatchingProperties;
import com.fieldservice.dispatch.exception.InvalidDispatchRequestException;
import com.fieldservice.dispatch.exception.WorkerNotFoundException;
import com.fieldservice.dispatch.geo.BoundingBox;
import com.fieldservice.dispatch.model.Actor;
import com.fieldservice.dispatch.model.Coordinate;
import com.fieldservice.dispatch.model.WorkerRanking;
import com.fieldservice.dispatch.model.WorkerRecord;
import com.fieldservice.dispatch.repository.WorkerRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class WorkerRegistry {

  private static final Logger logger = LoggerFactory.getLogger(WorkerRegistry.class);
  private static final double MIN_SERVICE_RADIUS_KM = 1.0;

  private final WorkerRepository workerRepository;
  private final DispatchAuthorizationPolicy authorizationPolicy;
  private final DispatchMatchingProperties matchingProperties;
  private final Clock clock;

  /**
   * 役割: 作業者の対応半径とカテゴリを登録/更新する。
   * 動作: serviceRadiusKm が null なら既定半径を使う。稼働状態と割当は変更しない。
   * 前提: 操作者は作業者本人か管理者。
   */
  public WorkerRecord registerWorker(
      Actor actor, String workerId, Double serviceRadiusKm, String category) {
    requireWorkerId(workerId);
    authorizationPolicy.requireSelfOrAdmin(actor, workerId, "register");
    final double radius =
        serviceRadiusKm == null ? matchingProperties.defaultRadiusKm() : serviceRadiusKm;
    if (Double.isNaN(radius) || radius < MIN_SERVICE_RADIUS_KM) {
      throw new InvalidDispatchRequestException("service radius must be at least 1 km");
    }
    final String normalizedCategory = blankToNull(category);
    RequestStore.requireMaxLength(
        "category", normalizedCategory, RequestStore.MAX_CATEGORY_LENGTH);
    final WorkerRecord record =
        workerRepository.upsertProfile(workerId, radius, normalizedCategory, now());
    logger.info(
        "worker registered workerId={} serviceRadiusKm={} category={}",
        workerId,
        radius,
        record.category());
    return record;
  }

  /**
   * 役割: 作業者本人の稼働可否と位置を反映する。
   * 動作: 未登録なら既定値で登録する。割当中は available=false のまま、割当解除後に戻す値だけを更新する。
   * 前提: available=true にする場合は位置が必要 (引数か登録済みの位置)。
   */
  public WorkerRecord setAvailability(
      Actor actor, String workerId, boolean available, Coordinate location) {
    requireWorkerId(workerId);
    authorizationPolicy.requireSelfOrAdmin(actor, workerId, "set availability");
    if (available && location == null) {
      final boolean knownLocation =
          workerRepository.findById(workerId).map(WorkerRecord::location).isPresent();
      if (!knownLocation) {
        throw new InvalidDispatchRequestException(
            "location is required when becoming available");
      }
    }
    final WorkerRecord record =
        workerRepository.updateAvailability(
            workerId, available, location, matchingProperties.defaultRadiusKm(), now());
    logger.info(
        "worker availability workerId={} requested={} available={} currentRequestId={}",
        workerId,
        available,
        record.available(),
        record.currentRequestId());
    return record;
  }

  public Optional<WorkerRecord> findWorker(String workerId) {
    return workerRepository.findById(workerId);
  }

  public WorkerRecord requireWorker(String workerId) {
    return workerRepository
        .findById(workerId)
        .orElseThrow(() -> new WorkerNotFoundException(workerId));
  }

  public WorkerRecord updateLocation(String workerId, Coordinate location, Instant at) {
    return workerRepository
        .updateLocation(workerId, location, at)
        .orElseThrow(() -> new WorkerNotFoundException(workerId));
  }

  /** 受諾に伴い作業者を確保する。available でない、または割当済みなら empty。 */
  Optional<WorkerRecord> reserveFor(String workerId, String requestId, Instant at) {
    return workerRepository.reserve(workerId, requestId, at);
  }

  /** 完了/取消に伴い割当を解除し、本人の最後の設定へ available を戻す。 */
  Optional<WorkerRecord> releaseFrom(
      String workerId, String requestId, boolean completed, Instant at) {
    final Optional<WorkerRecord> released =
        workerRepository.release(workerId, requestId, completed, at);
    if (released.isEmpty()) {
      logger.warn(
          "worker assignment not found on release workerId={} requestId={}", workerId, requestId);
    }
    return released;
  }

  public List<WorkerRecord> findAvailableWithin(BoundingBox box) {
    return workerRepository.findAvailableWithin(box);
  }

  public long countActiveWorkers() {
    return workerRepository.countActive();
  }

  public List<WorkerRanking> topWorkers(int limit) {
    return workerRepository.findTopByCompletedJobs(limit);
  }

  private void requireWorkerId(String workerId) {
    if (workerId == null || workerId.isBlank()) {
      throw new InvalidDispatchRequestException("workerId is required");
    }
    RequestStore.requireMaxLength("workerId", workerId, Actor.MAX_ID_LENGTH);
  }

  private String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }

  private Instant now() {
    return Instant.now(clock);
  }
}
