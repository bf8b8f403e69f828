/*
 * どこで: Dispatch サービス層
 * 何を: 依頼の作成と accept/start/complete/cancel の状態遷移、作業者側の副作用、イベント発行をまとめる
 * なぜ: status・担当者・遷移時刻の書き手をここに限定し、排他と通知の順序を 1 箇所で保証するため
 */
package com.fieldservice.dispatch.service;

import com.fieldservice.dispatch.exception.DispatchAccessDeniedException;
import com.fieldservice.dispatch.exception.DispatchException;
import com.fieldservice.dispatch.exception.InvalidRequestTransitionException;
import com.fieldservice.dispatch.exception.RequestAlreadyAssignedException;
import com.fieldservice.dispatch.model.Actor;
import com.fieldservice.dispatch.model.ActorRole;
import com.fieldservice.dispatch.model.Coordinate;
import com.fieldservice.dispatch.model.LifecycleEventType;
import com.fieldservice.dispatch.model.NewServiceRequest;
import com.fieldservice.dispatch.model.RequestLifecycleEvent;
import com.fieldservice.dispatch.model.RequestStatus;
import com.fieldservice.dispatch.model.RequestTransition;
import com.fieldservice.dispatch.model.ServiceRequestRecord;
import com.fieldservice.dispatch.model.WorkerDeclineRecord;
import com.fieldservice.dispatch.repository.WorkerDeclineRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class DispatchCoordinator {

  private static final Logger logger = LoggerFactory.getLogger(DispatchCoordinator.class);
  private static final int MAX_DECLINE_REASON_LENGTH = 500;

  private final RequestStore requestStore;
  private final WorkerRegistry workerRegistry;
  private final WorkerDeclineRepository declineRepository;
  private final DispatchAuthorizationPolicy authorizationPolicy;
  private final LifecycleEventEmitter eventEmitter;
  private final DispatchMetrics metrics;
  private final Clock clock;

  @Transactional
  public ServiceRequestRecord createRequest(Actor actor, NewServiceRequest command) {
    return measure(
        "create",
        () -> {
          authorizationPolicy.requireRole(actor, ActorRole.CUSTOMER, "createRequest");
          final Instant now = Instant.now(clock);
          final ServiceRequestRecord created = requestStore.create(actor.id(), command, now);
          logger.info(
              "request created requestId={} referenceCode={} priority={} customerId={}",
              created.requestId(),
              created.referenceCode(),
              created.priority(),
              created.customerId());
          emit(LifecycleEventType.REQUEST_CREATED, null, created, actor, now);
          return created;
        });
  }

  /**
   * 役割: PENDING の依頼を作業者に割り当てる。
   * 動作: 作業者を先に確保し、依頼を条件付きで claim する。claim に負けた場合は確保を戻して
   * AlreadyAssigned (依頼が終端なら InvalidTransition) を返す。敗者の稼働状態は変えない。
   * 前提: ロック順は 作業者 → 依頼。
   */
  @Transactional
  public ServiceRequestRecord accept(String requestId, Actor actor) {
    return measure(
        RequestTransition.ACCEPT.value(),
        () -> {
          final ServiceRequestRecord current = requestStore.require(requestId);
          authorizationPolicy.authorizeTransition(RequestTransition.ACCEPT, actor, current);
          final String workerId = actor.id();
          workerRegistry.requireWorker(workerId);
          final Instant now = Instant.now(clock);
          if (workerRegistry.reserveFor(workerId, requestId, now).isEmpty()) {
            throw new InvalidRequestTransitionException(
                "worker " + workerId + " is not available for dispatch");
          }
          final Optional<ServiceRequestRecord> claimed =
              requestStore.claimPending(requestId, workerId, now);
          if (claimed.isEmpty()) {
            workerRegistry.releaseFrom(workerId, requestId, false, now);
            throw raceLost(requestId, workerId);
          }
          final ServiceRequestRecord accepted = claimed.get();
          requestStore.recordActivity(
              requestId, workerId, "Accepted by worker " + workerId, now);
          metrics.recordTimeToAccept(Duration.between(accepted.createdAt(), now));
          logTransition(accepted, RequestStatus.PENDING, actor);
          emit(
              RequestTransition.ACCEPT.eventType(), RequestStatus.PENDING, accepted, actor, now);
          return accepted;
        });
  }

  @Transactional
  public ServiceRequestRecord start(String requestId, Actor actor) {
    return measure(RequestTransition.START.value(), () -> startInternal(requestId, actor, false));
  }

  @Transactional
  public ServiceRequestRecord complete(String requestId, Actor actor) {
    return measure(
        RequestTransition.COMPLETE.value(),
        () -> {
          final ServiceRequestRecord current = requestStore.require(requestId);
          authorizationPolicy.authorizeTransition(RequestTransition.COMPLETE, actor, current);
          final Instant now = Instant.now(clock);
          final ServiceRequestRecord completed =
              requestStore
                  .markCompleted(requestId, actor.id(), now)
                  .orElseThrow(() -> staleTransition(requestId, RequestTransition.COMPLETE));
          workerRegistry.releaseFrom(actor.id(), requestId, true, now);
          requestStore.recordActivity(requestId, actor.id(), "Work completed", now);
          logTransition(completed, RequestStatus.IN_PROGRESS, actor);
          emit(
              RequestTransition.COMPLETE.eventType(),
              RequestStatus.IN_PROGRESS,
              completed,
              actor,
              now);
          return completed;
        });
  }

  /**
   * 役割: 終端でない依頼を取り消し、担当者がいれば割当を解除する。
   * 動作: 読み出した状態を期待値に条件付き更新する。その間に状態が進んでいれば、
   * 進んだ状態で権限を判定し直して更新を試みる。状態は単調に進むため回数は有限。
   */
  @Transactional
  public ServiceRequestRecord cancel(String requestId, Actor actor) {
    return measure(
        RequestTransition.CANCEL.value(),
        () -> {
          final Instant now = Instant.now(clock);
          while (true) {
            final ServiceRequestRecord current = requestStore.require(requestId);
            authorizationPolicy.authorizeTransition(RequestTransition.CANCEL, actor, current);
            final Optional<ServiceRequestRecord> cancelled =
                requestStore.markCancelled(requestId, current.status(), actor.id(), now);
            if (cancelled.isEmpty()) {
              logger.debug(
                  "cancel observed concurrent transition requestId={} expected={}",
                  requestId,
                  current.status());
              continue;
            }
            if (current.assignedWorkerId() != null) {
              workerRegistry.releaseFrom(current.assignedWorkerId(), requestId, false, now);
            }
            final String cancelledBy = actor.role().name().toLowerCase(Locale.ROOT);
            requestStore.recordActivity(requestId, actor.id(), "Cancelled by " + cancelledBy, now);
            logTransition(cancelled.get(), current.status(), actor);
            emit(
                RequestTransition.CANCEL.eventType(),
                current.status(),
                cancelled.get(),
                actor,
                now);
            return cancelled.get();
          }
        });
  }

  /**
   * 役割: 作業者が PENDING の依頼を辞退したことを記録する。
   * 動作: 以後その作業者の近傍一覧から除外する。状態は変えず、イベントも出さない。
   */
  @Transactional
  public WorkerDeclineRecord decline(String requestId, Actor actor, String reason) {
    authorizationPolicy.requireRole(actor, ActorRole.WORKER, "decline");
    final String normalizedReason = reason == null ? "" : reason.strip();
    RequestStore.requireMaxLength("reason", normalizedReason, MAX_DECLINE_REASON_LENGTH);
    final ServiceRequestRecord current = requestStore.require(requestId);
    if (current.status() != RequestStatus.PENDING) {
      throw new InvalidRequestTransitionException(requestId, "decline", current.status());
    }
    final Instant now = Instant.now(clock);
    final WorkerDeclineRecord record =
        new WorkerDeclineRecord(actor.id(), requestId, normalizedReason, now);
    declineRepository.upsert(record);
    requestStore.recordActivity(requestId, actor.id(), "Declined by worker " + actor.id(), now);
    logger.info("request declined requestId={} workerId={}", requestId, actor.id());
    return record;
  }

  /**
   * 役割: 担当作業者の現在地を更新する。
   * 動作: arrived=true かつ ACCEPTED なら start 遷移まで行う。
   * 前提: 依頼は ACCEPTED か IN_PROGRESS で、操作者が担当者であること。
   */
  @Transactional
  public ServiceRequestRecord reportLocation(
      String requestId, Actor actor, Coordinate location, boolean arrived) {
    authorizationPolicy.requireRole(actor, ActorRole.WORKER, "reportLocation");
    final ServiceRequestRecord current = requestStore.require(requestId);
    if (!current.status().hasAssignee()) {
      throw new InvalidRequestTransitionException(
          requestId, "report location for", current.status());
    }
    if (!current.isAssignedTo(actor.id())) {
      throw new DispatchAccessDeniedException(
          "worker " + actor.id() + " is not assigned to request " + requestId);
    }
    final Instant now = Instant.now(clock);
    workerRegistry.updateLocation(actor.id(), location, now);
    if (arrived && current.status() == RequestStatus.ACCEPTED) {
      return measure(RequestTransition.START.value(), () -> startInternal(requestId, actor, true));
    }
    return current;
  }

  // 到着の履歴は遷移が成立した場合だけ残す
  private ServiceRequestRecord startInternal(String requestId, Actor actor, boolean arrived) {
    final ServiceRequestRecord current = requestStore.require(requestId);
    authorizationPolicy.authorizeTransition(RequestTransition.START, actor, current);
    final Instant now = Instant.now(clock);
    final ServiceRequestRecord started =
        requestStore
            .markStarted(requestId, actor.id(), now)
            .orElseThrow(() -> staleTransition(requestId, RequestTransition.START));
    if (arrived) {
      requestStore.recordActivity(requestId, actor.id(), "Worker arrived", now);
    }
    requestStore.recordActivity(requestId, actor.id(), "Work started", now);
    logTransition(started, RequestStatus.ACCEPTED, actor);
    emit(RequestTransition.START.eventType(), RequestStatus.ACCEPTED, started, actor, now);
    return started;
  }

  private DispatchException raceLost(String requestId, String workerId) {
    metrics.recordRaceLost();
    final ServiceRequestRecord latest = requestStore.require(requestId);
    logger.debug(
        "accept race lost requestId={} workerId={} status={} assignedWorkerId={}",
        requestId,
        workerId,
        latest.status(),
        latest.assignedWorkerId());
    if (latest.status().isTerminal()) {
      return new InvalidRequestTransitionException(requestId, "accept", latest.status());
    }
    return new RequestAlreadyAssignedException(requestId);
  }

  // 条件付き更新が 0 件だった場合、最新の状態を読み直して失敗理由にする
  private InvalidRequestTransitionException staleTransition(
      String requestId, RequestTransition transition) {
    final ServiceRequestRecord latest = requestStore.require(requestId);
    return new InvalidRequestTransitionException(requestId, transition.value(), latest.status());
  }

  private ServiceRequestRecord measure(String operation, Supplier<ServiceRequestRecord> action) {
    try {
      final ServiceRequestRecord result = action.get();
      metrics.recordTransition(operation, DispatchMetrics.RESULT_SUCCESS);
      return result;
    } catch (DispatchException ex) {
      metrics.recordTransition(operation, ex.errorCode().metricTag());
      throw ex;
    }
  }

  private void logTransition(ServiceRequestRecord updated, RequestStatus from, Actor actor) {
    logger.info(
        "request transition requestId={} from={} to={} actor={} role={}",
        updated.requestId(),
        from,
        updated.status(),
        actor.id(),
        actor.role());
  }

  private void emit(
      LifecycleEventType type,
      RequestStatus from,
      ServiceRequestRecord updated,
      Actor actor,
      Instant at) {
    eventEmitter.emit(
        new RequestLifecycleEvent(
            UUID.randomUUID().toString(),
            type,
            updated.requestId(),
            updated.referenceCode(),
            from,
            updated.status(),
            actor,
            updated.customerId(),
            updated.lastAssignedWorkerId(),
            updated.priority(),
            updated.location(),
            at));
  }
}
