/*
 * どこで: Dispatch サービス層
 * 何を: 依頼・履歴・担当者位置の参照ビューを提供する
 * なぜ: 参照権の判定を遷移と同じ policy に寄せ、ストアへの直接アクセスを避けるため
 */
package com.fieldservice.dispatch.service;

import com.fieldservice.dispatch.exception.InvalidRequestTransitionException;
import com.fieldservice.dispatch.geo.GeoDistance;
import com.fieldservice.dispatch.model.Actor;
import com.fieldservice.dispatch.model.ActorRole;
import com.fieldservice.dispatch.model.RequestActivityRecord;
import com.fieldservice.dispatch.model.RequestStatus;
import com.fieldservice.dispatch.model.ServiceRequestRecord;
import com.fieldservice.dispatch.model.WorkerDeclineRecord;
import com.fieldservice.dispatch.model.WorkerRecord;
import com.fieldservice.dispatch.model.WorkerTracking;
import com.fieldservice.dispatch.repository.WorkerDeclineRepository;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RequestQueryService {

  private final RequestStore requestStore;
  private final WorkerRegistry workerRegistry;
  private final WorkerDeclineRepository declineRepository;
  private final DispatchAuthorizationPolicy authorizationPolicy;

  public ServiceRequestRecord getRequest(Actor actor, String requestId) {
    final ServiceRequestRecord request = requestStore.require(requestId);
    authorizationPolicy.requireViewer(actor, request);
    return request;
  }

  public List<RequestActivityRecord> getActivity(Actor actor, String requestId) {
    getRequest(actor, requestId);
    return requestStore.history(requestId);
  }

  /** statuses が空なら全状態。 */
  public List<ServiceRequestRecord> listCustomerRequests(Actor actor, Set<RequestStatus> statuses) {
    authorizationPolicy.requireRole(actor, ActorRole.CUSTOMER, "listCustomerRequests");
    return requestStore.findByCustomer(actor.id(), statuses);
  }

  public List<ServiceRequestRecord> listActiveJobs(Actor actor) {
    authorizationPolicy.requireRole(actor, ActorRole.WORKER, "listActiveJobs");
    return requestStore.findByWorker(actor.id(), RequestStatus.ACTIVE_ASSIGNMENT);
  }

  public List<ServiceRequestRecord> listCompletedJobs(Actor actor) {
    authorizationPolicy.requireRole(actor, ActorRole.WORKER, "listCompletedJobs");
    return requestStore.findByWorker(actor.id(), EnumSet.of(RequestStatus.COMPLETED));
  }

  public List<WorkerDeclineRecord> listDeclined(Actor actor) {
    authorizationPolicy.requireRole(actor, ActorRole.WORKER, "listDeclined");
    return declineRepository.findByWorker(actor.id());
  }

  /**
   * 役割: 依頼の担当作業者の現在地と、現場までの直線距離を返す。
   * 動作: 担当者がいなければ InvalidTransition。位置が未報告なら距離は null。
   */
  public WorkerTracking trackAssignedWorker(Actor actor, String requestId) {
    final ServiceRequestRecord request = getRequest(actor, requestId);
    if (request.assignedWorkerId() == null) {
      throw new InvalidRequestTransitionException(requestId, "track", request.status());
    }
    final WorkerRecord worker = workerRegistry.requireWorker(request.assignedWorkerId());
    final Double distanceKm =
        worker.location() == null
            ? null
            : GeoDistance.distanceKm(worker.location(), request.location());
    return new WorkerTracking(
        requestId,
        worker.workerId(),
        worker.location(),
        request.location(),
        distanceKm,
        worker.updatedAt());
  }
}
