/*
 * どこで: Dispatch サービス層
 * 何を: 作業者の近くにある PENDING 依頼を優先度・距離・作成順で並べて返す。依頼側からは対応可能な作業者を距離順で返す
 * なぜ: 状態を変えない読み取り専用のビューとして、問い合わせのたびに最新のストアから計算するため
 */
package com.fieldservice.dispatch.service;

import com.fieldservice.dispatch.config.DispatchMatchingProperties;
import com.fieldservice.dispatch.exception.InvalidDispatchRequestException;
import com.fieldservice.dispatch.exception.InvalidRequestTransitionException;
import com.fieldservice.dispatch.geo.GeoDistance;
import com.fieldservice.dispatch.model.Actor;
import com.fieldservice.dispatch.model.ActorRole;
import com.fieldservice.dispatch.model.Coordinate;
import com.fieldservice.dispatch.model.MatchCandidate;
import com.fieldservice.dispatch.model.RequestStatus;
import com.fieldservice.dispatch.model.ServiceRequestRecord;
import com.fieldservice.dispatch.model.WorkerCandidate;
import com.fieldservice.dispatch.model.WorkerRecord;
import com.fieldservice.dispatch.repository.WorkerDeclineRepository;
import com.google.common.annotations.VisibleForTesting;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RequestMatcher {

  private static final Logger logger = LoggerFactory.getLogger(RequestMatcher.class);

  private final RequestStore requestStore;
  private final WorkerRegistry workerRegistry;
  private final WorkerDeclineRepository declineRepository;
  private final DispatchAuthorizationPolicy authorizationPolicy;
  private final DispatchMatchingProperties properties;

  /**
   * 役割: 問い合わせた作業者向けの候補依頼を返す。
   * 動作: location が null なら登録済みの位置を使い、どちらも無ければ空。
   * radiusKm が null なら作業者の対応半径を使い、上限半径で丸める。辞退済みの依頼は除く。
   * 前提: 返すリストは呼び出し時点のスナップショットで、以後の accept は改めて検証される。
   */
  public List<MatchCandidate> listNearbyPending(Actor actor, Coordinate location, Double radiusKm) {
    authorizationPolicy.requireRole(actor, ActorRole.WORKER, "listNearbyPending");
    final WorkerRecord worker = workerRegistry.requireWorker(actor.id());
    final Coordinate origin = location != null ? location : worker.location();
    if (origin == null) {
      logger.debug("nearby lookup skipped, location unknown workerId={}", actor.id());
      return List.of();
    }
    final double radius = resolveRadius(radiusKm, worker);
    final Set<String> declined = declineRepository.findRequestIdsByWorker(actor.id());
    final List<MatchCandidate> candidates =
        rank(
            origin,
            radius,
            worker.category(),
            declined,
            requestStore.findPendingWithin(GeoDistance.boundingBox(origin, radius)),
            properties.maxResults());
    logger.debug(
        "nearby lookup workerId={} radiusKm={} candidates={}",
        actor.id(),
        radius,
        candidates.size());
    return candidates;
  }

  /**
   * 役割: PENDING の依頼に対応できる作業者を近い順に返す。
   * 動作: 割当なしで available かつ位置が分かる作業者のうち、依頼までの距離が各自の対応半径
   * (上限半径で丸める) 以内のものを残す。カテゴリ不一致とこの依頼を辞退した作業者は除く。
   * 前提: 操作者は依頼を作成した顧客か管理者。
   */
  public List<WorkerCandidate> rankWorkersFor(Actor actor, String requestId) {
    final ServiceRequestRecord request = requestStore.require(requestId);
    authorizationPolicy.requireOwnerOrAdmin(actor, request, "rank workers");
    if (request.status() != RequestStatus.PENDING) {
      throw new InvalidRequestTransitionException(requestId, "rank workers for", request.status());
    }
    final Set<String> declined = declineRepository.findWorkerIdsByRequest(requestId);
    final List<WorkerCandidate> candidates =
        workerRegistry
            .findAvailableWithin(
                GeoDistance.boundingBox(request.location(), properties.maxRadiusKm()))
            .stream()
            .filter(worker -> worker.available() && worker.location() != null)
            .filter(worker -> !declined.contains(worker.workerId()))
            .filter(worker -> matchesCategory(worker.category(), request.category()))
            .map(
                worker ->
                    new WorkerCandidate(
                        worker, GeoDistance.distanceKm(request.location(), worker.location())))
            .filter(candidate -> candidate.distanceKm() <= resolveRadius(null, candidate.worker()))
            .sorted(WorkerCandidate.RANKING)
            .limit(properties.maxResults())
            .toList();
    logger.debug("worker ranking requestId={} candidates={}", requestId, candidates.size());
    return candidates;
  }

  @VisibleForTesting
  double resolveRadius(Double requestedKm, WorkerRecord worker) {
    if (requestedKm != null) {
      if (requestedKm.isNaN() || requestedKm <= 0) {
        throw new InvalidDispatchRequestException("radius must be positive");
      }
      return properties.clampRadius(requestedKm);
    }
    if (worker.serviceRadiusKm() > 0) {
      return properties.clampRadius(worker.serviceRadiusKm());
    }
    return properties.clampRadius(properties.defaultRadiusKm());
  }

  /**
   * 役割: 候補を距離で絞り込み、優先度の降順 → 距離の昇順 → 作成日時の昇順で並べる。
   * 動作: 作業者にカテゴリがある場合、同じカテゴリかカテゴリ無しの依頼だけを残す。
   */
  @VisibleForTesting
  static List<MatchCandidate> rank(
      Coordinate origin,
      double radiusKm,
      String workerCategory,
      Set<String> excludedRequestIds,
      Collection<ServiceRequestRecord> pending,
      int limit) {
    return pending.stream()
        .filter(request -> request.status() == RequestStatus.PENDING)
        .filter(request -> !excludedRequestIds.contains(request.requestId()))
        .filter(request -> matchesCategory(workerCategory, request.category()))
        .map(request -> new MatchCandidate(request, GeoDistance.distanceKm(origin, request.location())))
        .filter(candidate -> candidate.distanceKm() <= radiusKm)
        .sorted(MatchCandidate.RANKING)
        .limit(limit)
        .toList();
  }

  private static boolean matchesCategory(String workerCategory, String requestCategory) {
    return workerCategory == null
        || requestCategory == null
        || workerCategory.equalsIgnoreCase(requestCategory);
  }
}
