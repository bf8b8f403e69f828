/*
 * どこで: Dispatch Repository 層
 * 何を: 依頼の保存・条件付き遷移 (claim)・範囲検索を抽象化する
 * なぜ: 遷移の原子性をストア側の 1 操作に閉じ込め、実装 (JDBC / in-memory) を差し替え可能にするため
 */
package com.fieldservice.dispatch.repository;

import com.fieldservice.dispatch.geo.BoundingBox;
import com.fieldservice.dispatch.model.RequestStatisticsBucket;
import com.fieldservice.dispatch.model.RequestStatus;
import com.fieldservice.dispatch.model.ServiceRequestRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface ServiceRequestRepository {

  /**
   * 役割: 新規依頼を保存する。
   * 動作: referenceCode が既に使われていれば保存せず false を返す。
   * 前提: requestId は未使用であること。
   */
  boolean insert(ServiceRequestRecord record);

  Optional<ServiceRequestRecord> findById(String requestId);

  /**
   * 役割: PENDING の依頼を workerId に割り当てる。
   * 動作: status=PENDING のときだけ ACCEPTED へ更新し、更新後の record を返す。既に PENDING でなければ empty。
   * 前提: 読んでから書くのではなく、1 回の条件付き更新で判定すること。
   */
  Optional<ServiceRequestRecord> claimPending(String requestId, String workerId, Instant acceptedAt);

  /** 役割: ACCEPTED → IN_PROGRESS。 動作: 担当者が workerId と一致しない、または状態が違えば empty。 */
  Optional<ServiceRequestRecord> markStarted(String requestId, String workerId, Instant startedAt);

  /** 役割: IN_PROGRESS → COMPLETED。 動作: 担当者を外し、lastAssignedWorkerId は残す。 */
  Optional<ServiceRequestRecord> markCompleted(
      String requestId, String workerId, Instant completedAt);

  /**
   * 役割: 依頼を取り消す。
   * 動作: status が expectedStatus のままのときだけ CANCELLED へ更新する。
   * 前提: expectedStatus は終端状態でないこと。
   */
  Optional<ServiceRequestRecord> markCancelled(
      String requestId, RequestStatus expectedStatus, String actorId, Instant cancelledAt);

  /** 役割: 矩形内の PENDING 依頼を返す。 動作: 順序は保証しない。距離の最終判定は呼び出し側が行う。 */
  List<ServiceRequestRecord> findPendingWithin(BoundingBox box);

  /** 役割: 顧客の依頼を新しい順に返す。 動作: statuses が空なら全状態を対象にする。 */
  List<ServiceRequestRecord> findByCustomer(String customerId, Set<RequestStatus> statuses);

  /** 役割: 作業者が (最後に) 担当した依頼を新しい順に返す。 動作: statuses が空なら全状態を対象にする。 */
  List<ServiceRequestRecord> findByWorker(String workerId, Set<RequestStatus> statuses);

  /** 役割: status × priority ごとの件数と受諾までの所要時間の合計を返す。 */
  List<RequestStatisticsBucket> summarizeStatistics();
}
