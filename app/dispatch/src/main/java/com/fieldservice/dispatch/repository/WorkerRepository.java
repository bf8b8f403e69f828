/*
 * どこで: Dispatch Repository 層
 * 何を: 作業者の稼働可否・位置・割当の永続化を抽象化する
 * なぜ: 作業者単位の条件付き更新で割当の排他を保証するため
 */
package com.fieldservice.dispatch.repository;

import com.fieldservice.dispatch.geo.BoundingBox;
import com.fieldservice.dispatch.model.Coordinate;
import com.fieldservice.dispatch.model.WorkerRanking;
import com.fieldservice.dispatch.model.WorkerRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface WorkerRepository {

  Optional<WorkerRecord> findById(String workerId);

  /**
   * 役割: 作業者プロフィール (対応半径・カテゴリ) を登録/更新する。
   * 動作: 未登録なら available=false で作成し、登録済みなら稼働状態と割当は変更しない。
   */
  WorkerRecord upsertProfile(
      String workerId, double serviceRadiusKm, String category, Instant updatedAt);

  /**
   * 役割: 本人の明示的な稼働可否を反映する。
   * 動作: 未登録なら作成する。割当中は available=false のまま resumeAvailable だけを更新する。
   * location が null なら位置は変更しない。
   */
  WorkerRecord updateAvailability(
      String workerId,
      boolean available,
      Coordinate location,
      double defaultServiceRadiusKm,
      Instant updatedAt);

  Optional<WorkerRecord> updateLocation(String workerId, Coordinate location, Instant updatedAt);

  /**
   * 役割: 作業者を requestId の担当として確保する。
   * 動作: available=true かつ未割当のときだけ available=false と currentRequestId を設定する。条件を満たさなければ empty。
   */
  Optional<WorkerRecord> reserve(String workerId, String requestId, Instant updatedAt);

  /**
   * 役割: requestId の割当を解除する。
   * 動作: currentRequestId が一致するときだけ解除し、available を resumeAvailable へ戻す。
   * completed=true なら completedJobs を加算する。
   */
  Optional<WorkerRecord> release(
      String workerId, String requestId, boolean completed, Instant updatedAt);

  /**
   * 役割: 矩形内に位置があり、割当なしで available な作業者を返す。
   * 動作: 矩形は候補の絞り込み専用で、距離と対応半径の判定は呼び出し側で行う。
   */
  List<WorkerRecord> findAvailableWithin(BoundingBox box);

  /** 役割: 稼働中 (available または割当あり) の作業者数を返す。 */
  long countActive();

  List<WorkerRanking> findTopByCompletedJobs(int limit);
}
