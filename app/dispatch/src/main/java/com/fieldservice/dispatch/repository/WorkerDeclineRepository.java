package com.fieldservice.dispatch.repository;

import com.fieldservice.dispatch.model.WorkerDeclineRecord;
import java.util.List;
import java.util.Set;

public interface WorkerDeclineRepository {

  /** 役割: 辞退を記録する。 動作: 同じ作業者・依頼の組が既にあれば理由と時刻を更新する。 */
  void upsert(WorkerDeclineRecord record);

  Set<String> findRequestIdsByWorker(String workerId);

  Set<String> findWorkerIdsByRequest(String requestId);

  /** 役割: 作業者の辞退履歴を新しい順に返す。 */
  List<WorkerDeclineRecord> findByWorker(String workerId);
}
