package com.fieldservice.dispatch.repository;

import com.fieldservice.dispatch.model.RequestActivityRecord;
import java.util.List;

/** 依頼ごとの追記専用の履歴。更新・削除の操作は持たない。 */
public interface RequestActivityRepository {

  void append(RequestActivityRecord record);

  /** 役割: 依頼の履歴を古い順に返す。 */
  List<RequestActivityRecord> findByRequestId(String requestId);
}
