/*
 * どこで: Dispatch ドメインモデル
 * 何を: 依頼ライフサイクルの状態を定義する
 * なぜ: 遷移表と永続化の値を一致させるため
 */
package com.fieldservice.dispatch.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public enum RequestStatus {
  PENDING,
  ACCEPTED,
  IN_PROGRESS,
  COMPLETED,
  CANCELLED;

  public static final Set<RequestStatus> OPEN =
      Collections.unmodifiableSet(EnumSet.of(PENDING, ACCEPTED, IN_PROGRESS));
  public static final Set<RequestStatus> ACTIVE_ASSIGNMENT =
      Collections.unmodifiableSet(EnumSet.of(ACCEPTED, IN_PROGRESS));
  public static final Set<RequestStatus> FINISHED =
      Collections.unmodifiableSet(EnumSet.of(COMPLETED, CANCELLED));

  public boolean isTerminal() {
    return FINISHED.contains(this);
  }

  public boolean hasAssignee() {
    return ACTIVE_ASSIGNMENT.contains(this);
  }
}
