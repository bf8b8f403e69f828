/*
 * どこで: Dispatch ドメインモデル
 * 何を: 成功した状態遷移 1 件を不変レコードとして表す
 * なぜ: 通知側がストアを再参照せずに通知を組み立てられるようにするため
 */
package com.fieldservice.dispatch.model;

import java.time.Instant;

/** fromStatus は依頼作成イベントでのみ null。 */
public record RequestLifecycleEvent(
    String eventId,
    LifecycleEventType eventType,
    String requestId,
    String referenceCode,
    RequestStatus fromStatus,
    RequestStatus toStatus,
    Actor actor,
    String customerId,
    String workerId,
    RequestPriority priority,
    Coordinate location,
    Instant occurredAt) {}
