/*
 * どこで: common のイベント payload 定義
 * 何を: 依頼ライフサイクルイベントの配信形を共通レコードとして提供する
 * なぜ: 通知側がストアを再参照せずに通知文面を組み立てられるようにするため
 */
package com.fieldservice.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RequestLifecycleEventPayload(
    String eventId,
    String eventType,
    String occurredAt,
    String requestId,
    String referenceCode,
    String fromStatus,
    String toStatus,
    String actorId,
    String actorRole,
    String customerId,
    String workerId,
    String priority,
    double latitude,
    double longitude,
    String traceId) {}
