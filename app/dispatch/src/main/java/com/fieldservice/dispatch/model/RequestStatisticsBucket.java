package com.fieldservice.dispatch.model;

/** status × priority 単位の集計行。totalMillisToAccept は acceptedAt を持つ依頼のみの合計。 */
public record RequestStatisticsBucket(
    RequestStatus status,
    RequestPriority priority,
    long count,
    long acceptedCount,
    long totalMillisToAccept) {}
