package com.fieldservice.dispatch.model;

import java.time.Instant;

/** workerLocation が未報告の場合 distanceKm は null。 */
public record WorkerTracking(
    String requestId,
    String workerId,
    Coordinate workerLocation,
    Coordinate jobLocation,
    Double distanceKm,
    Instant workerUpdatedAt) {}
