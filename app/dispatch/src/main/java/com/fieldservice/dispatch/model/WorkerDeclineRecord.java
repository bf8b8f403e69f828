package com.fieldservice.dispatch.model;

import java.time.Instant;

public record WorkerDeclineRecord(
    String workerId, String requestId, String reason, Instant declinedAt) {}
