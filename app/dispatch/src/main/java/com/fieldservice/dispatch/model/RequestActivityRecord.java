package com.fieldservice.dispatch.model;

import java.time.Instant;

public record RequestActivityRecord(
    String requestId, String actorId, String message, Instant createdAt) {}
