package com.fieldservice.dispatch.model;

public record WorkerRanking(String workerId, long completedJobs) {}
