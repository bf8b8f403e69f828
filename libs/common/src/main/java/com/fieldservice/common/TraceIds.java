package com.fieldservice.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** MDC の trace_id (旧 traceId) を優先し、無ければ新規採番する。 */
  public static String currentOrNew() {
    final String traceId = MDC.get("trace_id");
    if (traceId != null && !traceId.isBlank()) {
      return traceId;
    }
    final String legacyTraceId = MDC.get("traceId");
    if (legacyTraceId != null && !legacyTraceId.isBlank()) {
      return legacyTraceId;
    }
    return newTraceId();
  }
}
