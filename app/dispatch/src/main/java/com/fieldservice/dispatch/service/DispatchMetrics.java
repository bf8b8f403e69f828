package com.fieldservice.dispatch.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class DispatchMetrics {

  public static final String RESULT_SUCCESS = "success";

  private final MeterRegistry meterRegistry;
  private final Counter raceLostCounter;
  private final Timer timeToAcceptTimer;
  private final ConcurrentMap<String, Counter> transitionCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> publishErrorCounters = new ConcurrentHashMap<>();

  public DispatchMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.raceLostCounter =
        Counter.builder("dispatch.accept.race_lost.total")
            .description("Accept attempts that lost the claim on a pending request")
            .register(meterRegistry);
    this.timeToAcceptTimer =
        Timer.builder("dispatch.time_to_accept")
            .description("Time from request creation to acceptance")
            .register(meterRegistry);
  }

  public void recordTransition(String transition, String result) {
    transitionCounters
        .computeIfAbsent(transition + "|" + result, key -> registerTransitionCounter(transition, result))
        .increment();
  }

  public void recordRaceLost() {
    raceLostCounter.increment();
  }

  public void recordTimeToAccept(Duration duration) {
    if (duration.isNegative()) {
      return;
    }
    timeToAcceptTimer.record(duration);
  }

  public void recordPublishError(String eventType) {
    publishErrorCounters
        .computeIfAbsent(eventType, this::registerPublishErrorCounter)
        .increment();
  }

  private Counter registerTransitionCounter(String transition, String result) {
    return Counter.builder("dispatch.transition.total")
        .tags(Tags.of("transition", transition, "result", result))
        .register(meterRegistry);
  }

  private Counter registerPublishErrorCounter(String eventType) {
    return Counter.builder("dispatch.event.publish.error.total")
        .tags(Tags.of("event_type", eventType))
        .register(meterRegistry);
  }
}
