package com.fieldservice.dispatch.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class DispatchMetricsTest {

  @Test
  void recordsTransitionsRacesAndPublishErrors() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final DispatchMetrics metrics = new DispatchMetrics(registry);

    metrics.recordTransition("accept", DispatchMetrics.RESULT_SUCCESS);
    metrics.recordTransition("accept", DispatchMetrics.RESULT_SUCCESS);
    metrics.recordTransition("cancel", "forbidden");
    metrics.recordRaceLost();
    metrics.recordTimeToAccept(Duration.ofSeconds(30));
    metrics.recordPublishError("REQUEST_ACCEPTED");

    final double accepted =
        registry
            .get("dispatch.transition.total")
            .tags("transition", "accept", "result", "success")
            .counter()
            .count();
    final double forbidden =
        registry
            .get("dispatch.transition.total")
            .tags("transition", "cancel", "result", "forbidden")
            .counter()
            .count();
    final double raceLost = registry.get("dispatch.accept.race_lost.total").counter().count();
    final double publishErrors =
        registry
            .get("dispatch.event.publish.error.total")
            .tag("event_type", "REQUEST_ACCEPTED")
            .counter()
            .count();

    assertThat(accepted).isEqualTo(2.0);
    assertThat(forbidden).isEqualTo(1.0);
    assertThat(raceLost).isEqualTo(1.0);
    assertThat(publishErrors).isEqualTo(1.0);
    assertThat(registry.get("dispatch.time_to_accept").timer().count()).isEqualTo(1L);
  }

  @Test
  void ignoresNegativeTimeToAccept() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final DispatchMetrics metrics = new DispatchMetrics(registry);

    metrics.recordTimeToAccept(Duration.ofSeconds(-1));

    assertThat(registry.get("dispatch.time_to_accept").timer().count()).isZero();
  }
}
