package com.fieldservice.dispatch.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldservice.dispatch.config.DispatchNatsProperties;
import com.fieldservice.dispatch.model.Actor;
import com.fieldservice.dispatch.model.Coordinate;
import com.fieldservice.dispatch.model.LifecycleEventType;
import com.fieldservice.dispatch.model.RequestLifecycleEvent;
import com.fieldservice.dispatch.model.RequestPriority;
import com.fieldservice.dispatch.model.RequestStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.nats.client.JetStream;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.slf4j.MDC;

class NatsLifecycleEventPublisherTest {

  private static final DispatchNatsProperties PROPERTIES =
      new DispatchNatsProperties(
          "dispatch.request.lifecycle", "dispatch-request-lifecycle", Duration.ofMinutes(2));

  private static final RequestLifecycleEvent CREATED =
      new RequestLifecycleEvent(
          "event-1",
          LifecycleEventType.REQUEST_CREATED,
          "req-1",
          "ABCDEF012345",
          null,
          RequestStatus.PENDING,
          Actor.customer("c-1"),
          "c-1",
          null,
          RequestPriority.EMERGENCY,
          new Coordinate(35.5, 139.25),
          Instant.parse("2026-03-01T09:00:00Z"));

  private final ObjectMapper objectMapper = new ObjectMapper();
  private JetStream jetStream;
  private SimpleMeterRegistry registry;
  private NatsLifecycleEventPublisher publisher;

  @BeforeEach
  void setUp() {
    jetStream = Mockito.mock(JetStream.class);
    registry = new SimpleMeterRegistry();
    publisher =
        new NatsLifecycleEventPublisher(
            jetStream, PROPERTIES, objectMapper, new DispatchMetrics(registry));
  }

  @Test
  void publishesSnakeCasePayloadWithMessageId() throws Exception {
    when(jetStream.publishAsync(any(String.class), any(Headers.class), any(byte[].class)))
        .thenReturn(CompletableFuture.completedFuture(Mockito.mock(PublishAck.class)));
    MDC.put("trace_id", "trace-123");
    try {
      publisher.publish(CREATED);
    } finally {
      MDC.remove("trace_id");
    }

    final ArgumentCaptor<Headers> headers = ArgumentCaptor.forClass(Headers.class);
    final ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
    verify(jetStream)
        .publishAsync(eq("dispatch.request.lifecycle"), headers.capture(), body.capture());

    assertThat(headers.getValue().getFirst("Nats-Msg-Id")).isEqualTo("event-1");
    final JsonNode json = objectMapper.readTree(body.getValue());
    assertThat(json.get("event_type").asText()).isEqualTo("REQUEST_CREATED");
    assertThat(json.get("request_id").asText()).isEqualTo("req-1");
    assertThat(json.get("from_status").isNull()).isTrue();
    assertThat(json.get("to_status").asText()).isEqualTo("PENDING");
    assertThat(json.get("actor_role").asText()).isEqualTo("CUSTOMER");
    assertThat(json.get("priority").asText()).isEqualTo("EMERGENCY");
    assertThat(json.get("latitude").asDouble()).isEqualTo(35.5);
    assertThat(json.get("trace_id").asText()).isEqualTo("trace-123");
  }

  @Test
  void failedAckIsCounted() {
    when(jetStream.publishAsync(any(String.class), any(Headers.class), any(byte[].class)))
        .thenReturn(CompletableFuture.failedFuture(new IOException("timeout")));

    publisher.publish(CREATED);

    assertThat(
            registry
                .get("dispatch.event.publish.error.total")
                .tag("event_type", "REQUEST_CREATED")
                .counter()
                .count())
        .isEqualTo(1.0);
  }
}
