package com.fieldservice.dispatch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldservice.common.TraceIds;
import com.fieldservice.common.event.RequestLifecycleEventPayload;
import com.fieldservice.dispatch.config.DispatchNatsProperties;
import com.fieldservice.dispatch.model.RequestLifecycleEvent;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.JetStream;
import io.nats.client.impl.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsLifecycleEventPublisher implements LifecycleEventPublisher {

  private static final Logger logger = LoggerFactory.getLogger(NatsLifecycleEventPublisher.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "JetStream は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final JetStream jetStream;

  private final DispatchNatsProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final DispatchMetrics metrics;

  public NatsLifecycleEventPublisher(
      JetStream jetStream,
      DispatchNatsProperties properties,
      ObjectMapper objectMapper,
      DispatchMetrics metrics) {
    this.jetStream = jetStream;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.metrics = metrics;
  }

  @Override
  public void publish(RequestLifecycleEvent event) {
    final byte[] body = serialize(toPayload(event));
    final Headers headers = new Headers();
    // stream の duplicate window 内で同じ eventId の再送を重複排除させる
    headers.add("Nats-Msg-Id", event.eventId());
    jetStream
        .publishAsync(properties.subject(), headers, body)
        .whenComplete(
            (ack, ex) -> {
              if (ex != null) {
                logger.warn(
                    "lifecycle event publish failed eventId={} type={} requestId={}",
                    event.eventId(),
                    event.eventType(),
                    event.requestId(),
                    ex);
                metrics.recordPublishError(event.eventType().name());
              }
            });
  }

  private RequestLifecycleEventPayload toPayload(RequestLifecycleEvent event) {
    return new RequestLifecycleEventPayload(
        event.eventId(),
        event.eventType().name(),
        event.occurredAt().toString(),
        event.requestId(),
        event.referenceCode(),
        event.fromStatus() == null ? null : event.fromStatus().name(),
        event.toStatus().name(),
        event.actor().id(),
        event.actor().role().name(),
        event.customerId(),
        event.workerId(),
        event.priority().name(),
        event.location().latitude(),
        event.location().longitude(),
        TraceIds.currentOrNew());
  }

  private byte[] serialize(RequestLifecycleEventPayload payload) {
    try {
      return objectMapper.writeValueAsBytes(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize lifecycle event", ex);
    }
  }
}
