/*
 * どこで: Dispatch サービス層
 * 何を: NATS 無効時にイベントをログへ出すだけの publisher を提供する
 * なぜ: ローカル/テストで NATS なしでもエンジンを起動可能にするため
 */
package com.fieldservice.dispatch.service;

import com.fieldservice.dispatch.model.RequestLifecycleEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class LoggingLifecycleEventPublisher implements LifecycleEventPublisher {

  private static final Logger logger = LoggerFactory.getLogger(LoggingLifecycleEventPublisher.class);

  @Override
  public void publish(RequestLifecycleEvent event) {
    logger.info(
        "lifecycle event eventId={} type={} requestId={} from={} to={} actor={}",
        event.eventId(),
        event.eventType(),
        event.requestId(),
        event.fromStatus(),
        event.toStatus(),
        event.actor().id());
  }
}
