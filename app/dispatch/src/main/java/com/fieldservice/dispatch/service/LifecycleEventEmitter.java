/*
 * どこで: Dispatch サービス層
 * 何を: 遷移確定後にライフサイクルイベントを publisher へ渡す
 * なぜ: 配信失敗で遷移を巻き戻さず、ロールバックされた遷移のイベントも出さないため
 */
package com.fieldservice.dispatch.service;

import com.fieldservice.dispatch.model.RequestLifecycleEvent;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

@Component
@RequiredArgsConstructor
public class LifecycleEventEmitter {

  private static final Logger logger = LoggerFactory.getLogger(LifecycleEventEmitter.class);

  private final LifecycleEventPublisher publisher;
  private final DispatchMetrics metrics;

  public void emit(RequestLifecycleEvent event) {
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      // commit 前に publish すると、ロールバック時に存在しない遷移を通知してしまう
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              publishQuietly(event);
            }
          });
      return;
    }
    publishQuietly(event);
  }

  private void publishQuietly(RequestLifecycleEvent event) {
    try {
      publisher.publish(event);
    } catch (RuntimeException ex) {
      // 通知は fire-and-forget。遷移は確定済みのため呼び出し側へは伝播しない
      logger.warn(
          "lifecycle event publish failed eventId={} type={} requestId={}",
          event.eventId(),
          event.eventType(),
          event.requestId(),
          ex);
      metrics.recordPublishError(event.eventType().name());
    }
  }
}
