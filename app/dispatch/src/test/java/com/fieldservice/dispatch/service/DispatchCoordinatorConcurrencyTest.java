/*
 * どこで: Dispatch 状態遷移の並行性テスト
 * 何を: 同じ依頼への同時 accept で勝者が 1 人だけになることを検証する
 * なぜ: 二重割当と、敗者の作業者が確保されたまま残る状態を防ぐため
 */
package com.fieldservice.dispatch.service;

import static com.fieldservice.dispatch.service.DispatchFixture.ORIGIN;
import static com.fieldservice.dispatch.service.DispatchFixture.north;
import static org.assertj.core.api.Assertions.assertThat;

import com.fieldservice.dispatch.exception.RequestAlreadyAssignedException;
import com.fieldservice.dispatch.model.Actor;
import com.fieldservice.dispatch.model.MatchCandidate;
import com.fieldservice.dispatch.model.RequestPriority;
import com.fieldservice.dispatch.model.RequestStatus;
import com.fieldservice.dispatch.model.ServiceRequestRecord;
import com.fieldservice.dispatch.model.WorkerRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class DispatchCoordinatorConcurrencyTest {

  private static final int WORKERS = 8;

  @Test
  void concurrentAcceptsProduceExactlyOneWinner() throws Exception {
    final DispatchFixture fixture = new DispatchFixture();
    final ServiceRequestRecord request =
        fixture.createRequest("c-1", RequestPriority.EMERGENCY, north(ORIGIN, 1.0));
    for (int i = 0; i < WORKERS; i++) {
      fixture.onlineWorker("w-" + i, north(ORIGIN, 0.1 * i));
    }

    final CountDownLatch ready = new CountDownLatch(WORKERS);
    final CountDownLatch go = new CountDownLatch(1);
    final AtomicInteger alreadyAssigned = new AtomicInteger();
    final ExecutorService executor = Executors.newFixedThreadPool(WORKERS);
    final List<Future<String>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < WORKERS; i++) {
        final Actor worker = Actor.worker("w-" + i);
        futures.add(
            executor.submit(
                () -> {
                  ready.countDown();
                  go.await();
                  try {
                    return fixture.coordinator.accept(request.requestId(), worker)
                        .assignedWorkerId();
                  } catch (RequestAlreadyAssignedException ex) {
                    alreadyAssigned.incrementAndGet();
                    return null;
                  }
                }));
      }
      assertThat(ready.await(5, TimeUnit.SECONDS)).isTrue();
      go.countDown();

      final List<String> winners = new ArrayList<>();
      for (Future<String> future : futures) {
        final String winner = future.get(10, TimeUnit.SECONDS);
        if (winner != null) {
          winners.add(winner);
        }
      }

      assertThat(winners).hasSize(1);
      assertThat(alreadyAssigned.get()).isEqualTo(WORKERS - 1);

      final ServiceRequestRecord stored = fixture.requestStore.require(request.requestId());
      assertThat(stored.status()).isEqualTo(RequestStatus.ACCEPTED);
      assertThat(stored.assignedWorkerId()).isEqualTo(winners.get(0));

      for (int i = 0; i < WORKERS; i++) {
        final WorkerRecord worker = fixture.workerRegistry.requireWorker("w-" + i);
        if (worker.workerId().equals(winners.get(0))) {
          assertThat(worker.available()).isFalse();
          assertThat(worker.currentRequestId()).isEqualTo(request.requestId());
        } else {
          // 敗者は確保されたまま残らない
          assertThat(worker.available()).isTrue();
          assertThat(worker.currentRequestId()).isNull();
          assertThat(fixture.matcher.listNearbyPending(Actor.worker(worker.workerId()), null, null))
              .extracting(MatchCandidate::requestId)
              .doesNotContain(request.requestId());
        }
      }
      assertThat(fixture.events).filteredOn(event -> event.toStatus() == RequestStatus.ACCEPTED)
          .hasSize(1);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void cancelRacingWithAcceptLeavesConsistentState() throws Exception {
    final DispatchFixture fixture = new DispatchFixture();
    final ServiceRequestRecord request =
        fixture.createRequest("c-1", RequestPriority.STANDARD, north(ORIGIN, 1.0));
    fixture.onlineWorker("w-1", ORIGIN);

    final CountDownLatch go = new CountDownLatch(1);
    final ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      final Future<?> accept =
          executor.submit(
              () -> {
                go.await();
                try {
                  fixture.coordinator.accept(request.requestId(), Actor.worker("w-1"));
                } catch (RuntimeException ignored) {
                  // 取消が先に確定した場合は失敗してよい
                }
                return null;
              });
      final Future<?> cancel =
          executor.submit(
              () -> {
                go.await();
                fixture.coordinator.cancel(request.requestId(), Actor.customer("c-1"));
                return null;
              });
      go.countDown();
      accept.get(10, TimeUnit.SECONDS);
      cancel.get(10, TimeUnit.SECONDS);

      // どちらの順でも、取消後の作業者は解放されている
      assertThat(fixture.requestStore.require(request.requestId()).status())
          .isEqualTo(RequestStatus.CANCELLED);
      final WorkerRecord worker = fixture.workerRegistry.requireWorker("w-1");
      assertThat(worker.currentRequestId()).isNull();
      assertThat(worker.available()).isTrue();
    } finally {
      executor.shutdownNow();
    }
  }
}
