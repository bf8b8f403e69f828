/*
 * どこで: Dispatch アプリの起動テスト (in-memory プロファイル)
 * 何を: DB と NATS なしでコンテキストが起動し、受諾から完了まで通ることを確認する
 * なぜ: ローカル実行用の構成が JDBC 構成と同じサービスを組み立てることを保証するため
 */
package com.fieldservice.dispatch;

import static org.assertj.core.api.Assertions.assertThat;

import com.fieldservice.dispatch.model.Actor;
import com.fieldservice.dispatch.model.Coordinate;
import com.fieldservice.dispatch.model.DispatchMetricsSnapshot;
import com.fieldservice.dispatch.model.MatchCandidate;
import com.fieldservice.dispatch.model.NewServiceRequest;
import com.fieldservice.dispatch.model.RequestPriority;
import com.fieldservice.dispatch.model.RequestStatus;
import com.fieldservice.dispatch.model.ServiceRequestRecord;
import com.fieldservice.dispatch.repository.InMemoryServiceRequestRepository;
import com.fieldservice.dispatch.repository.ServiceRequestRepository;
import com.fieldservice.dispatch.service.DispatchCoordinator;
import com.fieldservice.dispatch.service.DispatchMetricsAggregator;
import com.fieldservice.dispatch.service.RequestMatcher;
import com.fieldservice.dispatch.service.WorkerRegistry;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("in-memory")
class InMemoryDispatchApplicationTests {

  private static final Coordinate JOB_SITE = new Coordinate(35.6812, 139.7671);

  @Autowired private ServiceRequestRepository requestRepository;
  @Autowired private DispatchCoordinator coordinator;
  @Autowired private WorkerRegistry workerRegistry;
  @Autowired private RequestMatcher matcher;
  @Autowired private DispatchMetricsAggregator aggregator;

  @Test
  void dispatchFlowRunsWithoutExternalInfrastructure() {
    assertThat(requestRepository).isInstanceOf(InMemoryServiceRequestRepository.class);

    final ServiceRequestRecord created =
        coordinator.createRequest(
            Actor.customer("customer-ctx"),
            NewServiceRequest.of("No hot water", RequestPriority.EMERGENCY, JOB_SITE, "Marunouchi"));
    workerRegistry.setAvailability(
        Actor.worker("worker-ctx"), "worker-ctx", true, new Coordinate(35.69, 139.77));

    final List<MatchCandidate> candidates =
        matcher.listNearbyPending(Actor.worker("worker-ctx"), null, null);
    assertThat(candidates).extracting(MatchCandidate::requestId).contains(created.requestId());

    coordinator.accept(created.requestId(), Actor.worker("worker-ctx"));
    coordinator.start(created.requestId(), Actor.worker("worker-ctx"));
    final ServiceRequestRecord completed =
        coordinator.complete(created.requestId(), Actor.worker("worker-ctx"));
    assertThat(completed.status()).isEqualTo(RequestStatus.COMPLETED);

    final DispatchMetricsSnapshot snapshot = aggregator.getMetrics(Actor.admin("admin-ctx"));
    assertThat(snapshot.count(RequestStatus.COMPLETED)).isGreaterThanOrEqualTo(1);
    assertThat(snapshot.topWorkers()).isNotEmpty();
  }
}
