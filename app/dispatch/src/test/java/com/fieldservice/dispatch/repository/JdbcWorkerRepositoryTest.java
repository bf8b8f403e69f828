/*
 * どこで: JdbcWorkerRepository の統合テスト
 * 何を: 稼働可否の upsert と確保/解除の条件付き更新を検証する
 * なぜ: 割当中の作業者が別の依頼に確保されないことと、解除後の稼働状態の復元を保証するため
 */
package com.fieldservice.dispatch.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.fieldservice.dispatch.AbstractPostgresContainerTest;
import com.fieldservice.dispatch.geo.GeoDistance;
import com.fieldservice.dispatch.model.Coordinate;
import com.fieldservice.dispatch.model.WorkerRanking;
import com.fieldservice.dispatch.model.WorkerRecord;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class JdbcWorkerRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-01T09:00:00Z");
  private static final Coordinate LOCATION = new Coordinate(35.0, 139.0);

  @Autowired private WorkerRepository workerRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM workers", new MapSqlParameterSource());
  }

  @Test
  void updateAvailabilityCreatesAndUpdatesWorker() {
    final WorkerRecord created =
        workerRepository.updateAvailability("w-1", true, LOCATION, 20.0, BASE_TIME);

    assertThat(created.available()).isTrue();
    assertThat(created.location()).isEqualTo(LOCATION);
    assertThat(created.serviceRadiusKm()).isEqualTo(20.0);
    assertThat(created.lastAvailableAt()).isEqualTo(BASE_TIME);

    final WorkerRecord offline =
        workerRepository.updateAvailability("w-1", false, null, 20.0, BASE_TIME.plusSeconds(60));
    assertThat(offline.available()).isFalse();
    assertThat(offline.location()).isEqualTo(LOCATION);
    assertThat(offline.lastAvailableAt()).isNull();
    assertThat(workerRepository.findById("w-1")).contains(offline);
  }

  @Test
  void upsertProfileKeepsAvailability() {
    workerRepository.updateAvailability("w-1", true, LOCATION, 20.0, BASE_TIME);

    final WorkerRecord profiled =
        workerRepository.upsertProfile("w-1", 35.0, "plumbing", BASE_TIME.plusSeconds(5));

    assertThat(profiled.available()).isTrue();
    assertThat(profiled.serviceRadiusKm()).isEqualTo(35.0);
    assertThat(profiled.category()).isEqualTo("plumbing");

    final WorkerRecord fresh = workerRepository.upsertProfile("w-2", 10.0, null, BASE_TIME);
    assertThat(fresh.available()).isFalse();
    assertThat(fresh.location()).isNull();
  }

  @Test
  void findAvailableWithinSkipsBusyOfflineAndDistantWorkers() {
    workerRepository.updateAvailability("w-near", true, LOCATION, 20.0, BASE_TIME);
    workerRepository.updateAvailability("w-busy", true, LOCATION, 20.0, BASE_TIME);
    workerRepository.reserve("w-busy", "req-1", BASE_TIME);
    workerRepository.updateAvailability("w-off", false, LOCATION, 20.0, BASE_TIME);
    workerRepository.updateAvailability(
        "w-far", true, new Coordinate(43.0, 141.3), 20.0, BASE_TIME);
    workerRepository.upsertProfile("w-unplaced", 20.0, null, BASE_TIME);

    final List<WorkerRecord> found =
        workerRepository.findAvailableWithin(GeoDistance.boundingBox(LOCATION, 50.0));

    assertThat(found).extracting(WorkerRecord::workerId).containsExactly("w-near");
  }

  @Test
  void reserveSucceedsOnlyForAvailableUnassignedWorker() {
    workerRepository.updateAvailability("w-1", true, LOCATION, 20.0, BASE_TIME);

    final WorkerRecord reserved =
        workerRepository.reserve("w-1", "req-1", BASE_TIME.plusSeconds(1)).orElseThrow();
    assertThat(reserved.available()).isFalse();
    assertThat(reserved.currentRequestId()).isEqualTo("req-1");

    assertThat(workerRepository.reserve("w-1", "req-2", BASE_TIME.plusSeconds(2))).isEmpty();
    assertThat(workerRepository.reserve("missing", "req-2", BASE_TIME)).isEmpty();
  }

  @Test
  void availabilityToggleWhileAssignedIsAppliedOnRelease() {
    workerRepository.updateAvailability("w-1", true, LOCATION, 20.0, BASE_TIME);
    workerRepository.reserve("w-1", "req-1", BASE_TIME);

    final WorkerRecord toggled =
        workerRepository.updateAvailability("w-1", false, null, 20.0, BASE_TIME.plusSeconds(5));
    assertThat(toggled.available()).isFalse();
    assertThat(toggled.currentRequestId()).isEqualTo("req-1");
    assertThat(toggled.resumeAvailable()).isFalse();

    assertThat(workerRepository.release("w-1", "req-other", true, BASE_TIME)).isEmpty();

    final WorkerRecord released =
        workerRepository.release("w-1", "req-1", true, BASE_TIME.plusSeconds(10)).orElseThrow();
    assertThat(released.available()).isFalse();
    assertThat(released.currentRequestId()).isNull();
    assertThat(released.completedJobs()).isEqualTo(1);
  }

  @Test
  void countsActiveWorkersAndRanksByCompletedJobs() {
    workerRepository.updateAvailability("w-1", true, LOCATION, 20.0, BASE_TIME);
    workerRepository.updateAvailability("w-2", true, LOCATION, 20.0, BASE_TIME);
    workerRepository.updateAvailability("w-3", false, LOCATION, 20.0, BASE_TIME);
    for (int i = 0; i < 2; i++) {
      workerRepository.reserve("w-2", "req-" + i, BASE_TIME);
      workerRepository.release("w-2", "req-" + i, true, BASE_TIME);
    }
    workerRepository.reserve("w-1", "req-9", BASE_TIME);

    assertThat(workerRepository.countActive()).isEqualTo(2);
    assertThat(workerRepository.findTopByCompletedJobs(5))
        .containsExactly(new WorkerRanking("w-2", 2));
  }
}
