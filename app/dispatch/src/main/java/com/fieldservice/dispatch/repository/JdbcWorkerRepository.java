/*
 * どこで: Dispatch データアクセス (PostgreSQL)
 * 何を: workers の稼働可否/位置/割当を更新する
 * なぜ: 割当の確保と解除を作業者行への条件付き更新 1 文で行うため
 */
package com.fieldservice.dispatch.repository;

import static com.fieldservice.common.JdbcTimestampUtils.toInstant;
import static com.fieldservice.common.JdbcTimestampUtils.toTimestamp;

import com.fieldservice.dispatch.geo.BoundingBox;
import com.fieldservice.dispatch.model.Coordinate;
import com.fieldservice.dispatch.model.WorkerRanking;
import com.fieldservice.dispatch.model.WorkerRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "dispatch.store.type", havingValue = "jdbc", matchIfMissing = true)
@RequiredArgsConstructor
public class JdbcWorkerRepository implements WorkerRepository {

  private static final String COLUMNS =
      """
      worker_id, available, latitude, longitude, current_request_id, resume_available,
      service_radius_km, category, completed_jobs, last_available_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public Optional<WorkerRecord> findById(String workerId) {
    final String sql = "SELECT " + COLUMNS + " FROM workers WHERE worker_id = :workerId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("workerId", workerId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public WorkerRecord upsertProfile(
      String workerId, double serviceRadiusKm, String category, Instant updatedAt) {
    final String sql =
        """
        INSERT INTO workers (
          worker_id,
          available,
          resume_available,
          service_radius_km,
          category,
          completed_jobs,
          updated_at
        ) VALUES (
          :workerId,
          FALSE,
          FALSE,
          :serviceRadiusKm,
          :category,
          0,
          :updatedAt
        )
        ON CONFLICT (worker_id)
        DO UPDATE SET
          service_radius_km = EXCLUDED.service_radius_km,
          category = EXCLUDED.category,
          updated_at = EXCLUDED.updated_at
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("workerId", workerId)
            .addValue("serviceRadiusKm", serviceRadiusKm)
            .addValue("category", category, Types.VARCHAR)
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  @Override
  public WorkerRecord updateAvailability(
      String workerId,
      boolean available,
      Coordinate location,
      double defaultServiceRadiusKm,
      Instant updatedAt) {
    // 割当中は available を false に保ち、解除時に戻す値 (resume_available) だけを更新する
    final String sql =
        """
        INSERT INTO workers (
          worker_id,
          available,
          latitude,
          longitude,
          resume_available,
          service_radius_km,
          completed_jobs,
          last_available_at,
          updated_at
        ) VALUES (
          :workerId,
          :available,
          :latitude,
          :longitude,
          :available,
          :defaultServiceRadiusKm,
          0,
          :lastAvailableAt,
          :updatedAt
        )
        ON CONFLICT (worker_id)
        DO UPDATE SET
          available = CASE
            WHEN workers.current_request_id IS NULL THEN EXCLUDED.available
            ELSE FALSE
          END,
          resume_available = EXCLUDED.resume_available,
          latitude = COALESCE(EXCLUDED.latitude, workers.latitude),
          longitude = COALESCE(EXCLUDED.longitude, workers.longitude),
          last_available_at = CASE
            WHEN NOT EXCLUDED.available THEN NULL
            WHEN workers.current_request_id IS NOT NULL THEN workers.last_available_at
            WHEN workers.available THEN workers.last_available_at
            ELSE EXCLUDED.updated_at
          END,
          updated_at = EXCLUDED.updated_at
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("workerId", workerId)
            .addValue("available", available)
            .addValue("latitude", location == null ? null : location.latitude(), Types.DOUBLE)
            .addValue("longitude", location == null ? null : location.longitude(), Types.DOUBLE)
            .addValue("defaultServiceRadiusKm", defaultServiceRadiusKm)
            .addValue("lastAvailableAt", available ? toTimestamp(updatedAt) : null, Types.TIMESTAMP)
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  @Override
  public Optional<WorkerRecord> updateLocation(
      String workerId, Coordinate location, Instant updatedAt) {
    final String sql =
        """
        UPDATE workers
        SET latitude = :latitude,
            longitude = :longitude,
            updated_at = :updatedAt
        WHERE worker_id = :workerId
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("workerId", workerId)
            .addValue("latitude", location.latitude())
            .addValue("longitude", location.longitude())
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public Optional<WorkerRecord> reserve(String workerId, String requestId, Instant updatedAt) {
    final String sql =
        """
        UPDATE workers
        SET available = FALSE,
            current_request_id = :requestId,
            resume_available = TRUE,
            updated_at = :updatedAt
        WHERE worker_id = :workerId
          AND available = TRUE
          AND current_request_id IS NULL
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("workerId", workerId)
            .addValue("requestId", requestId)
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public Optional<WorkerRecord> release(
      String workerId, String requestId, boolean completed, Instant updatedAt) {
    final String sql =
        """
        UPDATE workers
        SET available = resume_available,
            current_request_id = NULL,
            completed_jobs = completed_jobs + :increment,
            last_available_at = CASE
              WHEN resume_available THEN COALESCE(last_available_at, :updatedAt)
              ELSE NULL
            END,
            updated_at = :updatedAt
        WHERE worker_id = :workerId
          AND current_request_id = :requestId
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("workerId", workerId)
            .addValue("requestId", requestId)
            .addValue("increment", completed ? 1 : 0)
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public List<WorkerRecord> findAvailableWithin(BoundingBox box) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM workers
            WHERE available = TRUE
              AND current_request_id IS NULL
              AND latitude BETWEEN :minLatitude AND :maxLatitude
              AND longitude BETWEEN :minLongitude AND :maxLongitude
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("minLatitude", box.minLatitude())
            .addValue("maxLatitude", box.maxLatitude())
            .addValue("minLongitude", box.minLongitude())
            .addValue("maxLongitude", box.maxLongitude());
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public long countActive() {
    final String sql =
        "SELECT COUNT(*) FROM workers WHERE available = TRUE OR current_request_id IS NOT NULL";
    final Long count = jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Long.class);
    return count == null ? 0L : count;
  }

  @Override
  public List<WorkerRanking> findTopByCompletedJobs(int limit) {
    final String sql =
        """
        SELECT worker_id, completed_jobs
        FROM workers
        WHERE completed_jobs > 0
        ORDER BY completed_jobs DESC, worker_id
        LIMIT :limit
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) -> new WorkerRanking(rs.getString("worker_id"), rs.getLong("completed_jobs")));
  }

  private WorkerRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new WorkerRecord(
        rs.getString("worker_id"),
        rs.getBoolean("available"),
        mapLocation(rs),
        rs.getString("current_request_id"),
        rs.getBoolean("resume_available"),
        rs.getDouble("service_radius_km"),
        rs.getString("category"),
        rs.getLong("completed_jobs"),
        toInstant(rs.getTimestamp("last_available_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }

  private Coordinate mapLocation(ResultSet rs) throws SQLException {
    final double latitude = rs.getDouble("latitude");
    if (rs.wasNull()) {
      return null;
    }
    final double longitude = rs.getDouble("longitude");
    if (rs.wasNull()) {
      return null;
    }
    return new Coordinate(latitude, longitude);
  }
}
