/*
 * どこで: Dispatch データアクセス (PostgreSQL)
 * 何を: service_requests の登録/条件付き遷移/範囲検索を行う
 * なぜ: 遷移を UPDATE ... WHERE status = 期待値 の 1 文で行い、二重受諾の窓をなくすため
 */
package com.fieldservice.dispatch.repository;

import static com.fieldservice.common.JdbcTimestampUtils.toInstant;
import static com.fieldservice.common.JdbcTimestampUtils.toTimestamp;

import com.fieldservice.dispatch.geo.BoundingBox;
import com.fieldservice.dispatch.model.Coordinate;
import com.fieldservice.dispatch.model.RequestPriority;
import com.fieldservice.dispatch.model.RequestStatisticsBucket;
import com.fieldservice.dispatch.model.RequestStatus;
import com.fieldservice.dispatch.model.ServiceRequestRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "dispatch.store.type", havingValue = "jdbc", matchIfMissing = true)
@RequiredArgsConstructor
public class JdbcServiceRequestRepository implements ServiceRequestRepository {

  private static final String COLUMNS =
      """
      request_id, reference_code, customer_id, title, description, category, priority,
      latitude, longitude, address, estimated_duration_minutes, status,
      assigned_worker_id, last_assigned_worker_id, created_at, accepted_at, started_at,
      completed_at, cancelled_at, cancelled_by, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public boolean insert(ServiceRequestRecord record) {
    final String sql =
        """
        INSERT INTO service_requests (
          request_id,
          reference_code,
          customer_id,
          title,
          description,
          category,
          priority,
          latitude,
          longitude,
          address,
          estimated_duration_minutes,
          status,
          created_at,
          updated_at
        ) VALUES (
          :requestId,
          :referenceCode,
          :customerId,
          :title,
          :description,
          :category,
          :priority,
          :latitude,
          :longitude,
          :address,
          :estimatedDurationMinutes,
          :status,
          :createdAt,
          :updatedAt
        )
        ON CONFLICT (reference_code) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requestId", record.requestId())
            .addValue("referenceCode", record.referenceCode())
            .addValue("customerId", record.customerId())
            .addValue("title", record.title())
            .addValue("description", record.description())
            .addValue("category", record.category())
            .addValue("priority", record.priority().name())
            .addValue("latitude", record.location().latitude())
            .addValue("longitude", record.location().longitude())
            .addValue("address", record.address())
            .addValue("estimatedDurationMinutes", record.estimatedDurationMinutes())
            .addValue("status", record.status().name())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    return jdbcTemplate.update(sql, params) == 1;
  }

  @Override
  public Optional<ServiceRequestRecord> findById(String requestId) {
    final String sql = "SELECT " + COLUMNS + " FROM service_requests WHERE request_id = :requestId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("requestId", requestId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public Optional<ServiceRequestRecord> claimPending(
      String requestId, String workerId, Instant acceptedAt) {
    // 同時実行時は行ロック解放後に WHERE が再評価されるため、敗者は 0 行になる
    final String sql =
        """
        UPDATE service_requests
        SET status = 'ACCEPTED',
            assigned_worker_id = :workerId,
            last_assigned_worker_id = :workerId,
            accepted_at = :at,
            updated_at = :at
        WHERE request_id = :requestId
          AND status = 'PENDING'
        RETURNING
        """
            + COLUMNS;
    return updateReturning(sql, requestId, workerId, acceptedAt);
  }

  @Override
  public Optional<ServiceRequestRecord> markStarted(
      String requestId, String workerId, Instant startedAt) {
    final String sql =
        """
        UPDATE service_requests
        SET status = 'IN_PROGRESS',
            started_at = :at,
            updated_at = :at
        WHERE request_id = :requestId
          AND status = 'ACCEPTED'
          AND assigned_worker_id = :workerId
        RETURNING
        """
            + COLUMNS;
    return updateReturning(sql, requestId, workerId, startedAt);
  }

  @Override
  public Optional<ServiceRequestRecord> markCompleted(
      String requestId, String workerId, Instant completedAt) {
    final String sql =
        """
        UPDATE service_requests
        SET status = 'COMPLETED',
            assigned_worker_id = NULL,
            completed_at = :at,
            updated_at = :at
        WHERE request_id = :requestId
          AND status = 'IN_PROGRESS'
          AND assigned_worker_id = :workerId
        RETURNING
        """
            + COLUMNS;
    return updateReturning(sql, requestId, workerId, completedAt);
  }

  @Override
  public Optional<ServiceRequestRecord> markCancelled(
      String requestId, RequestStatus expectedStatus, String actorId, Instant cancelledAt) {
    final String sql =
        """
        UPDATE service_requests
        SET status = 'CANCELLED',
            assigned_worker_id = NULL,
            cancelled_at = :at,
            cancelled_by = :actorId,
            updated_at = :at
        WHERE request_id = :requestId
          AND status = :expectedStatus
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requestId", requestId)
            .addValue("expectedStatus", expectedStatus.name())
            .addValue("actorId", actorId)
            .addValue("at", toTimestamp(cancelledAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public List<ServiceRequestRecord> findPendingWithin(BoundingBox box) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM service_requests
            WHERE status = 'PENDING'
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
  public List<ServiceRequestRecord> findByCustomer(String customerId, Set<RequestStatus> statuses) {
    return findByOwnerColumn("customer_id", customerId, statuses);
  }

  @Override
  public List<ServiceRequestRecord> findByWorker(String workerId, Set<RequestStatus> statuses) {
    return findByOwnerColumn("last_assigned_worker_id", workerId, statuses);
  }

  @Override
  public List<RequestStatisticsBucket> summarizeStatistics() {
    final String sql =
        """
        SELECT status,
               priority,
               COUNT(*) AS request_count,
               COUNT(accepted_at) AS accepted_count,
               COALESCE(
                 CAST(ROUND(SUM(EXTRACT(EPOCH FROM (accepted_at - created_at)) * 1000)) AS BIGINT),
                 0) AS total_millis_to_accept
        FROM service_requests
        GROUP BY status, priority
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        (rs, rowNum) ->
            new RequestStatisticsBucket(
                RequestStatus.valueOf(rs.getString("status")),
                RequestPriority.valueOf(rs.getString("priority")),
                rs.getLong("request_count"),
                rs.getLong("accepted_count"),
                rs.getLong("total_millis_to_accept")));
  }

  private List<ServiceRequestRecord> findByOwnerColumn(
      String column, String ownerId, Set<RequestStatus> statuses) {
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ownerId", ownerId);
    final StringBuilder sql =
        new StringBuilder("SELECT ")
            .append(COLUMNS)
            .append(" FROM service_requests WHERE ")
            .append(column)
            .append(" = :ownerId");
    if (statuses != null && !statuses.isEmpty()) {
      sql.append(" AND status IN (:statuses)");
      params.addValue("statuses", statuses.stream().map(RequestStatus::name).toList());
    }
    sql.append(" ORDER BY created_at DESC, request_id");
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  private Optional<ServiceRequestRecord> updateReturning(
      String sql, String requestId, String workerId, Instant at) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requestId", requestId)
            .addValue("workerId", workerId)
            .addValue("at", toTimestamp(at));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private ServiceRequestRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ServiceRequestRecord(
        rs.getString("request_id"),
        rs.getString("reference_code"),
        rs.getString("customer_id"),
        rs.getString("title"),
        rs.getString("description"),
        rs.getString("category"),
        RequestPriority.valueOf(rs.getString("priority")),
        new Coordinate(rs.getDouble("latitude"), rs.getDouble("longitude")),
        rs.getString("address"),
        rs.getInt("estimated_duration_minutes"),
        RequestStatus.valueOf(rs.getString("status")),
        rs.getString("assigned_worker_id"),
        rs.getString("last_assigned_worker_id"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("accepted_at")),
        toInstant(rs.getTimestamp("started_at")),
        toInstant(rs.getTimestamp("completed_at")),
        toInstant(rs.getTimestamp("cancelled_at")),
        rs.getString("cancelled_by"),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
