package com.fieldservice.dispatch.repository;

import static com.fieldservice.common.JdbcTimestampUtils.toTimestamp;

import com.fieldservice.dispatch.model.WorkerDeclineRecord;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "dispatch.store.type", havingValue = "jdbc", matchIfMissing = true)
@RequiredArgsConstructor
public class JdbcWorkerDeclineRepository implements WorkerDeclineRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public void upsert(WorkerDeclineRecord record) {
    final String sql =
        """
        INSERT INTO worker_declines (worker_id, request_id, reason, declined_at)
        VALUES (:workerId, :requestId, :reason, :declinedAt)
        ON CONFLICT (worker_id, request_id)
        DO UPDATE SET
          reason = EXCLUDED.reason,
          declined_at = EXCLUDED.declined_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("workerId", record.workerId())
            .addValue("requestId", record.requestId())
            .addValue("reason", record.reason())
            .addValue("declinedAt", toTimestamp(record.declinedAt()));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public Set<String> findRequestIdsByWorker(String workerId) {
    final String sql = "SELECT request_id FROM worker_declines WHERE worker_id = :workerId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("workerId", workerId);
    return new HashSet<>(jdbcTemplate.queryForList(sql, params, String.class));
  }

  @Override
  public Set<String> findWorkerIdsByRequest(String requestId) {
    final String sql = "SELECT worker_id FROM worker_declines WHERE request_id = :requestId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("requestId", requestId);
    return new HashSet<>(jdbcTemplate.queryForList(sql, params, String.class));
  }

  @Override
  public List<WorkerDeclineRecord> findByWorker(String workerId) {
    final String sql =
        """
        SELECT worker_id, request_id, reason, declined_at
        FROM worker_declines
        WHERE worker_id = :workerId
        ORDER BY declined_at DESC, request_id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("workerId", workerId);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new WorkerDeclineRecord(
                rs.getString("worker_id"),
                rs.getString("request_id"),
                rs.getString("reason"),
                rs.getTimestamp("declined_at").toInstant()));
  }
}
