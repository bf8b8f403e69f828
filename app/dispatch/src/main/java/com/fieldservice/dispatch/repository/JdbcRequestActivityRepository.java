package com.fieldservice.dispatch.repository;

import static com.fieldservice.common.JdbcTimestampUtils.toTimestamp;

import com.fieldservice.dispatch.model.RequestActivityRecord;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "dispatch.store.type", havingValue = "jdbc", matchIfMissing = true)
@RequiredArgsConstructor
public class JdbcRequestActivityRepository implements RequestActivityRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public void append(RequestActivityRecord record) {
    final String sql =
        """
        INSERT INTO request_activities (request_id, actor_id, message, created_at)
        VALUES (:requestId, :actorId, :message, :createdAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requestId", record.requestId())
            .addValue("actorId", record.actorId())
            .addValue("message", record.message())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public List<RequestActivityRecord> findByRequestId(String requestId) {
    final String sql =
        """
        SELECT request_id, actor_id, message, created_at
        FROM request_activities
        WHERE request_id = :requestId
        ORDER BY activity_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("requestId", requestId);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new RequestActivityRecord(
                rs.getString("request_id"),
                rs.getString("actor_id"),
                rs.getString("message"),
                rs.getTimestamp("created_at").toInstant()));
  }
}
