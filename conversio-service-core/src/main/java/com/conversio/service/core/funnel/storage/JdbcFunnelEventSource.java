package com.conversio.service.core.funnel.storage;

import com.conversio.event.model.ActorEvent;
import com.conversio.funnel.model.FunnelAggregation;
import com.conversio.service.core.funnel.query.FunnelStorageTimeoutException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Reads funnel rows from {@code conversio.events}, joined to person properties. Event, group key and group
 * property columns are jsonb.
 */
@Repository
@Slf4j
public class JdbcFunnelEventSource implements FunnelEventSource {

    static final int SAMPLE_BUCKETS = 10_000;

    private static final TypeReference<Map<String, Object>> PROPERTIES = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> GROUP_KEYS = new TypeReference<>() {};
    private static final TypeReference<Map<String, Map<String, Object>>> GROUP_PROPERTIES = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public JdbcFunnelEventSource(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ActorEvent> fetch(FunnelEventQuery query) {
        if (query.eventNames() != null && query.eventNames().isEmpty()) {
            return List.of();
        }
        String actor = actorExpression(query.aggregation());
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("date_from", Timestamp.from(query.dateFrom()))
                .addValue("date_to", Timestamp.from(query.dateTo()));
        StringBuilder sql = new StringBuilder(
                """
            select e.event_id, e.event_name, e.occurred_at, e.person_id, e.session_id, e.window_id,
                   e.group_keys::text as group_keys,
                   e.group_properties::text as group_properties,
                   e.properties::text as properties,
                   p.properties::text as person_properties
            from conversio.events e
            left join conversio.persons p on p.person_id = e.person_id
            where e.occurred_at >= :date_from
              and e.occurred_at <= :date_to
            """);
        sql.append("  and ").append(actor).append(" is not null\n");
        if (query.eventNames() != null) {
            sql.append("  and e.event_name in (:event_names)\n");
            params.addValue("event_names", List.copyOf(query.eventNames()));
        }
        if (query.samplingFactor() != null) {
            sql.append("  and mod(abs(hashtext(").append(actor).append(")), ")
                    .append(SAMPLE_BUCKETS)
                    .append(") < :sample_threshold\n");
            params.addValue("sample_threshold", Math.round(query.samplingFactor() * SAMPLE_BUCKETS));
        }
        sql.append("order by ").append(actor).append(", e.occurred_at, e.event_id");

        try {
            List<ActorEvent> rows = jdbc.query(sql.toString(), params, (rs, rowNum) -> mapRow(rs));
            log.debug(
                    "Fetched {} funnel rows range=[{}, {}] events={}",
                    rows.size(),
                    query.dateFrom(),
                    query.dateTo(),
                    query.eventNames());
            return rows;
        } catch (TransientDataAccessException e) {
            throw new FunnelStorageTimeoutException("Funnel event query did not complete", e);
        }
    }

    static String actorExpression(FunnelAggregation aggregation) {
        return switch (aggregation.target()) {
            case PERSON -> "e.person_id";
            case SESSION -> "e.session_id";
            case GROUP -> "(e.group_keys ->> '" + aggregation.groupTypeIndex() + "')";
        };
    }

    private ActorEvent mapRow(ResultSet rs) throws SQLException {
        Map<Integer, String> groups = new LinkedHashMap<>();
        parse(rs.getString("group_keys"), GROUP_KEYS).forEach((index, key) -> groups.put(Integer.valueOf(index), key));
        Map<Integer, Map<String, Object>> groupProperties = new LinkedHashMap<>();
        parse(rs.getString("group_properties"), GROUP_PROPERTIES)
                .forEach((index, props) -> groupProperties.put(Integer.valueOf(index), props));
        return ActorEvent.builder()
                .uuid(rs.getString("event_id"))
                .event(rs.getString("event_name"))
                .timestamp(rs.getTimestamp("occurred_at").toInstant())
                .personId(rs.getString("person_id"))
                .sessionId(rs.getString("session_id"))
                .windowId(rs.getString("window_id"))
                .groups(groups)
                .properties(parse(rs.getString("properties"), PROPERTIES))
                .personProperties(parse(rs.getString("person_properties"), PROPERTIES))
                .groupProperties(groupProperties)
                .build();
    }

    private <T extends Map<?, ?>> T parse(String json, TypeReference<T> type) throws SQLException {
        if (json == null || json.isBlank()) {
            return emptyMap();
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SQLException("Malformed jsonb column value", e);
        }
    }

    @SuppressWarnings("unchecked")
    private static <T extends Map<?, ?>> T emptyMap() {
        return (T) Map.of();
    }
}
