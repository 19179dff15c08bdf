package com.conversio.service.core.funnel.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.conversio.event.model.ActorEvent;
import com.conversio.funnel.model.FunnelAggregation;
import com.conversio.service.core.funnel.query.FunnelStorageTimeoutException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

class JdbcFunnelEventSourceTest {

    private static final Instant FROM = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant TO = Instant.parse("2024-01-08T00:00:00Z");

    @Mock
    private NamedParameterJdbcTemplate jdbc;

    private JdbcFunnelEventSource source;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        source = new JdbcFunnelEventSource(jdbc, new ObjectMapper());
    }

    @Test
    @SuppressWarnings("unchecked")
    void pushesDownNamesRangeAndSampling() {
        when(jdbc.query(anyString(), any(SqlParameterSource.class), any(RowMapper.class)))
                .thenReturn(List.of());

        source.fetch(new FunnelEventQuery(Set.of("sign up"), FROM, TO, FunnelAggregation.PERSONS, 0.25));

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbc).query(sql.capture(), params.capture(), any(RowMapper.class));
        assertThat(sql.getValue())
                .contains("from conversio.events e")
                .contains("e.event_name in (:event_names)")
                .contains("mod(abs(hashtext(e.person_id)), 10000) < :sample_threshold")
                .endsWith("order by e.person_id, e.occurred_at, e.event_id");
        MapSqlParameterSource values = (MapSqlParameterSource) params.getValue();
        assertThat(values.getValue("event_names")).isEqualTo(List.of("sign up"));
        assertThat(values.getValue("sample_threshold")).isEqualTo(2500L);
        assertThat(values.getValue("date_from")).isEqualTo(Timestamp.from(FROM));
    }

    @Test
    @SuppressWarnings("unchecked")
    void groupAggregationUsesGroupKeyAndSkipsNameFilterForAllEvents() {
        when(jdbc.query(anyString(), any(SqlParameterSource.class), any(RowMapper.class)))
                .thenReturn(List.of());

        source.fetch(new FunnelEventQuery(
                null, FROM, TO, new FunnelAggregation(FunnelAggregation.Target.GROUP, 1), null));

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(jdbc).query(sql.capture(), any(SqlParameterSource.class), any(RowMapper.class));
        assertThat(sql.getValue())
                .contains("(e.group_keys ->> '1') is not null")
                .doesNotContain("event_names")
                .doesNotContain("hashtext");
    }

    @Test
    void emptyNameSetNeverHitsStorage() {
        assertThat(source.fetch(new FunnelEventQuery(Set.of(), FROM, TO, FunnelAggregation.PERSONS, null)))
                .isEmpty();
        verifyNoInteractions(jdbc);
    }

    @Test
    @SuppressWarnings("unchecked")
    void mapsJsonColumnsIntoRows() throws Exception {
        ArgumentCaptor<RowMapper<ActorEvent>> mapper = ArgumentCaptor.forClass(RowMapper.class);
        when(jdbc.query(anyString(), any(SqlParameterSource.class), mapper.capture()))
                .thenReturn(List.of());
        source.fetch(new FunnelEventQuery(Set.of("buy"), FROM, TO, FunnelAggregation.PERSONS, null));

        ResultSet rs = mock(ResultSet.class);
        when(rs.getString("event_id")).thenReturn("e-1");
        when(rs.getString("event_name")).thenReturn("buy");
        when(rs.getTimestamp("occurred_at")).thenReturn(Timestamp.from(FROM));
        when(rs.getString("person_id")).thenReturn("p1");
        when(rs.getString("session_id")).thenReturn("s1");
        when(rs.getString("group_keys")).thenReturn("{\"0\":\"acme\"}");
        when(rs.getString("group_properties")).thenReturn("{\"0\":{\"industry\":\"retail\"}}");
        when(rs.getString("properties")).thenReturn("{\"$browser\":\"Chrome\",\"price\":9.5}");
        when(rs.getString("person_properties")).thenReturn(null);

        ActorEvent row = mapper.getValue().mapRow(rs, 0);

        assertThat(row.uuid()).isEqualTo("e-1");
        assertThat(row.timestamp()).isEqualTo(FROM);
        assertThat(row.groups()).containsEntry(0, "acme");
        assertThat(row.groupProperty(0, "industry")).isEqualTo("retail");
        assertThat(row.property("$browser")).isEqualTo("Chrome");
        assertThat(row.property("price")).isEqualTo(9.5);
        assertThat(row.personProperties()).isEmpty();
        assertThat(row.windowId()).isNull();
    }

    @Test
    @SuppressWarnings("unchecked")
    void translatesTransientFailuresToRetryableTimeout() {
        when(jdbc.query(anyString(), any(SqlParameterSource.class), any(RowMapper.class)))
                .thenThrow(new QueryTimeoutException("statement timeout"));

        assertThatThrownBy(() ->
                        source.fetch(new FunnelEventQuery(Set.of("buy"), FROM, TO, FunnelAggregation.PERSONS, null)))
                .isInstanceOf(FunnelStorageTimeoutException.class)
                .hasCauseInstanceOf(QueryTimeoutException.class);
    }
}
