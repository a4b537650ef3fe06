package com.factql.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.factql.api.FactRow;
import com.factql.store.QueryCancelledException;
import com.factql.store.QueryContext;
import java.math.BigInteger;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class FactRowReaderTest {

    @Test
    void readsFixedProjection() throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(true, false);
        when(rs.getObject(1)).thenReturn(LocalDate.of(2024, 1, 1));
        when(rs.getObject(2)).thenReturn(LocalDateTime.of(2024, 1, 1, 10, 0, 0, 500_000_000));
        when(rs.getObject(3)).thenReturn(-1L);
        when(rs.getString(4)).thenReturn("sess-456");
        when(rs.getString(5)).thenReturn("click");
        when(rs.getString(6)).thenReturn("page_views");
        when(rs.getDouble(7)).thenReturn(1.0);

        List<FactRow> rows = FactRowReader.readAll(rs, QueryContext.withTimeout(Duration.ofSeconds(30)));

        assertThat(rows).hasSize(1);
        FactRow row = rows.get(0);
        assertThat(row.getEventDate()).isEqualTo("2024-01-01");
        assertThat(row.getEventTime()).isEqualTo("2024-01-01T10:00:00Z");
        assertThat(row.getUserId()).isEqualTo(new BigInteger("18446744073709551615"));
        assertThat(row.getSessionId()).isEqualTo("sess-456");
        assertThat(row.getEventType()).isEqualTo("click");
        assertThat(row.getMetricName()).isEqualTo("page_views");
        assertThat(row.getMetricValue()).isEqualTo(1.0);
    }

    @Test
    void stopsWhenCancelled() throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(true);
        QueryContext context = QueryContext.withTimeout(Duration.ofSeconds(30));
        context.cancel();

        assertThatThrownBy(() -> FactRowReader.readAll(rs, context))
                .isInstanceOf(QueryCancelledException.class);
    }
}
