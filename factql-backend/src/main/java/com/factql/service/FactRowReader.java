package com.factql.service;

import com.factql.api.FactRow;
import com.factql.decode.CellConversions;
import com.factql.store.QueryContext;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the fixed raw projection
 * {@code event_date, event_time, user_id, session_id, event_type, metric_name, metric_value}.
 */
final class FactRowReader {

    private FactRowReader() {
    }

    static List<FactRow> readAll(ResultSet rs, QueryContext context) throws SQLException {
        List<FactRow> rows = new ArrayList<>();
        while (rs.next()) {
            context.throwIfCancelled();
            rows.add(FactRow.builder()
                    .eventDate(CellConversions.toIsoDate(rs.getObject(1)))
                    .eventTime(CellConversions.toRfc3339(rs.getObject(2)))
                    .userId(CellConversions.toUnsigned64(rs.getObject(3)))
                    .sessionId(rs.getString(4))
                    .eventType(rs.getString(5))
                    .metricName(rs.getString(6))
                    .metricValue(rs.getDouble(7))
                    .build());
        }
        return rows;
    }
}
