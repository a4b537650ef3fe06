package com.factql.decode;

import com.factql.store.QueryContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes a result set of unknown shape into {@link MaterializedRecord}s.
 *
 * <p>Column descriptors are read once per execution and resolved through
 * {@link TypeDispatchTable}; every row then gets freshly allocated slots. Rows keep the
 * store's order and columns keep the store's column order.
 */
@Slf4j
@Component
public class ResultMaterializer {

    /**
     * Materializes every row of {@code rs}.
     *
     * @param rs result set positioned before the first row
     * @param context checked before each row; on cancellation the rows decoded so far are dropped
     * @return records in store order
     * @throws SQLException on JDBC errors
     */
    public List<MaterializedRecord> materialize(ResultSet rs, QueryContext context) throws SQLException {
        List<ColumnTypeDescriptor> columns = ColumnTypeDescriptor.describe(rs.getMetaData());
        List<ColumnKind> kinds = new ArrayList<>(columns.size());
        for (ColumnTypeDescriptor column : columns) {
            ColumnKind kind = TypeDispatchTable.resolve(column);
            if (kind == ColumnKind.OPAQUE) {
                log.debug("Column {} has unrecognized type '{}', passing values through", column.getName(), column.getReportedType());
            }
            kinds.add(kind);
        }

        List<MaterializedRecord> records = new ArrayList<>();
        while (rs.next()) {
            context.throwIfCancelled();
            records.add(materializeRow(rs, columns, kinds));
        }
        return records;
    }

    private static MaterializedRecord materializeRow(ResultSet rs, List<ColumnTypeDescriptor> columns, List<ColumnKind> kinds)
            throws SQLException {
        MaterializedRecord.Builder record = MaterializedRecord.builder();
        for (int i = 0; i < columns.size(); i++) {
            ScanSlot slot = kinds.get(i).newSlot();
            slot.scan(rs, i + 1);
            record.add(columns.get(i).getName(), slot.toCellValue());
        }
        return record.build();
    }
}
