package com.factql.decode;

import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A result column as reported by the store at execution time: its label and type name.
 */
public final class ColumnTypeDescriptor {
    private final String name;
    private final String reportedType;

    public ColumnTypeDescriptor(String name, String reportedType) {
        this.name = Objects.requireNonNull(name, "name");
        this.reportedType = reportedType != null ? reportedType : "";
    }

    /**
     * Reads every column descriptor of an executed query, in store order.
     *
     * @param rsmd result set metadata
     * @return descriptors, one per column
     * @throws SQLException on JDBC errors
     */
    public static List<ColumnTypeDescriptor> describe(ResultSetMetaData rsmd) throws SQLException {
        int columnCount = rsmd.getColumnCount();
        List<ColumnTypeDescriptor> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(new ColumnTypeDescriptor(rsmd.getColumnLabel(i), rsmd.getColumnTypeName(i)));
        }
        return columns;
    }

    public String getName() {
        return name;
    }

    public String getReportedType() {
        return reportedType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ColumnTypeDescriptor that)) {
            return false;
        }
        return name.equals(that.name) && reportedType.equals(that.reportedType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, reportedType);
    }

    @Override
    public String toString() {
        return name + " " + reportedType;
    }
}
