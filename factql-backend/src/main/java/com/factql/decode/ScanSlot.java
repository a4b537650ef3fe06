package com.factql.decode;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;

/**
 * Typed holder receiving one cell of one row. Allocated per column per row by
 * {@link ColumnKind#newSlot()}.
 *
 * <p>A cell whose driver value does not fit the slot's type is kept as an opaque value
 * instead of failing the row.
 */
public abstract class ScanSlot {
    private Object unexpected;

    /**
     * Reads the cell at {@code columnIndex} of the current row.
     *
     * @param rs result set positioned on a row
     * @param columnIndex 1-based column index
     * @throws SQLException on JDBC errors
     */
    public final void scan(ResultSet rs, int columnIndex) throws SQLException {
        Object v = rs.getObject(columnIndex);
        if (v != null && !accept(v)) {
            unexpected = v;
        }
    }

    /**
     * Portable value of the scanned cell.
     */
    public final CellValue toCellValue() {
        if (unexpected != null) {
            return CellValue.opaque(unexpected);
        }
        return decoded();
    }

    /**
     * Stores {@code v} if it has a type this slot understands.
     *
     * @param v non-null driver value
     * @return false when the value was not accepted
     */
    protected abstract boolean accept(Object v);

    /**
     * Value held by the slot; {@link CellValue#nullValue()} when the cell was null.
     */
    protected abstract CellValue decoded();

    static final class TemporalSlot extends ScanSlot {
        private LocalDateTime value;

        @Override
        protected boolean accept(Object v) {
            value = CellConversions.toLocalDateTime(v);
            return value != null;
        }

        @Override
        protected CellValue decoded() {
            return value != null ? CellValue.text(CellConversions.formatTimestamp(value)) : CellValue.nullValue();
        }
    }

    static final class UInt64Slot extends ScanSlot {
        private BigInteger value;

        @Override
        protected boolean accept(Object v) {
            value = CellConversions.toUnsigned64(v);
            return value != null;
        }

        @Override
        protected CellValue decoded() {
            return value != null ? CellValue.integer(value) : CellValue.nullValue();
        }
    }

    static final class Float64Slot extends ScanSlot {
        private Double value;

        @Override
        protected boolean accept(Object v) {
            if (v instanceof Number n) {
                value = n.doubleValue();
                return true;
            }
            return false;
        }

        @Override
        protected CellValue decoded() {
            return value != null ? CellValue.floating(value) : CellValue.nullValue();
        }
    }

    static final class TextSlot extends ScanSlot {
        private String value;

        @Override
        protected boolean accept(Object v) {
            if (v instanceof String s) {
                value = s;
            } else if (v instanceof byte[] bytes) {
                value = new String(bytes, StandardCharsets.UTF_8);
            } else {
                value = String.valueOf(v);
            }
            return true;
        }

        @Override
        protected CellValue decoded() {
            return value != null ? CellValue.text(value) : CellValue.nullValue();
        }
    }

    static final class OpaqueSlot extends ScanSlot {
        private Object value;

        @Override
        protected boolean accept(Object v) {
            value = v;
            return true;
        }

        @Override
        protected CellValue decoded() {
            return value != null ? CellValue.opaque(value) : CellValue.nullValue();
        }
    }
}
