package com.factql.decode;

import java.util.Map;

/**
 * Maps a store-reported column type to its {@link ColumnKind}.
 *
 * <p>The result shape of an aggregate query depends on the client's group-by and metric
 * choice, so decoding is driven by this table at execution time rather than by a fixed row
 * type. Types not listed here decode as {@link ColumnKind#OPAQUE}.
 */
public final class TypeDispatchTable {

    private static final Map<String, ColumnKind> KINDS = Map.ofEntries(
            Map.entry("date", ColumnKind.TEMPORAL),
            Map.entry("date32", ColumnKind.TEMPORAL),
            Map.entry("datetime", ColumnKind.TEMPORAL),
            Map.entry("datetime64", ColumnKind.TEMPORAL),
            Map.entry("uint64", ColumnKind.UINT64),
            Map.entry("float64", ColumnKind.FLOAT64),
            Map.entry("string", ColumnKind.TEXT),
            Map.entry("fixedstring", ColumnKind.TEXT)
    );

    private TypeDispatchTable() {
    }

    public static ColumnKind resolve(ColumnTypeDescriptor descriptor) {
        return resolve(descriptor.getReportedType());
    }

    public static ColumnKind resolve(String reportedType) {
        return KINDS.getOrDefault(ColumnTypeNormalizer.key(reportedType), ColumnKind.OPAQUE);
    }
}
