package com.factql.decode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TypeDispatchTableTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "Date|TEMPORAL",
            "Date32|TEMPORAL",
            "DateTime|TEMPORAL",
            "DateTime('Europe/Berlin')|TEMPORAL",
            "DateTime64(3)|TEMPORAL",
            "DateTime64(6, 'UTC')|TEMPORAL",
            "UInt64|UINT64",
            "Float64|FLOAT64",
            "String|TEXT",
            "LowCardinality(String)|TEXT",
            "FixedString(16)|TEXT",
            "Nullable(Float64)|FLOAT64",
            "LowCardinality(Nullable(String))|TEXT",
            "UInt32|OPAQUE",
            "Int64|OPAQUE",
            "Float32|OPAQUE",
            "Array(String)|OPAQUE",
            "Map(String, String)|OPAQUE",
            "Bool|OPAQUE"
    })
    void resolvesReportedTypes(String reportedType, ColumnKind expected) {
        assertEquals(expected, TypeDispatchTable.resolve(new ColumnTypeDescriptor("c", reportedType)));
    }

    @Test
    void missingTypeIsOpaque() {
        assertEquals(ColumnKind.OPAQUE, TypeDispatchTable.resolve((String) null));
        assertEquals(ColumnKind.OPAQUE, TypeDispatchTable.resolve(""));
    }

    @Test
    void normalizerStripsWrappersAndParameters() {
        assertEquals("String", ColumnTypeNormalizer.normalize(" LowCardinality(Nullable(String)) "));
        assertEquals("DateTime64", ColumnTypeNormalizer.normalize("DateTime64(3, 'UTC')"));
        assertEquals("Array", ColumnTypeNormalizer.normalize("Array(Nullable(String))"));
        assertEquals("", ColumnTypeNormalizer.normalize(null));
    }

    @Test
    void eachKindAllocatesAFreshSlot() {
        for (ColumnKind kind : ColumnKind.values()) {
            ScanSlot first = kind.newSlot();
            ScanSlot second = kind.newSlot();
            assertEquals(first.getClass(), second.getClass());
            assertNotSame(first, second, kind.name());
        }
    }
}
