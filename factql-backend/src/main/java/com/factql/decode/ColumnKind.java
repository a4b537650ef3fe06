package com.factql.decode;

import java.util.function.Supplier;

/**
 * Decode strategy for one result column. Each kind allocates its own {@link ScanSlot}.
 */
public enum ColumnKind {
    TEMPORAL(ScanSlot.TemporalSlot::new),
    UINT64(ScanSlot.UInt64Slot::new),
    FLOAT64(ScanSlot.Float64Slot::new),
    TEXT(ScanSlot.TextSlot::new),
    OPAQUE(ScanSlot.OpaqueSlot::new);

    private final Supplier<ScanSlot> allocator;

    ColumnKind(Supplier<ScanSlot> allocator) {
        this.allocator = allocator;
    }

    /**
     * Allocates a fresh, empty slot. Slots are never shared between rows.
     */
    public ScanSlot newSlot() {
        return allocator.get();
    }
}
