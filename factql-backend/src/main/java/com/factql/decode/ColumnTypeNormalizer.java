package com.factql.decode;

import java.util.Locale;

/**
 * Normalizes a store-reported column type name into the bare type name used as the
 * {@link TypeDispatchTable} key.
 *
 * <p>{@code Nullable(...)} and {@code LowCardinality(...)} wrappers are unwrapped and type
 * parameters dropped: {@code LowCardinality(Nullable(String))} becomes {@code String},
 * {@code DateTime64(3, 'UTC')} becomes {@code DateTime64}.
 */
public final class ColumnTypeNormalizer {
    private static final String[] WRAPPERS = {"Nullable(", "LowCardinality("};

    private ColumnTypeNormalizer() {
    }

    /**
     * Normalize a reported type name.
     *
     * @param reportedType type name from result set metadata, may be null
     * @return bare type name, or empty string when nothing was reported
     */
    public static String normalize(String reportedType) {
        if (reportedType == null) {
            return "";
        }
        String v = reportedType.trim();
        boolean unwrapped = true;
        while (unwrapped) {
            unwrapped = false;
            for (String wrapper : WRAPPERS) {
                if (v.regionMatches(true, 0, wrapper, 0, wrapper.length()) && v.endsWith(")")) {
                    v = v.substring(wrapper.length(), v.length() - 1).trim();
                    unwrapped = true;
                }
            }
        }
        int paren = v.indexOf('(');
        if (paren > 0) {
            v = v.substring(0, paren).trim();
        }
        return v;
    }

    /**
     * Same as {@link #normalize(String)} but case-folded, for lookups.
     */
    static String key(String reportedType) {
        return normalize(reportedType).toLowerCase(Locale.ROOT);
    }
}
