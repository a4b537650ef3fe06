package com.factql.decode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Date;

/**
 * Conversions from the Java objects a JDBC driver hands out to portable values.
 *
 * <p>Drivers differ in which {@code java.time} or {@code java.sql} class they return for the
 * same column type; every method here accepts all of them.
 */
public final class CellConversions {
    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private CellConversions() {
    }

    /**
     * Wall-clock date-time of a temporal driver value, as the store reported it.
     *
     * @param v driver value
     * @return local date-time, or null when {@code v} is null or not temporal
     */
    public static LocalDateTime toLocalDateTime(Object v) {
        if (v instanceof LocalDateTime ldt) {
            return ldt;
        }
        if (v instanceof LocalDate ld) {
            return ld.atStartOfDay();
        }
        if (v instanceof OffsetDateTime odt) {
            return odt.toLocalDateTime();
        }
        if (v instanceof ZonedDateTime zdt) {
            return zdt.toLocalDateTime();
        }
        if (v instanceof Instant instant) {
            return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        }
        if (v instanceof Timestamp ts) {
            return ts.toLocalDateTime();
        }
        if (v instanceof java.sql.Date d) {
            return d.toLocalDate().atStartOfDay();
        }
        if (v instanceof Date d) {
            return LocalDateTime.ofInstant(d.toInstant(), ZoneOffset.UTC);
        }
        return null;
    }

    /**
     * Formats as {@code YYYY-MM-DDTHH:MM:SS}, dropping fractional seconds.
     */
    public static String formatTimestamp(LocalDateTime value) {
        return TIMESTAMP_FORMAT.format(value);
    }

    /**
     * Calendar date of a temporal driver value, formatted {@code YYYY-MM-DD}.
     *
     * @param v driver value
     * @return formatted date, or null when {@code v} is not temporal
     */
    public static String toIsoDate(Object v) {
        LocalDateTime ldt = toLocalDateTime(v);
        return ldt != null ? DateTimeFormatter.ISO_LOCAL_DATE.format(ldt.toLocalDate()) : null;
    }

    /**
     * RFC 3339 instant with offset and whole seconds. Values without zone information are
     * read as UTC.
     *
     * @param v driver value
     * @return formatted instant, or null when {@code v} is not temporal
     */
    public static String toRfc3339(Object v) {
        OffsetDateTime odt;
        if (v instanceof OffsetDateTime o) {
            odt = o;
        } else if (v instanceof ZonedDateTime zdt) {
            odt = zdt.toOffsetDateTime();
        } else if (v instanceof Timestamp ts) {
            odt = ts.toInstant().atOffset(ZoneOffset.UTC);
        } else {
            LocalDateTime ldt = toLocalDateTime(v);
            if (ldt == null) {
                return null;
            }
            odt = ldt.atOffset(ZoneOffset.UTC);
        }
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(odt.truncatedTo(ChronoUnit.SECONDS));
    }

    /**
     * Unsigned 64-bit integer from a driver value. Drivers that hand out a signed {@code long}
     * for {@code UInt64} wrap values above {@link Long#MAX_VALUE}; those are unwrapped here.
     *
     * @param v driver value
     * @return unsigned value, or null when {@code v} is not integral
     */
    public static BigInteger toUnsigned64(Object v) {
        if (v instanceof BigInteger bi) {
            return bi;
        }
        if (v instanceof Long l) {
            return l >= 0 ? BigInteger.valueOf(l) : new BigInteger(Long.toUnsignedString(l));
        }
        if (v instanceof Integer || v instanceof Short || v instanceof Byte) {
            return BigInteger.valueOf(((Number) v).longValue());
        }
        if (v instanceof BigDecimal bd) {
            return bd.toBigInteger();
        }
        if (v instanceof String s) {
            try {
                return new BigInteger(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
