package com.factql.decode;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Portable value of one decoded cell.
 *
 * <p>{@link Kind#OPAQUE} holds a driver value of a column type the service does not decode;
 * it is written to JSON as-is.
 */
@JsonSerialize(using = CellValue.Serializer.class)
@JsonDeserialize(using = CellValue.Deserializer.class)
public final class CellValue {

    public enum Kind {
        NULL,
        BOOL,
        INT,
        FLOAT,
        TEXT,
        OPAQUE
    }

    private static final CellValue NULL = new CellValue(Kind.NULL, null);

    private final Kind kind;
    private final Object value;

    private CellValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static CellValue nullValue() {
        return NULL;
    }

    public static CellValue bool(boolean value) {
        return new CellValue(Kind.BOOL, value);
    }

    public static CellValue integer(BigInteger value) {
        return new CellValue(Kind.INT, Objects.requireNonNull(value, "value"));
    }

    public static CellValue integer(long value) {
        return integer(BigInteger.valueOf(value));
    }

    /**
     * A float cell. NaN and the infinities have no JSON number form and become
     * {@link #nullValue()}.
     */
    public static CellValue floating(double value) {
        return Double.isFinite(value) ? new CellValue(Kind.FLOAT, value) : NULL;
    }

    public static CellValue text(String value) {
        return new CellValue(Kind.TEXT, Objects.requireNonNull(value, "value"));
    }

    public static CellValue opaque(Object value) {
        return value == null ? NULL : new CellValue(Kind.OPAQUE, value);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    /**
     * The held value: {@link Boolean}, {@link BigInteger}, {@link Double}, {@link String},
     * the raw opaque object, or null.
     */
    public Object getValue() {
        return value;
    }

    public String asText() {
        if (kind != Kind.TEXT) {
            throw new IllegalStateException("not a text value: " + kind);
        }
        return (String) value;
    }

    /**
     * Numeric view of INT, FLOAT and numeric opaque values.
     *
     * @throws IllegalStateException for any other value
     */
    public double asDouble() {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new IllegalStateException("not a numeric value: " + kind);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue that)) {
            return false;
        }
        return kind == that.kind && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind + "(" + value + ")";
    }

    static final class Serializer extends JsonSerializer<CellValue> {
        @Override
        public void serialize(CellValue cell, JsonGenerator gen, SerializerProvider provider) throws IOException {
            switch (cell.kind) {
                case NULL:
                    gen.writeNull();
                    break;
                case BOOL:
                    gen.writeBoolean((Boolean) cell.value);
                    break;
                case INT:
                    gen.writeNumber((BigInteger) cell.value);
                    break;
                case FLOAT:
                    gen.writeNumber((Double) cell.value);
                    break;
                case TEXT:
                    gen.writeString((String) cell.value);
                    break;
                default:
                    provider.defaultSerializeValue(cell.value, gen);
                    break;
            }
        }

        @Override
        public boolean isEmpty(SerializerProvider provider, CellValue cell) {
            return cell == null || cell.isNull();
        }
    }

    static final class Deserializer extends JsonDeserializer<CellValue> {
        @Override
        public CellValue deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return fromNode(p.readValueAsTree());
        }

        @Override
        public CellValue getNullValue(DeserializationContext ctxt) {
            return NULL;
        }

        static CellValue fromNode(JsonNode node) {
            if (node == null || node.isNull() || node.isMissingNode()) {
                return NULL;
            }
            if (node.isBoolean()) {
                return bool(node.booleanValue());
            }
            if (node.isIntegralNumber()) {
                return integer(node.bigIntegerValue());
            }
            if (node.isNumber()) {
                return floating(node.doubleValue());
            }
            if (node.isTextual()) {
                return text(node.textValue());
            }
            return opaque(node);
        }
    }
}
