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
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One decoded result row: (column name, value) pairs in the order the store reported the
 * columns. Serialized as a JSON object whose keys keep that order.
 */
@JsonSerialize(using = MaterializedRecord.Serializer.class)
@JsonDeserialize(using = MaterializedRecord.Deserializer.class)
public final class MaterializedRecord {

    public static final class Field {
        private final String name;
        private final CellValue value;

        public Field(String name, CellValue value) {
            this.name = Objects.requireNonNull(name, "name");
            this.value = Objects.requireNonNull(value, "value");
        }

        public String getName() {
            return name;
        }

        public CellValue getValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Field that)) {
                return false;
            }
            return name.equals(that.name) && value.equals(that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, value);
        }

        @Override
        public String toString() {
            return name + "=" + value;
        }
    }

    private final List<Field> fields;

    private MaterializedRecord(List<Field> fields) {
        this.fields = Collections.unmodifiableList(fields);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getColumnNames() {
        return fields.stream().map(Field::getName).toList();
    }

    /**
     * First field with the given column name.
     */
    public Optional<CellValue> get(String name) {
        return fields.stream()
                .filter(f -> f.name.equals(name))
                .map(Field::getValue)
                .findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof MaterializedRecord that && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "MaterializedRecord" + fields;
    }

    public static final class Builder {
        private final List<Field> fields = new ArrayList<>();

        private Builder() {
        }

        public Builder add(String name, CellValue value) {
            fields.add(new Field(name, value));
            return this;
        }

        public MaterializedRecord build() {
            return new MaterializedRecord(new ArrayList<>(fields));
        }
    }

    static final class Serializer extends JsonSerializer<MaterializedRecord> {
        @Override
        public void serialize(MaterializedRecord record, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            for (Field field : record.fields) {
                gen.writeFieldName(field.name);
                provider.defaultSerializeValue(field.value, gen);
            }
            gen.writeEndObject();
        }
    }

    static final class Deserializer extends JsonDeserializer<MaterializedRecord> {
        @Override
        public MaterializedRecord deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.readValueAsTree();
            if (!node.isObject()) {
                return ctxt.reportInputMismatch(MaterializedRecord.class, "expected a JSON object for a record");
            }
            Builder builder = builder();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                builder.add(entry.getKey(), CellValue.Deserializer.fromNode(entry.getValue()));
            }
            return builder.build();
        }
    }
}
