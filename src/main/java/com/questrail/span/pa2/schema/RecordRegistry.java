package com.questrail.span.pa2.schema;

import com.questrail.span.pa2.model.RecordTag;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from {@link RecordTag} to {@link RecordSchema}.
 *
 * <p>A registry is built once and never changes afterwards, so any number of
 * threads may look up schemas concurrently without synchronization.</p>
 */
public final class RecordRegistry
{
    private final Map<RecordTag, RecordSchema> schemas;
    private final Map<String, RecordSchema> schemasByText;

    private RecordRegistry(Map<RecordTag, RecordSchema> schemas) {
        this.schemas = Collections.unmodifiableMap(new LinkedHashMap<>(schemas));

        Map<String, RecordSchema> byText = new HashMap<>(schemas.size() * 2);
        schemas.forEach((tag, schema) -> byText.put(tag.value(), schema));
        this.schemasByText = Collections.unmodifiableMap(byText);
    }

    /**
     * Resolves a tag to its schema.
     */
    public Optional<RecordSchema> lookup(RecordTag tag) {
        Objects.requireNonNull(tag, "tag");
        return Optional.ofNullable(schemas.get(tag));
    }

    /**
     * Resolves the two-character wire form of a tag to its schema.
     * Text that is not a well-formed tag resolves to nothing.
     */
    public Optional<RecordSchema> lookup(String tag) {
        Objects.requireNonNull(tag, "tag");
        return Optional.ofNullable(schemasByText.get(tag));
    }

    /**
     * Returns the set of all registered tags, in registration order.
     */
    public Set<RecordTag> tags() {
        return schemas.keySet();
    }

    public int size() {
        return schemas.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<RecordTag, RecordSchema> schemas = new LinkedHashMap<>();

        public Builder register(RecordSchema schema) {
            Objects.requireNonNull(schema, "schema");
            RecordSchema prev = schemas.putIfAbsent(schema.tag(), schema);
            if (prev != null) {
                throw new IllegalArgumentException(
                        "Tag '" + schema.tag().value() + "' already registered to " + prev.typeName());
            }
            return this;
        }

        public Builder registerAll(RecordRegistry other) {
            Objects.requireNonNull(other, "other");
            other.schemas.values().forEach(this::register);
            return this;
        }

        public RecordRegistry build() {
            if (schemas.isEmpty()) {
                throw new IllegalStateException("At least one record schema required");
            }
            return new RecordRegistry(schemas);
        }
    }
}
