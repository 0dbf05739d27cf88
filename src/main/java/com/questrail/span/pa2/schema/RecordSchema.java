package com.questrail.span.pa2.schema;

import com.questrail.span.pa2.field.FieldSpec;
import com.questrail.span.pa2.model.RecordTag;

import java.util.*;

/**
 * RecordSchema
 * -----------------------------------------------------------------------------
 * The ordered, named field layout of one PA2 record tag.
 *
 * <p>A schema is pure configuration. It is backed by:</p>
 * <ul>
 *   <li>an array for index -> field, in declaration order</li>
 *   <li>a map for field name -> index</li>
 * </ul>
 *
 * <p>Field names are unique within a schema. Fields may overlap; several PA2
 * layouts expose the same characters under two interpretations.</p>
 */
public final class RecordSchema
{
    private final RecordTag tag;
    private final String typeName;
    private final FieldSpec[] fieldByIndex;
    private final Map<String, Integer> indexByName;
    private final List<FieldSpec> fields;
    private final List<String> fieldNames;

    private RecordSchema(RecordTag tag, String typeName, FieldSpec[] fieldsInOrder) {
        this.tag = Objects.requireNonNull(tag, "tag");
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        if (typeName.isBlank()) {
            throw new IllegalArgumentException("Type name must not be blank");
        }
        if (fieldsInOrder.length == 0) {
            throw new IllegalArgumentException("At least one field is required for " + typeName);
        }

        this.fieldByIndex = Arrays.copyOf(fieldsInOrder, fieldsInOrder.length);

        Map<String, Integer> tmp = new HashMap<>(fieldByIndex.length * 2);
        List<String> names = new ArrayList<>(fieldByIndex.length);
        for (int i = 0; i < fieldByIndex.length; i++) {
            FieldSpec field = Objects.requireNonNull(fieldByIndex[i], "field at index " + i);
            Integer prev = tmp.put(field.name(), i);
            if (prev != null) {
                throw new IllegalArgumentException("Duplicate field '" + field.name() + "' in " + typeName);
            }
            names.add(field.name());
        }
        this.indexByName = Collections.unmodifiableMap(tmp);
        this.fields = List.of(fieldByIndex);
        this.fieldNames = Collections.unmodifiableList(names);
    }

    /**
     * Creates a schema from fields in declaration order.
     *
     * @param tag      the record tag this layout applies to
     * @param typeName human-readable record type name, used for rendering
     * @param fields   the field bindings, in declaration order
     * @return a new schema
     * @throws IllegalArgumentException if no fields are given or a name repeats
     */
    public static RecordSchema of(RecordTag tag, String typeName, FieldSpec... fields) {
        Objects.requireNonNull(fields, "fields");
        return new RecordSchema(tag, typeName, fields);
    }

    public RecordTag tag() {
        return tag;
    }

    public String typeName() {
        return typeName;
    }

    public int size() {
        return fieldByIndex.length;
    }

    /**
     * Returns all field names in declaration order.
     */
    public List<String> fieldNames() {
        return fieldNames;
    }

    /**
     * Returns the 0-based declaration index of the named field.
     *
     * @throws IllegalArgumentException if the name is unknown to this schema
     */
    public int indexOf(String name) {
        Objects.requireNonNull(name, "name");
        Integer idx = indexByName.get(name);
        if (idx == null) {
            throw new IllegalArgumentException("Unknown field '" + name + "' in " + typeName);
        }
        return idx;
    }

    public FieldSpec fieldAt(int index) {
        if (index < 0 || index >= fieldByIndex.length) {
            throw new IndexOutOfBoundsException("index=" + index + ", size=" + fieldByIndex.length);
        }
        return fieldByIndex[index];
    }

    public FieldSpec field(String name) {
        return fieldByIndex[indexOf(name)];
    }

    public boolean contains(String name) {
        return name != null && indexByName.containsKey(name);
    }

    /**
     * Returns the minimum line length that satisfies every range-checked
     * field of this layout.
     */
    public int minimumLineLength() {
        int max = RecordTag.LENGTH;
        for (FieldSpec field : fieldByIndex) {
            switch (field.kind()) {
                case STRING, STRING_GROUP -> { }
                default -> max = Math.max(max, field.stop());
            }
        }
        return max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecordSchema that)) return false;
        return tag.equals(that.tag)
                && typeName.equals(that.typeName)
                && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, typeName, fields);
    }

    @Override
    public String toString() {
        return "RecordSchema[" + typeName + ", tag='" + tag.value() + "', fields=" + fieldByIndex.length + "]";
    }
}
