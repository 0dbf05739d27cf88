package com.questrail.span.pa2.model;

import com.questrail.span.pa2.codec.FieldDecodeException;
import com.questrail.span.pa2.field.FieldKind;
import com.questrail.span.pa2.field.FieldSpec;
import com.questrail.span.pa2.field.TierSpan;
import com.questrail.span.pa2.schema.RecordSchema;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.*;

/**
 * A PA2 line decoded against its {@link RecordSchema}.
 *
 * <h2>Contents</h2>
 * <p>
 * A {@code DecodedRecord} owns the original raw line, the schema used to
 * decode it and one value per schema field. It <em>contains</em> the raw line
 * rather than being one; the line is retained for equality and debugging.
 * </p>
 *
 * <h2>Values</h2>
 * <p>
 * Field values are a pure function of the raw line and the field binding, so
 * they are computed once, eagerly, when the record is created. Typed accessors
 * check the field kind and fail with {@link IllegalArgumentException} when
 * the name is unknown or the kind does not match.
 * </p>
 *
 * <h2>Missing values</h2>
 * <ul>
 *   <li>{@link #integer(String)}: empty {@link OptionalInt} when absent</li>
 *   <li>{@link #scaled(String)}: {@link Double#NaN} when unparsable</li>
 *   <li>{@link #time(String)}: midnight when blank</li>
 * </ul>
 *
 * <p>Two records are equal iff their raw lines and schemas are equal.</p>
 */
public final class DecodedRecord
{
    private final String rawLine;
    private final RecordSchema schema;
    private final Object[] values;

    private DecodedRecord(String rawLine, RecordSchema schema, Object[] values) {
        this.rawLine = rawLine;
        this.schema = schema;
        this.values = values;
    }

    /**
     * Decodes every field of {@code schema} from {@code rawLine}.
     *
     * <p>The first field that fails aborts the whole record; no partially
     * decoded record is ever produced.</p>
     *
     * @param rawLine the full raw line, tag included
     * @param schema  the layout to apply
     * @return the decoded record
     * @throws FieldDecodeException if a field cannot be decoded
     */
    public static DecodedRecord decode(String rawLine, RecordSchema schema) {
        Objects.requireNonNull(rawLine, "rawLine");
        Objects.requireNonNull(schema, "schema");

        Object[] values = new Object[schema.size()];
        for (int i = 0; i < values.length; i++) {
            FieldSpec field = schema.fieldAt(i);
            try {
                values[i] = field.decode(rawLine);
            } catch (RuntimeException e) {
                throw new FieldDecodeException(schema.tag(), field, e);
            }
        }
        return new DecodedRecord(rawLine, schema, values);
    }

    public String rawLine() {
        return rawLine;
    }

    public RecordSchema schema() {
        return schema;
    }

    public RecordTag tag() {
        return schema.tag();
    }

    public String typeName() {
        return schema.typeName();
    }

    /**
     * Returns the field names in schema declaration order.
     */
    public List<String> fieldNames() {
        return schema.fieldNames();
    }

    public boolean has(String name) {
        return schema.contains(name);
    }

    /**
     * Returns the raw decoded value of a field. The runtime type depends on
     * the field kind; an absent integer is {@code null}.
     *
     * @throws IllegalArgumentException if the field is unknown
     */
    public Object get(String name) {
        return values[schema.indexOf(name)];
    }

    /**
     * Returns all values keyed by field name, in declaration order.
     * Absent integers map to {@code null}.
     */
    public Map<String, Object> values() {
        Map<String, Object> map = new LinkedHashMap<>(values.length * 2);
        for (int i = 0; i < values.length; i++) {
            map.put(schema.fieldAt(i).name(), values[i]);
        }
        return Collections.unmodifiableMap(map);
    }

    public String string(String name) {
        return (String) typed(name, FieldKind.STRING);
    }

    @SuppressWarnings("unchecked")
    public List<String> strings(String name) {
        return (List<String>) typed(name, FieldKind.STRING_GROUP);
    }

    public OptionalInt integer(String name) {
        Integer value = (Integer) typed(name, FieldKind.INTEGER);
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    public double scaled(String name) {
        return (Double) typed(name, FieldKind.SCALED_FLOAT);
    }

    public LocalDate date(String name) {
        return (LocalDate) typed(name, FieldKind.DATE);
    }

    public LocalTime time(String name) {
        return (LocalTime) typed(name, FieldKind.TIME);
    }

    @SuppressWarnings("unchecked")
    public List<TierSpan> tiers(String name) {
        return (List<TierSpan>) typed(name, FieldKind.TIER_SPANS);
    }

    @SuppressWarnings("unchecked")
    public List<Double> risk(String name) {
        return (List<Double>) typed(name, FieldKind.SIGNED_MAGNITUDE_ARRAY);
    }

    private Object typed(String name, FieldKind expected) {
        int index = schema.indexOf(name);
        FieldKind actual = schema.fieldAt(index).kind();
        if (actual != expected) {
            throw new IllegalArgumentException(
                    "Field '" + name + "' of " + schema.typeName() + " is " + actual + ", not " + expected);
        }
        return values[index];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DecodedRecord that)) return false;
        return rawLine.equals(that.rawLine) && schema.equals(that.schema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rawLine, schema);
    }

    /**
     * Canonical debug rendering: {@code TypeName(a=..., b=...)} with field
     * names sorted lexicographically. Strings are single-quoted, absent
     * integers render as {@code null}.
     */
    @Override
    public String toString() {
        List<String> names = new ArrayList<>(schema.fieldNames());
        Collections.sort(names);

        StringJoiner members = new StringJoiner(", ", schema.typeName() + "(", ")");
        for (String name : names) {
            members.add(name + "=" + render(get(name)));
        }
        return members.toString();
    }

    private static String render(Object value) {
        if (value instanceof String s) {
            return "'" + s + "'";
        }
        if (value instanceof List<?> list) {
            StringJoiner items = new StringJoiner(", ", "[", "]");
            for (Object item : list) {
                items.add(render(item));
            }
            return items.toString();
        }
        return String.valueOf(value);
    }
}
