package com.questrail.span.pa2.field;

import java.util.Objects;

/**
 * Binds a field name to a character range and a {@link FieldKind}.
 *
 * <p>Ranges are 0-based and end-exclusive. Grouped kinds
 * ({@link FieldKind#STRING_GROUP}, {@link FieldKind#TIER_SPANS},
 * {@link FieldKind#SIGNED_MAGNITUDE_ARRAY}) carry a chunk width in
 * {@code step}; the range must be a whole number of chunks. Tier and risk
 * chunks have a fixed wire width, so their {@code step} must equal it. {@code scale}
 * is meaningful only for {@link FieldKind#SCALED_FLOAT}.</p>
 *
 * <p>Instances are immutable and are normally created through the static
 * factories, e.g. {@code FieldSpec.scaled("rate", 10, 20)}.</p>
 */
public record FieldSpec(String name, FieldKind kind, int start, int stop, int step, double scale)
{
    /** Default scale of a {@link FieldKind#SCALED_FLOAT} field. */
    public static final double DEFAULT_SCALE = 1e-6;

    /** Widest {@link FieldKind#INTEGER} field; any 9 characters parse into an {@code int}. */
    public static final int MAX_INTEGER_WIDTH = 9;

    public FieldSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Field name must not be blank");
        }
        if (start < 0 || start > stop) {
            throw new IllegalArgumentException(
                    "Field '" + name + "' requires 0 <= start <= stop (was [" + start + ", " + stop + "))");
        }
        if (step <= 0) {
            throw new IllegalArgumentException("Field '" + name + "' step must be positive (was " + step + ")");
        }
        if ((stop - start) % step != 0) {
            throw new IllegalArgumentException(
                    "Field '" + name + "' width " + (stop - start) + " is not a multiple of step " + step);
        }
        if (kind == FieldKind.TIER_SPANS && step != FieldAccessors.TIER_CHUNK_WIDTH) {
            throw new IllegalArgumentException(
                    "Tier field '" + name + "' step must be " + FieldAccessors.TIER_CHUNK_WIDTH + " (was " + step + ")");
        }
        if (kind == FieldKind.SIGNED_MAGNITUDE_ARRAY && step != FieldAccessors.RISK_CHUNK_WIDTH) {
            throw new IllegalArgumentException(
                    "Risk field '" + name + "' step must be " + FieldAccessors.RISK_CHUNK_WIDTH + " (was " + step + ")");
        }
        if (kind == FieldKind.INTEGER && stop - start > MAX_INTEGER_WIDTH) {
            throw new IllegalArgumentException(
                    "Integer field '" + name + "' must span at most " + MAX_INTEGER_WIDTH + " characters");
        }
        if (kind == FieldKind.DATE && stop - start != FieldAccessors.DATE_WIDTH) {
            throw new IllegalArgumentException("Date field '" + name + "' must span 8 characters");
        }
        if (kind == FieldKind.TIME && stop - start != FieldAccessors.TIME_WIDTH) {
            throw new IllegalArgumentException("Time field '" + name + "' must span 4 characters");
        }
    }

    public static FieldSpec string(String name, int start, int stop) {
        return new FieldSpec(name, FieldKind.STRING, start, stop, 1, 0);
    }

    public static FieldSpec strings(String name, int start, int stop, int step) {
        return new FieldSpec(name, FieldKind.STRING_GROUP, start, stop, step, 0);
    }

    public static FieldSpec integer(String name, int start, int stop) {
        return new FieldSpec(name, FieldKind.INTEGER, start, stop, 1, 0);
    }

    public static FieldSpec scaled(String name, int start, int stop) {
        return scaled(name, start, stop, DEFAULT_SCALE);
    }

    /**
     * A scaled fixed-point field. A negative {@code scale} marks a field whose
     * sign is carried by the character immediately after {@code stop}.
     */
    public static FieldSpec scaled(String name, int start, int stop, double scale) {
        return new FieldSpec(name, FieldKind.SCALED_FLOAT, start, stop, 1, scale);
    }

    public static FieldSpec date(String name, int start) {
        return new FieldSpec(name, FieldKind.DATE, start, start + FieldAccessors.DATE_WIDTH, 1, 0);
    }

    public static FieldSpec time(String name, int start) {
        return new FieldSpec(name, FieldKind.TIME, start, start + FieldAccessors.TIME_WIDTH, 1, 0);
    }

    public static FieldSpec tiers(String name, int start, int stop) {
        return new FieldSpec(name, FieldKind.TIER_SPANS, start, stop, FieldAccessors.TIER_CHUNK_WIDTH, 0);
    }

    public static FieldSpec risk(String name, int start, int stop) {
        return new FieldSpec(name, FieldKind.SIGNED_MAGNITUDE_ARRAY, start, stop, FieldAccessors.RISK_CHUNK_WIDTH, 0);
    }

    /**
     * Decodes this field from a raw line.
     *
     * @param line the full raw record line
     * @return the decoded value; {@code null} only for an absent
     *         {@link FieldKind#INTEGER}
     * @throws RuntimeException if the field is malformed beyond its
     *         missing-value policy, or its range exceeds the line
     */
    public Object decode(String line) {
        Objects.requireNonNull(line, "line");
        return switch (kind) {
            case STRING -> FieldAccessors.string(line, start, stop);
            case STRING_GROUP -> FieldAccessors.stringGroup(line, start, stop, step);
            case INTEGER -> FieldAccessors.integer(line, start, stop);
            case SCALED_FLOAT -> FieldAccessors.scaledFloat(line, start, stop, scale);
            case DATE -> FieldAccessors.date(line, start);
            case TIME -> FieldAccessors.time(line, start);
            case TIER_SPANS -> FieldAccessors.tierSpans(line, start, stop);
            case SIGNED_MAGNITUDE_ARRAY -> FieldAccessors.signedMagnitudeArray(line, start, stop);
        };
    }
}
