package com.questrail.span.pa2.field;

/**
 * The primitive wire encodings a PA2 field can use.
 *
 * <p>Each kind has its own missing-value convention:</p>
 * <ul>
 *   <li>{@link #STRING}, {@link #STRING_GROUP}: never fail; blank yields empty,
 *       and a range past the end of the line is clamped</li>
 *   <li>{@link #INTEGER}: unparsable yields <em>absent</em></li>
 *   <li>{@link #SCALED_FLOAT}: unparsable yields {@link Double#NaN}</li>
 *   <li>{@link #TIME}: unparsable yields midnight</li>
 *   <li>{@link #TIER_SPANS}: non-numeric chunks are skipped</li>
 *   <li>{@link #DATE}, {@link #SIGNED_MAGNITUDE_ARRAY}: malformed input is fatal</li>
 * </ul>
 *
 * <p>Every kind other than the two text kinds fails when its range extends
 * past the end of the line.</p>
 */
public enum FieldKind
{
    STRING,
    STRING_GROUP,
    INTEGER,
    SCALED_FLOAT,
    DATE,
    TIME,
    TIER_SPANS,
    SIGNED_MAGNITUDE_ARRAY
}
