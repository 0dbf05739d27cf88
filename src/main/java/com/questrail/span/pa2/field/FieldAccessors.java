package com.questrail.span.pa2.field;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * FieldAccessors
 * -----------------------------------------------------------------------------
 * Stateless decode primitives for the PA2 fixed-width wire format.
 *
 * <p>Every accessor takes the full raw line plus a 0-based, end-exclusive
 * character range {@code [start, stop)} and returns a typed value. Accessors
 * never read outside the range they are given, except for
 * {@link #scaledFloat(String, int, int, double)}, which inspects the single
 * character at {@code stop} to resolve an out-of-band sign.</p>
 *
 * <p>Failures surface as plain runtime exceptions
 * ({@link IndexOutOfBoundsException}, {@link NumberFormatException},
 * {@link DateTimeParseException}). The record decoder wraps them with record
 * and field context.</p>
 */
public final class FieldAccessors
{
    /** Width of one tier chunk: 2 filler digits plus two 6-digit months. */
    public static final int TIER_CHUNK_WIDTH = 14;

    /** Width of one risk array chunk: 5 magnitude digits plus a sign flag. */
    public static final int RISK_CHUNK_WIDTH = 6;

    /** Risk array magnitudes are stored in units of 1e-4. */
    static final double RISK_SCALE = 1e-4;

    static final int DATE_WIDTH = 8;
    static final int TIME_WIDTH = 4;

    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("HHmm").withResolverStyle(ResolverStyle.STRICT);

    private FieldAccessors() {}

    /**
     * Slices {@code [start, stop)} and strips trailing whitespace.
     * Leading whitespace is preserved. A range extending past the end of the
     * line is clamped, so this never fails.
     */
    public static String string(String line, int start, int stop) {
        return clampedSlice(line, start, stop).stripTrailing();
    }

    /**
     * Splits {@code [start, stop)} into consecutive chunks of {@code step}
     * characters, right-trims each chunk and drops chunks that trim to empty.
     */
    public static List<String> stringGroup(String line, int start, int stop, int step) {
        List<String> values = new ArrayList<>((stop - start) / step);
        for (int index = start; index < stop; index += step) {
            String chunk = clampedSlice(line, index, index + step).stripTrailing();
            if (!chunk.isEmpty()) {
                values.add(chunk);
            }
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * Parses {@code [start, stop)} as a base-10 signed integer.
     *
     * @return the value, or {@code null} when the slice is not an integer
     *         (e.g. all blanks)
     */
    public static Integer integer(String line, int start, int stop) {
        String slice = slice(line, start, stop);
        try {
            return parseInt(slice);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Parses {@code [start, stop)} as a base-10 integer and multiplies it by
     * the effective scale.
     *
     * <p>A negative configured scale means the sign travels out of band: the
     * configured (negative) scale applies only when the character at
     * {@code stop} is {@code '-'}. In every other case, including a missing
     * character at {@code stop}, {@code |scale|} applies.</p>
     *
     * @return the scaled value, or {@link Double#NaN} when the slice is not
     *         an integer
     */
    public static double scaledFloat(String line, int start, int stop, double scale) {
        String slice = slice(line, start, stop);
        long raw;
        try {
            raw = Long.parseLong(slice.strip());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
        boolean negative = scale < 0 && stop < line.length() && line.charAt(stop) == '-';
        return raw * (negative ? scale : Math.abs(scale));
    }

    /**
     * Parses the 8 characters at {@code start} as {@code YYYYMMDD}.
     *
     * @throws DateTimeParseException if the characters are not a valid date
     */
    public static LocalDate date(String line, int start) {
        return LocalDate.parse(slice(line, start, start + DATE_WIDTH), DATE_FORMAT);
    }

    /**
     * Parses the 4 characters at {@code start} as {@code HHMM}.
     *
     * <p>Unparsable input (typically blanks) silently yields
     * {@link LocalTime#MIDNIGHT}. Callers cannot distinguish a blank time from
     * a genuine {@code 0000}.</p>
     */
    public static LocalTime time(String line, int start) {
        String slice = slice(line, start, start + TIME_WIDTH);
        try {
            return LocalTime.parse(slice, TIME_FORMAT);
        } catch (DateTimeParseException e) {
            return LocalTime.MIDNIGHT;
        }
    }

    /**
     * Walks {@code [start, stop)} in 14-character chunks. A chunk is kept only
     * if all of its characters are ASCII digits; kept chunks decode the 6-digit
     * months at chunk offsets 2 and 8.
     */
    public static List<TierSpan> tierSpans(String line, int start, int stop) {
        requireRange(line, start, stop);
        List<TierSpan> spans = new ArrayList<>((stop - start) / TIER_CHUNK_WIDTH);
        for (int index = start; index + TIER_CHUNK_WIDTH <= stop; index += TIER_CHUNK_WIDTH) {
            if (allDigits(line, index, index + TIER_CHUNK_WIDTH)) {
                spans.add(new TierSpan(
                        Integer.parseInt(line.substring(index + 2, index + 8)),
                        Integer.parseInt(line.substring(index + 8, index + 14))));
            }
        }
        return Collections.unmodifiableList(spans);
    }

    /**
     * Walks {@code [start, stop)} in 6-character chunks: a zero-padded 5-digit
     * magnitude followed by a sign flag ({@code '-'} for negative, anything
     * else positive). Each value is {@code magnitude * 1e-4} with the sign
     * applied.
     *
     * @throws NumberFormatException if any magnitude is malformed
     */
    public static List<Double> signedMagnitudeArray(String line, int start, int stop) {
        requireRange(line, start, stop);
        List<Double> values = new ArrayList<>((stop - start) / RISK_CHUNK_WIDTH);
        for (int index = start; index < stop; index += RISK_CHUNK_WIDTH) {
            int magnitude = parseInt(line.substring(index, index + RISK_CHUNK_WIDTH - 1));
            char sign = line.charAt(index + RISK_CHUNK_WIDTH - 1);
            values.add(magnitude * (sign == '-' ? -RISK_SCALE : RISK_SCALE));
        }
        return Collections.unmodifiableList(values);
    }

    // ========================================================================
    // Slicing helpers
    // ========================================================================

    private static String slice(String line, int start, int stop) {
        requireRange(line, start, stop);
        return line.substring(start, stop);
    }

    private static String clampedSlice(String line, int start, int stop) {
        int length = line.length();
        if (start >= length) {
            return "";
        }
        return line.substring(start, Math.min(stop, length));
    }

    private static void requireRange(String line, int start, int stop) {
        if (stop > line.length()) {
            throw new IndexOutOfBoundsException(
                    "Field range [" + start + ", " + stop + ") exceeds line length " + line.length());
        }
    }

    // Whitespace around the digits and an explicit sign are accepted.
    private static int parseInt(String text) {
        return Integer.parseInt(text.strip());
    }

    private static boolean allDigits(String line, int start, int stop) {
        for (int i = start; i < stop; i++) {
            char c = line.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
