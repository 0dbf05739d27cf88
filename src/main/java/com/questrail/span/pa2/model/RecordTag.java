package com.questrail.span.pa2.model;

import java.util.Objects;

/**
 * Strongly typed representation of a PA2 record tag.
 *
 * <h2>Why this type exists</h2>
 * <p>
 * Every PA2 line starts with a two-character tag that selects its layout.
 * Most tags are a single letter or digit followed by a literal space
 * ({@code "T "}, {@code "5 "}); the risk array tags use both characters
 * ({@code "81"}, {@code "82"}). Passing these around as raw strings makes it
 * easy to drop the trailing space and silently miss a lookup.
 * </p>
 *
 * <h2>Constraints</h2>
 * <ul>
 *   <li>Exactly two characters</li>
 *   <li>The first character is not whitespace</li>
 * </ul>
 */
public final class RecordTag
{
    /** Number of characters in a tag. */
    public static final int LENGTH = 2;

    private final String value;

    private RecordTag(String value) {
        this.value = value;
    }

    /**
     * Creates a {@code RecordTag} from its two-character wire form.
     *
     * @param value the tag text, including any trailing space
     * @return a {@code RecordTag}
     * @throws IllegalArgumentException if the text is not a valid tag
     */
    public static RecordTag of(String value) {
        Objects.requireNonNull(value, "value");
        if (value.length() != LENGTH) {
            throw new IllegalArgumentException(
                    "PA2 record tag must be exactly " + LENGTH + " characters (was '" + value + "')");
        }
        if (Character.isWhitespace(value.charAt(0))) {
            throw new IllegalArgumentException("PA2 record tag must not start with whitespace (was '" + value + "')");
        }
        return new RecordTag(value);
    }

    /**
     * Returns the two-character wire form, including any trailing space.
     */
    public String value() {
        return value;
    }

    /**
     * Returns true if {@code line} starts with this tag.
     */
    public boolean matches(String line) {
        return line != null && line.startsWith(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecordTag that)) return false;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "RecordTag['" + value + "']";
    }
}
