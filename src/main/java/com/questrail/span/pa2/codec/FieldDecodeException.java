package com.questrail.span.pa2.codec;

import com.questrail.span.pa2.field.FieldSpec;
import com.questrail.span.pa2.model.RecordTag;

import java.util.Objects;

/**
 * A field could not be decoded, which fails the whole line.
 *
 * <p>Raised for malformed dates and risk arrays, and for any non-text field
 * whose range extends past the end of the line. The accessor's own failure
 * is kept as the cause.</p>
 */
public final class FieldDecodeException extends RecordDecodeException
{
    private final RecordTag tag;
    private final String fieldName;

    public FieldDecodeException(RecordTag tag, FieldSpec field, Throwable cause) {
        super("Failed to decode field '" + Objects.requireNonNull(field, "field").name()
                + "' [" + field.start() + ", " + field.stop() + ") of record '"
                + Objects.requireNonNull(tag, "tag").value() + "': " + cause.getMessage(), cause);
        this.tag = tag;
        this.fieldName = field.name();
    }

    public RecordTag tag() {
        return tag;
    }

    public String fieldName() {
        return fieldName;
    }
}
