package com.questrail.span.pa2.codec;

/**
 * Indicates that a raw PA2 line could not be decoded into a record.
 *
 * Subclasses distinguish:
 * <ul>
 *   <li>{@link UnknownRecordTagException}: no layout is registered for the tag</li>
 *   <li>{@link FieldDecodeException}: a field is malformed beyond its
 *       missing-value policy, or lies past the end of the line</li>
 * </ul>
 *
 * Decode failures are local to one line. Whether to skip the line or abort
 * a batch is left to the caller.
 */
public class RecordDecodeException extends RuntimeException
{
    public RecordDecodeException(String message) {
        super(message);
    }

    public RecordDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
