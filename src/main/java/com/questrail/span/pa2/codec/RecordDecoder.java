package com.questrail.span.pa2.codec;

import com.questrail.span.pa2.model.DecodedRecord;

import java.util.Optional;

/**
 * RecordDecoder
 * -----------------------------------------------------------------------------
 * Line-level decoder for PA2 records.
 *
 * <p>This interface is the single boundary between raw PA2 text and decoded
 * records. The decoder is responsible only for:</p>
 * <ul>
 *   <li>Reading the two-character tag</li>
 *   <li>Selecting the registered layout for that tag</li>
 *   <li>Decoding every field of the layout from the line</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Reading files or splitting them into lines</li>
 *   <li>Cross-record consistency, ordering or de-duplication</li>
 *   <li>Retrying or skipping malformed lines</li>
 * </ul>
 *
 * <p>Implementations are stateless apart from an immutable registry and may be
 * shared freely between threads.</p>
 */
public interface RecordDecoder
{
    /**
     * Decodes a single complete PA2 line.
     *
     * @param line one raw line, without its line terminator
     * @return the decoded record
     * @throws UnknownRecordTagException if the tag has no registered layout
     * @throws FieldDecodeException if a field is malformed or out of range
     */
    DecodedRecord decode(String line);

    /**
     * Decodes a single line, mapping any decode failure to
     * {@link Optional#empty()}.
     *
     * @param line one raw line, without its line terminator
     * @return the decoded record, or empty if the line could not be decoded
     */
    default Optional<DecodedRecord> tryDecode(String line) {
        try {
            return Optional.of(decode(line));
        }
        catch (RecordDecodeException e) {
            // Line-level failure: drop the line
            return Optional.empty();
        }
    }
}
