package com.questrail.span.pa2;

import com.questrail.span.pa2.codec.RecordDecoder;
import com.questrail.span.pa2.codec.impl.DefaultRecordDecoder;
import com.questrail.span.pa2.model.DecodedRecord;

import java.util.Optional;

/**
 * SpanRecords
 * =============================================================================
 * Static entry point for decoding PA2 lines with the standard layouts.
 *
 * <pre>
 *   DecodedRecord rate = SpanRecords.decode("T CLPCUSD$0000001063");
 *   rate.string("from_iso");   // "CLP"
 *   rate.scaled("rate");       // 0.001063
 * </pre>
 *
 * <p>The shared decoder has no observability sink. Callers that want logging
 * or a custom registry build their own {@link DefaultRecordDecoder}.</p>
 */
public final class SpanRecords
{
    private static final RecordDecoder DEFAULT = new DefaultRecordDecoder();

    private SpanRecords() {}

    /**
     * Decodes one PA2 line against the standard layouts.
     *
     * @see RecordDecoder#decode(String)
     */
    public static DecodedRecord decode(String line) {
        return DEFAULT.decode(line);
    }

    /**
     * @see RecordDecoder#tryDecode(String)
     */
    public static Optional<DecodedRecord> tryDecode(String line) {
        return DEFAULT.tryDecode(line);
    }

    public static RecordDecoder decoder() {
        return DEFAULT;
    }
}
