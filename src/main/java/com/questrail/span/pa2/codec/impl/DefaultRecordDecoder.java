package com.questrail.span.pa2.codec.impl;

import com.questrail.span.pa2.codec.RecordDecodeException;
import com.questrail.span.pa2.codec.RecordDecoder;
import com.questrail.span.pa2.codec.UnknownRecordTagException;
import com.questrail.span.pa2.config.RecordDecoderConfig;
import com.questrail.span.pa2.model.DecodedRecord;
import com.questrail.span.pa2.model.RecordTag;
import com.questrail.span.pa2.observability.DecodeErrorEvent;
import com.questrail.span.pa2.observability.DecodeObservabilitySink;
import com.questrail.span.pa2.schema.RecordRegistry;
import com.questrail.span.pa2.schema.RecordSchema;

import java.util.Objects;

/**
 * DefaultRecordDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link RecordDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Tag extraction (first two characters of the line)</li>
 *   <li>Schema lookup in the configured {@link RecordRegistry}</li>
 *   <li>Field decoding, one {@code FieldSpec} at a time, in declaration order</li>
 * </ol>
 *
 * <p>No validation beyond what each field's own range implies is performed;
 * in particular the total line length is never checked. Every failure is
 * reported to the observability sink and then thrown.</p>
 */
public final class DefaultRecordDecoder implements RecordDecoder
{
    private final RecordRegistry registry;
    private final DecodeObservabilitySink observability;
    private final RecordDecoderConfig config;

    public DefaultRecordDecoder() {
        this(RecordDecoderConfig.defaults());
    }

    public DefaultRecordDecoder(RecordDecoderConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = config.registry();
        this.observability = config.observability();
    }

    @Override
    public DecodedRecord decode(String line)
    {
        Objects.requireNonNull(line, "line");
        try {
            // 1) Tag: always the first two characters, trailing space included
            if (line.length() < RecordTag.LENGTH) {
                throw new UnknownRecordTagException(line);
            }
            final String tag = line.substring(0, RecordTag.LENGTH);

            // 2) Layout lookup
            final RecordSchema schema = registry.lookup(tag)
                    .orElseThrow(() -> new UnknownRecordTagException(tag));

            // 3) Field decode; the first failing field fails the line
            final DecodedRecord record = DecodedRecord.decode(line, schema);

            observability.onRecordDecoded(record);
            return record;
        }
        catch (RecordDecodeException e) {
            observability.onError(new DecodeErrorEvent(config.clock().now(), line, e.getMessage(), e));
            throw e;
        }
    }

    public RecordRegistry registry() {
        return registry;
    }
}
