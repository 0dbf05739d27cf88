package com.questrail.span.pa2.observability;

import com.questrail.span.pa2.model.DecodedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of DecodeObservabilitySink that emits logs via SLF4J.
 *
 * <p>Decode failures are logged at WARN: a bad line is a per-line condition,
 * and the caller decides whether it is fatal for the file.</p>
 */
public final class Slf4jDecodeObservabilitySink implements DecodeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDecodeObservabilitySink.class);

    @Override
    public void onRecordDecoded(DecodedRecord record) {
        if (log.isTraceEnabled()) {
            log.trace("PA2 record decoded: {}", record);
        } else {
            log.debug("PA2 record decoded: tag='{}' type={}", record.tag().value(), record.typeName());
        }
    }

    @Override
    public void onError(DecodeErrorEvent event) {
        log.warn("PA2 decode error: {} (line='{}')", event.message(), event.line(), event.cause());
    }
}
