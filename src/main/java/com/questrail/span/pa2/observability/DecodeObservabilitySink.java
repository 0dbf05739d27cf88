package com.questrail.span.pa2.observability;

import com.questrail.span.pa2.model.DecodedRecord;

/**
 * Receives observability events from the PA2 decoder.
 * Implementations can provide logging, metrics, or counting.
 *
 * <p>Sinks are called on the decoding thread and must be safe for concurrent
 * use when a decoder is shared.</p>
 */
public interface DecodeObservabilitySink {
    /**
     * Called after a line has been decoded successfully.
     * @param record the decoded record
     */
    void onRecordDecoded(DecodedRecord record);

    /**
     * Called when a line cannot be decoded, before the failure is thrown.
     * @param event the error event
     */
    void onError(DecodeErrorEvent event);
}
