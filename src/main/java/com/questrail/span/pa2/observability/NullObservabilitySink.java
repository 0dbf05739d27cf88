package com.questrail.span.pa2.observability;

import com.questrail.span.pa2.model.DecodedRecord;

/**
 * No-op implementation of DecodeObservabilitySink.
 */
public final class NullObservabilitySink implements DecodeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onRecordDecoded(DecodedRecord record) {}

    @Override
    public void onError(DecodeErrorEvent event) {}
}
