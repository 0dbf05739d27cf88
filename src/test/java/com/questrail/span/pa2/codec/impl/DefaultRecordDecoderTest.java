package com.questrail.span.pa2.codec.impl;

import com.questrail.span.pa2.Pa2Fixtures;
import com.questrail.span.pa2.codec.FieldDecodeException;
import com.questrail.span.pa2.codec.UnknownRecordTagException;
import com.questrail.span.pa2.config.RecordDecoderConfig;
import com.questrail.span.pa2.field.FieldSpec;
import com.questrail.span.pa2.model.DecodedRecord;
import com.questrail.span.pa2.model.RecordTag;
import com.questrail.span.pa2.observability.DecodeErrorEvent;
import com.questrail.span.pa2.observability.RecordingObservabilitySink;
import com.questrail.span.pa2.schema.RecordRegistry;
import com.questrail.span.pa2.schema.RecordSchema;
import com.questrail.span.pa2.schema.StandardRecordSchemas;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultRecordDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultRecordDecoder}.
 *
 * <p>These tests exercise the line-level decode pipeline:</p>
 * <ul>
 *   <li>tag extraction and registry lookup</li>
 *   <li>field decoding against the selected layout</li>
 *   <li>failure reporting to the observability sink</li>
 * </ul>
 */
final class DefaultRecordDecoderTest
{
    private static final Instant NOW = Instant.parse("2025-06-20T14:07:00Z");

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    private final DefaultRecordDecoder decoder = new DefaultRecordDecoder(RecordDecoderConfig.builder()
            .withObservability(sink)
            .withClock(() -> NOW)
            .build());

    @Test
    void decodeCurrencyConversion()
    {
        DecodedRecord record = decoder.decode("T CLPCUSD$0000001063");

        assertSame(StandardRecordSchemas.CURRENCY_CONVERSION, record.schema());
        assertEquals("CLP", record.string("from_iso"));
        assertEquals("C", record.string("from_code"));
        assertEquals("USD", record.string("to_iso"));
        assertEquals("$", record.string("to_code"));
        assertEquals(0.001063, record.scaled("rate"), 1e-15);
    }

    @Test
    void decodeExchangeHeader()
    {
        DecodedRecord record = decoder.decode("1 CBT  01");

        assertEquals("CBT", record.string("acronym"));
        assertEquals("01", record.string("code"));
    }

    @Test
    void decodeCommodityGroupOmitsBlankChunks()
    {
        String line = "5 CME       06    07          31    " + "      " + "AUW   " + "      " + "      " + "      ";

        DecodedRecord record = decoder.decode(line);

        assertEquals("CME", record.string("code"));
        assertEquals(List.of("06", "07", "31", "AUW"), record.strings("commodities"));
    }

    @Test
    void unknownTagProducesNoRecord()
    {
        UnknownRecordTagException e = assertThrows(UnknownRecordTagException.class,
                () -> decoder.decode("Q 0000000000"));

        assertEquals("Q ", e.tag());
        assertTrue(sink.getDecodedRecords().isEmpty());
    }

    @Test
    void tagIsCaseAndSpaceSensitive()
    {
        assertThrows(UnknownRecordTagException.class, () -> decoder.decode("t CLPCUSD$0000001063"));
        assertThrows(UnknownRecordTagException.class, () -> decoder.decode("TXCLPCUSD$0000001063"));
        assertThrows(UnknownRecordTagException.class, () -> decoder.decode("8 CBT"));
    }

    @Test
    void lineShorterThanTagIsUnknown()
    {
        assertEquals("", assertThrows(UnknownRecordTagException.class, () -> decoder.decode("")).tag());
        assertEquals("T", assertThrows(UnknownRecordTagException.class, () -> decoder.decode("T")).tag());
    }

    @Test
    void malformedDateFailsTheLine()
    {
        String line = Pa2Fixtures.withCharAt(Pa2Fixtures.EXCHANGE_COMPLEX_HEADER, 12, ' ');

        FieldDecodeException e = assertThrows(FieldDecodeException.class, () -> decoder.decode(line));

        assertEquals("business_date", e.fieldName());
        assertEquals(RecordTag.of("0 "), e.tag());
    }

    @Test
    void malformedRiskArrayFailsTheLine()
    {
        String line = Pa2Fixtures.withCharAt(Pa2Fixtures.FIRST_RISK_ARRAY, 56, 'x');

        FieldDecodeException e = assertThrows(FieldDecodeException.class, () -> decoder.decode(line));

        assertEquals("risk", e.fieldName());
        assertInstanceOf(NumberFormatException.class, e.getCause());
    }

    @Test
    void truncatedNumericFieldFailsTheLine()
    {
        FieldDecodeException e = assertThrows(FieldDecodeException.class,
                () -> decoder.decode("T CLPCUSD$00000010"));

        assertEquals("rate", e.fieldName());
    }

    @Test
    void truncatedTextFieldsAreClamped()
    {
        DecodedRecord record = decoder.decode("1 CB");

        assertEquals("CB", record.string("acronym"));
        assertEquals("", record.string("code"));
    }

    @Test
    void successIsReportedToSink()
    {
        DecodedRecord record = decoder.decode(Pa2Fixtures.EXCHANGE_HEADER);

        assertEquals(List.of(record), sink.getDecodedRecords());
        assertEquals(List.of(record), sink.getAllEvents());
        assertTrue(sink.getErrors().isEmpty());
    }

    @Test
    void failureIsReportedToSinkBeforeThrowing()
    {
        assertThrows(UnknownRecordTagException.class, () -> decoder.decode("Q junk"));

        List<DecodeErrorEvent> errors = sink.getErrors();
        assertEquals(1, errors.size());
        assertEquals(NOW, errors.get(0).timestamp());
        assertEquals("Q junk", errors.get(0).line());
        assertInstanceOf(UnknownRecordTagException.class, errors.get(0).cause());
    }

    @Test
    void tryDecodeMapsFailureToEmpty()
    {
        assertTrue(decoder.tryDecode("Q junk").isEmpty());
        assertTrue(decoder.tryDecode("T CLPCUSD$0000001063").isPresent());
        assertEquals(1, sink.getErrors().size());
    }

    @Test
    void decodeIsDeterministic()
    {
        DecodedRecord first = decoder.decode(Pa2Fixtures.SECOND_RISK_ARRAY);
        DecodedRecord second = decoder.decode(Pa2Fixtures.SECOND_RISK_ARRAY);

        assertEquals(first, second);
        assertEquals(first.values(), second.values());
        assertEquals(first.toString(), second.toString());
    }

    @Test
    void customRegistryOnlyKnowsItsOwnTags()
    {
        RecordSchema custom = RecordSchema.of(RecordTag.of("Q "), "Custom",
                FieldSpec.integer("value", 2, 6));
        DefaultRecordDecoder customDecoder = new DefaultRecordDecoder(RecordDecoderConfig.builder()
                .withRegistry(RecordRegistry.builder().register(custom).build())
                .build());

        assertEquals(1234, customDecoder.decode("Q 1234").integer("value").orElseThrow());
        assertThrows(UnknownRecordTagException.class, () -> customDecoder.decode(Pa2Fixtures.EXCHANGE_HEADER));
    }

    @Test
    void concurrentDecodingOfIndependentLines() throws Exception
    {
        DefaultRecordDecoder shared = new DefaultRecordDecoder();
        List<String> lines = List.of(
                Pa2Fixtures.FIRST_RISK_ARRAY,
                Pa2Fixtures.SECOND_RISK_ARRAY,
                Pa2Fixtures.ARRAY_CALCULATION_PARAMETERS,
                Pa2Fixtures.DAILY_ADJUSTMENTS_RATES);

        List<String> expected = new ArrayList<>();
        for (String line : lines) {
            expected.add(shared.decode(line).toString());
        }

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < 400; i++) {
                String line = lines.get(i % lines.size());
                results.add(pool.submit(() -> shared.decode(line).toString()));
            }
            for (int i = 0; i < results.size(); i++) {
                assertEquals(expected.get(i % lines.size()), results.get(i).get());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
