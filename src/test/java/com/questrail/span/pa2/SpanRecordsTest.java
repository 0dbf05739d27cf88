package com.questrail.span.pa2;

import com.questrail.span.pa2.codec.UnknownRecordTagException;
import com.questrail.span.pa2.codec.impl.DefaultRecordDecoder;
import com.questrail.span.pa2.model.DecodedRecord;
import com.questrail.span.pa2.schema.StandardRecordSchemas;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SpanRecordsTest
{
    @Test
    void decodesEveryStandardTag()
    {
        List<String> lines = List.of(
                Pa2Fixtures.EXCHANGE_COMPLEX_HEADER,
                Pa2Fixtures.CURRENCY_CONVERSION,
                Pa2Fixtures.EXCHANGE_HEADER,
                Pa2Fixtures.FIRST_COMBINED_COMMODITY,
                Pa2Fixtures.SECOND_COMBINED_COMMODITY,
                Pa2Fixtures.REQUIRED_SPREADS,
                Pa2Fixtures.THIRD_COMBINED_COMMODITY,
                Pa2Fixtures.ARRAY_CALCULATION_PARAMETERS,
                Pa2Fixtures.PRICE_CONVERSION_PARAMETERS,
                Pa2Fixtures.COMMODITY_GROUP,
                Pa2Fixtures.INTER_COMMODITY_SPREAD,
                Pa2Fixtures.FIRST_RISK_ARRAY,
                Pa2Fixtures.SECOND_RISK_ARRAY,
                Pa2Fixtures.SERIES_INTRACOMMODITY_SPREADS,
                Pa2Fixtures.SCANNING_METHOD,
                Pa2Fixtures.DAILY_ADJUSTMENTS_RATES,
                Pa2Fixtures.COMBINATION_MARGINING_METHOD,
                Pa2Fixtures.COMBINATION_PRODUCT_FAMILY,
                Pa2Fixtures.COMBINATION_UNDERLYING_LEGS);

        for (String line : lines) {
            DecodedRecord record = SpanRecords.decode(line);
            assertEquals(line.substring(0, 2), record.tag().value());
            assertSame(StandardRecordSchemas.registry().lookup(record.tag()).orElseThrow(), record.schema());
        }
    }

    @Test
    void tryDecodeSkipsUnknownLines()
    {
        assertTrue(SpanRecords.tryDecode("Q whatever").isEmpty());
        assertEquals("CBT", SpanRecords.tryDecode("1 CBT  01").orElseThrow().string("acronym"));
    }

    @Test
    void decodeThrowsForUnknownTag()
    {
        assertThrows(UnknownRecordTagException.class, () -> SpanRecords.decode("Q whatever"));
    }

    @Test
    void sharedDecoderUsesStandardRegistry()
    {
        DefaultRecordDecoder decoder = assertInstanceOf(DefaultRecordDecoder.class, SpanRecords.decoder());
        assertSame(StandardRecordSchemas.registry(), decoder.registry());
    }
}
