package com.questrail.span.pa2.model;

import com.questrail.span.pa2.Pa2Fixtures;
import com.questrail.span.pa2.codec.FieldDecodeException;
import com.questrail.span.pa2.field.FieldSpec;
import com.questrail.span.pa2.field.TierSpan;
import com.questrail.span.pa2.schema.RecordSchema;
import com.questrail.span.pa2.schema.StandardRecordSchemas;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link DecodedRecord}: typed access, rendering and equality.
 */
final class DecodedRecordTest
{
    private static final RecordSchema MIXED = RecordSchema.of(RecordTag.of("M "), "Mixed",
            FieldSpec.string("name", 2, 6),
            FieldSpec.integer("count", 6, 9),
            FieldSpec.scaled("rate", 9, 13, 1e-2),
            FieldSpec.date("day", 13),
            FieldSpec.time("at", 21),
            FieldSpec.strings("codes", 25, 31, 3),
            FieldSpec.tiers("tiers", 31, 45),
            FieldSpec.risk("risk", 45, 51));

    private static final String LINE =
            "M " + "ab  " + "   " + "0150" + "20250620" + "    " + "X  YZ " + "00202507202512" + "00100-";

    @Test
    void typedAccessorsReturnDecodedValues()
    {
        DecodedRecord record = DecodedRecord.decode(LINE, MIXED);

        assertEquals("ab", record.string("name"));
        assertTrue(record.integer("count").isEmpty());
        assertEquals(1.5, record.scaled("rate"), 1e-12);
        assertEquals(LocalDate.of(2025, 6, 20), record.date("day"));
        assertEquals(LocalTime.MIDNIGHT, record.time("at"));
        assertEquals(List.of("X", "YZ"), record.strings("codes"));
        assertEquals(List.of(new TierSpan(202507, 202512)), record.tiers("tiers"));
        assertEquals(List.of(100 * -1e-4), record.risk("risk"));
    }

    @Test
    void typedAccessorRejectsKindMismatch()
    {
        DecodedRecord record = DecodedRecord.decode(LINE, MIXED);

        assertThrows(IllegalArgumentException.class, () -> record.scaled("name"));
        assertThrows(IllegalArgumentException.class, () -> record.string("count"));
    }

    @Test
    void unknownFieldIsRejected()
    {
        DecodedRecord record = DecodedRecord.decode(LINE, MIXED);

        assertFalse(record.has("missing"));
        assertThrows(IllegalArgumentException.class, () -> record.get("missing"));
    }

    @Test
    void valuesFollowDeclarationOrder()
    {
        DecodedRecord record = DecodedRecord.decode(LINE, MIXED);

        Map<String, Object> values = record.values();
        assertEquals(MIXED.fieldNames(), List.copyOf(values.keySet()));
        assertNull(values.get("count"));
        assertEquals(record.fieldNames(), MIXED.fieldNames());
    }

    @Test
    void retainsRawLineAndSchema()
    {
        DecodedRecord record = DecodedRecord.decode(LINE, MIXED);

        assertSame(LINE, record.rawLine());
        assertSame(MIXED, record.schema());
        assertEquals(RecordTag.of("M "), record.tag());
        assertEquals("Mixed", record.typeName());
    }

    @Test
    void renderingSortsFieldNames()
    {
        DecodedRecord record = DecodedRecord.decode(LINE, MIXED);

        assertEquals("Mixed(at=00:00, codes=['X', 'YZ'], count=null, day=2025-06-20, name='ab', "
                        + "rate=1.5, risk=[-0.01], tiers=[(202507, 202512)])",
                record.toString());
    }

    @Test
    void renderingOfStandardRecord()
    {
        DecodedRecord record = DecodedRecord.decode(Pa2Fixtures.EXCHANGE_HEADER, StandardRecordSchemas.EXCHANGE_HEADER);

        assertEquals("ExchangeHeader(acronym='CBT', code='01')", record.toString());
    }

    @Test
    void equalityIsByRawLineAndSchema()
    {
        DecodedRecord a = DecodedRecord.decode(LINE, MIXED);
        DecodedRecord b = DecodedRecord.decode(new String(LINE.toCharArray()), MIXED);
        DecodedRecord c = DecodedRecord.decode(LINE.replace("ab  ", "cd  "), MIXED);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test
    void fatalFieldFailsWholeRecord()
    {
        String badDate = LINE.replace("20250620", "2025XX20");

        FieldDecodeException e = assertThrows(FieldDecodeException.class,
                () -> DecodedRecord.decode(badDate, MIXED));
        assertEquals("day", e.fieldName());
        assertEquals(RecordTag.of("M "), e.tag());
    }

    @Test
    void truncatedLineFailsOnFirstRangeCheckedField()
    {
        FieldDecodeException e = assertThrows(FieldDecodeException.class,
                () -> DecodedRecord.decode(LINE.substring(0, 12), MIXED));
        assertEquals("rate", e.fieldName());
        assertInstanceOf(IndexOutOfBoundsException.class, e.getCause());
    }
}
