package com.questrail.gatt.codec.template;

import com.questrail.gatt.codec.IntegerFormat;
import com.questrail.gatt.error.ValueRangeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ScaledTemplateTest
{
    @Test
    void decodesWithoutBinaryRoundingError()
    {
        ScaledTemplate template = ScaledTemplate.of(IntegerFormat.UINT16, 0.01);
        assertEquals(24.04, template.decode(new byte[] { 0x64, 0x09 }, 0));
    }

    @Test
    void mdbFormMatchesDecimalScale()
    {
        ScaledTemplate decimal = ScaledTemplate.of(IntegerFormat.UINT16, 0.01);
        ScaledTemplate mdb = ScaledTemplate.fromMdb(IntegerFormat.UINT16, 1, -2, 0);
        assertEquals(decimal.decodeRaw(2404), mdb.decodeRaw(2404));
        assertEquals(0.01, mdb.resolution());
    }

    @Test
    void offsetIsAddedBeforeScaling()
    {
        ScaledTemplate template = ScaledTemplate.of(IntegerFormat.SINT8, 0.5, 40);
        assertEquals(0.0, template.decodeRaw(-40));
        assertEquals(25.0, template.decodeRaw(10));
        assertEquals(10, template.encodeRaw(25.0));
    }

    @Test
    void encodesToLittleEndianRaw()
    {
        ScaledTemplate template = ScaledTemplate.of(IntegerFormat.UINT16, 0.01);
        assertArrayEquals(new byte[] { 0x64, 0x09 }, template.encode(24.04));
    }

    @Test
    void encodeRoundsHalfUpToNearestStep()
    {
        ScaledTemplate template = ScaledTemplate.of(IntegerFormat.UINT16, 0.01);
        assertEquals(2405, template.encodeRaw(24.046));
        assertEquals(2404, template.encodeRaw(24.044));
    }

    @Test
    void everyRawStepSurvivesDecodeThenEncode()
    {
        ScaledTemplate template = ScaledTemplate.of(IntegerFormat.SINT16, 0.01);
        for (long raw = IntegerFormat.SINT16.min(); raw <= IntegerFormat.SINT16.max(); raw += 7) {
            assertEquals(raw, template.encodeRaw(template.decodeRaw(raw)), "raw " + raw);
        }
    }

    @Test
    void encodeRejectsValuesOutsideFormat()
    {
        ScaledTemplate template = ScaledTemplate.of(IntegerFormat.UINT8, 0.5);
        assertEquals(127.5, template.maxValue());
        assertThrows(ValueRangeException.class, () -> template.encodeRaw(128.0));
        assertThrows(ValueRangeException.class, () -> template.encodeRaw(-1.0));
        assertThrows(ValueRangeException.class, () -> template.encodeRaw(Double.NaN));
    }

    @Test
    void rangeFollowsFormat()
    {
        ScaledTemplate template = ScaledTemplate.of(IntegerFormat.SINT16, 0.01);
        assertEquals(-327.68, template.minValue());
        assertEquals(327.67, template.maxValue());
    }

    @Test
    void rejectsZeroScale()
    {
        assertThrows(IllegalArgumentException.class, () -> ScaledTemplate.of(IntegerFormat.UINT8, 0.0));
        assertThrows(IllegalArgumentException.class, () -> ScaledTemplate.fromMdb(IntegerFormat.UINT8, 0, 0, 0));
    }
}
