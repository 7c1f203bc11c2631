package com.questrail.gatt.codec;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

final class BitFieldsTest
{
    private static final long[] SAMPLES = {
            0L, -1L, 0x1234_5678_9ABC_DEF0L, 0x8000_0000_0000_0001L, 0x00FF_00FF_00FF_00FFL
    };

    @Test
    void extractsFieldFromMiddleOfWord()
    {
        assertEquals(0b101, BitFields.extractField(0b1011_0100, 2, 3));
        assertEquals(0xF, BitFields.extractField(0xF0, 4, 4));
    }

    @Test
    void setFieldMasksOversizedValue()
    {
        assertEquals(0x50, BitFields.setField(0, 5, 4, 3));
        assertEquals(0x0F, BitFields.setField(0, 0xFF, 0, 4));
        assertEquals(0xA5, BitFields.setField(0xAF, 0x5, 0, 4));
    }

    @Test
    void setOfExtractIsIdentity()
    {
        for (long value : SAMPLES) {
            for (int start = 0; start < 64; start++) {
                for (int width = 1; start + width <= 64; width++) {
                    long field = BitFields.extractField(value, start, width);
                    assertEquals(value, BitFields.setField(value, field, start, width),
                            "start=" + start + " width=" + width);
                }
            }
        }
    }

    @Test
    void masks()
    {
        assertEquals(0L, BitFields.mask(0));
        assertEquals(0xFFL, BitFields.mask(8));
        assertEquals(-1L, BitFields.mask(64));
        assertEquals(0xF0L, BitFields.mask(4, 4));
        assertThrows(IllegalArgumentException.class, () -> BitFields.mask(65));
    }

    @Test
    void rejectsFieldsOutsideTheWord()
    {
        assertThrows(IllegalArgumentException.class, () -> BitFields.extractField(0, 60, 8));
        assertThrows(IllegalArgumentException.class, () -> BitFields.extractField(0, 0, 9, 8));
        assertThrows(IllegalArgumentException.class, () -> BitFields.extractField(0, -1, 4));
        assertThrows(IllegalArgumentException.class, () -> BitFields.setField(0, 1, 0, 0));
    }

    @Test
    void singleBitOperations()
    {
        assertTrue(BitFields.testBit(0b100, 2));
        assertFalse(BitFields.testBit(0b100, 1));
        assertEquals(0b101, BitFields.setBit(0b100, 0));
        assertEquals(0b000, BitFields.clearBit(0b100, 2));
        assertEquals(0b110, BitFields.toggleBit(0b100, 1));
        assertEquals(Long.MIN_VALUE, BitFields.setBit(0, 63));
        assertThrows(IllegalArgumentException.class, () -> BitFields.testBit(0, 64));
    }

    @Test
    void countsAndLocatesBits()
    {
        assertEquals(8, BitFields.popCount(0xFF));
        assertTrue(BitFields.parity(0b111));
        assertFalse(BitFields.parity(0b11));
        assertEquals(OptionalInt.of(3), BitFields.firstSetBit(0b1000));
        assertEquals(OptionalInt.of(7), BitFields.lastSetBit(0x80));
        assertEquals(OptionalInt.empty(), BitFields.firstSetBit(0));
        assertEquals(OptionalInt.empty(), BitFields.lastSetBit(0));
    }

    @Test
    void rotatesWithinWidth()
    {
        assertEquals(0b0011, BitFields.rotateLeft(0b1001, 1, 4));
        assertEquals(0b1001, BitFields.rotateRight(0b0011, 1, 4));
        assertEquals(0b1001, BitFields.rotateLeft(0b1001, 4, 4));
        assertEquals(0b1001, BitFields.rotateLeft(0b0011, -1, 4));
        assertEquals(Long.rotateLeft(0x1234L, 12), BitFields.rotateLeft(0x1234L, 12, 64));
    }

    @Test
    void reversesLowBits()
    {
        assertEquals(0b1000, BitFields.reverse(0b0001, 4));
        assertEquals(0b1011, BitFields.reverse(0b1101, 4));
        assertEquals(0x01, BitFields.reverse(0x80, 8));
    }

    @Test
    void mergePacksDisjointFields()
    {
        long packed = BitFields.merge(8, new BitField(0x3, 0, 4), new BitField(0xA, 4, 4));
        assertEquals(0xA3, packed);
    }

    @Test
    void mergeRejectsOverlapAndOverflow()
    {
        assertThrows(IllegalArgumentException.class,
                () -> BitFields.merge(8, new BitField(1, 0, 4), new BitField(1, 3, 2)));
        assertThrows(IllegalArgumentException.class,
                () -> BitFields.merge(8, new BitField(1, 6, 4)));
    }

    @Test
    void splitIsInverseOfMerge()
    {
        List<BitField> fields = BitFields.split(0xA3, 4, 4);
        assertEquals(2, fields.size());
        assertEquals(0x3, fields.get(0).value());
        assertEquals(0xA, fields.get(1).value());
        assertEquals(4, fields.get(1).startBit());
        assertEquals(0xA3, BitFields.merge(8, fields.toArray(new BitField[0])));
    }

    @Test
    void fitsInWidth()
    {
        assertTrue(BitFields.fitsInWidth(0xFF, 8));
        assertFalse(BitFields.fitsInWidth(0x100, 8));
        assertTrue(BitFields.fitsInWidth(-1L, 64));
    }
}
