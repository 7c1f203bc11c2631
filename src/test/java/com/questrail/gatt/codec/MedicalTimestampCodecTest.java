package com.questrail.gatt.codec;

import com.questrail.gatt.error.InsufficientDataException;
import com.questrail.gatt.error.ValueRangeException;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class MedicalTimestampCodecTest
{
    private static final byte[] CHRISTMAS_2020 = { (byte) 0xE4, 0x07, 12, 25, 10, 30, 15 };

    @Test
    void decodesDateTime()
    {
        assertEquals(Optional.of(LocalDateTime.of(2020, 12, 25, 10, 30, 15)),
                MedicalTimestampCodec.decode(CHRISTMAS_2020, 0));
    }

    @Test
    void encodesDateTime()
    {
        assertArrayEquals(CHRISTMAS_2020, MedicalTimestampCodec.encode(LocalDateTime.of(2020, 12, 25, 10, 30, 15)));
    }

    @Test
    void allZeroMeansUnknown()
    {
        assertEquals(Optional.empty(), MedicalTimestampCodec.decode(new byte[7], 0));
        assertArrayEquals(new byte[7], MedicalTimestampCodec.encode(Optional.empty()));
    }

    @Test
    void outOfRangeFieldIsNamed()
    {
        byte[] raw = CHRISTMAS_2020.clone();
        raw[2] = 13;
        ValueRangeException e = assertThrows(ValueRangeException.class, () -> MedicalTimestampCodec.decode(raw, 0));
        assertEquals("month value 13 outside range [1, 12]", e.getMessage());
    }

    @Test
    void yearBeforeGregorianCalendarIsRejected()
    {
        byte[] raw = { 0x2D, 0x06, 1, 1, 0, 0, 0 };
        assertThrows(ValueRangeException.class, () -> MedicalTimestampCodec.decode(raw, 0));
    }

    @Test
    void impossibleCalendarDayIsRejected()
    {
        byte[] raw = { (byte) 0xE5, 0x07, 2, 30, 0, 0, 0 };
        assertThrows(ValueRangeException.class, () -> MedicalTimestampCodec.decode(raw, 0));
    }

    @Test
    void shortBufferIsInsufficientData()
    {
        assertThrows(InsufficientDataException.class, () -> MedicalTimestampCodec.decode(new byte[6], 0));
    }
}
