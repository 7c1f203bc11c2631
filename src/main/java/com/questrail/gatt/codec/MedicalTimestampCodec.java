package com.questrail.gatt.codec;

import com.questrail.gatt.error.ValueRangeException;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Seven-byte date-time field: year (uint16 LE), month, day, hours, minutes,
 * seconds (uint8 each).
 *
 * <p>
 * Seven zero bytes mean "time not known" and decode to an empty optional.
 * Any other content must be a valid calendar date with year 1582 or later.
 * </p>
 */
public final class MedicalTimestampCodec
{
    public static final int LENGTH = 7;
    public static final int MIN_YEAR = 1582;
    public static final int MAX_YEAR = 9999;

    private MedicalTimestampCodec() {}

    public static Optional<LocalDateTime> decode(byte[] buffer, int offset) {
        BinaryCodec.requireLength(buffer, offset, LENGTH);
        boolean allZero = true;
        for (int i = offset; i < offset + LENGTH; i++) {
            if (buffer[i] != 0) {
                allZero = false;
                break;
            }
        }
        if (allZero) {
            return Optional.empty();
        }

        int year = (int) BinaryCodec.decodeInt(buffer, offset, IntegerFormat.UINT16);
        int month = Byte.toUnsignedInt(buffer[offset + 2]);
        int day = Byte.toUnsignedInt(buffer[offset + 3]);
        int hour = Byte.toUnsignedInt(buffer[offset + 4]);
        int minute = Byte.toUnsignedInt(buffer[offset + 5]);
        int second = Byte.toUnsignedInt(buffer[offset + 6]);

        checkFields(year, month, day, hour, minute, second);
        try {
            return Optional.of(LocalDateTime.of(year, month, day, hour, minute, second));
        } catch (DateTimeException e) {
            throw new ValueRangeException("day " + day + " is not valid for " + year + "-" + month);
        }
    }

    public static byte[] encode(Optional<LocalDateTime> timestamp) {
        Objects.requireNonNull(timestamp, "timestamp");
        return timestamp.map(MedicalTimestampCodec::encode).orElseGet(() -> new byte[LENGTH]);
    }

    public static byte[] encode(LocalDateTime timestamp) {
        Objects.requireNonNull(timestamp, "timestamp");
        checkFields(timestamp.getYear(), timestamp.getMonthValue(), timestamp.getDayOfMonth(),
                timestamp.getHour(), timestamp.getMinute(), timestamp.getSecond());

        byte[] out = new byte[LENGTH];
        byte[] year = BinaryCodec.encodeInt(timestamp.getYear(), IntegerFormat.UINT16);
        out[0] = year[0];
        out[1] = year[1];
        out[2] = (byte) timestamp.getMonthValue();
        out[3] = (byte) timestamp.getDayOfMonth();
        out[4] = (byte) timestamp.getHour();
        out[5] = (byte) timestamp.getMinute();
        out[6] = (byte) timestamp.getSecond();
        return out;
    }

    private static void checkFields(int year, int month, int day, int hour, int minute, int second) {
        check("year", year, MIN_YEAR, MAX_YEAR);
        check("month", month, 1, 12);
        check("day", day, 1, 31);
        check("hour", hour, 0, 23);
        check("minute", minute, 0, 59);
        check("second", second, 0, 59);
    }

    private static void check(String field, int value, int min, int max) {
        if (value < min || value > max) {
            throw new ValueRangeException(field, value, min, max);
        }
    }
}
