package com.questrail.gatt.codec;

import java.util.Locale;
import java.util.Optional;

/**
 * Fixed-width integer wire formats used by characteristic layouts.
 */
public enum IntegerFormat
{
    UINT8(1, false),
    SINT8(1, true),
    UINT16(2, false),
    SINT16(2, true),
    UINT24(3, false),
    SINT24(3, true),
    UINT32(4, false),
    SINT32(4, true),
    UINT48(6, false);

    private final int width;
    private final boolean signed;
    private final long min;
    private final long max;

    IntegerFormat(int width, boolean signed) {
        this.width = width;
        this.signed = signed;
        int bits = width * 8;
        if (signed) {
            this.min = -(1L << (bits - 1));
            this.max = (1L << (bits - 1)) - 1;
        } else {
            this.min = 0;
            this.max = (1L << bits) - 1;
        }
    }

    /** @return width in bytes */
    public int width() {
        return width;
    }

    public boolean signed() {
        return signed;
    }

    public long min() {
        return min;
    }

    public long max() {
        return max;
    }

    public boolean accepts(long value) {
        return value >= min && value <= max;
    }

    /**
     * Maps a specification data type name such as {@code uint16} or
     * {@code sint24}.
     */
    public static Optional<IntegerFormat> fromDataType(String dataType) {
        if (dataType == null) {
            return Optional.empty();
        }
        String t = dataType.trim().toUpperCase(Locale.ROOT);
        for (IntegerFormat f : values()) {
            if (f.name().equals(t)) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }
}
