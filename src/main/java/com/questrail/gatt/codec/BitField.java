package com.questrail.gatt.codec;

/**
 * One {@code (value, startBit, width)} triple of a packed integer.
 *
 * @param value    unsigned field value, right-aligned
 * @param startBit position of the least significant bit of the field
 * @param width    field width in bits
 */
public record BitField(long value, int startBit, int width)
{
    public BitField {
        if (startBit < 0 || width < 1 || startBit + width > BitFields.MAX_WIDTH) {
            throw new IllegalArgumentException(
                    "invalid bit field start=" + startBit + " width=" + width);
        }
    }
}
