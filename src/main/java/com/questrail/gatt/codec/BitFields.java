package com.questrail.gatt.codec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Pure integer helpers for packed flag and feature fields.
 *
 * <p>
 * All operations work on a {@code long} holding at most
 * {@link #MAX_WIDTH} bits. The only failure mode is an invalid bit position
 * or width, reported as {@link IllegalArgumentException}. Field values are
 * treated as unsigned and are masked to their width when written.
 * </p>
 */
public final class BitFields
{
    public static final int MAX_WIDTH = 64;

    private BitFields() {}

    /**
     * @return a mask with the low {@code width} bits set
     */
    public static long mask(int width) {
        if (width < 0 || width > MAX_WIDTH) {
            throw new IllegalArgumentException("mask width must be in range 0-64 (was " + width + ")");
        }
        return width == MAX_WIDTH ? -1L : (1L << width) - 1;
    }

    /**
     * @return a mask covering {@code width} bits starting at {@code startBit}
     */
    public static long mask(int startBit, int width) {
        checkField(startBit, width, MAX_WIDTH);
        return mask(width) << startBit;
    }

    public static long extractField(long value, int startBit, int width) {
        return extractField(value, startBit, width, MAX_WIDTH);
    }

    public static long extractField(long value, int startBit, int width, int totalWidth) {
        checkField(startBit, width, totalWidth);
        return (value >>> startBit) & mask(width);
    }

    public static long setField(long value, long fieldValue, int startBit, int width) {
        return setField(value, fieldValue, startBit, width, MAX_WIDTH);
    }

    public static long setField(long value, long fieldValue, int startBit, int width, int totalWidth) {
        checkField(startBit, width, totalWidth);
        long m = mask(width);
        return (value & ~(m << startBit)) | ((fieldValue & m) << startBit);
    }

    public static boolean testBit(long value, int bit) {
        checkBit(bit);
        return ((value >>> bit) & 1L) != 0;
    }

    public static long setBit(long value, int bit) {
        checkBit(bit);
        return value | (1L << bit);
    }

    public static long clearBit(long value, int bit) {
        checkBit(bit);
        return value & ~(1L << bit);
    }

    public static long toggleBit(long value, int bit) {
        checkBit(bit);
        return value ^ (1L << bit);
    }

    public static int popCount(long value) {
        return Long.bitCount(value);
    }

    /**
     * @return {@code true} if an odd number of bits is set
     */
    public static boolean parity(long value) {
        return (Long.bitCount(value) & 1) == 1;
    }

    public static OptionalInt firstSetBit(long value) {
        return value == 0 ? OptionalInt.empty() : OptionalInt.of(Long.numberOfTrailingZeros(value));
    }

    public static OptionalInt lastSetBit(long value) {
        return value == 0 ? OptionalInt.empty() : OptionalInt.of(63 - Long.numberOfLeadingZeros(value));
    }

    /**
     * Rotates the low {@code width} bits of {@code value} left by {@code distance}.
     * Bits above {@code width} are discarded.
     */
    public static long rotateLeft(long value, int distance, int width) {
        checkWidth(width);
        if (distance < 0) {
            return rotateRight(value, -distance, width);
        }
        if (width == MAX_WIDTH) {
            return Long.rotateLeft(value, distance);
        }
        long v = value & mask(width);
        int n = distance % width;
        if (n == 0) {
            return v;
        }
        return ((v << n) | (v >>> (width - n))) & mask(width);
    }

    public static long rotateRight(long value, int distance, int width) {
        checkWidth(width);
        if (distance < 0) {
            return rotateLeft(value, -distance, width);
        }
        if (width == MAX_WIDTH) {
            return Long.rotateRight(value, distance);
        }
        int n = distance % width;
        return rotateLeft(value, n == 0 ? 0 : width - n, width);
    }

    /**
     * Reverses the order of the low {@code width} bits.
     */
    public static long reverse(long value, int width) {
        checkWidth(width);
        return Long.reverse(value & mask(width)) >>> (MAX_WIDTH - width);
    }

    /**
     * Packs several fields into one integer.
     *
     * @throws IllegalArgumentException if a field exceeds {@code totalWidth},
     *                                  or two fields overlap
     */
    public static long merge(int totalWidth, BitField... fields) {
        checkWidth(totalWidth);
        Objects.requireNonNull(fields, "fields");
        long occupied = 0;
        long result = 0;
        for (BitField f : fields) {
            checkField(f.startBit(), f.width(), totalWidth);
            long m = mask(f.width()) << f.startBit();
            if ((occupied & m) != 0) {
                throw new IllegalArgumentException(
                        "bit field at " + f.startBit() + " width " + f.width() + " overlaps another field");
            }
            occupied |= m;
            result |= (f.value() & mask(f.width())) << f.startBit();
        }
        return result;
    }

    /**
     * Splits consecutive fields of the given widths, starting at bit 0.
     */
    public static List<BitField> split(long value, int... widths) {
        Objects.requireNonNull(widths, "widths");
        List<BitField> fields = new ArrayList<>(widths.length);
        int start = 0;
        for (int w : widths) {
            checkField(start, w, MAX_WIDTH);
            fields.add(new BitField(extractField(value, start, w), start, w));
            start += w;
        }
        return fields;
    }

    /**
     * @return {@code true} if {@code value} fits as an unsigned field of {@code width} bits
     */
    public static boolean fitsInWidth(long value, int width) {
        checkWidth(width);
        return width == MAX_WIDTH || (value & ~mask(width)) == 0;
    }

    private static void checkField(int startBit, int width, int totalWidth) {
        checkWidth(totalWidth);
        if (startBit < 0 || width < 1 || startBit + width > totalWidth) {
            throw new IllegalArgumentException(
                    "bit field start=" + startBit + " width=" + width
                            + " exceeds total width " + totalWidth);
        }
    }

    private static void checkWidth(int width) {
        if (width < 1 || width > MAX_WIDTH) {
            throw new IllegalArgumentException("width must be in range 1-64 (was " + width + ")");
        }
    }

    private static void checkBit(int bit) {
        if (bit < 0 || bit >= MAX_WIDTH) {
            throw new IllegalArgumentException("bit index must be in range 0-63 (was " + bit + ")");
        }
    }
}
