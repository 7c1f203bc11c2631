package com.questrail.gatt.codec;

import com.questrail.gatt.error.SpecialFloatFormatException;
import com.questrail.gatt.error.ValueRangeException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * MedicalFloatCodec
 * -----------------------------------------------------------------------------
 * IEEE-11073 medical-device floating point (SFLOAT and FLOAT).
 *
 * <h2>Layout</h2>
 * <ul>
 *   <li>SFLOAT (16 bit): 4-bit two's-complement exponent (-8..7) in the high
 *       nibble, 12-bit two's-complement mantissa (-2048..2047) below it.</li>
 *   <li>FLOAT (32 bit): 8-bit exponent (-128..127) in the high byte,
 *       24-bit mantissa below it.</li>
 * </ul>
 * <p>
 * value = mantissa &times; 10<sup>exponent</sup>. The five top-of-range
 * mantissa codes with exponent zero are sentinels ({@link MedicalSpecialValue})
 * and are matched on the raw bits before any arithmetic.
 * </p>
 *
 * <h2>Encoding</h2>
 * <p>
 * NaN and the infinities map straight to their sentinel codes. Any other
 * value gets the smallest exponent whose rounded mantissa still fits the
 * finite mantissa range, which is the encoding with the least precision
 * loss. Values too large for every exponent fail with
 * {@link ValueRangeException}.
 * </p>
 */
public final class MedicalFloatCodec
{
    public static final int SFLOAT_MIN_EXPONENT = -8;
    public static final int SFLOAT_MAX_EXPONENT = 7;
    public static final int SFLOAT_MAX_MANTISSA = 2045;

    public static final int FLOAT32_MIN_EXPONENT = -128;
    public static final int FLOAT32_MAX_EXPONENT = 127;
    public static final int FLOAT32_MAX_MANTISSA = 8_388_605;

    private MedicalFloatCodec() {}

    // ---------------------------------------------------------------------
    // SFLOAT
    // ---------------------------------------------------------------------

    public static double decodeSfloat(byte[] buffer, int offset) {
        return decodeSfloatBits((int) BinaryCodec.decodeInt(buffer, offset, IntegerFormat.UINT16));
    }

    public static double decodeSfloatBits(int bits) {
        int raw = bits & 0xFFFF;
        Optional<MedicalSpecialValue> special = classifySfloat(raw);
        if (special.isPresent()) {
            return sentinel(special.get(), "SFLOAT", raw);
        }
        long mantissa = signExtend(BitFields.extractField(raw, 0, 12, 16), 12);
        long exponent = signExtend(BitFields.extractField(raw, 12, 4, 16), 4);
        return scale(mantissa, (int) exponent);
    }

    public static Optional<MedicalSpecialValue> classifySfloat(int bits) {
        int raw = bits & 0xFFFF;
        for (MedicalSpecialValue v : MedicalSpecialValue.values()) {
            if (v.sfloatCode() == raw) {
                return Optional.of(v);
            }
        }
        return Optional.empty();
    }

    public static byte[] encodeSfloat(double value) {
        return BinaryCodec.encodeInt(encodeSfloatBits(value), IntegerFormat.UINT16);
    }

    public static int encodeSfloatBits(double value) {
        Optional<MedicalSpecialValue> special = specialFor(value);
        if (special.isPresent()) {
            return special.get().sfloatCode();
        }
        long[] me = fit(value, SFLOAT_MIN_EXPONENT, SFLOAT_MAX_EXPONENT, SFLOAT_MAX_MANTISSA, "SFLOAT");
        return (int) BitFields.merge(16,
                new BitField(me[0], 0, 12),
                new BitField(me[1], 12, 4));
    }

    // ---------------------------------------------------------------------
    // FLOAT (32 bit)
    // ---------------------------------------------------------------------

    public static double decodeFloat32(byte[] buffer, int offset) {
        return decodeFloat32Bits(BinaryCodec.decodeInt(buffer, offset, IntegerFormat.UINT32));
    }

    public static double decodeFloat32Bits(long bits) {
        long raw = bits & 0xFFFF_FFFFL;
        Optional<MedicalSpecialValue> special = classifyFloat32(raw);
        if (special.isPresent()) {
            return sentinel(special.get(), "FLOAT", raw);
        }
        long mantissa = signExtend(BitFields.extractField(raw, 0, 24, 32), 24);
        long exponent = signExtend(BitFields.extractField(raw, 24, 8, 32), 8);
        return scale(mantissa, (int) exponent);
    }

    public static Optional<MedicalSpecialValue> classifyFloat32(long bits) {
        long raw = bits & 0xFFFF_FFFFL;
        for (MedicalSpecialValue v : MedicalSpecialValue.values()) {
            if (v.float32Code() == raw) {
                return Optional.of(v);
            }
        }
        return Optional.empty();
    }

    public static byte[] encodeFloat32(double value) {
        return BinaryCodec.encodeInt(encodeFloat32Bits(value), IntegerFormat.UINT32);
    }

    public static long encodeFloat32Bits(double value) {
        Optional<MedicalSpecialValue> special = specialFor(value);
        if (special.isPresent()) {
            return special.get().float32Code();
        }
        long[] me = fit(value, FLOAT32_MIN_EXPONENT, FLOAT32_MAX_EXPONENT, FLOAT32_MAX_MANTISSA, "FLOAT");
        return BitFields.merge(32,
                new BitField(me[0], 0, 24),
                new BitField(me[1], 24, 8));
    }

    // ---------------------------------------------------------------------
    // Shared
    // ---------------------------------------------------------------------

    private static double sentinel(MedicalSpecialValue special, String format, long raw) {
        if (special == MedicalSpecialValue.RESERVED) {
            throw new SpecialFloatFormatException(
                    String.format("%s raw value 0x%X is a reserved code with no defined meaning", format, raw));
        }
        return special.ieeeValue();
    }

    private static Optional<MedicalSpecialValue> specialFor(double value) {
        if (Double.isNaN(value)) {
            return Optional.of(MedicalSpecialValue.NAN);
        }
        if (value == Double.POSITIVE_INFINITY) {
            return Optional.of(MedicalSpecialValue.POSITIVE_INFINITY);
        }
        if (value == Double.NEGATIVE_INFINITY) {
            return Optional.of(MedicalSpecialValue.NEGATIVE_INFINITY);
        }
        return Optional.empty();
    }

    private static long signExtend(long value, int width) {
        long signBit = 1L << (width - 1);
        return (value ^ signBit) - signBit;
    }

    private static double scale(long mantissa, int exponent) {
        return BigDecimal.valueOf(mantissa).scaleByPowerOfTen(exponent).doubleValue();
    }

    /**
     * @return {@code {mantissa, exponent}}
     */
    private static long[] fit(double value, int minExponent, int maxExponent, long maxMantissa, String format) {
        if (value == 0.0) {
            return new long[] {0, 0};
        }
        BigDecimal exact = BigDecimal.valueOf(value).stripTrailingZeros();
        // Whole multiples of a large power of ten start at the top exponent and take a wider mantissa.
        int start = Math.min(maxExponent, Math.max(minExponent, -exact.scale()));
        for (int exponent = start; exponent <= maxExponent; exponent++) {
            BigDecimal m = exact.scaleByPowerOfTen(-exponent).setScale(0, RoundingMode.HALF_UP);
            if (m.abs().compareTo(BigDecimal.valueOf(maxMantissa)) <= 0) {
                long mantissa = m.longValueExact();
                if (mantissa == 0) {
                    return new long[] {0, 0};
                }
                return new long[] {mantissa, exponent};
            }
        }
        throw new ValueRangeException(format + " value " + value + " not representable: magnitude exceeds "
                + maxMantissa + "e" + maxExponent);
    }
}
