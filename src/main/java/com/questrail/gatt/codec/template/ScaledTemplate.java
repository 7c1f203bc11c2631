package com.questrail.gatt.codec.template;

import com.questrail.gatt.codec.BinaryCodec;
import com.questrail.gatt.codec.IntegerFormat;
import com.questrail.gatt.error.ValueRangeException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * ScaledTemplate
 * -----------------------------------------------------------------------------
 * Linear scaling of one little-endian integer field:
 * {@code value = scale × (raw + offset)}.
 *
 * <p>
 * The Bluetooth specification writes the same rule as
 * {@code value = M × 10^d × (raw + b)}; {@link #fromMdb} accepts that form.
 * </p>
 *
 * <h2>Precision</h2>
 * <p>
 * The scale factor is held as a decimal so decoding does not accumulate
 * binary rounding error: raw {@code 2404} with scale {@code 0.01} decodes to
 * exactly {@code 24.04}. Encoding rounds half-up to the nearest raw step, so a
 * round trip is lossy only within {@link #resolution()}.
 * </p>
 */
public final class ScaledTemplate
{
    private final IntegerFormat format;
    private final BigDecimal scale;
    private final long offset;

    private ScaledTemplate(IntegerFormat format, BigDecimal scale, long offset) {
        this.format = Objects.requireNonNull(format, "format");
        if (scale.signum() == 0) {
            throw new IllegalArgumentException("scale factor must not be zero");
        }
        this.scale = scale;
        this.offset = offset;
    }

    public static ScaledTemplate of(IntegerFormat format, double scale) {
        return of(format, scale, 0);
    }

    public static ScaledTemplate of(IntegerFormat format, double scale, long offset) {
        if (!Double.isFinite(scale)) {
            throw new IllegalArgumentException("scale factor must be finite (was " + scale + ")");
        }
        return new ScaledTemplate(format, BigDecimal.valueOf(scale), offset);
    }

    /**
     * @param multiplier       M
     * @param decimalExponent  d
     * @param binaryOffset     b
     */
    public static ScaledTemplate fromMdb(IntegerFormat format, int multiplier, int decimalExponent, long binaryOffset) {
        return new ScaledTemplate(format,
                BigDecimal.valueOf(multiplier).scaleByPowerOfTen(decimalExponent),
                binaryOffset);
    }

    public IntegerFormat format() {
        return format;
    }

    public int width() {
        return format.width();
    }

    public double scale() {
        return scale.doubleValue();
    }

    public long offset() {
        return offset;
    }

    public double resolution() {
        return scale.abs().doubleValue();
    }

    public double decode(byte[] buffer, int at) {
        return decodeRaw(BinaryCodec.decodeInt(buffer, at, format));
    }

    public double decodeRaw(long raw) {
        return BigDecimal.valueOf(raw).add(BigDecimal.valueOf(offset)).multiply(scale).doubleValue();
    }

    public byte[] encode(double value) {
        return BinaryCodec.encodeInt(encodeRaw(value), format);
    }

    /**
     * @throws ValueRangeException if the value is not finite or its raw form
     *                             does not fit the integer format
     */
    public long encodeRaw(double value) {
        if (!Double.isFinite(value)) {
            throw new ValueRangeException("scaled " + format.name() + " value " + value + " is not finite");
        }
        BigDecimal raw = BigDecimal.valueOf(value)
                .divide(scale, 0, RoundingMode.HALF_UP)
                .subtract(BigDecimal.valueOf(offset));
        if (raw.compareTo(BigDecimal.valueOf(format.min())) < 0
                || raw.compareTo(BigDecimal.valueOf(format.max())) > 0) {
            throw new ValueRangeException("scaled " + format.name(), value, minValue(), maxValue());
        }
        return raw.longValueExact();
    }

    /** @return smallest physical value the format can carry */
    public double minValue() {
        return Math.min(decodeRaw(format.min()), decodeRaw(format.max()));
    }

    /** @return largest physical value the format can carry */
    public double maxValue() {
        return Math.max(decodeRaw(format.min()), decodeRaw(format.max()));
    }

    @Override
    public String toString() {
        return "ScaledTemplate[" + format + " x " + scale.toPlainString()
                + (offset == 0 ? "" : " offset " + offset) + "]";
    }
}
