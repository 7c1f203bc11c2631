package com.questrail.gatt.codec;

/**
 * Reserved codes of the IEEE-11073 medical float formats.
 *
 * <p>
 * Each code is a mantissa value paired with exponent zero. The raw codes
 * below are the complete 16-bit (SFLOAT) and 32-bit (FLOAT) bit patterns.
 * </p>
 */
public enum MedicalSpecialValue
{
    NAN(0x07FF, 0x007FFFFFL, Double.NaN),
    /** Not at this resolution. */
    NRES(0x0800, 0x00800000L, Double.NaN),
    POSITIVE_INFINITY(0x07FE, 0x007FFFFEL, Double.POSITIVE_INFINITY),
    NEGATIVE_INFINITY(0x0802, 0x00800002L, Double.NEGATIVE_INFINITY),
    /** Reserved for future use; has no numeric meaning. */
    RESERVED(0x0801, 0x00800001L, Double.NaN);

    private final int sfloatCode;
    private final long float32Code;
    private final double ieeeValue;

    MedicalSpecialValue(int sfloatCode, long float32Code, double ieeeValue) {
        this.sfloatCode = sfloatCode;
        this.float32Code = float32Code;
        this.ieeeValue = ieeeValue;
    }

    public int sfloatCode() {
        return sfloatCode;
    }

    public long float32Code() {
        return float32Code;
    }

    /**
     * IEEE-754 counterpart. Meaningless for {@link #RESERVED}, which the codec
     * rejects instead of mapping.
     */
    public double ieeeValue() {
        return ieeeValue;
    }
}
