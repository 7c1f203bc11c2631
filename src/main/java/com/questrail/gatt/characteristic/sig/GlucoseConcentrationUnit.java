package com.questrail.gatt.characteristic.sig;

/**
 * Unit selected by bit 2 of the Glucose Measurement flags.
 */
public enum GlucoseConcentrationUnit
{
    KG_PER_LITRE("kg/L"),
    MOL_PER_LITRE("mol/L");

    private final String symbol;

    GlucoseConcentrationUnit(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
