package com.questrail.gatt.characteristic.sig;

/**
 * Unit selected by bit 0 of the Temperature Measurement flags.
 */
public enum TemperatureUnit
{
    CELSIUS("°C"),
    FAHRENHEIT("°F");

    private final String symbol;

    TemperatureUnit(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
