package com.questrail.gatt.registry;

import java.util.Map;

/**
 * Display symbols for the unit identifiers used by the specification dataset.
 */
final class UnitSymbols
{
    private static final String PREFIX = "org.bluetooth.unit.";

    private static final Map<String, String> SYMBOLS = Map.ofEntries(
            Map.entry("unitless", ""),
            Map.entry("percentage", "%"),
            Map.entry("thermodynamic_temperature.degree_celsius", "°C"),
            Map.entry("thermodynamic_temperature.degree_fahrenheit", "°F"),
            Map.entry("thermodynamic_temperature.kelvin", "K"),
            Map.entry("pressure.pascal", "Pa"),
            Map.entry("pressure.bar", "bar"),
            Map.entry("length.metre", "m"),
            Map.entry("velocity.metres_per_second", "m/s"),
            Map.entry("electric_potential_difference.volt", "V"),
            Map.entry("electric_current.ampere", "A"),
            Map.entry("power.watt", "W"),
            Map.entry("energy.joule", "J"),
            Map.entry("time.second", "s"),
            Map.entry("time.minute", "min"),
            Map.entry("time.hour", "h"),
            Map.entry("mass.kilogram", "kg"),
            Map.entry("frequency.hertz", "Hz"),
            Map.entry("period.beats_per_minute", "bpm"),
            Map.entry("illuminance.lux", "lx"),
            Map.entry("irradiance.watt_per_square_metre", "W/m²"),
            Map.entry("plane_angle.degree", "°"),
            Map.entry("concentration.parts_per_million", "ppm"),
            Map.entry("angular_velocity.revolution_per_minute", "rpm")
    );

    private UnitSymbols() {}

    /**
     * @return the display symbol, or the input unchanged if it is not a known
     *         unit identifier
     */
    static String symbolFor(String unit) {
        if (unit == null || unit.isBlank()) {
            return "";
        }
        String key = unit.trim();
        if (key.startsWith(PREFIX)) {
            key = key.substring(PREFIX.length());
        }
        return SYMBOLS.getOrDefault(key, unit.trim());
    }
}
