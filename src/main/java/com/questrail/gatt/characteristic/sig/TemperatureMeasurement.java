package com.questrail.gatt.characteristic.sig;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Decoded Temperature Measurement.
 *
 * @param temperature medical FLOAT value; NaN or infinite when the device
 *                    reported a sentinel
 */
public record TemperatureMeasurement(
    double temperature,
    TemperatureUnit unit,
    Optional<LocalDateTime> timestamp,
    Optional<TemperatureType> type
) {
    public TemperatureMeasurement {
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(type, "type");
    }

    public static TemperatureMeasurement celsius(double temperature) {
        return new TemperatureMeasurement(temperature, TemperatureUnit.CELSIUS, Optional.empty(), Optional.empty());
    }
}
