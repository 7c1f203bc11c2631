package com.questrail.gatt.characteristic.sig;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Decoded Glucose Measurement.
 *
 * @param sequenceNumber    correlates the measurement with its context record
 * @param baseTime          empty when the device reported "time not known"
 * @param timeOffsetMinutes offset applied to {@code baseTime}
 * @param sample            concentration with sample type and location
 * @param sensorStatus      sensor status annunciation bits
 * @param contextFollows    a Glucose Measurement Context with the same
 *                          sequence number follows
 */
public record GlucoseMeasurement(
    int sequenceNumber,
    Optional<LocalDateTime> baseTime,
    OptionalInt timeOffsetMinutes,
    Optional<Sample> sample,
    OptionalInt sensorStatus,
    boolean contextFollows
) {
    public GlucoseMeasurement {
        if (sequenceNumber < 0 || sequenceNumber > 0xFFFF) {
            throw new IllegalArgumentException("sequence number must be uint16 (was " + sequenceNumber + ")");
        }
        Objects.requireNonNull(baseTime, "baseTime");
        Objects.requireNonNull(timeOffsetMinutes, "timeOffsetMinutes");
        Objects.requireNonNull(sample, "sample");
        Objects.requireNonNull(sensorStatus, "sensorStatus");
    }

    /**
     * @param type     sample type nibble (1 = capillary whole blood, ...)
     * @param location sample location nibble (1 = finger, ...)
     */
    public record Sample(double concentration, GlucoseConcentrationUnit unit, int type, int location)
    {
        public Sample {
            Objects.requireNonNull(unit, "unit");
            if (type < 0 || type > 0xF || location < 0 || location > 0xF) {
                throw new IllegalArgumentException(
                        "sample type and location must be 4-bit codes (were " + type + ", " + location + ")");
            }
        }
    }
}
