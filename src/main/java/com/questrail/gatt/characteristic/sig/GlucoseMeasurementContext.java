package com.questrail.gatt.characteristic.sig;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Decoded Glucose Measurement Context. Only meaningful next to the
 * {@link GlucoseMeasurement} carrying the same sequence number.
 */
public record GlucoseMeasurementContext(
    int sequenceNumber,
    OptionalInt extendedFlags,
    Optional<Carbohydrate> carbohydrate,
    OptionalInt meal,
    OptionalInt testerHealth,
    Optional<Exercise> exercise,
    Optional<Medication> medication,
    OptionalDouble hba1cPercent
) {
    public GlucoseMeasurementContext {
        if (sequenceNumber < 0 || sequenceNumber > 0xFFFF) {
            throw new IllegalArgumentException("sequence number must be uint16 (was " + sequenceNumber + ")");
        }
        Objects.requireNonNull(extendedFlags, "extendedFlags");
        Objects.requireNonNull(carbohydrate, "carbohydrate");
        Objects.requireNonNull(meal, "meal");
        Objects.requireNonNull(testerHealth, "testerHealth");
        Objects.requireNonNull(exercise, "exercise");
        Objects.requireNonNull(medication, "medication");
        Objects.requireNonNull(hba1cPercent, "hba1cPercent");
    }

    public static GlucoseMeasurementContext of(int sequenceNumber) {
        return new GlucoseMeasurementContext(sequenceNumber, OptionalInt.empty(), Optional.empty(),
                OptionalInt.empty(), OptionalInt.empty(), Optional.empty(), Optional.empty(),
                OptionalDouble.empty());
    }

    public record Carbohydrate(int id, double kilograms) {}

    public record Exercise(int durationSeconds, int intensityPercent) {}

    public enum MedicationUnit { KILOGRAMS, LITRES }

    public record Medication(int id, double amount, MedicationUnit unit)
    {
        public Medication {
            Objects.requireNonNull(unit, "unit");
        }
    }
}
