package com.questrail.gatt.characteristic.sig;

import com.questrail.gatt.api.CharacteristicContext;
import com.questrail.gatt.api.CharacteristicUuid;
import com.questrail.gatt.api.ValueType;
import com.questrail.gatt.characteristic.AbstractCharacteristic;
import com.questrail.gatt.characteristic.DependencyDeclaration;
import com.questrail.gatt.codec.BinaryCodec;
import com.questrail.gatt.codec.BitFields;
import com.questrail.gatt.codec.FieldReader;
import com.questrail.gatt.codec.IntegerFormat;
import com.questrail.gatt.codec.MedicalFloatCodec;
import com.questrail.gatt.codec.template.TemplateKind;
import com.questrail.gatt.error.MissingDependencyException;
import com.questrail.gatt.validation.ValidationConstraints;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Glucose Measurement Context (0x2A34).
 *
 * <p>
 * Requires the Glucose Measurement decoded in the same exchange: the
 * context is rejected if its sequence number differs from the
 * measurement's.
 * </p>
 *
 * <pre>
 * flags (uint8)
 *   bit 0  carbohydrate id + carbohydrate (SFLOAT kg) present
 *   bit 1  meal present
 *   bit 2  tester / health present
 *   bit 3  exercise duration (uint16 s) + intensity (uint8 %) present
 *   bit 4  medication id + medication (SFLOAT) present
 *   bit 5  medication unit: 0 = kg, 1 = litres
 *   bit 6  HbA1c (SFLOAT %) present
 *   bit 7  extended flags present
 * sequence number (uint16)
 * extended flags (uint8, optional)
 * ...optional fields in flag order
 * </pre>
 */
public final class GlucoseMeasurementContextCharacteristic extends AbstractCharacteristic<GlucoseMeasurementContext>
{
    public static final CharacteristicUuid UUID = CharacteristicUuid.ofShort(0x2A34);

    static final int FLAG_CARBOHYDRATE = 0;
    static final int FLAG_MEAL = 1;
    static final int FLAG_TESTER_HEALTH = 2;
    static final int FLAG_EXERCISE = 3;
    static final int FLAG_MEDICATION = 4;
    static final int FLAG_MEDICATION_LITRES = 5;
    static final int FLAG_HBA1C = 6;
    static final int FLAG_EXTENDED = 7;

    public GlucoseMeasurementContextCharacteristic() {
        super(UUID, "Glucose Measurement Context", "", GlucoseMeasurementContext.class,
                TemplateKind.COMPOSITE, ValueType.STRUCT,
                ValidationConstraints.builder()
                        .withLengthRange(3, 17)
                        .withVariableLength(true)
                        .withExpectedType(GlucoseMeasurementContext.class)
                        .build());
    }

    @Override
    public DependencyDeclaration dependencies() {
        return DependencyDeclaration.requires(GlucoseMeasurementCharacteristic.UUID);
    }

    @Override
    public GlucoseMeasurementContext decode(byte[] raw, CharacteristicContext context) {
        FieldReader reader = new FieldReader(raw);
        long flags = reader.readInt("flags", IntegerFormat.UINT8);
        int sequenceOffset = reader.offset();
        int sequence = (int) reader.readInt("sequence_number", IntegerFormat.UINT16);

        GlucoseMeasurement measurement = context
                .valueOf(GlucoseMeasurementCharacteristic.UUID, GlucoseMeasurement.class)
                .orElseThrow(() -> new MissingDependencyException(name(),
                        List.of(GlucoseMeasurementCharacteristic.UUID.toString())));
        if (measurement.sequenceNumber() != sequence) {
            throw reader.fail("sequence_number", sequenceOffset,
                    "sequence number " + sequence + " does not match glucose measurement "
                            + measurement.sequenceNumber());
        }

        OptionalInt extended = BitFields.testBit(flags, FLAG_EXTENDED)
                ? OptionalInt.of((int) reader.readInt("extended_flags", IntegerFormat.UINT8))
                : OptionalInt.empty();

        Optional<GlucoseMeasurementContext.Carbohydrate> carbohydrate = Optional.empty();
        if (BitFields.testBit(flags, FLAG_CARBOHYDRATE)) {
            int id = (int) reader.readInt("carbohydrate_id", IntegerFormat.UINT8);
            carbohydrate = Optional.of(new GlucoseMeasurementContext.Carbohydrate(id, reader.readSfloat("carbohydrate")));
        }

        OptionalInt meal = BitFields.testBit(flags, FLAG_MEAL)
                ? OptionalInt.of((int) reader.readInt("meal", IntegerFormat.UINT8))
                : OptionalInt.empty();

        OptionalInt testerHealth = BitFields.testBit(flags, FLAG_TESTER_HEALTH)
                ? OptionalInt.of((int) reader.readInt("tester_health", IntegerFormat.UINT8))
                : OptionalInt.empty();

        Optional<GlucoseMeasurementContext.Exercise> exercise = Optional.empty();
        if (BitFields.testBit(flags, FLAG_EXERCISE)) {
            int duration = (int) reader.readInt("exercise_duration", IntegerFormat.UINT16);
            int intensity = (int) reader.readInt("exercise_intensity", IntegerFormat.UINT8);
            exercise = Optional.of(new GlucoseMeasurementContext.Exercise(duration, intensity));
        }

        Optional<GlucoseMeasurementContext.Medication> medication = Optional.empty();
        if (BitFields.testBit(flags, FLAG_MEDICATION)) {
            int id = (int) reader.readInt("medication_id", IntegerFormat.UINT8);
            double amount = reader.readSfloat("medication");
            GlucoseMeasurementContext.MedicationUnit unit = BitFields.testBit(flags, FLAG_MEDICATION_LITRES)
                    ? GlucoseMeasurementContext.MedicationUnit.LITRES
                    : GlucoseMeasurementContext.MedicationUnit.KILOGRAMS;
            medication = Optional.of(new GlucoseMeasurementContext.Medication(id, amount, unit));
        }

        OptionalDouble hba1c = BitFields.testBit(flags, FLAG_HBA1C)
                ? OptionalDouble.of(reader.readSfloat("hba1c"))
                : OptionalDouble.empty();

        return new GlucoseMeasurementContext(sequence, extended, carbohydrate, meal, testerHealth,
                exercise, medication, hba1c);
    }

    @Override
    public byte[] encode(GlucoseMeasurementContext value) {
        long flags = 0;
        flags = flag(flags, FLAG_CARBOHYDRATE, value.carbohydrate().isPresent());
        flags = flag(flags, FLAG_MEAL, value.meal().isPresent());
        flags = flag(flags, FLAG_TESTER_HEALTH, value.testerHealth().isPresent());
        flags = flag(flags, FLAG_EXERCISE, value.exercise().isPresent());
        flags = flag(flags, FLAG_MEDICATION, value.medication().isPresent());
        flags = flag(flags, FLAG_MEDICATION_LITRES, value.medication()
                .map(m -> m.unit() == GlucoseMeasurementContext.MedicationUnit.LITRES)
                .orElse(false));
        flags = flag(flags, FLAG_HBA1C, value.hba1cPercent().isPresent());
        flags = flag(flags, FLAG_EXTENDED, value.extendedFlags().isPresent());

        ByteArrayOutputStream out = new ByteArrayOutputStream(17);
        out.write((int) flags);
        out.writeBytes(BinaryCodec.encodeInt(value.sequenceNumber(), IntegerFormat.UINT16));
        value.extendedFlags().ifPresent(f -> out.writeBytes(BinaryCodec.encodeInt(f, IntegerFormat.UINT8)));
        value.carbohydrate().ifPresent(c -> {
            out.writeBytes(BinaryCodec.encodeInt(c.id(), IntegerFormat.UINT8));
            out.writeBytes(MedicalFloatCodec.encodeSfloat(c.kilograms()));
        });
        value.meal().ifPresent(m -> out.writeBytes(BinaryCodec.encodeInt(m, IntegerFormat.UINT8)));
        value.testerHealth().ifPresent(t -> out.writeBytes(BinaryCodec.encodeInt(t, IntegerFormat.UINT8)));
        value.exercise().ifPresent(e -> {
            out.writeBytes(BinaryCodec.encodeInt(e.durationSeconds(), IntegerFormat.UINT16));
            out.writeBytes(BinaryCodec.encodeInt(e.intensityPercent(), IntegerFormat.UINT8));
        });
        value.medication().ifPresent(m -> {
            out.writeBytes(BinaryCodec.encodeInt(m.id(), IntegerFormat.UINT8));
            out.writeBytes(MedicalFloatCodec.encodeSfloat(m.amount()));
        });
        value.hba1cPercent().ifPresent(h -> out.writeBytes(MedicalFloatCodec.encodeSfloat(h)));
        return out.toByteArray();
    }

    private static long flag(long flags, int bit, boolean set) {
        return set ? BitFields.setBit(flags, bit) : flags;
    }
}
