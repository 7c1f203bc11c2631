package com.questrail.gatt.characteristic.sig;

import com.questrail.gatt.api.CharacteristicContext;
import com.questrail.gatt.api.CharacteristicUuid;
import com.questrail.gatt.api.ValueType;
import com.questrail.gatt.characteristic.AbstractCharacteristic;
import com.questrail.gatt.codec.BinaryCodec;
import com.questrail.gatt.codec.BitField;
import com.questrail.gatt.codec.BitFields;
import com.questrail.gatt.codec.FieldReader;
import com.questrail.gatt.codec.IntegerFormat;
import com.questrail.gatt.codec.MedicalFloatCodec;
import com.questrail.gatt.codec.MedicalTimestampCodec;
import com.questrail.gatt.codec.template.TemplateKind;
import com.questrail.gatt.validation.ValidationConstraints;

import java.io.ByteArrayOutputStream;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Glucose Measurement (0x2A18).
 *
 * <pre>
 * flags (uint8)
 *   bit 0  time offset present
 *   bit 1  concentration, type and sample location present
 *   bit 2  concentration unit: 0 = kg/L, 1 = mol/L
 *   bit 3  sensor status annunciation present
 *   bit 4  context information follows
 * sequence number (uint16)
 * base time (7 bytes)
 * time offset (sint16 minutes, optional)
 * concentration (SFLOAT) + type/location (uint8 nibbles, optional)
 * sensor status annunciation (uint16, optional)
 * </pre>
 */
public final class GlucoseMeasurementCharacteristic extends AbstractCharacteristic<GlucoseMeasurement>
{
    public static final CharacteristicUuid UUID = CharacteristicUuid.ofShort(0x2A18);

    static final int FLAG_TIME_OFFSET = 0;
    static final int FLAG_SAMPLE = 1;
    static final int FLAG_MOL_PER_LITRE = 2;
    static final int FLAG_SENSOR_STATUS = 3;
    static final int FLAG_CONTEXT_FOLLOWS = 4;

    public GlucoseMeasurementCharacteristic() {
        super(UUID, "Glucose Measurement", "", GlucoseMeasurement.class,
                TemplateKind.COMPOSITE, ValueType.STRUCT,
                ValidationConstraints.builder()
                        .withLengthRange(10, 17)
                        .withVariableLength(true)
                        .withExpectedType(GlucoseMeasurement.class)
                        .build());
    }

    @Override
    public GlucoseMeasurement decode(byte[] raw, CharacteristicContext context) {
        FieldReader reader = new FieldReader(raw);
        long flags = reader.readInt("flags", IntegerFormat.UINT8);
        int sequence = (int) reader.readInt("sequence_number", IntegerFormat.UINT16);
        Optional<LocalDateTime> baseTime = reader.readTimestamp("base_time");

        OptionalInt timeOffset = BitFields.testBit(flags, FLAG_TIME_OFFSET)
                ? OptionalInt.of((int) reader.readInt("time_offset", IntegerFormat.SINT16))
                : OptionalInt.empty();

        Optional<GlucoseMeasurement.Sample> sample = Optional.empty();
        if (BitFields.testBit(flags, FLAG_SAMPLE)) {
            GlucoseConcentrationUnit unit = BitFields.testBit(flags, FLAG_MOL_PER_LITRE)
                    ? GlucoseConcentrationUnit.MOL_PER_LITRE
                    : GlucoseConcentrationUnit.KG_PER_LITRE;
            double concentration = reader.readSfloat("concentration");
            long typeLocation = reader.readInt("type_sample_location", IntegerFormat.UINT8);
            sample = Optional.of(new GlucoseMeasurement.Sample(
                    concentration,
                    unit,
                    (int) BitFields.extractField(typeLocation, 0, 4, 8),
                    (int) BitFields.extractField(typeLocation, 4, 4, 8)));
        }

        OptionalInt status = BitFields.testBit(flags, FLAG_SENSOR_STATUS)
                ? OptionalInt.of((int) reader.readInt("sensor_status", IntegerFormat.UINT16))
                : OptionalInt.empty();

        return new GlucoseMeasurement(sequence, baseTime, timeOffset, sample, status,
                BitFields.testBit(flags, FLAG_CONTEXT_FOLLOWS));
    }

    @Override
    public byte[] encode(GlucoseMeasurement value) {
        long flags = 0;
        if (value.timeOffsetMinutes().isPresent()) {
            flags = BitFields.setBit(flags, FLAG_TIME_OFFSET);
        }
        if (value.sample().isPresent()) {
            flags = BitFields.setBit(flags, FLAG_SAMPLE);
            if (value.sample().get().unit() == GlucoseConcentrationUnit.MOL_PER_LITRE) {
                flags = BitFields.setBit(flags, FLAG_MOL_PER_LITRE);
            }
        }
        if (value.sensorStatus().isPresent()) {
            flags = BitFields.setBit(flags, FLAG_SENSOR_STATUS);
        }
        if (value.contextFollows()) {
            flags = BitFields.setBit(flags, FLAG_CONTEXT_FOLLOWS);
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream(17);
        out.write((int) flags);
        out.writeBytes(BinaryCodec.encodeInt(value.sequenceNumber(), IntegerFormat.UINT16));
        out.writeBytes(MedicalTimestampCodec.encode(value.baseTime()));
        value.timeOffsetMinutes().ifPresent(
                offset -> out.writeBytes(BinaryCodec.encodeInt(offset, IntegerFormat.SINT16)));
        value.sample().ifPresent(s -> {
            out.writeBytes(MedicalFloatCodec.encodeSfloat(s.concentration()));
            out.write((int) BitFields.merge(8,
                    new BitField(s.type(), 0, 4),
                    new BitField(s.location(), 4, 4)));
        });
        value.sensorStatus().ifPresent(
                status -> out.writeBytes(BinaryCodec.encodeInt(status, IntegerFormat.UINT16)));
        return out.toByteArray();
    }
}
