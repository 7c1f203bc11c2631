package com.questrail.gatt.characteristic.sig;

import com.questrail.gatt.api.CharacteristicContext;
import com.questrail.gatt.api.CharacteristicUuid;
import com.questrail.gatt.api.ValueType;
import com.questrail.gatt.characteristic.AbstractCharacteristic;
import com.questrail.gatt.codec.BitFields;
import com.questrail.gatt.codec.FieldReader;
import com.questrail.gatt.codec.IntegerFormat;
import com.questrail.gatt.codec.MedicalFloatCodec;
import com.questrail.gatt.codec.MedicalTimestampCodec;
import com.questrail.gatt.codec.template.EnumTemplate;
import com.questrail.gatt.codec.template.TemplateKind;
import com.questrail.gatt.validation.ValidationConstraints;

import java.io.ByteArrayOutputStream;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Temperature Measurement (0x2A1C).
 *
 * <pre>
 * flags (uint8)
 *   bit 0  unit: 0 = Celsius, 1 = Fahrenheit
 *   bit 1  time stamp present
 *   bit 2  temperature type present
 * temperature (medical FLOAT, 4 bytes)
 * time stamp (7 bytes, optional)
 * temperature type (uint8, optional)
 * </pre>
 */
public final class TemperatureMeasurementCharacteristic extends AbstractCharacteristic<TemperatureMeasurement>
{
    public static final CharacteristicUuid UUID = CharacteristicUuid.ofShort(0x2A1C);

    static final int FLAG_FAHRENHEIT = 0;
    static final int FLAG_TIMESTAMP = 1;
    static final int FLAG_TYPE = 2;

    private static final EnumTemplate<TemperatureType> TYPE_TEMPLATE =
            EnumTemplate.uint8(TemperatureType.class, "Temperature Type");

    public TemperatureMeasurementCharacteristic() {
        super(UUID, "Temperature Measurement", "°C", TemperatureMeasurement.class,
                TemplateKind.COMPOSITE, ValueType.STRUCT,
                ValidationConstraints.builder()
                        .withLengthRange(5, 13)
                        .withVariableLength(true)
                        .withExpectedType(TemperatureMeasurement.class)
                        .build());
    }

    @Override
    public TemperatureMeasurement decode(byte[] raw, CharacteristicContext context) {
        FieldReader reader = new FieldReader(raw);
        long flags = reader.readInt("flags", IntegerFormat.UINT8);

        TemperatureUnit unit = BitFields.testBit(flags, FLAG_FAHRENHEIT)
                ? TemperatureUnit.FAHRENHEIT
                : TemperatureUnit.CELSIUS;
        reader.record("unit", unit);

        double temperature = reader.readMedicalFloat32("temperature");

        Optional<LocalDateTime> timestamp = BitFields.testBit(flags, FLAG_TIMESTAMP)
                ? reader.readTimestamp("timestamp")
                : Optional.empty();

        Optional<TemperatureType> type = BitFields.testBit(flags, FLAG_TYPE)
                ? Optional.of(reader.read("temperature_type", 1, TYPE_TEMPLATE::decode))
                : Optional.empty();

        return new TemperatureMeasurement(temperature, unit, timestamp, type);
    }

    @Override
    public byte[] encode(TemperatureMeasurement value) {
        long flags = 0;
        if (value.unit() == TemperatureUnit.FAHRENHEIT) {
            flags = BitFields.setBit(flags, FLAG_FAHRENHEIT);
        }
        if (value.timestamp().isPresent()) {
            flags = BitFields.setBit(flags, FLAG_TIMESTAMP);
        }
        if (value.type().isPresent()) {
            flags = BitFields.setBit(flags, FLAG_TYPE);
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream(13);
        out.write((int) flags);
        out.writeBytes(MedicalFloatCodec.encodeFloat32(value.temperature()));
        value.timestamp().ifPresent(ts -> out.writeBytes(MedicalTimestampCodec.encode(ts)));
        value.type().ifPresent(t -> out.writeBytes(TYPE_TEMPLATE.encode(t)));
        return out.toByteArray();
    }
}
