package com.questrail.gatt.characteristic;

import com.questrail.gatt.api.CharacteristicContext;
import com.questrail.gatt.api.CharacteristicUuid;
import com.questrail.gatt.api.ValueType;
import com.questrail.gatt.codec.BinaryCodec;
import com.questrail.gatt.codec.template.ScaledTemplate;
import com.questrail.gatt.codec.template.TemplateKind;
import com.questrail.gatt.validation.ValidationConstraints;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Characteristic made of a single scaled integer.
 *
 * <p>
 * Some layouts reserve one raw value to mean "value is not known"; when
 * configured, that raw value decodes to {@link Double#NaN} and NaN encodes
 * back to it.
 * </p>
 */
public class ScaledCharacteristic extends AbstractCharacteristic<Double>
{
    private final ScaledTemplate template;
    private final OptionalLong unknownRaw;

    public ScaledCharacteristic(CharacteristicUuid uuid,
                                String name,
                                String unit,
                                ScaledTemplate template,
                                double minValue,
                                double maxValue,
                                OptionalLong unknownRaw) {
        super(uuid, name, unit, Double.class, TemplateKind.SCALED, ValueType.FLOAT,
                ValidationConstraints.builder()
                        .withExactLength(template.width())
                        .withValueRange(minValue, maxValue)
                        .withExpectedType(Double.class)
                        .build());
        this.template = Objects.requireNonNull(template, "template");
        this.unknownRaw = Objects.requireNonNull(unknownRaw, "unknownRaw");
    }

    public ScaledCharacteristic(CharacteristicUuid uuid, String name, String unit, ScaledTemplate template) {
        this(uuid, name, unit, template, template.minValue(), template.maxValue(), OptionalLong.empty());
    }

    public ScaledTemplate template() {
        return template;
    }

    @Override
    public Double decode(byte[] raw, CharacteristicContext context) {
        long value = BinaryCodec.decodeInt(raw, 0, template.format());
        if (unknownRaw.isPresent() && unknownRaw.getAsLong() == value) {
            return Double.NaN;
        }
        return template.decodeRaw(value);
    }

    @Override
    public byte[] encode(Double value) {
        if (value.isNaN() && unknownRaw.isPresent()) {
            return BinaryCodec.encodeInt(unknownRaw.getAsLong(), template.format());
        }
        return template.encode(value);
    }
}
