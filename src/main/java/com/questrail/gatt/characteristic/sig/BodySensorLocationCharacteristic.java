package com.questrail.gatt.characteristic.sig;

import com.questrail.gatt.api.CharacteristicContext;
import com.questrail.gatt.api.CharacteristicUuid;
import com.questrail.gatt.api.ValueType;
import com.questrail.gatt.characteristic.AbstractCharacteristic;
import com.questrail.gatt.codec.template.EnumTemplate;
import com.questrail.gatt.codec.template.TemplateKind;
import com.questrail.gatt.validation.ValidationConstraints;

/**
 * Body Sensor Location (0x2A38).
 */
public final class BodySensorLocationCharacteristic extends AbstractCharacteristic<BodySensorLocation>
{
    public static final CharacteristicUuid UUID = CharacteristicUuid.ofShort(0x2A38);

    private static final EnumTemplate<BodySensorLocation> TEMPLATE =
            EnumTemplate.uint8(BodySensorLocation.class, "Body Sensor Location");

    public BodySensorLocationCharacteristic() {
        super(UUID, "Body Sensor Location", "", BodySensorLocation.class,
                TemplateKind.ENUMERATION, ValueType.ENUM,
                ValidationConstraints.builder()
                        .withExactLength(1)
                        .withExpectedType(BodySensorLocation.class)
                        .build());
    }

    @Override
    public BodySensorLocation decode(byte[] raw, CharacteristicContext context) {
        return TEMPLATE.decode(raw, 0);
    }

    @Override
    public byte[] encode(BodySensorLocation value) {
        return TEMPLATE.encode(value);
    }
}
