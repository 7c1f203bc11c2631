package com.questrail.gatt.characteristic.sig;

import com.questrail.gatt.api.CharacteristicContext;
import com.questrail.gatt.api.CharacteristicUuid;
import com.questrail.gatt.api.ValueType;
import com.questrail.gatt.characteristic.AbstractCharacteristic;
import com.questrail.gatt.codec.BinaryCodec;
import com.questrail.gatt.codec.IntegerFormat;
import com.questrail.gatt.codec.template.TemplateKind;
import com.questrail.gatt.validation.ValidationConstraints;

/**
 * Battery Level (0x2A19): remaining charge in percent, one unsigned byte.
 */
public final class BatteryLevelCharacteristic extends AbstractCharacteristic<Integer>
{
    public static final CharacteristicUuid UUID = CharacteristicUuid.ofShort(0x2A19);

    public BatteryLevelCharacteristic() {
        super(UUID, "Battery Level", "%", Integer.class, TemplateKind.SCALED, ValueType.INT,
                ValidationConstraints.builder()
                        .withExactLength(1)
                        .withValueRange(0, 100)
                        .withExpectedType(Integer.class)
                        .build());
    }

    @Override
    public Integer decode(byte[] raw, CharacteristicContext context) {
        return (int) BinaryCodec.decodeInt(raw, 0, IntegerFormat.UINT8);
    }

    @Override
    public byte[] encode(Integer value) {
        return BinaryCodec.encodeInt(value, IntegerFormat.UINT8);
    }
}
