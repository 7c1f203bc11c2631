package com.questrail.gatt.characteristic.sig;

import com.questrail.gatt.api.CharacteristicUuid;
import com.questrail.gatt.characteristic.ScaledCharacteristic;
import com.questrail.gatt.codec.IntegerFormat;
import com.questrail.gatt.codec.template.ScaledTemplate;

/**
 * Pressure (0x2A6D): uint32 in units of 0.1 Pa.
 */
public final class PressureCharacteristic extends ScaledCharacteristic
{
    public static final CharacteristicUuid UUID = CharacteristicUuid.ofShort(0x2A6D);

    public PressureCharacteristic() {
        super(UUID, "Pressure", "Pa", ScaledTemplate.of(IntegerFormat.UINT32, 0.1));
    }
}
