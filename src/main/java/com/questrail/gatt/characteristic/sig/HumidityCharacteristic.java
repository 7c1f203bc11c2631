package com.questrail.gatt.characteristic.sig;

import com.questrail.gatt.api.CharacteristicUuid;
import com.questrail.gatt.characteristic.ScaledCharacteristic;
import com.questrail.gatt.codec.IntegerFormat;
import com.questrail.gatt.codec.template.ScaledTemplate;

import java.util.OptionalLong;

/**
 * Humidity (0x2A6F): uint16 in units of 0.01 %. Raw {@code 0xFFFF} means
 * "value is not known".
 */
public final class HumidityCharacteristic extends ScaledCharacteristic
{
    public static final CharacteristicUuid UUID = CharacteristicUuid.ofShort(0x2A6F);

    public HumidityCharacteristic() {
        super(UUID, "Humidity", "%",
                ScaledTemplate.fromMdb(IntegerFormat.UINT16, 1, -2, 0),
                0.0, 100.0,
                OptionalLong.of(0xFFFF));
    }
}
