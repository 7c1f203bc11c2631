package com.questrail.gatt.characteristic.sig;

import com.questrail.gatt.api.CharacteristicUuid;
import com.questrail.gatt.characteristic.ScaledCharacteristic;
import com.questrail.gatt.codec.IntegerFormat;
import com.questrail.gatt.codec.template.ScaledTemplate;

import java.util.OptionalLong;

/**
 * Temperature (0x2A6E): sint16 in units of 0.01 &deg;C. Raw {@code 0x8000}
 * means "value is not known".
 */
public final class TemperatureCharacteristic extends ScaledCharacteristic
{
    public static final CharacteristicUuid UUID = CharacteristicUuid.ofShort(0x2A6E);

    public TemperatureCharacteristic() {
        super(UUID, "Temperature", "°C",
                ScaledTemplate.of(IntegerFormat.SINT16, 0.01),
                -273.15, 327.67,
                OptionalLong.of(IntegerFormat.SINT16.min()));
    }
}
