package com.questrail.gatt.characteristic.sig;

import com.questrail.gatt.api.CharacteristicContext;
import com.questrail.gatt.api.CharacteristicUuid;
import com.questrail.gatt.api.ValueType;
import com.questrail.gatt.characteristic.AbstractCharacteristic;
import com.questrail.gatt.codec.BinaryCodec;
import com.questrail.gatt.codec.template.TemplateKind;
import com.questrail.gatt.error.LengthMismatchException;
import com.questrail.gatt.validation.ValidationConstraints;

/**
 * Device Name (0x2A00): UTF-8 text of at most 248 bytes, optionally NUL
 * terminated.
 */
public final class DeviceNameCharacteristic extends AbstractCharacteristic<String>
{
    public static final CharacteristicUuid UUID = CharacteristicUuid.ofShort(0x2A00);
    public static final int MAX_LENGTH = 248;

    public DeviceNameCharacteristic() {
        super(UUID, "Device Name", "", String.class, TemplateKind.STRING, ValueType.STRING,
                ValidationConstraints.builder()
                        .withLengthRange(0, MAX_LENGTH)
                        .withVariableLength(true)
                        .withExpectedType(String.class)
                        .build());
    }

    @Override
    public String decode(byte[] raw, CharacteristicContext context) {
        return BinaryCodec.decodeUtf8(raw, 0);
    }

    @Override
    public byte[] encode(String value) {
        byte[] bytes = BinaryCodec.encodeUtf8(value);
        if (bytes.length > MAX_LENGTH) {
            throw LengthMismatchException.atMost(MAX_LENGTH, bytes.length);
        }
        return bytes;
    }
}
