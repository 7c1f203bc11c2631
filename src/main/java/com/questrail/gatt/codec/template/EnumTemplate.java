package com.questrail.gatt.codec.template;

import com.questrail.gatt.codec.BinaryCodec;
import com.questrail.gatt.codec.IntegerFormat;
import com.questrail.gatt.error.EnumValueException;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps an unsigned integer field onto enumeration constants.
 *
 * @param <E> enumeration whose constants carry their own wire codes
 */
public final class EnumTemplate<E extends Enum<E> & WireEnum>
{
    private final Class<E> type;
    private final String displayName;
    private final IntegerFormat format;
    private final Map<Long, E> byCode = new HashMap<>();

    public EnumTemplate(Class<E> type, String displayName, IntegerFormat format) {
        this.type = Objects.requireNonNull(type, "type");
        this.displayName = Objects.requireNonNull(displayName, "displayName");
        this.format = Objects.requireNonNull(format, "format");
        for (E constant : type.getEnumConstants()) {
            E previous = byCode.put((long) constant.code(), constant);
            if (previous != null) {
                throw new IllegalArgumentException(
                        type.getSimpleName() + " code " + constant.code() + " used by both "
                                + previous + " and " + constant);
            }
        }
    }

    public static <E extends Enum<E> & WireEnum> EnumTemplate<E> uint8(Class<E> type, String displayName) {
        return new EnumTemplate<>(type, displayName, IntegerFormat.UINT8);
    }

    public Class<E> type() {
        return type;
    }

    public int width() {
        return format.width();
    }

    public E decode(byte[] buffer, int offset) {
        return fromCode(BinaryCodec.decodeInt(buffer, offset, format));
    }

    public E fromCode(long code) {
        E value = byCode.get(code);
        if (value == null) {
            throw new EnumValueException(displayName, code);
        }
        return value;
    }

    public byte[] encode(E value) {
        Objects.requireNonNull(value, "value");
        return BinaryCodec.encodeInt(value.code(), format);
    }
}
