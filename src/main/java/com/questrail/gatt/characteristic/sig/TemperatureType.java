package com.questrail.gatt.characteristic.sig;

import com.questrail.gatt.codec.template.WireEnum;

/**
 * Temperature Type codes (measurement site).
 */
public enum TemperatureType implements WireEnum
{
    ARMPIT(1),
    BODY(2),
    EAR(3),
    FINGER(4),
    GASTRO_INTESTINAL_TRACT(5),
    MOUTH(6),
    RECTUM(7),
    TOE(8),
    TYMPANUM(9);

    private final int code;

    TemperatureType(int code) {
        this.code = code;
    }

    @Override
    public int code() {
        return code;
    }
}
