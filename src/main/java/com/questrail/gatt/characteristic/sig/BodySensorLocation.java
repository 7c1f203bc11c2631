package com.questrail.gatt.characteristic.sig;

import com.questrail.gatt.codec.template.WireEnum;

/**
 * Body Sensor Location codes.
 */
public enum BodySensorLocation implements WireEnum
{
    OTHER(0),
    CHEST(1),
    WRIST(2),
    FINGER(3),
    HAND(4),
    EAR_LOBE(5),
    FOOT(6);

    private final int code;

    BodySensorLocation(int code) {
        this.code = code;
    }

    @Override
    public int code() {
        return code;
    }
}
