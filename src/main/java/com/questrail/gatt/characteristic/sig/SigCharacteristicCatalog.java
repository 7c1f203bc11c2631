package com.questrail.gatt.characteristic.sig;

import com.questrail.gatt.characteristic.Characteristic;

import java.util.List;

/**
 * Built-in characteristic decoders shipped with the library.
 */
public final class SigCharacteristicCatalog
{
    private SigCharacteristicCatalog() {}

    public static List<Characteristic<?>> defaults() {
        return List.of(
                new DeviceNameCharacteristic(),
                new BatteryLevelCharacteristic(),
                new BodySensorLocationCharacteristic(),
                new TemperatureCharacteristic(),
                new HumidityCharacteristic(),
                new PressureCharacteristic(),
                new TemperatureMeasurementCharacteristic(),
                new GlucoseMeasurementCharacteristic(),
                new GlucoseMeasurementContextCharacteristic()
        );
    }
}
