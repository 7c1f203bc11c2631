package com.questrail.gatt.registry;

import com.questrail.gatt.characteristic.ScaledCharacteristic;
import com.questrail.gatt.codec.IntegerFormat;
import com.questrail.gatt.codec.template.ScaledTemplate;

import java.util.Optional;

/**
 * Scaled decoder synthesized from a specification entry that declares an
 * integer wire type but has no dedicated decoder.
 */
final class SpecDrivenCharacteristic extends ScaledCharacteristic
{
    private SpecDrivenCharacteristic(SpecificationEntry entry, ScaledTemplate template) {
        super(entry.uuid(), entry.name(), UnitSymbols.symbolFor(entry.unit()), template);
    }

    static Optional<SpecDrivenCharacteristic> from(SpecificationEntry entry) {
        return IntegerFormat.fromDataType(entry.dataType()).map(format -> {
            ScaledTemplate template = entry.declaresScale()
                    ? ScaledTemplate.fromMdb(format,
                            entry.multiplier() == null ? 1 : entry.multiplier(),
                            entry.decimalExponent() == null ? 0 : entry.decimalExponent(),
                            entry.binaryOffset() == null ? 0 : entry.binaryOffset())
                    : ScaledTemplate.of(format, 1.0);
            return new SpecDrivenCharacteristic(entry, template);
        });
    }
}
