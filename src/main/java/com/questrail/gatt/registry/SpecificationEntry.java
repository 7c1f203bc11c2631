package com.questrail.gatt.registry;

import com.questrail.gatt.api.CharacteristicUuid;
import com.questrail.gatt.api.GattProperty;

import java.util.Objects;
import java.util.Set;

/**
 * One characteristic as listed by the external specification dataset.
 *
 * @param unit            unit identifier as published (e.g.
 *                        {@code org.bluetooth.unit.percentage}); may be empty
 * @param dataType        declared wire type (e.g. {@code uint16}); may be empty
 * @param multiplier      M of the {@code M × 10^d × (raw + b)} rule, or null
 * @param decimalExponent d, or null
 * @param binaryOffset    b, or null
 */
public record SpecificationEntry(
    CharacteristicUuid uuid,
    String name,
    String identifier,
    String unit,
    String dataType,
    Set<GattProperty> properties,
    Integer multiplier,
    Integer decimalExponent,
    Long binaryOffset
) {
    public SpecificationEntry {
        Objects.requireNonNull(uuid, "uuid");
        Objects.requireNonNull(name, "name");
        identifier = identifier == null ? "" : identifier;
        unit = unit == null ? "" : unit;
        dataType = dataType == null ? "" : dataType;
        properties = properties == null ? Set.of() : Set.copyOf(properties);
    }

    public static SpecificationEntry of(CharacteristicUuid uuid, String name, String identifier) {
        return new SpecificationEntry(uuid, name, identifier, "", "", Set.of(), null, null, null);
    }

    public boolean declaresScale() {
        return multiplier != null || decimalExponent != null || binaryOffset != null;
    }
}
