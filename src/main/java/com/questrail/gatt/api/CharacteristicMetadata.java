package com.questrail.gatt.api;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable description of one characteristic as published in the
 * specification dataset (or supplied with a custom registration).
 *
 * @param uuid        canonical identity
 * @param name        display name, e.g. {@code Battery Level}
 * @param identifier  specification identifier string, e.g.
 *                    {@code org.bluetooth.characteristic.battery_level}; may be empty
 * @param unit        display unit symbol, empty when unitless
 * @param valueType   logical value type
 * @param dataType    declared wire data type ({@code uint16}, ...), empty if not declared
 * @param properties  declared GATT properties
 */
public record CharacteristicMetadata(
    CharacteristicUuid uuid,
    String name,
    String identifier,
    String unit,
    ValueType valueType,
    String dataType,
    Set<GattProperty> properties
) {
    public CharacteristicMetadata {
        Objects.requireNonNull(uuid, "uuid");
        Objects.requireNonNull(name, "name");
        identifier = identifier == null ? "" : identifier;
        unit = unit == null ? "" : unit;
        valueType = valueType == null ? ValueType.UNKNOWN : valueType;
        dataType = dataType == null ? "" : dataType;
        properties = properties == null || properties.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(properties));
    }

    /**
     * Minimal metadata: identity, name, unit and value type only.
     */
    public static CharacteristicMetadata of(CharacteristicUuid uuid, String name, String unit, ValueType valueType) {
        return new CharacteristicMetadata(uuid, name, "", unit, valueType, "", Set.of());
    }

    public Optional<String> declaredDataType() {
        return dataType.isEmpty() ? Optional.empty() : Optional.of(dataType);
    }
}
