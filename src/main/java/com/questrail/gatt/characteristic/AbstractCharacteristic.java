package com.questrail.gatt.characteristic;

import com.questrail.gatt.api.CharacteristicUuid;
import com.questrail.gatt.api.ValueType;
import com.questrail.gatt.codec.template.TemplateKind;
import com.questrail.gatt.validation.ValidationConstraints;

import java.util.Objects;

/**
 * Holds the declarative part of a characteristic so concrete types only
 * implement {@code decode} and {@code encode}.
 */
public abstract class AbstractCharacteristic<T> implements Characteristic<T>
{
    private final CharacteristicUuid uuid;
    private final String name;
    private final String unit;
    private final Class<T> valueClass;
    private final TemplateKind kind;
    private final ValueType valueType;
    private final ValidationConstraints constraints;

    protected AbstractCharacteristic(CharacteristicUuid uuid,
                                     String name,
                                     String unit,
                                     Class<T> valueClass,
                                     TemplateKind kind,
                                     ValueType valueType,
                                     ValidationConstraints constraints) {
        this.uuid = Objects.requireNonNull(uuid, "uuid");
        this.name = Objects.requireNonNull(name, "name");
        this.unit = unit == null ? "" : unit;
        this.valueClass = Objects.requireNonNull(valueClass, "valueClass");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.valueType = Objects.requireNonNull(valueType, "valueType");
        this.constraints = Objects.requireNonNull(constraints, "constraints");
    }

    @Override
    public final CharacteristicUuid uuid() {
        return uuid;
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final String unit() {
        return unit;
    }

    @Override
    public final Class<T> valueClass() {
        return valueClass;
    }

    @Override
    public final TemplateKind kind() {
        return kind;
    }

    @Override
    public final ValueType valueType() {
        return valueType;
    }

    @Override
    public final ValidationConstraints constraints() {
        return constraints;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + uuid + " " + name + "]";
    }
}
