package com.questrail.gatt.characteristic;

import com.questrail.gatt.api.CharacteristicContext;
import com.questrail.gatt.api.CharacteristicUuid;
import com.questrail.gatt.api.ValueType;
import com.questrail.gatt.codec.template.TemplateKind;
import com.questrail.gatt.validation.ValidationConstraints;

/**
 * Contract every concrete characteristic decoder implements.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Declare identity, {@link ValidationConstraints} and (optionally)
 *       {@link DependencyDeclaration}.</li>
 *   <li>Translate already-validated bytes to a value and back.</li>
 * </ul>
 *
 * <p>
 * Implementations never validate lengths or ranges themselves;
 * {@link ParsePipeline} does that before {@link #decode} and before
 * {@link #encode}. Implementations must be immutable and thread-safe: the
 * registry shares one instance across all callers.
 * </p>
 *
 * @param <T> decoded value type
 */
public interface Characteristic<T>
{
    CharacteristicUuid uuid();

    String name();

    /**
     * @return display unit symbol, empty when unitless
     */
    default String unit() {
        return "";
    }

    ValidationConstraints constraints();

    default DependencyDeclaration dependencies() {
        return DependencyDeclaration.none();
    }

    TemplateKind kind();

    ValueType valueType();

    Class<T> valueClass();

    /**
     * @param raw     bytes that already passed input validation
     * @param context other characteristics decoded before this one; every
     *                required dependency is guaranteed to be available
     */
    T decode(byte[] raw, CharacteristicContext context);

    /**
     * @param value value that already passed output validation
     */
    byte[] encode(T value);
}
