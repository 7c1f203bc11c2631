package com.questrail.gatt.api;

import com.questrail.gatt.error.TypeMismatchException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable set of already-decoded characteristics visible to a decode.
 *
 * <p>
 * Dependent characteristics read their dependencies' values from here. Only
 * successful results count as available; a failed result is present for
 * diagnostics but yields no value.
 * </p>
 */
public final class CharacteristicContext
{
    private static final CharacteristicContext EMPTY = new CharacteristicContext(Map.of());

    private final Map<CharacteristicUuid, DecodedResult<?>> results;

    private CharacteristicContext(Map<CharacteristicUuid, DecodedResult<?>> results) {
        this.results = results;
    }

    public static CharacteristicContext empty() {
        return EMPTY;
    }

    public static CharacteristicContext of(Map<CharacteristicUuid, ? extends DecodedResult<?>> results) {
        Objects.requireNonNull(results, "results");
        if (results.isEmpty()) {
            return EMPTY;
        }
        return new CharacteristicContext(Collections.unmodifiableMap(new LinkedHashMap<>(results)));
    }

    /**
     * @return a new context containing this context's results plus {@code result}
     */
    public CharacteristicContext with(DecodedResult<?> result) {
        Objects.requireNonNull(result, "result");
        Map<CharacteristicUuid, DecodedResult<?>> copy = new LinkedHashMap<>(results);
        copy.put(result.uuid().orElseThrow(
                () -> new IllegalArgumentException("result without uuid cannot join a context")), result);
        return new CharacteristicContext(Collections.unmodifiableMap(copy));
    }

    /**
     * @return a new context where entries of {@code other} replace entries of this one
     */
    public CharacteristicContext withAll(Map<CharacteristicUuid, ? extends DecodedResult<?>> other) {
        Objects.requireNonNull(other, "other");
        if (other.isEmpty()) {
            return this;
        }
        Map<CharacteristicUuid, DecodedResult<?>> copy = new LinkedHashMap<>(results);
        copy.putAll(other);
        return new CharacteristicContext(Collections.unmodifiableMap(copy));
    }

    public Optional<DecodedResult<?>> result(CharacteristicUuid uuid) {
        return Optional.ofNullable(results.get(uuid));
    }

    public boolean isAvailable(CharacteristicUuid uuid) {
        DecodedResult<?> r = results.get(uuid);
        return r != null && r.isSuccess();
    }

    public Optional<Object> valueOf(CharacteristicUuid uuid) {
        DecodedResult<?> r = results.get(uuid);
        if (r == null || !r.isSuccess()) {
            return Optional.empty();
        }
        return r.value().map(Object.class::cast);
    }

    /**
     * Typed lookup of a dependency's decoded value.
     *
     * @throws TypeMismatchException if the value exists with a different type
     */
    public <V> Optional<V> valueOf(CharacteristicUuid uuid, Class<V> type) {
        Objects.requireNonNull(type, "type");
        Optional<Object> value = valueOf(uuid);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        Object v = value.get();
        if (!type.isInstance(v)) {
            throw new TypeMismatchException(type, v);
        }
        return Optional.of(type.cast(v));
    }

    public Map<CharacteristicUuid, DecodedResult<?>> asMap() {
        return results;
    }

    public int size() {
        return results.size();
    }
}
