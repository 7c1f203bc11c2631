package com.questrail.gatt.api;

import com.questrail.gatt.error.ErrorKind;
import com.questrail.gatt.error.FieldError;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of decoding one characteristic value.
 *
 * <h2>Success vs. failure</h2>
 * <p>
 * A successful result carries the decoded value. A failed result carries no
 * value but always an {@link ErrorKind} and a message; composite
 * characteristics additionally attach the failing sub-fields and any
 * sub-fields decoded before the failure.
 * </p>
 *
 * <p>
 * All diagnostic detail lives on this object. Parse never throws for
 * malformed input.
 * </p>
 *
 * @param <T> decoded value type
 */
public final class DecodedResult<T>
{
    private final CharacteristicUuid uuid;
    private final String name;
    private final T value;
    private final byte[] raw;
    private final ErrorKind errorKind;
    private final String message;
    private final List<FieldError> fieldErrors;
    private final Map<String, Object> partialValues;
    private final List<String> trace;

    private DecodedResult(CharacteristicUuid uuid,
                          String name,
                          T value,
                          byte[] raw,
                          ErrorKind errorKind,
                          String message,
                          List<FieldError> fieldErrors,
                          Map<String, Object> partialValues,
                          List<String> trace) {
        this.uuid = uuid;
        this.name = Objects.requireNonNull(name, "name");
        this.value = value;
        this.raw = raw == null ? new byte[0] : raw.clone();
        this.errorKind = errorKind;
        this.message = message == null ? "" : message;
        this.fieldErrors = List.copyOf(fieldErrors);
        this.partialValues = Collections.unmodifiableMap(new LinkedHashMap<>(partialValues));
        this.trace = List.copyOf(trace);
    }

    public static <T> DecodedResult<T> success(CharacteristicUuid uuid,
                                               String name,
                                               T value,
                                               byte[] raw,
                                               List<String> trace) {
        Objects.requireNonNull(uuid, "uuid");
        Objects.requireNonNull(value, "value");
        return new DecodedResult<>(uuid, name, value, raw, null, "", List.of(), Map.of(), trace);
    }

    public static <T> DecodedResult<T> failure(CharacteristicUuid uuid,
                                               String name,
                                               byte[] raw,
                                               ErrorKind kind,
                                               String message,
                                               List<FieldError> fieldErrors,
                                               Map<String, Object> partialValues,
                                               List<String> trace) {
        Objects.requireNonNull(kind, "kind");
        return new DecodedResult<>(uuid, name, null, raw, kind, message, fieldErrors, partialValues, trace);
    }

    public static <T> DecodedResult<T> failure(CharacteristicUuid uuid,
                                               String name,
                                               byte[] raw,
                                               ErrorKind kind,
                                               String message) {
        return failure(uuid, name, raw, kind, message, List.of(), Map.of(), List.of());
    }

    /**
     * Failure for an identifier that is neither a known alias nor a
     * well-formed uuid.
     */
    public static <T> DecodedResult<T> unresolved(String identifier, byte[] raw) {
        return new DecodedResult<>(null, identifier, null, raw, ErrorKind.UUID_RESOLUTION,
                "unknown characteristic identifier '" + identifier + "'", List.of(), Map.of(), List.of());
    }

    /**
     * @return empty only for results of identifiers that could not be resolved
     *         to a uuid at all
     */
    public Optional<CharacteristicUuid> uuid() {
        return Optional.ofNullable(uuid);
    }

    public String name() {
        return name;
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    /**
     * @throws IllegalStateException if this result is a failure
     */
    public T requireValue() {
        if (value == null) {
            throw new IllegalStateException(name + " decode failed: " + message);
        }
        return value;
    }

    public byte[] raw() {
        return raw.clone();
    }

    public Optional<ErrorKind> errorKind() {
        return Optional.ofNullable(errorKind);
    }

    public String message() {
        return message;
    }

    public List<FieldError> fieldErrors() {
        return fieldErrors;
    }

    public Map<String, Object> partialValues() {
        return partialValues;
    }

    public List<String> trace() {
        return trace;
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "DecodedResult[" + uuid + " " + name + " = " + value + "]";
        }
        return "DecodedResult[" + uuid + " " + name + " FAILED " + errorKind + ": " + message
                + ", raw=" + Arrays.toString(raw) + "]";
    }
}
