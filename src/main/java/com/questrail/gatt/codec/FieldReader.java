package com.questrail.gatt.codec;

import com.questrail.gatt.error.FieldError;
import com.questrail.gatt.error.FieldFailureException;
import com.questrail.gatt.error.GattException;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * FieldReader
 * -----------------------------------------------------------------------------
 * Sequential cursor used by composite decoders.
 *
 * <p>
 * Every read names its field. If a read fails, the failure is rethrown as a
 * {@link FieldFailureException} that carries the field name, the byte offset
 * where the field started, and every field decoded so far. Successful reads
 * are recorded in order and exposed by {@link #decodedFields()}.
 * </p>
 *
 * <p>
 * Not thread-safe; one reader per decode call.
 * </p>
 */
public final class FieldReader
{
    private final byte[] buffer;
    private final Map<String, Object> decoded = new LinkedHashMap<>();
    private int offset;

    public FieldReader(byte[] buffer) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
    }

    public int offset() {
        return offset;
    }

    public int remaining() {
        return buffer.length - offset;
    }

    public boolean hasRemaining() {
        return offset < buffer.length;
    }

    public long readInt(String field, IntegerFormat format) {
        return read(field, format.width(), (b, o) -> BinaryCodec.decodeInt(b, o, format));
    }

    public double readSfloat(String field) {
        return read(field, 2, MedicalFloatCodec::decodeSfloat);
    }

    public double readMedicalFloat32(String field) {
        return read(field, 4, MedicalFloatCodec::decodeFloat32);
    }

    /**
     * Reads a seven-byte timestamp. An absent ("not known") timestamp is not
     * recorded as a decoded field.
     */
    public Optional<LocalDateTime> readTimestamp(String field) {
        Optional<LocalDateTime> value = read(field, MedicalTimestampCodec.LENGTH, MedicalTimestampCodec::decode);
        if (value.isPresent()) {
            decoded.put(field, value.get());
        } else {
            decoded.remove(field);
        }
        return value;
    }

    /**
     * Reads a fixed-width field with a caller-supplied decoder and advances
     * past it.
     */
    public <V> V read(String field, int width, FieldDecoder<V> decoder) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(decoder, "decoder");
        int start = offset;
        V value;
        try {
            BinaryCodec.requireLength(buffer, start, width);
            value = decoder.decode(buffer, start);
        } catch (GattException e) {
            throw failure(field, start, e.getMessage(), e);
        }
        offset = start + width;
        decoded.put(field, value);
        return value;
    }

    /**
     * Records a value derived from already-read fields (for example a flag
     * decoded out of a flags byte).
     */
    public void record(String field, Object value) {
        decoded.put(Objects.requireNonNull(field, "field"), Objects.requireNonNull(value, "value"));
    }

    /**
     * Fails the named field at the current offset.
     */
    public FieldFailureException fail(String field, String reason) {
        return failure(field, offset, reason, null);
    }

    /**
     * Fails the named field at an explicit offset.
     */
    public FieldFailureException fail(String field, int fieldOffset, String reason) {
        return failure(field, fieldOffset, reason, null);
    }

    public Map<String, Object> decodedFields() {
        return Collections.unmodifiableMap(decoded);
    }

    private FieldFailureException failure(String field, int at, String reason, Throwable cause) {
        return new FieldFailureException(List.of(FieldError.at(field, at, reason)), decoded, cause);
    }
}
