package com.questrail.gatt.characteristic;

import com.questrail.gatt.api.CharacteristicContext;
import com.questrail.gatt.api.CharacteristicUuid;
import com.questrail.gatt.api.DecodedResult;
import com.questrail.gatt.codec.BinaryCodec;
import com.questrail.gatt.error.ErrorKind;
import com.questrail.gatt.error.FieldFailureException;
import com.questrail.gatt.error.GattException;
import com.questrail.gatt.error.MissingDependencyException;
import com.questrail.gatt.error.ParseTrace;
import com.questrail.gatt.error.TypeMismatchException;
import com.questrail.gatt.validation.ValidationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ParsePipeline
 * -----------------------------------------------------------------------------
 * Generic wrappers around a {@link Characteristic}'s decode and encode.
 *
 * <h2>parse</h2>
 * <ol>
 *   <li>validate raw length</li>
 *   <li>check required dependencies against the context</li>
 *   <li>decode</li>
 *   <li>validate the decoded value (type, range)</li>
 *   <li>wrap into a {@link DecodedResult}</li>
 * </ol>
 * <p>
 * Any exception raised along the way becomes a failed result; parse never
 * throws for bad input. A buffer that fails step 1 never reaches the
 * concrete decoder.
 * </p>
 *
 * <h2>build</h2>
 * <p>
 * Validates the value first and only then calls encode, so a value that
 * violates constraints fails before any bytes are produced. Unlike parse,
 * build throws.
 * </p>
 */
public final class ParsePipeline
{
    private static final Logger log = LoggerFactory.getLogger(ParsePipeline.class);

    private ParsePipeline() {}

    public static <T> DecodedResult<T> parse(Characteristic<T> characteristic, byte[] raw) {
        return parse(characteristic, raw, CharacteristicContext.empty(), ParseTrace.disabled());
    }

    public static <T> DecodedResult<T> parse(Characteristic<T> characteristic,
                                             byte[] raw,
                                             CharacteristicContext context,
                                             ParseTrace trace) {
        Objects.requireNonNull(characteristic, "characteristic");
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(trace, "trace");

        CharacteristicUuid uuid = characteristic.uuid();
        String name = characteristic.name();
        trace.step(() -> "Starting parse of " + name);

        try {
            trace.step(() -> "Validating data length (got " + raw.length + " bytes)");
            ValidationEngine.validateInput(raw, characteristic.constraints());

            requireDependencies(characteristic, context, trace);

            trace.step("Decoding value");
            T value = characteristic.decode(raw.clone(), context);
            if (value == null) {
                throw new GattException(ErrorKind.DECODE_FAILURE, name + " decoder produced no value");
            }

            trace.step("Validating value");
            ValidationEngine.validateOutput(value, characteristic.constraints());

            trace.step("Parse completed successfully");
            return DecodedResult.success(uuid, name, value, raw, trace.steps());
        } catch (FieldFailureException e) {
            trace.step(() -> "Parse failed: " + e.getMessage());
            log.debug("{} field failure on [{}]: {}", name, BinaryCodec.hex(raw), e.getMessage());
            return DecodedResult.failure(uuid, name, raw, e.kind(), e.getMessage(),
                    e.fieldErrors(), e.partialValues(), trace.steps());
        } catch (GattException e) {
            trace.step(() -> "Parse failed: " + e.getMessage());
            log.debug("{} parse failed on [{}]: {}", name, BinaryCodec.hex(raw), e.getMessage());
            return DecodedResult.failure(uuid, name, raw, e.kind(), e.getMessage(),
                    List.of(), Map.of(), trace.steps());
        } catch (RuntimeException e) {
            trace.step(() -> "Parse failed: " + e);
            log.warn("{} decoder raised unexpected {}", name, e.getClass().getSimpleName(), e);
            return DecodedResult.failure(uuid, name, raw, ErrorKind.DECODE_FAILURE, e.toString(),
                    List.of(), Map.of(), trace.steps());
        }
    }

    private static void requireDependencies(Characteristic<?> characteristic,
                                            CharacteristicContext context,
                                            ParseTrace trace) {
        DependencyDeclaration deps = characteristic.dependencies();
        if (deps.isEmpty()) {
            return;
        }
        trace.step(() -> "Checking dependencies " + deps.all());
        List<String> missing = new ArrayList<>();
        for (CharacteristicUuid required : deps.required()) {
            if (!context.isAvailable(required)) {
                missing.add(required.toString());
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingDependencyException(characteristic.name(), missing);
        }
    }

    /**
     * Validates and encodes a value.
     *
     * @throws GattException if the value has the wrong type, violates the
     *                       declared range, or cannot be encoded
     */
    public static <T> byte[] build(Characteristic<T> characteristic, Object value) {
        Objects.requireNonNull(characteristic, "characteristic");
        if (!characteristic.valueClass().isInstance(value)) {
            throw new TypeMismatchException(characteristic.valueClass(), value);
        }
        ValidationEngine.validateOutput(value, characteristic.constraints());
        return characteristic.encode(characteristic.valueClass().cast(value));
    }
}
