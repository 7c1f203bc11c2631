package com.questrail.gatt.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raised by composite decoders when a named sub-field fails.
 *
 * <p>
 * The exception keeps the fields that were decoded before the failure so the
 * resulting {@code DecodedResult} does not discard partial progress.
 * </p>
 */
public final class FieldFailureException extends GattException
{
    private final List<FieldError> fieldErrors;
    private final Map<String, Object> partialValues;

    public FieldFailureException(List<FieldError> fieldErrors,
                                 Map<String, Object> partialValues,
                                 Throwable cause) {
        super(ErrorKind.FIELD_FAILURE, describe(fieldErrors), cause);
        this.fieldErrors = List.copyOf(fieldErrors);
        this.partialValues = Collections.unmodifiableMap(new LinkedHashMap<>(partialValues));
    }

    public List<FieldError> fieldErrors() {
        return fieldErrors;
    }

    public Map<String, Object> partialValues() {
        return partialValues;
    }

    private static String describe(List<FieldError> errors) {
        if (errors.isEmpty()) {
            return "field failure";
        }
        return errors.get(0).describe();
    }
}
