package com.questrail.gatt.error;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * One failed sub-field of a composite characteristic.
 */
public record FieldError(String field, OptionalInt offset, String reason)
{
    public FieldError {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(offset, "offset");
        Objects.requireNonNull(reason, "reason");
    }

    public static FieldError at(String field, int offset, String reason) {
        return new FieldError(field, OptionalInt.of(offset), reason);
    }

    public static FieldError of(String field, String reason) {
        return new FieldError(field, OptionalInt.empty(), reason);
    }

    public String describe() {
        if (offset.isPresent()) {
            return "field '" + field + "' at offset " + offset.getAsInt() + ": " + reason;
        }
        return "field '" + field + "': " + reason;
    }
}
