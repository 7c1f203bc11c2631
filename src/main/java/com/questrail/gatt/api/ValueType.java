package com.questrail.gatt.api;

import java.util.Locale;

/**
 * Logical type of a characteristic's decoded value.
 */
public enum ValueType
{
    INT,
    FLOAT,
    STRING,
    BOOL,
    BYTES,
    DATETIME,
    BITFIELD,
    ENUM,
    STRUCT,
    UNKNOWN;

    /**
     * Maps a specification data type name ({@code uint16}, {@code medfloat16},
     * {@code utf8s}, ...) to its logical value type.
     */
    public static ValueType fromDataType(String dataType) {
        if (dataType == null || dataType.isBlank()) {
            return UNKNOWN;
        }
        String t = dataType.trim().toLowerCase(Locale.ROOT);
        if (t.startsWith("uint") || t.startsWith("sint")) {
            return INT;
        }
        return switch (t) {
            case "float32", "float64", "medfloat16", "medfloat32", "sfloat", "float" -> FLOAT;
            case "utf8s", "utf16s", "string" -> STRING;
            case "boolean", "bool" -> BOOL;
            case "datetime", "date_time" -> DATETIME;
            case "bitfield", "boolean[]" -> BITFIELD;
            case "struct" -> STRUCT;
            case "opaque", "bytes" -> BYTES;
            default -> UNKNOWN;
        };
    }
}
