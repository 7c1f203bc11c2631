package com.questrail.gatt.error;

/**
 * Top-level classification of every failure the codec can report.
 *
 * <p>
 * Simple callers only need the kind and the message attached to a
 * {@link com.questrail.gatt.api.DecodedResult}; richer callers may also
 * inspect field errors and the parse trace.
 * </p>
 */
public enum ErrorKind
{
    /** Buffer shorter than the characteristic or field requires. */
    INSUFFICIENT_DATA,

    /** Fixed-length buffer longer than declared. */
    LENGTH_MISMATCH,

    /** Numeric value outside its declared bounds. */
    VALUE_RANGE,

    /** Decoded or supplied value has the wrong runtime type. */
    TYPE_MISMATCH,

    /** Integer code is not a member of the enumeration. */
    ENUM_VALUE,

    /** Named sub-field of a composite characteristic failed. */
    FIELD_FAILURE,

    /** A required other characteristic was not available. */
    MISSING_DEPENDENCY,

    /** Identifier could not be resolved to a known characteristic. */
    UUID_RESOLUTION,

    /** Custom registration collided with an existing identifier. */
    COLLISION,

    /** Medical float bits map neither to a finite value nor to a sentinel. */
    SPECIAL_FLOAT_FORMAT,

    /** Declared dependencies within a batch form a cycle. */
    DEPENDENCY_CYCLE,

    /** Any other failure raised by a concrete decoder. */
    DECODE_FAILURE
}
