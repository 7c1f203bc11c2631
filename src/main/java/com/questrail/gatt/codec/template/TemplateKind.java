package com.questrail.gatt.codec.template;

/**
 * Explicit tag each characteristic declares for the layout family it uses.
 *
 * <p>
 * Callers that need to treat templated characteristics generically (tooling,
 * documentation generators, the registry's synthesized decoders) switch on
 * this tag instead of inspecting the implementing class.
 * </p>
 */
public enum TemplateKind
{
    /** Single integer with linear scaling. */
    SCALED,
    /** Single IEEE-11073 SFLOAT or FLOAT value. */
    MEDICAL_FLOAT,
    /** Single integer code mapped to an enumeration. */
    ENUMERATION,
    /** Packed bit flags. */
    FLAGS,
    /** Multi-field layout, usually flag-driven. */
    COMPOSITE,
    /** UTF-8 text. */
    STRING,
    /** Seven-byte date-time. */
    TIMESTAMP,
    /** Uninterpreted bytes. */
    RAW
}
