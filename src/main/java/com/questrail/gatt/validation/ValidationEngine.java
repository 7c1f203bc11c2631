package com.questrail.gatt.validation;

import com.questrail.gatt.error.InsufficientDataException;
import com.questrail.gatt.error.LengthMismatchException;
import com.questrail.gatt.error.TypeMismatchException;
import com.questrail.gatt.error.ValueRangeException;

import java.util.Objects;

/**
 * ValidationEngine
 * -----------------------------------------------------------------------------
 * Generic enforcement of {@link ValidationConstraints}.
 *
 * <h2>Input</h2>
 * <ul>
 *   <li>Shorter than {@code exactLength} or {@code minLength}:
 *       {@link InsufficientDataException}.</li>
 *   <li>Longer than {@code exactLength} (unless variable length is declared)
 *       or longer than {@code maxLength}: {@link LengthMismatchException}.</li>
 * </ul>
 *
 * <h2>Output</h2>
 * <ul>
 *   <li>Not an instance of {@code expectedType}: {@link TypeMismatchException}.</li>
 *   <li>Finite number outside {@code [minValue, maxValue]}:
 *       {@link ValueRangeException}. NaN and infinities are sentinel values
 *       and pass.</li>
 * </ul>
 *
 * <p>
 * This class is the single source of failure wording for length, range and
 * type checks.
 * </p>
 */
public final class ValidationEngine
{
    private ValidationEngine() {}

    public static void validateInput(byte[] raw, ValidationConstraints constraints) {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(constraints, "constraints");
        int length = raw.length;

        if (constraints.exactLength() != null) {
            int exact = constraints.exactLength();
            if (length < exact) {
                throw new InsufficientDataException(exact, length);
            }
            if (length > exact && !constraints.variableLength()) {
                throw LengthMismatchException.exact(exact, length);
            }
        }
        if (constraints.minLength() != null && length < constraints.minLength()) {
            throw new InsufficientDataException(constraints.minLength(), length);
        }
        if (constraints.maxLength() != null && length > constraints.maxLength()) {
            throw LengthMismatchException.atMost(constraints.maxLength(), length);
        }
    }

    public static void validateOutput(Object value, ValidationConstraints constraints) {
        Objects.requireNonNull(constraints, "constraints");
        if (constraints.expectedType() != null && !constraints.expectedType().isInstance(value)) {
            throw new TypeMismatchException(constraints.expectedType(), value);
        }
        if (!(value instanceof Number number)) {
            return;
        }
        double v = number.doubleValue();
        if (!Double.isFinite(v)) {
            return;
        }
        Double min = constraints.minValue();
        Double max = constraints.maxValue();
        if ((min != null && v < min) || (max != null && v > max)) {
            throw new ValueRangeException("value " + number + " outside range ["
                    + (min == null ? "-inf" : min) + ", " + (max == null ? "inf" : max) + "]");
        }
    }
}
