package com.questrail.gatt.validation;

import com.questrail.gatt.error.InsufficientDataException;
import com.questrail.gatt.error.LengthMismatchException;
import com.questrail.gatt.error.TypeMismatchException;
import com.questrail.gatt.error.ValueRangeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ValidationEngineTest
{
    private static final ValidationConstraints ONE_BYTE =
            ValidationConstraints.builder().withExactLength(1).build();

    @Test
    void emptyBufferAgainstExactLengthIsInsufficientData()
    {
        InsufficientDataException e = assertThrows(InsufficientDataException.class,
                () -> ValidationEngine.validateInput(new byte[0], ONE_BYTE));
        assertEquals(1, e.required());
        assertEquals(0, e.actual());
    }

    @Test
    void longerThanExactLengthIsMismatch()
    {
        LengthMismatchException e = assertThrows(LengthMismatchException.class,
                () -> ValidationEngine.validateInput(new byte[2], ONE_BYTE));
        assertEquals("expected exactly 1 bytes, got 2", e.getMessage());
    }

    @Test
    void variableLengthAllowsTrailingBytes()
    {
        ValidationConstraints c = ValidationConstraints.builder()
                .withExactLength(1)
                .withVariableLength(true)
                .build();
        assertDoesNotThrow(() -> ValidationEngine.validateInput(new byte[4], c));
    }

    @Test
    void lengthRangeIsEnforcedAtBothEnds()
    {
        ValidationConstraints c = ValidationConstraints.builder().withLengthRange(2, 4).build();
        assertThrows(InsufficientDataException.class, () -> ValidationEngine.validateInput(new byte[1], c));
        assertDoesNotThrow(() -> ValidationEngine.validateInput(new byte[2], c));
        assertDoesNotThrow(() -> ValidationEngine.validateInput(new byte[4], c));
        assertThrows(LengthMismatchException.class, () -> ValidationEngine.validateInput(new byte[5], c));
    }

    @Test
    void noConstraintsAcceptsAnything()
    {
        assertDoesNotThrow(() -> ValidationEngine.validateInput(new byte[0], ValidationConstraints.none()));
        assertDoesNotThrow(() -> ValidationEngine.validateOutput("x", ValidationConstraints.none()));
    }

    @Test
    void outputTypeIsChecked()
    {
        ValidationConstraints c = ValidationConstraints.builder().withExpectedType(Integer.class).build();
        TypeMismatchException e = assertThrows(TypeMismatchException.class,
                () -> ValidationEngine.validateOutput("50", c));
        assertEquals("expected Integer, got String", e.getMessage());
    }

    @Test
    void outputRangeIsInclusive()
    {
        ValidationConstraints c = ValidationConstraints.builder().withValueRange(0, 100).build();
        assertDoesNotThrow(() -> ValidationEngine.validateOutput(0, c));
        assertDoesNotThrow(() -> ValidationEngine.validateOutput(100, c));
        ValueRangeException e = assertThrows(ValueRangeException.class,
                () -> ValidationEngine.validateOutput(101, c));
        assertEquals("value 101 outside range [0.0, 100.0]", e.getMessage());
    }

    @Test
    void sentinelValuesSkipRangeCheck()
    {
        ValidationConstraints c = ValidationConstraints.builder().withValueRange(0, 100).build();
        assertDoesNotThrow(() -> ValidationEngine.validateOutput(Double.NaN, c));
        assertDoesNotThrow(() -> ValidationEngine.validateOutput(Double.POSITIVE_INFINITY, c));
    }

    @Test
    void builderRejectsInvertedRanges()
    {
        assertThrows(IllegalArgumentException.class,
                () -> ValidationConstraints.builder().withLengthRange(4, 2).build());
        assertThrows(IllegalArgumentException.class,
                () -> ValidationConstraints.builder().withValueRange(10, 0).build());
        assertThrows(IllegalArgumentException.class,
                () -> ValidationConstraints.builder().withMinLength(-1).build());
    }
}
