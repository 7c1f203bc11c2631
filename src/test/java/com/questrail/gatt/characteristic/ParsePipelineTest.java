package com.questrail.gatt.characteristic;

import com.questrail.gatt.api.CharacteristicContext;
import com.questrail.gatt.api.CharacteristicUuid;
import com.questrail.gatt.api.DecodedResult;
import com.questrail.gatt.api.ValueType;
import com.questrail.gatt.characteristic.sig.BatteryLevelCharacteristic;
import com.questrail.gatt.codec.template.TemplateKind;
import com.questrail.gatt.error.ErrorKind;
import com.questrail.gatt.error.ParseTrace;
import com.questrail.gatt.error.TypeMismatchException;
import com.questrail.gatt.error.ValueRangeException;
import com.questrail.gatt.validation.ValidationConstraints;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ParsePipelineTest
 * -----------------------------------------------------------------------------
 * Verifies ordering guarantees of the generic parse and build wrappers: input
 * validation before decode, output validation before encode, and conversion
 * of every failure into a result.
 */
final class ParsePipelineTest
{
    private static final CharacteristicUuid A = TestCharacteristics.uuid("0001");
    private static final CharacteristicUuid B = TestCharacteristics.uuid("0002");

    @Test
    void invalidLengthNeverReachesDecoder()
    {
        TestCharacteristics.Counter counter = TestCharacteristics.counter(A, "Counter");

        DecodedResult<Integer> result = ParsePipeline.parse(counter, new byte[0]);

        assertFalse(result.isSuccess());
        assertEquals(Optional.of(ErrorKind.INSUFFICIENT_DATA), result.errorKind());
        assertEquals(0, counter.decodeCount());
    }

    @Test
    void successCarriesValueAndRawBytes()
    {
        DecodedResult<Integer> result = ParsePipeline.parse(new BatteryLevelCharacteristic(), new byte[] { 0x55 });

        assertTrue(result.isSuccess());
        assertEquals(85, result.requireValue());
        assertEquals(Optional.of(BatteryLevelCharacteristic.UUID), result.uuid());
        assertEquals("Battery Level", result.name());
        assertArrayEquals(new byte[] { 0x55 }, result.raw());
        assertEquals("", result.message());
    }

    @Test
    void decodedValueOutsideRangeIsRangeFailure()
    {
        DecodedResult<Integer> result = ParsePipeline.parse(new BatteryLevelCharacteristic(), new byte[] { 0x65 });

        assertEquals(Optional.of(ErrorKind.VALUE_RANGE), result.errorKind());
        assertEquals(Optional.empty(), result.value());
        assertThrows(IllegalStateException.class, result::requireValue);
    }

    @Test
    void unexpectedDecoderExceptionBecomesDecodeFailure()
    {
        Characteristic<Integer> broken = new AbstractCharacteristic<>(A, "Broken", "", Integer.class,
                TemplateKind.RAW, ValueType.INT, ValidationConstraints.none()) {
            @Override
            public Integer decode(byte[] raw, CharacteristicContext context) {
                throw new IllegalStateException("boom");
            }

            @Override
            public byte[] encode(Integer value) {
                return new byte[0];
            }
        };

        DecodedResult<Integer> result = ParsePipeline.parse(broken, new byte[] { 1 });

        assertEquals(Optional.of(ErrorKind.DECODE_FAILURE), result.errorKind());
        assertTrue(result.message().contains("boom"));
    }

    @Test
    void recordingTraceListsEveryStage()
    {
        DecodedResult<Integer> result = ParsePipeline.parse(new BatteryLevelCharacteristic(), new byte[] { 0x10 },
                CharacteristicContext.empty(), ParseTrace.recording());

        assertEquals(List.of(
                "Starting parse of Battery Level",
                "Validating data length (got 1 bytes)",
                "Decoding value",
                "Validating value",
                "Parse completed successfully"), result.trace());
    }

    @Test
    void failedTraceEndsWithReason()
    {
        DecodedResult<Integer> result = ParsePipeline.parse(new BatteryLevelCharacteristic(), new byte[] { 1, 2 },
                CharacteristicContext.empty(), ParseTrace.recording());

        String last = result.trace().get(result.trace().size() - 1);
        assertEquals("Parse failed: expected exactly 1 bytes, got 2", last);
    }

    @Test
    void disabledTraceRecordsNothing()
    {
        DecodedResult<Integer> result = ParsePipeline.parse(new BatteryLevelCharacteristic(), new byte[] { 0x10 });
        assertTrue(result.trace().isEmpty());
    }

    @Test
    void missingRequiredDependencyFailsBeforeDecode()
    {
        TestCharacteristics.Counter dependent =
                TestCharacteristics.counter(B, "Dependent", DependencyDeclaration.requires(A));

        DecodedResult<Integer> result = ParsePipeline.parse(dependent, new byte[] { 1 },
                CharacteristicContext.empty(), ParseTrace.disabled());

        assertEquals(Optional.of(ErrorKind.MISSING_DEPENDENCY), result.errorKind());
        assertEquals(0, dependent.decodeCount());
    }

    @Test
    void failedDependencyCountsAsMissing()
    {
        TestCharacteristics.Counter dependent =
                TestCharacteristics.counter(B, "Dependent", DependencyDeclaration.requires(A));
        CharacteristicContext context = CharacteristicContext.empty()
                .with(DecodedResult.failure(A, "A", new byte[0], ErrorKind.INSUFFICIENT_DATA, "short"));

        DecodedResult<Integer> result = ParsePipeline.parse(dependent, new byte[] { 1 }, context, ParseTrace.disabled());

        assertEquals(Optional.of(ErrorKind.MISSING_DEPENDENCY), result.errorKind());
    }

    @Test
    void availableDependencyIsVisibleToDecoder()
    {
        TestCharacteristics.Counter dependent =
                TestCharacteristics.counter(B, "Dependent", DependencyDeclaration.requires(A));
        CharacteristicContext context = CharacteristicContext.empty()
                .with(DecodedResult.success(A, "A", 40, new byte[] { 40 }, List.of()));

        DecodedResult<Integer> result = ParsePipeline.parse(dependent, new byte[] { 2 }, context, ParseTrace.disabled());

        assertEquals(42, result.requireValue());
    }

    @Test
    void buildValidatesBeforeEncoding()
    {
        TestCharacteristics.Counter counter = TestCharacteristics.counter(A, "Counter");

        assertThrows(ValueRangeException.class, () -> ParsePipeline.build(counter, 201));
        assertThrows(TypeMismatchException.class, () -> ParsePipeline.build(counter, "7"));
        assertEquals(0, counter.encodeCount());

        assertArrayEquals(new byte[] { 7 }, ParsePipeline.build(counter, 7));
        assertEquals(1, counter.encodeCount());
    }
}
