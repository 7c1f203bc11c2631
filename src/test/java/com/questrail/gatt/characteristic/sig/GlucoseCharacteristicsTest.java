package com.questrail.gatt.characteristic.sig;

import com.questrail.gatt.api.CharacteristicContext;
import com.questrail.gatt.api.DecodedResult;
import com.questrail.gatt.characteristic.ParsePipeline;
import com.questrail.gatt.error.ErrorKind;
import com.questrail.gatt.error.ParseTrace;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GlucoseCharacteristicsTest
 * -----------------------------------------------------------------------------
 * Glucose Measurement and its dependent Glucose Measurement Context.
 */
final class GlucoseCharacteristicsTest
{
    private static final byte[] MEASUREMENT = {
            0x13,                                          // flags: time offset, sample, context follows
            0x07, 0x00,                                    // sequence 7
            (byte) 0xE5, 0x07, 6, 1, 8, 0, 0,              // 2021-06-01 08:00:00
            (byte) 0xF1, (byte) 0xFF,                      // offset -15 min
            0x5F, (byte) 0xB0,                             // 95e-5 kg/L
            0x21                                           // type 1, location 2
    };

    private final GlucoseMeasurementCharacteristic measurement = new GlucoseMeasurementCharacteristic();
    private final GlucoseMeasurementContextCharacteristic context = new GlucoseMeasurementContextCharacteristic();

    @Test
    void decodesMeasurement()
    {
        GlucoseMeasurement m = ParsePipeline.parse(measurement, MEASUREMENT).requireValue();

        assertEquals(7, m.sequenceNumber());
        assertEquals(Optional.of(LocalDateTime.of(2021, 6, 1, 8, 0, 0)), m.baseTime());
        assertEquals(OptionalInt.of(-15), m.timeOffsetMinutes());
        assertTrue(m.contextFollows());
        assertTrue(m.sensorStatus().isEmpty());

        GlucoseMeasurement.Sample sample = m.sample().orElseThrow();
        assertEquals(0.00095, sample.concentration());
        assertEquals(GlucoseConcentrationUnit.KG_PER_LITRE, sample.unit());
        assertEquals(1, sample.type());
        assertEquals(2, sample.location());
    }

    @Test
    void encodeReproducesMeasurementBytes()
    {
        GlucoseMeasurement m = ParsePipeline.parse(measurement, MEASUREMENT).requireValue();
        assertArrayEquals(MEASUREMENT, ParsePipeline.build(measurement, m));
    }

    @Test
    void truncatedSampleIsFieldFailure()
    {
        byte[] raw = Arrays.copyOf(MEASUREMENT, 13);

        DecodedResult<GlucoseMeasurement> result = ParsePipeline.parse(measurement, raw);

        assertEquals(Optional.of(ErrorKind.FIELD_FAILURE), result.errorKind());
        assertEquals("concentration", result.fieldErrors().get(0).field());
        assertEquals(7L, result.partialValues().get("sequence_number"));
    }

    @Test
    void contextRequiresMeasurement()
    {
        byte[] raw = { 0x02, 0x07, 0x00, 0x01 };

        DecodedResult<GlucoseMeasurementContext> result = ParsePipeline.parse(context, raw);

        assertEquals(Optional.of(ErrorKind.MISSING_DEPENDENCY), result.errorKind());
    }

    @Test
    void contextDecodesWhenSequenceMatches()
    {
        byte[] raw = { 0x03, 0x07, 0x00, 0x01, 0x05, (byte) 0xE0, 0x01 };

        DecodedResult<GlucoseMeasurementContext> result =
                ParsePipeline.parse(context, raw, contextWithMeasurement(), ParseTrace.disabled());

        GlucoseMeasurementContext c = result.requireValue();
        assertEquals(7, c.sequenceNumber());
        assertEquals(Optional.of(new GlucoseMeasurementContext.Carbohydrate(1, 0.05)), c.carbohydrate());
        assertEquals(OptionalInt.of(1), c.meal());
        assertTrue(c.exercise().isEmpty());
    }

    @Test
    void contextWithMismatchedSequenceFailsOnThatField()
    {
        byte[] raw = { 0x02, 0x08, 0x00, 0x01 };

        DecodedResult<GlucoseMeasurementContext> result =
                ParsePipeline.parse(context, raw, contextWithMeasurement(), ParseTrace.disabled());

        assertEquals(Optional.of(ErrorKind.FIELD_FAILURE), result.errorKind());
        assertEquals("sequence_number", result.fieldErrors().get(0).field());
        assertEquals(OptionalInt.of(1), result.fieldErrors().get(0).offset());
    }

    @Test
    void contextEncodesEveryOptionalBlock()
    {
        GlucoseMeasurementContext value = new GlucoseMeasurementContext(7,
                OptionalInt.empty(),
                Optional.empty(),
                OptionalInt.of(2),
                OptionalInt.of(1),
                Optional.of(new GlucoseMeasurementContext.Exercise(600, 80)),
                Optional.of(new GlucoseMeasurementContext.Medication(1, 0.5,
                        GlucoseMeasurementContext.MedicationUnit.LITRES)),
                OptionalDouble.of(6.5));

        byte[] raw = ParsePipeline.build(context, value);
        DecodedResult<GlucoseMeasurementContext> decoded =
                ParsePipeline.parse(context, raw, contextWithMeasurement(), ParseTrace.disabled());

        assertEquals(value, decoded.requireValue());
        assertEquals(0x7E, Byte.toUnsignedInt(raw[0]));
    }

    private CharacteristicContext contextWithMeasurement() {
        GlucoseMeasurement m = ParsePipeline.parse(measurement, MEASUREMENT).requireValue();
        return CharacteristicContext.empty()
                .with(DecodedResult.success(GlucoseMeasurementCharacteristic.UUID, "Glucose Measurement",
                        m, MEASUREMENT, List.of()));
    }
}
