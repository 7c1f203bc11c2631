package com.questrail.gatt.api;

import com.questrail.gatt.error.ErrorKind;
import com.questrail.gatt.error.TypeMismatchException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class CharacteristicContextTest
{
    private static final CharacteristicUuid A = CharacteristicUuid.ofShort(0x2A19);
    private static final CharacteristicUuid B = CharacteristicUuid.ofShort(0x2A6E);

    @Test
    void onlySuccessfulResultsAreAvailable()
    {
        CharacteristicContext context = CharacteristicContext.empty()
                .with(DecodedResult.success(A, "A", 50, new byte[] { 50 }, List.of()))
                .with(DecodedResult.failure(B, "B", new byte[0], ErrorKind.INSUFFICIENT_DATA, "short"));

        assertTrue(context.isAvailable(A));
        assertFalse(context.isAvailable(B));
        assertEquals(Optional.of(50), context.valueOf(A));
        assertEquals(Optional.empty(), context.valueOf(B));
        assertTrue(context.result(B).isPresent());
        assertEquals(2, context.size());
    }

    @Test
    void withReturnsNewContext()
    {
        CharacteristicContext empty = CharacteristicContext.empty();
        CharacteristicContext one = empty.with(DecodedResult.success(A, "A", 1, new byte[] { 1 }, List.of()));

        assertEquals(0, empty.size());
        assertEquals(1, one.size());
        assertThrows(UnsupportedOperationException.class, () -> one.asMap().clear());
    }

    @Test
    void withAllLetsLaterResultsReplaceEarlierOnes()
    {
        CharacteristicContext first = CharacteristicContext.empty()
                .with(DecodedResult.success(A, "A", 10, new byte[] { 10 }, List.of()));

        CharacteristicContext merged = first.withAll(Map.of(
                A, DecodedResult.success(A, "A", 20, new byte[] { 20 }, List.of()),
                B, DecodedResult.success(B, "B", 2150, new byte[] { 0x66, 0x08 }, List.of())));

        assertEquals(Optional.of(10), first.valueOf(A));
        assertEquals(Optional.of(20), merged.valueOf(A));
        assertEquals(Optional.of(2150), merged.valueOf(B));
        assertEquals(2, merged.size());
        assertSame(first, first.withAll(Map.of()));
    }

    @Test
    void typedLookupRejectsWrongType()
    {
        CharacteristicContext context = CharacteristicContext.of(
                Map.of(A, DecodedResult.success(A, "A", 50, new byte[] { 50 }, List.of())));

        assertEquals(Optional.of(50), context.valueOf(A, Integer.class));
        assertThrows(TypeMismatchException.class, () -> context.valueOf(A, String.class));
        assertEquals(Optional.empty(), context.valueOf(B, String.class));
    }

    @Test
    void unresolvedResultCannotJoinContext()
    {
        DecodedResult<Object> unresolved = DecodedResult.unresolved("nope", new byte[0]);
        assertThrows(IllegalArgumentException.class, () -> CharacteristicContext.empty().with(unresolved));
    }

    @Test
    void unresolvedResultDescribesIdentifier()
    {
        DecodedResult<Object> unresolved = DecodedResult.unresolved("nope", new byte[] { 1 });

        assertFalse(unresolved.isSuccess());
        assertEquals(Optional.empty(), unresolved.uuid());
        assertEquals(Optional.of(ErrorKind.UUID_RESOLUTION), unresolved.errorKind());
        assertEquals("unknown characteristic identifier 'nope'", unresolved.message());
        assertArrayEquals(new byte[] { 1 }, unresolved.raw());
    }
}
