package com.questrail.gatt.codec.template;

import com.questrail.gatt.error.EnumValueException;
import com.questrail.gatt.codec.IntegerFormat;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class EnumTemplateTest
{
    enum Mode implements WireEnum
    {
        OFF(0), ON(1), AUTO(5);

        private final int code;

        Mode(int code) {
            this.code = code;
        }

        @Override
        public int code() {
            return code;
        }
    }

    enum Clashing implements WireEnum
    {
        A, B;

        @Override
        public int code() {
            return 1;
        }
    }

    @Test
    void decodesKnownCodes()
    {
        EnumTemplate<Mode> template = EnumTemplate.uint8(Mode.class, "Mode");
        assertEquals(Mode.AUTO, template.decode(new byte[] { 0x05 }, 0));
        assertEquals(Mode.OFF, template.fromCode(0));
    }

    @Test
    void unknownCodeIsEnumValueError()
    {
        EnumTemplate<Mode> template = EnumTemplate.uint8(Mode.class, "Mode");
        EnumValueException e = assertThrows(EnumValueException.class, () -> template.decode(new byte[] { 0x07 }, 0));
        assertEquals(7, e.code());
        assertEquals("7 is not a valid Mode code", e.getMessage());
    }

    @Test
    void encodesWithDeclaredWidth()
    {
        EnumTemplate<Mode> template = new EnumTemplate<>(Mode.class, "Mode", IntegerFormat.UINT16);
        assertArrayEquals(new byte[] { 0x05, 0x00 }, template.encode(Mode.AUTO));
        assertEquals(2, template.width());
    }

    @Test
    void duplicateCodesAreRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> EnumTemplate.uint8(Clashing.class, "Clashing"));
    }
}
