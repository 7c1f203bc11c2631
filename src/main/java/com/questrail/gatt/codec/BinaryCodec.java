package com.questrail.gatt.codec;

import com.questrail.gatt.error.InsufficientDataException;
import com.questrail.gatt.error.LengthMismatchException;
import com.questrail.gatt.error.ValueRangeException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * BinaryCodec
 * -----------------------------------------------------------------------------
 * Stateless fixed-width primitive encode/decode.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Decode fails with {@link InsufficientDataException} when
 *       {@code offset + width} exceeds the buffer, never with an index fault.</li>
 *   <li>Encode fails with {@link ValueRangeException} when the value does not
 *       fit the requested width and signedness. Values are never wrapped or
 *       truncated.</li>
 *   <li>Floats are IEEE-754 little-endian.</li>
 * </ul>
 *
 * <p>
 * Netty buffers are used internally only; callers exchange {@code byte[]}.
 * </p>
 */
public final class BinaryCodec
{
    private BinaryCodec() {}

    /**
     * Throws if {@code width} bytes are not available at {@code offset}.
     */
    public static void requireLength(byte[] buffer, int offset, int width) {
        Objects.requireNonNull(buffer, "buffer");
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0 (was " + offset + ")");
        }
        if ((long) offset + width > buffer.length) {
            throw new InsufficientDataException(offset + width, buffer.length);
        }
    }

    // ---------------------------------------------------------------------
    // Integers
    // ---------------------------------------------------------------------

    public static long decodeInt(byte[] buffer, int offset, IntegerFormat format) {
        return decodeInt(buffer, offset, format, ByteOrder.LITTLE_ENDIAN);
    }

    public static long decodeInt(byte[] buffer, int offset, IntegerFormat format, ByteOrder order) {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(order, "order");
        requireLength(buffer, offset, format.width());

        ByteBuf buf = Unpooled.wrappedBuffer(buffer);
        boolean le = order == ByteOrder.LITTLE_ENDIAN;

        return switch (format) {
            case UINT8 -> buf.getUnsignedByte(offset);
            case SINT8 -> buf.getByte(offset);
            case UINT16 -> le ? buf.getUnsignedShortLE(offset) : buf.getUnsignedShort(offset);
            case SINT16 -> le ? buf.getShortLE(offset) : buf.getShort(offset);
            case UINT24 -> le ? buf.getUnsignedMediumLE(offset) : buf.getUnsignedMedium(offset);
            case SINT24 -> le ? buf.getMediumLE(offset) : buf.getMedium(offset);
            case UINT32 -> le ? buf.getUnsignedIntLE(offset) : buf.getUnsignedInt(offset);
            case SINT32 -> le ? buf.getIntLE(offset) : buf.getInt(offset);
            case UINT48 -> decodeUint48(buf, offset, le);
        };
    }

    private static long decodeUint48(ByteBuf buf, int offset, boolean le) {
        long value = 0;
        for (int i = 0; i < 6; i++) {
            int index = le ? offset + i : offset + 5 - i;
            value |= (long) buf.getUnsignedByte(index) << (8 * i);
        }
        return value;
    }

    public static byte[] encodeInt(long value, IntegerFormat format) {
        return encodeInt(value, format, ByteOrder.LITTLE_ENDIAN);
    }

    public static byte[] encodeInt(long value, IntegerFormat format, ByteOrder order) {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(order, "order");
        if (!format.accepts(value)) {
            throw new ValueRangeException(format.name(), value, format.min(), format.max());
        }

        ByteBuf buf = Unpooled.buffer(format.width(), format.width());
        boolean le = order == ByteOrder.LITTLE_ENDIAN;
        switch (format) {
            case UINT8, SINT8 -> buf.writeByte((int) value);
            case UINT16, SINT16 -> {
                if (le) buf.writeShortLE((int) value); else buf.writeShort((int) value);
            }
            case UINT24, SINT24 -> {
                if (le) buf.writeMediumLE((int) value); else buf.writeMedium((int) value);
            }
            case UINT32, SINT32 -> {
                if (le) buf.writeIntLE((int) value); else buf.writeInt((int) value);
            }
            case UINT48 -> {
                for (int i = 0; i < 6; i++) {
                    int shift = le ? 8 * i : 8 * (5 - i);
                    buf.writeByte((int) (value >>> shift));
                }
            }
        }
        return ByteBufUtil.getBytes(buf);
    }

    // ---------------------------------------------------------------------
    // Floats
    // ---------------------------------------------------------------------

    public static double decodeFloat32(byte[] buffer, int offset) {
        requireLength(buffer, offset, 4);
        return Unpooled.wrappedBuffer(buffer).getFloatLE(offset);
    }

    public static double decodeFloat64(byte[] buffer, int offset) {
        requireLength(buffer, offset, 8);
        return Unpooled.wrappedBuffer(buffer).getDoubleLE(offset);
    }

    /**
     * Encodes a single-precision value. Finite values beyond the float range
     * fail rather than overflowing to infinity.
     */
    public static byte[] encodeFloat32(double value) {
        if (Double.isFinite(value) && Math.abs(value) > Float.MAX_VALUE) {
            throw new ValueRangeException("float32", value, -Float.MAX_VALUE, Float.MAX_VALUE);
        }
        ByteBuf buf = Unpooled.buffer(4, 4);
        buf.writeFloatLE((float) value);
        return ByteBufUtil.getBytes(buf);
    }

    public static byte[] encodeFloat64(double value) {
        ByteBuf buf = Unpooled.buffer(8, 8);
        buf.writeDoubleLE(value);
        return ByteBufUtil.getBytes(buf);
    }

    // ---------------------------------------------------------------------
    // Strings and variable-length fields
    // ---------------------------------------------------------------------

    /**
     * Decodes UTF-8 from {@code offset} to the first NUL terminator or the end
     * of the buffer. Malformed sequences are replaced with U+FFFD.
     */
    public static String decodeUtf8(byte[] buffer, int offset) {
        requireLength(buffer, offset, 0);
        int end = offset;
        while (end < buffer.length && buffer[end] != 0) {
            end++;
        }
        return new String(buffer, offset, end - offset, StandardCharsets.UTF_8);
    }

    public static byte[] encodeUtf8(String value) {
        Objects.requireNonNull(value, "value");
        return value.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Returns the bytes from {@code offset} to the end of the buffer after
     * checking their count against {@code [minLength, maxLength]}.
     */
    public static byte[] decodeVariable(byte[] buffer, int offset, int minLength, int maxLength) {
        requireLength(buffer, offset, 0);
        if (minLength < 0 || maxLength < minLength) {
            throw new IllegalArgumentException(
                    "invalid length bounds [" + minLength + ", " + maxLength + "]");
        }
        int length = buffer.length - offset;
        if (length < minLength) {
            throw new InsufficientDataException("variable field", offset + minLength, buffer.length);
        }
        if (length > maxLength) {
            throw LengthMismatchException.atMost(maxLength, length);
        }
        return Arrays.copyOfRange(buffer, offset, buffer.length);
    }

    /**
     * Hex rendering used in diagnostic messages.
     */
    public static String hex(byte[] buffer) {
        return ByteBufUtil.hexDump(buffer);
    }
}
