package com.questrail.gatt.codec;

/**
 * Decodes one value starting at an offset of a buffer.
 */
@FunctionalInterface
public interface FieldDecoder<V>
{
    V decode(byte[] buffer, int offset);
}
