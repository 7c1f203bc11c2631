package com.questrail.gatt.codec.template;

/**
 * Enumeration constant with a fixed wire code.
 */
public interface WireEnum
{
    int code();
}
