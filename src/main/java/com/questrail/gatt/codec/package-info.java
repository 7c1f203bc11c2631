/**
 * Primitive codecs shared by every characteristic.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>{@link com.questrail.gatt.codec.BinaryCodec}: fixed-width integers,
 *       IEEE-754 floats, UTF-8 strings, variable-length fields.</li>
 *   <li>{@link com.questrail.gatt.codec.BitFields}: packed flag fields.</li>
 *   <li>{@link com.questrail.gatt.codec.MedicalFloatCodec} and
 *       {@link com.questrail.gatt.codec.MedicalTimestampCodec}: IEEE-11073
 *       formats.</li>
 *   <li>{@link com.questrail.gatt.codec.FieldReader}: named-field cursor for
 *       composite layouts.</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * <p>
 * Netty's {@code ByteBuf} is used as the byte-order primitive inside this
 * package only. Every public signature exchanges {@code byte[]}; no Netty type
 * crosses the package boundary.
 * </p>
 *
 * <p>
 * Everything here is stateless except {@code FieldReader}, which is confined to
 * a single decode call.
 * </p>
 */
package com.questrail.gatt.codec;
