/**
 * Error and diagnostics model.
 *
 * <h2>Two channels</h2>
 * <ul>
 *   <li>Expected absence (an identifier nobody registered) is reported with
 *       {@link java.util.Optional}, never with an exception.</li>
 *   <li>Malformed input is reported as a {@link com.questrail.gatt.error.GattException}
 *       subclass tagged with an {@link com.questrail.gatt.error.ErrorKind}; the parse
 *       pipeline converts it into a failed result.</li>
 * </ul>
 *
 * <p>
 * Programmer errors (invalid bit widths, null arguments) fail fast with
 * {@link java.lang.IllegalArgumentException} or {@link java.lang.NullPointerException}
 * and are not part of this taxonomy.
 * </p>
 */
package com.questrail.gatt.error;
