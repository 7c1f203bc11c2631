/**
 * Observability hooks.
 *
 * <p>
 * The codec reports registry loads, failed decodes and absorbed errors to a
 * {@link com.questrail.gatt.observability.GattObservabilitySink}. The default
 * sink is {@link com.questrail.gatt.observability.NullObservabilitySink};
 * {@link com.questrail.gatt.observability.Slf4jGattObservabilitySink} routes
 * events to SLF4J.
 * </p>
 */
package com.questrail.gatt.observability;
