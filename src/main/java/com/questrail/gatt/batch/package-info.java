/**
 * Dependency-aware decoding of several characteristics at once.
 *
 * <p>
 * The batch decoder works on a fully materialized input map and context. It
 * never decides whether a dependency value is fresh enough; refreshing cached
 * reads belongs to the transport layer that supplies the bytes.
 * </p>
 */
package com.questrail.gatt.batch;
