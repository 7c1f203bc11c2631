/**
 * Identifier registry.
 *
 * <p>
 * {@link com.questrail.gatt.registry.CharacteristicRegistry} owns the only
 * shared mutable state of the codec. It is filled once from a
 * {@link com.questrail.gatt.registry.SpecificationSource} (by default the YAML
 * dataset bundled under {@code bluetooth-sig/}) plus a catalog of decoders,
 * and is read without locks afterwards.
 * </p>
 *
 * <p>
 * Name-based spellings are derived once, at load or registration time, by
 * {@code AliasGenerator}. Runtime lookups only lowercase the query.
 * </p>
 */
package com.questrail.gatt.registry;
