package com.questrail.gatt.registry;

/**
 * Lifecycle of the registry's specification data.
 *
 * <p>
 * {@code LOADED} is terminal for specification data. Custom registrations
 * live in a separate namespace and may change in any state after loading.
 * </p>
 */
public enum RegistryState
{
    UNINITIALIZED,
    LOADING,
    LOADED
}
