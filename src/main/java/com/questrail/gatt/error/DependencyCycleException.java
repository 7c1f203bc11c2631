package com.questrail.gatt.error;

import java.util.List;

/**
 * Structural error: declared dependencies inside one batch form a cycle.
 * Fails the whole batch before any entry is decoded.
 */
public final class DependencyCycleException extends GattException
{
    private final List<String> cycle;

    public DependencyCycleException(List<String> cycle) {
        super(ErrorKind.DEPENDENCY_CYCLE, "dependency cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
