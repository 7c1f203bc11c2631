package com.questrail.gatt.registry;

import java.io.IOException;
import java.util.List;

/**
 * Read-only supplier of the external specification dataset.
 *
 * <p>
 * Called at most once per registry, on first use. Failures are absorbed by
 * the registry, which then continues without specification data.
 * </p>
 */
public interface SpecificationSource
{
    /**
     * @throws IOException              if the dataset cannot be read
     * @throws IllegalArgumentException if the dataset is structurally invalid
     */
    List<SpecificationEntry> load() throws IOException;

    /**
     * @return human-readable location, used in logs
     */
    String description();

    static SpecificationSource empty() {
        return new SpecificationSource() {
            @Override
            public List<SpecificationEntry> load() {
                return List.of();
            }

            @Override
            public String description() {
                return "<none>";
            }
        };
    }
}
