package com.questrail.gatt.config;

import com.questrail.gatt.characteristic.Characteristic;
import com.questrail.gatt.characteristic.sig.SigCharacteristicCatalog;
import com.questrail.gatt.observability.GattObservabilitySink;
import com.questrail.gatt.observability.NullObservabilitySink;
import com.questrail.gatt.registry.SpecificationSource;
import com.questrail.gatt.registry.YamlSpecificationSource;

import java.util.List;
import java.util.Objects;

/**
 * Aggregated configuration for a {@code GattTranslator}.
 *
 * @param specificationSource external dataset read once by the registry
 * @param catalog             decoders bound at load time
 * @param observabilitySink   receives load, failure and error events
 * @param parseTrace          collect a parse trace on every result
 */
public record GattTranslatorConfig(
    SpecificationSource specificationSource,
    List<Characteristic<?>> catalog,
    GattObservabilitySink observabilitySink,
    boolean parseTrace
) {
    public GattTranslatorConfig {
        Objects.requireNonNull(specificationSource, "specificationSource");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        catalog = List.copyOf(Objects.requireNonNull(catalog, "catalog"));
    }

    public static GattTranslatorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SpecificationSource specificationSource = YamlSpecificationSource.bundled();
        private List<Characteristic<?>> catalog = SigCharacteristicCatalog.defaults();
        private GattObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private boolean parseTrace = false;

        public Builder withSpecificationSource(SpecificationSource specificationSource) {
            this.specificationSource = specificationSource;
            return this;
        }

        public Builder withCatalog(List<? extends Characteristic<?>> catalog) {
            this.catalog = List.copyOf(catalog);
            return this;
        }

        public Builder withObservabilitySink(GattObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public Builder withParseTrace(boolean parseTrace) {
            this.parseTrace = parseTrace;
            return this;
        }

        public GattTranslatorConfig build() {
            return new GattTranslatorConfig(specificationSource, catalog, observabilitySink, parseTrace);
        }
    }
}
