package com.questrail.gatt.registry;

import com.questrail.gatt.api.CharacteristicMetadata;
import com.questrail.gatt.api.CharacteristicUuid;
import com.questrail.gatt.api.ValueType;
import com.questrail.gatt.characteristic.Characteristic;
import com.questrail.gatt.error.RegistrationCollisionException;
import com.questrail.gatt.observability.GattErrorEvent;
import com.questrail.gatt.observability.GattObservabilitySink;
import com.questrail.gatt.observability.RegistryLoadEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * CharacteristicRegistry
 * -----------------------------------------------------------------------------
 * Thread-safe, lazily loaded map from identifier or alias to characteristic
 * metadata and decoder.
 *
 * <h2>Loading</h2>
 * <p>
 * The specification dataset is read on first use, exactly once:
 * {@link RegistryState#UNINITIALIZED} &rarr; {@link RegistryState#LOADING}
 * &rarr; {@link RegistryState#LOADED}. Callers check a volatile state field
 * without locking; only a caller that finds the registry not yet loaded takes
 * the lock, re-checks, and performs the load. Threads arriving during the load
 * block on the lock and then see the loaded maps.
 * </p>
 *
 * <p>
 * If the dataset is missing or unreadable, the failure is logged and reported
 * to the observability sink, and the registry continues with decoders from
 * the catalog only. Custom registrations work either way.
 * </p>
 *
 * <h2>Storage</h2>
 * <ul>
 *   <li>canonical maps: uuid &rarr; metadata, uuid &rarr; decoder</li>
 *   <li>alias map: normalized spelling &rarr; uuid (no metadata duplication)</li>
 *   <li>a separate custom namespace with the same three maps, consulted
 *       first</li>
 * </ul>
 *
 * <h2>Reads</h2>
 * <p>
 * After loading, every lookup is a lock-free {@link ConcurrentHashMap} read.
 * Lookup misses return {@link Optional#empty()}; they are expected for
 * arbitrary external input and never throw.
 * </p>
 */
public final class CharacteristicRegistry
{
    private static final Logger log = LoggerFactory.getLogger(CharacteristicRegistry.class);

    private final SpecificationSource source;
    private final List<Characteristic<?>> catalog;
    private final GattObservabilitySink sink;

    private final Object lock = new Object();
    private volatile RegistryState state = RegistryState.UNINITIALIZED;

    private final Map<CharacteristicUuid, CharacteristicMetadata> specMetadata = new ConcurrentHashMap<>();
    private final Map<CharacteristicUuid, Characteristic<?>> specDecoders = new ConcurrentHashMap<>();
    private final Map<String, CharacteristicUuid> specAliases = new ConcurrentHashMap<>();

    private final Map<CharacteristicUuid, CharacteristicMetadata> customMetadata = new ConcurrentHashMap<>();
    private final Map<CharacteristicUuid, Characteristic<?>> customDecoders = new ConcurrentHashMap<>();
    private final Map<String, CharacteristicUuid> customAliases = new ConcurrentHashMap<>();

    public CharacteristicRegistry(SpecificationSource source,
                                  List<? extends Characteristic<?>> catalog,
                                  GattObservabilitySink sink) {
        this.source = Objects.requireNonNull(source, "source");
        this.catalog = List.copyOf(Objects.requireNonNull(catalog, "catalog"));
        this.sink = Objects.requireNonNull(sink, "sink");

        Set<CharacteristicUuid> seen = new HashSet<>();
        for (Characteristic<?> c : this.catalog) {
            if (!seen.add(c.uuid())) {
                throw new IllegalArgumentException("catalog contains two decoders for " + c.uuid());
            }
        }
    }

    public RegistryState state() {
        return state;
    }

    // ---------------------------------------------------------------------
    // Loading
    // ---------------------------------------------------------------------

    /**
     * Performs the one-time load if it has not happened yet. Every lookup
     * calls this; calling it directly only moves the cost to a chosen moment.
     */
    public void ensureLoaded() {
        if (state == RegistryState.LOADED) {
            return;
        }
        synchronized (lock) {
            if (state == RegistryState.LOADED) {
                return;
            }
            state = RegistryState.LOADING;
            boolean loaded = false;
            try {
                load();
                loaded = true;
            } finally {
                state = loaded ? RegistryState.LOADED : RegistryState.UNINITIALIZED;
            }
        }
    }

    private void load() {
        List<SpecificationEntry> entries;
        boolean degraded = false;
        try {
            entries = source.load();
        } catch (IOException | RuntimeException e) {
            degraded = true;
            entries = List.of();
            log.warn("Specification source {} unavailable, continuing without it: {}",
                    source.description(), e.getMessage());
            sink.onError(new GattErrorEvent(Instant.now(),
                    "Specification source " + source.description() + " could not be loaded", e));
        }

        for (SpecificationEntry entry : entries) {
            CharacteristicMetadata metadata = toMetadata(entry);
            CharacteristicMetadata previous = specMetadata.putIfAbsent(entry.uuid(), metadata);
            if (previous != null) {
                log.warn("Duplicate specification entry for {} ('{}'); keeping '{}'",
                        entry.uuid(), entry.name(), previous.name());
            }
        }

        for (Characteristic<?> characteristic : catalog) {
            specDecoders.put(characteristic.uuid(), characteristic);
            specMetadata.computeIfAbsent(characteristic.uuid(), uuid -> synthesize(characteristic));
        }

        for (SpecificationEntry entry : entries) {
            if (specDecoders.containsKey(entry.uuid())) {
                continue;
            }
            try {
                SpecDrivenCharacteristic.from(entry)
                        .ifPresent(decoder -> specDecoders.put(entry.uuid(), decoder));
            } catch (IllegalArgumentException e) {
                log.warn("No decoder synthesized for {} ('{}'): {}", entry.uuid(), entry.name(), e.getMessage());
            }
        }

        List<CharacteristicMetadata> ordered = new ArrayList<>(specMetadata.values());
        ordered.sort(Comparator.comparing(CharacteristicMetadata::uuid));
        for (CharacteristicMetadata metadata : ordered) {
            for (String alias : AliasGenerator.aliasesFor(metadata)) {
                CharacteristicUuid existing = specAliases.putIfAbsent(alias, metadata.uuid());
                if (existing != null && !existing.equals(metadata.uuid())) {
                    log.debug("Alias '{}' already maps to {}; not remapping to {}",
                            alias, existing, metadata.uuid());
                }
            }
        }

        sink.onRegistryLoaded(new RegistryLoadEvent(Instant.now(), source.description(),
                specMetadata.size(), specDecoders.size(), specAliases.size(), degraded));
    }

    private static CharacteristicMetadata toMetadata(SpecificationEntry entry) {
        return new CharacteristicMetadata(
                entry.uuid(),
                entry.name(),
                entry.identifier(),
                UnitSymbols.symbolFor(entry.unit()),
                ValueType.fromDataType(entry.dataType()),
                entry.dataType(),
                entry.properties());
    }

    private static CharacteristicMetadata synthesize(Characteristic<?> characteristic) {
        return CharacteristicMetadata.of(characteristic.uuid(), characteristic.name(),
                characteristic.unit(), characteristic.valueType());
    }

    // ---------------------------------------------------------------------
    // Lookups
    // ---------------------------------------------------------------------

    /**
     * Resolves a uuid in any accepted spelling, or any registered alias
     * (display name, specification identifier, snake_case name).
     */
    public Optional<CharacteristicMetadata> resolve(String identifierOrAlias) {
        return resolveUuid(identifierOrAlias).flatMap(this::resolve);
    }

    public Optional<CharacteristicMetadata> resolve(CharacteristicUuid uuid) {
        Objects.requireNonNull(uuid, "uuid");
        ensureLoaded();
        CharacteristicMetadata custom = customMetadata.get(uuid);
        if (custom != null) {
            return Optional.of(custom);
        }
        return Optional.ofNullable(specMetadata.get(uuid));
    }

    /**
     * Maps an identifier or alias to a uuid. Well-formed uuids are returned
     * even when nothing is registered for them.
     */
    public Optional<CharacteristicUuid> resolveUuid(String identifierOrAlias) {
        if (identifierOrAlias == null || identifierOrAlias.isBlank()) {
            return Optional.empty();
        }
        ensureLoaded();
        String key = AliasGenerator.normalize(identifierOrAlias);
        CharacteristicUuid uuid = customAliases.get(key);
        if (uuid == null) {
            uuid = specAliases.get(key);
        }
        if (uuid != null) {
            return Optional.of(uuid);
        }
        return CharacteristicUuid.tryParse(identifierOrAlias);
    }

    public Optional<Characteristic<?>> resolveDecoder(CharacteristicUuid uuid) {
        Objects.requireNonNull(uuid, "uuid");
        ensureLoaded();
        Characteristic<?> custom = customDecoders.get(uuid);
        if (custom != null) {
            return Optional.of(custom);
        }
        return Optional.ofNullable(specDecoders.get(uuid));
    }

    public Optional<Characteristic<?>> resolveDecoder(String identifierOrAlias) {
        return resolveUuid(identifierOrAlias).flatMap(this::resolveDecoder);
    }

    /**
     * @return every resolvable entry, custom entries replacing specification
     *         entries with the same uuid, ordered by uuid
     */
    public List<CharacteristicMetadata> allMetadata() {
        ensureLoaded();
        Map<CharacteristicUuid, CharacteristicMetadata> merged = new HashMap<>(specMetadata);
        merged.putAll(customMetadata);
        List<CharacteristicMetadata> all = new ArrayList<>(merged.values());
        all.sort(Comparator.comparing(CharacteristicMetadata::uuid));
        return all;
    }

    // ---------------------------------------------------------------------
    // Custom registrations
    // ---------------------------------------------------------------------

    /**
     * Registers a decoder with metadata derived from the decoder itself.
     */
    public void registerCustom(Characteristic<?> characteristic, boolean override) {
        Objects.requireNonNull(characteristic, "characteristic");
        registerCustom(characteristic, synthesize(characteristic), override);
    }

    /**
     * Registers a decoder and its metadata in the custom namespace.
     *
     * @throws RegistrationCollisionException if the uuid is already known
     *                                        (specification or custom) and
     *                                        {@code override} is false
     */
    public void registerCustom(Characteristic<?> characteristic, CharacteristicMetadata metadata, boolean override) {
        Objects.requireNonNull(characteristic, "characteristic");
        Objects.requireNonNull(metadata, "metadata");
        CharacteristicUuid uuid = characteristic.uuid();
        if (!uuid.equals(metadata.uuid())) {
            throw new IllegalArgumentException(
                    "metadata uuid " + metadata.uuid() + " does not match decoder uuid " + uuid);
        }
        ensureLoaded();

        synchronized (lock) {
            if (!override) {
                Optional<String> existing = existingName(uuid);
                if (existing.isPresent()) {
                    throw new RegistrationCollisionException(uuid.toString(), existing.get());
                }
            }
            customAliases.values().removeIf(uuid::equals);
            customMetadata.put(uuid, metadata);
            customDecoders.put(uuid, characteristic);
            for (String alias : AliasGenerator.aliasesFor(metadata)) {
                customAliases.put(alias, uuid);
            }
        }
        log.info("Registered custom characteristic {} '{}'{}", uuid, metadata.name(), override ? " (override)" : "");
    }

    private Optional<String> existingName(CharacteristicUuid uuid) {
        CharacteristicMetadata custom = customMetadata.get(uuid);
        if (custom != null) {
            return Optional.of(custom.name());
        }
        CharacteristicMetadata spec = specMetadata.get(uuid);
        if (spec != null) {
            return Optional.of(spec.name());
        }
        Characteristic<?> decoder = specDecoders.get(uuid);
        return decoder == null ? Optional.empty() : Optional.of(decoder.name());
    }

    /**
     * Drops every custom registration, restoring the specification view.
     */
    public void clearCustomRegistrations() {
        synchronized (lock) {
            customAliases.clear();
            customMetadata.clear();
            customDecoders.clear();
        }
    }
}
