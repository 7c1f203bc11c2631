package com.questrail.gatt.batch;

import com.questrail.gatt.api.CharacteristicContext;
import com.questrail.gatt.api.CharacteristicUuid;
import com.questrail.gatt.api.DecodedResult;
import com.questrail.gatt.characteristic.Characteristic;
import com.questrail.gatt.characteristic.ParsePipeline;
import com.questrail.gatt.error.DependencyCycleException;
import com.questrail.gatt.error.ErrorKind;
import com.questrail.gatt.error.ParseTrace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * BatchDecoder
 * -----------------------------------------------------------------------------
 * Decodes several characteristics together, honoring their declared
 * dependencies.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Resolve a decoder for every entry. Entries without one fail with
 *       {@code UUID_RESOLUTION}; the rest of the batch continues.</li>
 *   <li>Order the resolved entries by dependency
 *       ({@link DependencyGraph}). A cycle fails the entire batch with
 *       {@link DependencyCycleException} before anything is decoded.</li>
 *   <li>Decode in that order. Each entry sees the caller's context plus every
 *       result produced so far in this batch.</li>
 * </ol>
 *
 * <h2>Failure isolation</h2>
 * <p>
 * A required dependency that is absent, or present but failed, fails only
 * its dependent with {@code MISSING_DEPENDENCY}. Unavailable optional
 * dependencies are logged at debug level and do not fail anything.
 * </p>
 *
 * <p>
 * The returned map iterates in the caller's input order.
 * </p>
 */
public final class BatchDecoder
{
    private static final Logger log = LoggerFactory.getLogger(BatchDecoder.class);

    private final Function<CharacteristicUuid, Optional<Characteristic<?>>> decoders;
    private final boolean traceEnabled;

    /**
     * @param decoders     decoder lookup, usually the registry's
     * @param traceEnabled collect a parse trace for every entry
     */
    public BatchDecoder(Function<CharacteristicUuid, Optional<Characteristic<?>>> decoders, boolean traceEnabled) {
        this.decoders = Objects.requireNonNull(decoders, "decoders");
        this.traceEnabled = traceEnabled;
    }

    /**
     * @throws DependencyCycleException if declared dependencies among the
     *                                  batch members form a cycle
     */
    public Map<CharacteristicUuid, DecodedResult<?>> decode(Map<CharacteristicUuid, byte[]> batch,
                                                            CharacteristicContext context) {
        Objects.requireNonNull(batch, "batch");
        Objects.requireNonNull(context, "context");

        Map<CharacteristicUuid, DecodedResult<?>> results = new LinkedHashMap<>();
        Map<CharacteristicUuid, Characteristic<?>> members = new LinkedHashMap<>();
        for (Map.Entry<CharacteristicUuid, byte[]> entry : batch.entrySet()) {
            CharacteristicUuid uuid = Objects.requireNonNull(entry.getKey(), "batch key");
            Objects.requireNonNull(entry.getValue(), "batch value for " + uuid);
            Optional<Characteristic<?>> decoder = decoders.apply(uuid);
            if (decoder.isPresent()) {
                members.put(uuid, decoder.get());
            } else {
                results.put(uuid, DecodedResult.failure(uuid, "Unknown", entry.getValue(),
                        ErrorKind.UUID_RESOLUTION, "no decoder registered for " + uuid));
            }
        }

        List<CharacteristicUuid> order = new DependencyGraph(members).order();
        log.debug("Batch decode order: {}", order);

        CharacteristicContext current = context;
        for (CharacteristicUuid uuid : order) {
            Characteristic<?> characteristic = members.get(uuid);
            for (CharacteristicUuid optional : characteristic.dependencies().optional()) {
                if (!current.isAvailable(optional)) {
                    log.debug("Optional dependency {} of {} unavailable; decoding without it",
                            optional, characteristic.name());
                }
            }
            DecodedResult<?> result = ParsePipeline.parse(characteristic, batch.get(uuid), current,
                    ParseTrace.of(traceEnabled));
            results.put(uuid, result);
            current = current.with(result);
        }

        Map<CharacteristicUuid, DecodedResult<?>> ordered = new LinkedHashMap<>();
        for (CharacteristicUuid uuid : batch.keySet()) {
            ordered.put(uuid, results.get(uuid));
        }
        return Collections.unmodifiableMap(ordered);
    }
}
