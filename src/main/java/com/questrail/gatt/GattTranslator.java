package com.questrail.gatt;

import com.questrail.gatt.api.CharacteristicContext;
import com.questrail.gatt.api.CharacteristicMetadata;
import com.questrail.gatt.api.CharacteristicUuid;
import com.questrail.gatt.api.DecodedResult;
import com.questrail.gatt.batch.BatchDecoder;
import com.questrail.gatt.characteristic.Characteristic;
import com.questrail.gatt.characteristic.ParsePipeline;
import com.questrail.gatt.config.GattTranslatorConfig;
import com.questrail.gatt.error.DependencyCycleException;
import com.questrail.gatt.error.ErrorKind;
import com.questrail.gatt.error.GattException;
import com.questrail.gatt.error.ParseTrace;
import com.questrail.gatt.error.RegistrationCollisionException;
import com.questrail.gatt.error.UnresolvedIdentifierException;
import com.questrail.gatt.observability.DecodeFailureEvent;
import com.questrail.gatt.observability.GattObservabilitySink;
import com.questrail.gatt.observability.Slf4jGattObservabilitySink;
import com.questrail.gatt.registry.CharacteristicRegistry;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * GattTranslator
 * -----------------------------------------------------------------------------
 * Entry point of the codec: raw characteristic bytes in, typed values out,
 * and back.
 *
 * <h2>Operations</h2>
 * <ul>
 *   <li>{@link #parse(String, byte[], CharacteristicContext)}: one
 *       characteristic; never throws for bad input.</li>
 *   <li>{@link #parseBatch(Map, CharacteristicContext)}: several
 *       characteristics in dependency order.</li>
 *   <li>{@link #build(String, Object)}: validate and encode a value.</li>
 *   <li>{@link #resolveMetadata(String)}: identifier or alias lookup.</li>
 *   <li>{@link #registerCustom}: add or override a decoder.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * <p>
 * Every operation is synchronous and safe to call from any thread. The only
 * shared state is the {@link CharacteristicRegistry}; it loads on first use.
 * I/O is the caller's concern: this class never reads from or writes to a
 * device, and it decodes exactly the context it is given.
 * </p>
 */
public final class GattTranslator
{
    private final CharacteristicRegistry registry;
    private final GattObservabilitySink sink;
    private final boolean parseTrace;
    private final BatchDecoder batchDecoder;

    public GattTranslator(GattTranslatorConfig config) {
        Objects.requireNonNull(config, "config");
        this.sink = config.observabilitySink();
        this.parseTrace = config.parseTrace();
        this.registry = new CharacteristicRegistry(config.specificationSource(), config.catalog(), sink);
        this.batchDecoder = new BatchDecoder(registry::resolveDecoder, parseTrace);
    }

    /**
     * New translator over the bundled dataset and built-in decoders.
     */
    public static GattTranslator create() {
        return new GattTranslator(GattTranslatorConfig.defaults());
    }

    /**
     * Process-wide translator, created on first call, logging through SLF4J.
     */
    public static GattTranslator shared() {
        return Holder.INSTANCE;
    }

    private static final class Holder
    {
        static final GattTranslator INSTANCE = new GattTranslator(GattTranslatorConfig.builder()
                .withObservabilitySink(new Slf4jGattObservabilitySink())
                .build());
    }

    public CharacteristicRegistry registry() {
        return registry;
    }

    // ---------------------------------------------------------------------
    // Decode
    // ---------------------------------------------------------------------

    public DecodedResult<?> parse(String identifier, byte[] raw) {
        return parse(identifier, raw, CharacteristicContext.empty());
    }

    /**
     * Decodes one characteristic.
     *
     * @param identifier uuid in any spelling, or a registered alias
     * @return a successful result, or a failed one carrying the error kind;
     *         an unknown identifier yields {@link ErrorKind#UUID_RESOLUTION}
     */
    public DecodedResult<?> parse(String identifier, byte[] raw, CharacteristicContext context) {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(raw, "raw");
        Optional<CharacteristicUuid> uuid = registry.resolveUuid(identifier);
        if (uuid.isEmpty()) {
            DecodedResult<?> result = DecodedResult.unresolved(identifier, raw);
            sink.onDecodeFailure(new DecodeFailureEvent(Instant.now(), null, identifier,
                    ErrorKind.UUID_RESOLUTION, result.message()));
            return result;
        }
        return parse(uuid.get(), raw, context);
    }

    public DecodedResult<?> parse(CharacteristicUuid uuid, byte[] raw, CharacteristicContext context) {
        Objects.requireNonNull(uuid, "uuid");
        Objects.requireNonNull(raw, "raw");
        Optional<Characteristic<?>> decoder = registry.resolveDecoder(uuid);
        if (decoder.isEmpty()) {
            String name = registry.resolve(uuid).map(CharacteristicMetadata::name).orElse("Unknown");
            return report(DecodedResult.failure(uuid, name, raw, ErrorKind.UUID_RESOLUTION,
                    "no decoder registered for " + uuid));
        }
        return parse(decoder.get(), raw, context);
    }

    /**
     * Decodes with an explicit decoder, bypassing registry resolution.
     */
    public <T> DecodedResult<T> parse(Characteristic<T> characteristic, byte[] raw, CharacteristicContext context) {
        return report(ParsePipeline.parse(characteristic, raw, context, ParseTrace.of(parseTrace)));
    }

    public Map<CharacteristicUuid, DecodedResult<?>> parseBatch(Map<CharacteristicUuid, byte[]> batch) {
        return parseBatch(batch, CharacteristicContext.empty());
    }

    /**
     * Decodes several characteristics, resolving declared dependencies against
     * other batch entries and the supplied context.
     *
     * @throws DependencyCycleException if dependencies among the batch members
     *                                  form a cycle; nothing is decoded
     */
    public Map<CharacteristicUuid, DecodedResult<?>> parseBatch(Map<CharacteristicUuid, byte[]> batch,
                                                                CharacteristicContext context) {
        Map<CharacteristicUuid, DecodedResult<?>> results = batchDecoder.decode(batch, context);
        for (DecodedResult<?> result : results.values()) {
            report(result);
        }
        return results;
    }

    private <T> DecodedResult<T> report(DecodedResult<T> result) {
        if (!result.isSuccess()) {
            sink.onDecodeFailure(new DecodeFailureEvent(Instant.now(), result.uuid().orElse(null),
                    result.name(), result.errorKind().orElse(ErrorKind.DECODE_FAILURE), result.message()));
        }
        return result;
    }

    // ---------------------------------------------------------------------
    // Encode
    // ---------------------------------------------------------------------

    /**
     * Validates and encodes a value.
     *
     * @throws UnresolvedIdentifierException if no decoder is registered
     * @throws GattException                 if the value has the wrong type,
     *                                       violates declared bounds, or cannot
     *                                       be encoded
     */
    public byte[] build(String identifier, Object value) {
        Objects.requireNonNull(identifier, "identifier");
        Characteristic<?> characteristic = registry.resolveDecoder(identifier)
                .orElseThrow(() -> new UnresolvedIdentifierException(identifier));
        return ParsePipeline.build(characteristic, value);
    }

    public byte[] build(CharacteristicUuid uuid, Object value) {
        Objects.requireNonNull(uuid, "uuid");
        Characteristic<?> characteristic = registry.resolveDecoder(uuid)
                .orElseThrow(() -> new UnresolvedIdentifierException(uuid.toString()));
        return ParsePipeline.build(characteristic, value);
    }

    // ---------------------------------------------------------------------
    // Registry
    // ---------------------------------------------------------------------

    public Optional<CharacteristicMetadata> resolveMetadata(String identifierOrAlias) {
        return registry.resolve(identifierOrAlias);
    }

    /**
     * @throws RegistrationCollisionException if the uuid is already known and
     *                                        {@code override} is false
     */
    public void registerCustom(Characteristic<?> characteristic, CharacteristicMetadata metadata, boolean override) {
        registry.registerCustom(characteristic, metadata, override);
    }

    public void registerCustom(Characteristic<?> characteristic, boolean override) {
        registry.registerCustom(characteristic, override);
    }
}
