package com.questrail.gatt.registry;

import com.questrail.gatt.api.CharacteristicUuid;
import com.questrail.gatt.api.GattProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * YamlSpecificationSource
 * -----------------------------------------------------------------------------
 * Reads characteristic definitions from a YAML document.
 *
 * <h2>Format</h2>
 * <pre>
 * uuids:
 *   - uuid: '2A19'
 *     name: Battery Level
 *     id: org.bluetooth.characteristic.battery_level
 *     unit: org.bluetooth.unit.percentage      # optional
 *     type: uint8                              # optional
 *     properties: [read, notify]               # optional
 *     multiplier: 1                            # optional, M
 *     decimal_exponent: 0                      # optional, d
 *     offset: 0                                # optional, b
 * </pre>
 *
 * <p>
 * A malformed document fails the whole load. A malformed entry inside a
 * well-formed document is logged and skipped.
 * </p>
 */
public final class YamlSpecificationSource implements SpecificationSource
{
    private static final Logger log = LoggerFactory.getLogger(YamlSpecificationSource.class);

    /** Classpath location of the dataset bundled with the library. */
    public static final String BUNDLED_RESOURCE = "bluetooth-sig/characteristic_uuids.yaml";

    private final String description;
    private final StreamOpener opener;

    @FunctionalInterface
    private interface StreamOpener
    {
        InputStream open() throws IOException;
    }

    private YamlSpecificationSource(String description, StreamOpener opener) {
        this.description = description;
        this.opener = opener;
    }

    public static YamlSpecificationSource bundled() {
        return classpath(BUNDLED_RESOURCE);
    }

    public static YamlSpecificationSource classpath(String resource) {
        Objects.requireNonNull(resource, "resource");
        return new YamlSpecificationSource("classpath:" + resource, () -> {
            InputStream in = YamlSpecificationSource.class.getClassLoader().getResourceAsStream(resource);
            if (in == null) {
                throw new IOException("classpath resource not found: " + resource);
            }
            return in;
        });
    }

    public static YamlSpecificationSource file(Path path) {
        Objects.requireNonNull(path, "path");
        return new YamlSpecificationSource(path.toString(), () -> Files.newInputStream(path));
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public List<SpecificationEntry> load() throws IOException {
        Object document;
        try (Reader reader = new InputStreamReader(opener.open(), StandardCharsets.UTF_8)) {
            document = new Yaml().load(reader);
        } catch (YAMLException ex) {
            throw new IllegalArgumentException("Failed to parse YAML specification at " + description, ex);
        }

        if (!(document instanceof Map<?, ?> root)) {
            throw new IllegalArgumentException(description + ": document root must be a mapping");
        }
        Object uuids = root.get("uuids");
        if (!(uuids instanceof List<?> items)) {
            throw new IllegalArgumentException(description + ": 'uuids' must be a list");
        }

        List<SpecificationEntry> entries = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            Object item = items.get(i);
            if (!(item instanceof Map<?, ?> fields)) {
                log.warn("Skipping specification entry #{} in {}: not a mapping", i, description);
                continue;
            }
            try {
                entries.add(toEntry(fields));
            } catch (IllegalArgumentException ex) {
                log.warn("Skipping specification entry #{} in {}: {}", i, description, ex.getMessage());
            }
        }
        log.debug("Read {} specification entries from {}", entries.size(), description);
        return entries;
    }

    private static SpecificationEntry toEntry(Map<?, ?> fields) {
        CharacteristicUuid uuid = toUuid(fields.get("uuid"));
        String name = requireText(fields, "name");
        return new SpecificationEntry(
                uuid,
                name,
                text(fields, "id"),
                text(fields, "unit"),
                text(fields, "type"),
                toProperties(fields.get("properties")),
                toInteger(fields, "multiplier"),
                toInteger(fields, "decimal_exponent"),
                toLong(fields, "offset"));
    }

    private static CharacteristicUuid toUuid(Object value) {
        if (value instanceof Number number) {
            return CharacteristicUuid.ofShort(exactInt(number, "uuid"));
        }
        if (value instanceof String text) {
            return CharacteristicUuid.parse(text);
        }
        throw new IllegalArgumentException("missing or invalid 'uuid': " + value);
    }

    private static String requireText(Map<?, ?> fields, String key) {
        String value = text(fields, key);
        if (value.isBlank()) {
            throw new IllegalArgumentException("missing '" + key + "'");
        }
        return value;
    }

    private static String text(Map<?, ?> fields, String key) {
        Object value = fields.get(key);
        return value == null ? "" : value.toString().trim();
    }

    private static Integer toInteger(Map<?, ?> fields, String key) {
        Object value = fields.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return exactInt(number, key);
        }
        try {
            return Integer.valueOf(value.toString().trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("'" + key + "' must be an integer (was " + value + ")", ex);
        }
    }

    private static int exactInt(Number number, String key) {
        try {
            return new BigDecimal(number.toString()).intValueExact();
        } catch (ArithmeticException | NumberFormatException ex) {
            throw new IllegalArgumentException("'" + key + "' must be an integer (was " + number + ")", ex);
        }
    }

    private static Long toLong(Map<?, ?> fields, String key) {
        Integer value = toInteger(fields, key);
        return value == null ? null : value.longValue();
    }

    private static Set<GattProperty> toProperties(Object value) {
        if (value == null) {
            return Set.of();
        }
        if (!(value instanceof List<?> names)) {
            throw new IllegalArgumentException("'properties' must be a list (was " + value + ")");
        }
        Set<GattProperty> properties = EnumSet.noneOf(GattProperty.class);
        for (Object n : names) {
            String name = String.valueOf(n);
            properties.add(GattProperty.fromName(name).orElseThrow(
                    () -> new IllegalArgumentException("unknown property '" + name + "'")));
        }
        return properties;
    }
}
