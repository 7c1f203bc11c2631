package com.questrail.gatt.registry;

import com.questrail.gatt.api.CharacteristicMetadata;
import com.questrail.gatt.api.CharacteristicUuid;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Derives the lookup spellings of a characteristic.
 *
 * <p>
 * Runs once per entry while the registry loads (or when a custom entry is
 * registered). Runtime lookups only normalize the query with
 * {@link #normalize(String)} and hit the alias map; names are never
 * re-derived per call.
 * </p>
 *
 * <p>
 * For Battery Level (0x2A19) the aliases are {@code 2a19}, {@code 0x2a19},
 * the 32-digit and dashed long forms, {@code battery level},
 * {@code battery_level}, {@code batterylevel} and
 * {@code org.bluetooth.characteristic.battery_level}.
 * </p>
 */
final class AliasGenerator
{
    private AliasGenerator() {}

    static String normalize(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }

    static Set<String> aliasesFor(CharacteristicMetadata metadata) {
        Set<String> aliases = new LinkedHashSet<>();
        CharacteristicUuid uuid = metadata.uuid();

        String shortForm = normalize(uuid.shortForm());
        aliases.add(shortForm);
        aliases.add("0x" + shortForm);
        aliases.add(normalize(uuid.canonicalForm()));
        aliases.add(normalize(uuid.dashedForm()));

        String name = normalize(metadata.name());
        if (!name.isEmpty()) {
            aliases.add(name);
            aliases.add(snakeCase(name));
            aliases.add(name.replaceAll("[^a-z0-9]", ""));
        }

        String identifier = normalize(metadata.identifier());
        if (!identifier.isEmpty()) {
            aliases.add(identifier);
            int lastDot = identifier.lastIndexOf('.');
            if (lastDot >= 0 && lastDot < identifier.length() - 1) {
                aliases.add(identifier.substring(lastDot + 1));
            }
        }
        aliases.remove("");
        return aliases;
    }

    static String snakeCase(String text) {
        return normalize(text)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
    }
}
