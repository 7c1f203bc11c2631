package com.questrail.gatt.api;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable identity of a GATT characteristic.
 *
 * <h2>Representations</h2>
 * <p>
 * The protocol addresses characteristics either by a 16-bit (or 32-bit)
 * short form assigned by the Bluetooth SIG, or by a full 128-bit value.
 * Short forms are shorthand for a full value built on the SIG base UUID
 * {@code 0000xxxx-0000-1000-8000-00805F9B34FB}.
 * </p>
 *
 * <p>
 * This type always stores the canonical 128-bit form (32 uppercase hex
 * digits, no separators), so equality does not depend on how the value was
 * spelled. Accepted input spellings:
 * </p>
 * <ul>
 *   <li>{@code 2A19}, {@code 0x2A19}, {@code 2a19}</li>
 *   <li>{@code 00002A19} (32-bit short form)</li>
 *   <li>{@code 00002A1900001000800000805F9B34FB}</li>
 *   <li>{@code 00002a19-0000-1000-8000-00805f9b34fb}</li>
 * </ul>
 */
public final class CharacteristicUuid implements Comparable<CharacteristicUuid>
{
    /**
     * Tail shared by every SIG-assigned 128-bit identifier.
     */
    public static final String SIG_BASE_SUFFIX = "00001000800000805F9B34FB";

    private final String canonical;

    private CharacteristicUuid(String canonical) {
        this.canonical = canonical;
    }

    /**
     * Parses any accepted spelling.
     *
     * @throws IllegalArgumentException if the text is not a valid identifier
     */
    public static CharacteristicUuid parse(String text) {
        Objects.requireNonNull(text, "text");
        String canonical = normalize(text);
        if (canonical == null) {
            throw new IllegalArgumentException("invalid characteristic UUID '" + text + "'");
        }
        return new CharacteristicUuid(canonical);
    }

    /**
     * Parses any accepted spelling, returning empty instead of failing.
     */
    public static Optional<CharacteristicUuid> tryParse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String canonical = normalize(text);
        return canonical == null ? Optional.empty() : Optional.of(new CharacteristicUuid(canonical));
    }

    /**
     * Builds the identifier for a SIG-assigned 16-bit short form.
     */
    public static CharacteristicUuid ofShort(int shortForm) {
        if (shortForm < 0 || shortForm > 0xFFFF) {
            throw new IllegalArgumentException(
                    "16-bit UUID must be in range 0x0000-0xFFFF (was " + shortForm + ")");
        }
        return new CharacteristicUuid(String.format("0000%04X", shortForm) + SIG_BASE_SUFFIX);
    }

    private static String normalize(String text) {
        String s = text.trim();
        if (s.startsWith("0x") || s.startsWith("0X")) {
            s = s.substring(2);
        }
        s = s.replace("-", "").toUpperCase(Locale.ROOT);
        if (!isHex(s)) {
            return null;
        }
        return switch (s.length()) {
            case 4 -> "0000" + s + SIG_BASE_SUFFIX;
            case 8 -> s + SIG_BASE_SUFFIX;
            case 32 -> s;
            default -> null;
        };
    }

    private static boolean isHex(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            boolean hex = (c >= '0' && c <= '9') || (c >= 'A' && c <= 'F');
            if (!hex) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return {@code true} if this identifier lives on the SIG base UUID
     */
    public boolean isSigAssigned() {
        return canonical.startsWith("0000") && canonical.endsWith(SIG_BASE_SUFFIX);
    }

    /**
     * @return four hex digits for SIG-assigned identifiers, otherwise the full form
     */
    public String shortForm() {
        return isSigAssigned() ? canonical.substring(4, 8) : canonical;
    }

    /**
     * @return 32 uppercase hex digits without separators
     */
    public String canonicalForm() {
        return canonical;
    }

    /**
     * @return the conventional 8-4-4-4-12 dashed form, uppercase
     */
    public String dashedForm() {
        return canonical.substring(0, 8) + "-"
                + canonical.substring(8, 12) + "-"
                + canonical.substring(12, 16) + "-"
                + canonical.substring(16, 20) + "-"
                + canonical.substring(20);
    }

    @Override
    public int compareTo(CharacteristicUuid other) {
        return canonical.compareTo(other.canonical);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CharacteristicUuid that)) return false;
        return canonical.equals(that.canonical);
    }

    @Override
    public int hashCode() {
        return canonical.hashCode();
    }

    @Override
    public String toString() {
        return isSigAssigned() ? "0x" + shortForm() : dashedForm();
    }
}
