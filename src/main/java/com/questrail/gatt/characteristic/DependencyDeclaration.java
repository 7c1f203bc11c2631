package com.questrail.gatt.characteristic;

import com.questrail.gatt.api.CharacteristicUuid;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Other characteristics whose decoded values a characteristic reads during
 * its own decode.
 *
 * <ul>
 *   <li>Required: decode fails with {@code MISSING_DEPENDENCY} unless each one
 *       is available.</li>
 *   <li>Optional: used when available; decode proceeds without them.</li>
 * </ul>
 */
public record DependencyDeclaration(List<CharacteristicUuid> required, List<CharacteristicUuid> optional)
{
    private static final DependencyDeclaration NONE = new DependencyDeclaration(List.of(), List.of());

    public DependencyDeclaration {
        required = List.copyOf(required);
        optional = List.copyOf(optional);
        for (CharacteristicUuid uuid : optional) {
            if (required.contains(uuid)) {
                throw new IllegalArgumentException(uuid + " declared both required and optional");
            }
        }
    }

    public static DependencyDeclaration none() {
        return NONE;
    }

    public static DependencyDeclaration requires(CharacteristicUuid... required) {
        return new DependencyDeclaration(List.of(required), List.of());
    }

    public static DependencyDeclaration optional(CharacteristicUuid... optional) {
        return new DependencyDeclaration(List.of(), List.of(optional));
    }

    public DependencyDeclaration andOptional(CharacteristicUuid... more) {
        List<CharacteristicUuid> merged = new ArrayList<>(optional);
        merged.addAll(List.of(more));
        return new DependencyDeclaration(required, merged);
    }

    public boolean isEmpty() {
        return required.isEmpty() && optional.isEmpty();
    }

    /**
     * @return required followed by optional dependencies, without duplicates
     */
    public Set<CharacteristicUuid> all() {
        Set<CharacteristicUuid> all = new LinkedHashSet<>(required);
        all.addAll(optional);
        return all;
    }

    public boolean isRequired(CharacteristicUuid uuid) {
        return required.contains(Objects.requireNonNull(uuid, "uuid"));
    }
}
