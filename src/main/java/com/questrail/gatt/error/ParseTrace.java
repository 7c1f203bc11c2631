package com.questrail.gatt.error;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Ordered, human-readable record of the steps taken while parsing one
 * characteristic.
 *
 * <p>
 * A trace is collected only when explicitly requested. The shared
 * {@link #disabled()} instance ignores every step; callers that build step
 * text should use {@link #step(Supplier)} so no string is formatted when
 * tracing is off.
 * </p>
 *
 * <p>
 * Instances are confined to a single parse call and are not thread-safe.
 * </p>
 */
public final class ParseTrace
{
    private static final ParseTrace DISABLED = new ParseTrace(false);

    private final boolean enabled;
    private final List<String> steps;

    private ParseTrace(boolean enabled) {
        this.enabled = enabled;
        this.steps = enabled ? new ArrayList<>() : List.of();
    }

    public static ParseTrace disabled() {
        return DISABLED;
    }

    public static ParseTrace recording() {
        return new ParseTrace(true);
    }

    public static ParseTrace of(boolean enabled) {
        return enabled ? recording() : DISABLED;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void step(String step) {
        if (enabled) {
            steps.add(Objects.requireNonNull(step, "step"));
        }
    }

    public void step(Supplier<String> step) {
        if (enabled) {
            steps.add(Objects.requireNonNull(step.get(), "step"));
        }
    }

    /**
     * @return immutable snapshot of recorded steps; always empty when disabled
     */
    public List<String> steps() {
        return List.copyOf(steps);
    }
}
