package com.navgraph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A named, ordered sequence of route paths describing an intended user flow.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Journey auth = new Journey("auth", List.of("/login", "/dashboard", "/settings"));
 * }</pre>
 *
 * @param name unique journey name
 * @param steps route paths in the order the user visits them, at least two
 */
public record Journey(
    String name,
    List<String> steps
) {
    /**
     * Compact constructor with validation.
     */
    public Journey {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(steps, "steps must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (steps.size() < 2) {
            throw new IllegalArgumentException(
                "journey '" + name + "' must have at least 2 steps, got " + steps.size());
        }
        steps = List.copyOf(steps);
    }

    /**
     * Number of consecutive step pairs that must be linked.
     *
     * @return {@code steps.size() - 1}
     */
    public int pairCount() {
        return steps.size() - 1;
    }
}
