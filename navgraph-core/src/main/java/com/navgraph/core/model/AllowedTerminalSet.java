package com.navgraph.core.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Route paths allowed to have no outbound links without being reported as dead ends
 * (logout, error and not-found pages).
 *
 * @param paths terminal paths, sorted and unmodifiable; may be empty
 */
public record AllowedTerminalSet(
    Set<String> paths
) {
    /**
     * Terminal pages assumed when none are declared.
     */
    public static final Set<String> CONVENTION_TERMINALS = Set.of("/logout", "/error", "/404", "/500");

    /**
     * Compact constructor with validation.
     */
    public AllowedTerminalSet {
        if (paths == null) {
            paths = Set.of();
        }
        paths = Collections.unmodifiableSet(new TreeSet<>(paths));
    }

    /**
     * Creates a terminal set from the given paths.
     *
     * @param paths terminal paths
     * @return a new terminal set
     */
    public static AllowedTerminalSet of(String... paths) {
        return new AllowedTerminalSet(Set.copyOf(Arrays.asList(paths)));
    }

    /**
     * Creates a terminal set from a collection of paths.
     *
     * @param paths terminal paths
     * @return a new terminal set
     */
    public static AllowedTerminalSet of(Collection<String> paths) {
        return new AllowedTerminalSet(paths == null ? Set.of() : new TreeSet<>(paths));
    }

    /**
     * A terminal set that permits no dead ends.
     *
     * @return empty terminal set
     */
    public static AllowedTerminalSet none() {
        return new AllowedTerminalSet(Set.of());
    }

    /**
     * The framework convention default: logout, error and not-found pages.
     *
     * @return default terminal set
     */
    public static AllowedTerminalSet conventionDefault() {
        return new AllowedTerminalSet(CONVENTION_TERMINALS);
    }

    public boolean contains(String path) {
        return paths.contains(path);
    }
}
