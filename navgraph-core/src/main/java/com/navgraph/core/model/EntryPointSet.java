package com.navgraph.core.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Route paths designated as traversal roots.
 *
 * <p>Must be non-empty: an empty entry set is a configuration error, never an implicit
 * "treat every node as a root".
 *
 * @param paths entry point paths, sorted and unmodifiable
 */
public record EntryPointSet(
    Set<String> paths
) {
    /**
     * Conventional root path used when no entry points are declared.
     */
    public static final String DEFAULT_ROOT = "/";

    /**
     * Compact constructor with validation.
     */
    public EntryPointSet {
        Objects.requireNonNull(paths, "paths must not be null");
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("entry point set must not be empty");
        }
        paths = Collections.unmodifiableSet(new TreeSet<>(paths));
    }

    /**
     * Creates an entry point set from the given paths.
     *
     * @param paths entry point paths
     * @return a new entry point set
     */
    public static EntryPointSet of(String... paths) {
        return new EntryPointSet(Set.copyOf(Arrays.asList(paths)));
    }

    /**
     * Creates an entry point set from a collection of paths.
     *
     * @param paths entry point paths
     * @return a new entry point set
     */
    public static EntryPointSet of(Collection<String> paths) {
        Objects.requireNonNull(paths, "paths must not be null");
        return new EntryPointSet(new TreeSet<>(paths));
    }

    /**
     * The framework convention default: {@code "/"} as the sole entry point.
     *
     * @return default entry point set
     */
    public static EntryPointSet conventionDefault() {
        return of(DEFAULT_ROOT);
    }

    public boolean contains(String path) {
        return paths.contains(path);
    }
}
