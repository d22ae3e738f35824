package com.navgraph.core.exception;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Thrown when an entry point names a route that is not part of the graph.
 *
 * <p>A typo in an entry point must not silently shrink the reachable set.
 */
public class UnknownEntryPointException extends NavigationConfigurationException {

    private final Set<String> unknownPaths;

    public UnknownEntryPointException(Set<String> unknownPaths) {
        super("Unknown entry point(s): " + new TreeSet<>(unknownPaths));
        this.unknownPaths = Collections.unmodifiableSet(new TreeSet<>(unknownPaths));
    }

    public Set<String> getUnknownPaths() {
        return unknownPaths;
    }
}
