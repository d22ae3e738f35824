package com.navgraph.core.model;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Classification of every graph node by reachability from the entry points.
 *
 * <p>The three sets are pairwise disjoint. {@code reachable} holds reached nodes that
 * have outbound links or are allowed terminals; reached nodes without either are
 * {@code deadEnds}.
 *
 * @param reachable reached nodes that are not dead ends
 * @param orphans nodes not reached from any entry point
 * @param deadEnds reached nodes with no outbound links that are not allowed terminals
 */
public record ReachabilityResult(
    Set<String> reachable,
    Set<String> orphans,
    Set<String> deadEnds
) {
    /**
     * Compact constructor with validation.
     */
    public ReachabilityResult {
        Objects.requireNonNull(reachable, "reachable must not be null");
        Objects.requireNonNull(orphans, "orphans must not be null");
        Objects.requireNonNull(deadEnds, "deadEnds must not be null");
        reachable = Collections.unmodifiableSet(new TreeSet<>(reachable));
        orphans = Collections.unmodifiableSet(new TreeSet<>(orphans));
        deadEnds = Collections.unmodifiableSet(new TreeSet<>(deadEnds));
    }

    /**
     * Every node reached by the traversal, dead ends included.
     *
     * @return union of {@code reachable} and {@code deadEnds}
     */
    public Set<String> reached() {
        Set<String> reached = new TreeSet<>(reachable);
        reached.addAll(deadEnds);
        return Collections.unmodifiableSet(reached);
    }

    public int totalNodes() {
        return reachable.size() + orphans.size() + deadEnds.size();
    }
}
