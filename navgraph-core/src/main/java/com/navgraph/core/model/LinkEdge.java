package com.navgraph.core.model;

import java.util.Objects;

/**
 * A directed navigational link between two routes.
 *
 * @param from source route path
 * @param to target route path
 * @param kind link kind, defaults to {@link LinkKind#NAVIGATIONAL}
 */
public record LinkEdge(
    String from,
    String to,
    LinkKind kind
) {
    /**
     * Compact constructor with validation.
     */
    public LinkEdge {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        if (kind == null) {
            kind = LinkKind.NAVIGATIONAL;
        }
    }

    /**
     * Creates a navigational link.
     *
     * @param from source route path
     * @param to target route path
     * @return a new navigational link
     */
    public static LinkEdge of(String from, String to) {
        return new LinkEdge(from, to, LinkKind.NAVIGATIONAL);
    }

    /**
     * Creates a programmatic link.
     *
     * @param from source route path
     * @param to target route path
     * @return a new programmatic link
     */
    public static LinkEdge programmatic(String from, String to) {
        return new LinkEdge(from, to, LinkKind.PROGRAMMATIC);
    }

    @Override
    public String toString() {
        return from + " -> " + to + " (" + kind.name().toLowerCase() + ")";
    }
}
