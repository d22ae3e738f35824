package com.navgraph.core.model;

import java.util.Objects;

/**
 * A declared page or endpoint in the navigation graph.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * RouteNode home = RouteNode.of("/");
 * RouteNode product = new RouteNode("/products/:id", "app/products/[id]/page.tsx", RouteKind.DYNAMIC);
 * }</pre>
 *
 * @param path unique route identifier, possibly a template with parameter placeholders
 * @param sourceRef opaque reference to where the route is defined (file, line or registry key), may be null
 * @param kind route kind, defaults to {@link RouteKind#STATIC}
 */
public record RouteNode(
    String path,
    String sourceRef,
    RouteKind kind
) {
    /**
     * Compact constructor with validation.
     */
    public RouteNode {
        Objects.requireNonNull(path, "path must not be null");
        if (path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        if (kind == null) {
            kind = RouteKind.STATIC;
        }
    }

    /**
     * Creates a static route without a source reference.
     *
     * @param path route path
     * @return a new static route node
     */
    public static RouteNode of(String path) {
        return new RouteNode(path, null, RouteKind.STATIC);
    }

    /**
     * Creates a dynamic route.
     *
     * @param path route path template
     * @param sourceRef where the route is defined
     * @return a new dynamic route node
     */
    public static RouteNode dynamic(String path, String sourceRef) {
        return new RouteNode(path, sourceRef, RouteKind.DYNAMIC);
    }

    /**
     * Returns true if this route carries parameter slots.
     *
     * @return true for dynamic routes
     */
    public boolean isDynamic() {
        return kind == RouteKind.DYNAMIC;
    }
}
