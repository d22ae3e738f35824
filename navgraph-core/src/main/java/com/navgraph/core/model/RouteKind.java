package com.navgraph.core.model;

/**
 * Kind of a declared route.
 *
 * <p>Dynamic routes carry parameter slots (e.g. {@code /products/:id}) but are treated
 * as ordinary nodes for graph purposes.
 */
public enum RouteKind {
    /** Fixed path without parameter placeholders */
    STATIC,

    /** Path template with one or more parameter slots */
    DYNAMIC
}
