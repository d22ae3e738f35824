package com.navgraph.core.model;

/**
 * Kind of a navigational link. Informational only: every kind counts
 * equally for reachability.
 */
public enum LinkKind {
    /** Declarative link (anchor, menu entry, breadcrumb) */
    NAVIGATIONAL,

    /** Navigation triggered from code (router push, redirect) */
    PROGRAMMATIC
}
