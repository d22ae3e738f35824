package com.navgraph.core.util;

import java.util.regex.Pattern;

/**
 * Helpers for route path templates.
 */
public final class RoutePaths {

    /**
     * Matches a parameter segment in the common router notations:
     * {@code :id}, {@code [id]}, {@code [...slug]}, {@code {id}} and {@code <int:id>}.
     */
    private static final Pattern PARAMETER_SEGMENT = Pattern.compile(
        "(^|/)(:[A-Za-z_][\\w-]*|\\[{1,2}(\\.\\.\\.)?[\\w-]+]{1,2}|\\{[\\w-]+}|<(\\w+:)?[\\w-]+>)(?=/|$)"
    );

    private RoutePaths() {
        // Utility class
    }

    /**
     * Returns true if the path contains at least one parameter segment.
     *
     * @param path route path
     * @return true for path templates such as {@code /products/:id}
     */
    public static boolean isDynamic(String path) {
        return path != null && PARAMETER_SEGMENT.matcher(path).find();
    }

    /**
     * Normalizes a declared route path: trims whitespace, ensures a leading slash and
     * removes a trailing slash (except for the root).
     *
     * @param path declared path
     * @return normalized path
     */
    public static String normalize(String path) {
        if (path == null) {
            return null;
        }
        String trimmed = path.trim();
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        if (!trimmed.startsWith("/")) {
            trimmed = "/" + trimmed;
        }
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
