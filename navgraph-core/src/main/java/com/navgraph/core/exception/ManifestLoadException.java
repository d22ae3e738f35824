package com.navgraph.core.exception;

import java.nio.file.Path;

/**
 * Thrown when a navigation manifest or journey registry cannot be read,
 * parsed or validated.
 */
public class ManifestLoadException extends NavigationConfigurationException {

    private final Path source;

    public ManifestLoadException(Path source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public ManifestLoadException(Path source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}
