package com.navgraph.core.renderer;

import java.util.Objects;

/**
 * A generated file to be rendered.
 *
 * @param relativePath path relative to the output directory (e.g., "navigation-analysis.json")
 * @param content file content
 * @param contentType MIME type of the content
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
