package com.navgraph.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Collection of generated files to be rendered.
 *
 * @param files list of generated files
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    /**
     * Wraps a single file.
     *
     * @param file the file
     * @return output containing only {@code file}
     */
    public static GeneratedOutput of(GeneratedFile file) {
        return new GeneratedOutput(List.of(file));
    }
}
