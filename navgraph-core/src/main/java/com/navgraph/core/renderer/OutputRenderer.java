package com.navgraph.core.renderer;

/**
 * Writes a serialized analysis result to an output destination.
 *
 * <p>Renderers only move bytes: they never reformat the analysis into prose. They are
 * discovered via Java Service Provider Interface (SPI) and selected by {@link #getId()}.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.navgraph.core.renderer.OutputRenderer}
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Used for selecting the renderer from configuration and the command line.
     * Lowercase (e.g., "filesystem", "console").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the generated output to the target destination.
     *
     * @param output the files to render
     * @param context rendering context with output directory and settings
     * @throws IllegalStateException if the output cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
