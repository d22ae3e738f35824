package com.navgraph.core.renderer.impl;

import com.navgraph.core.renderer.GeneratedFile;
import com.navgraph.core.renderer.GeneratedOutput;
import com.navgraph.core.renderer.OutputRenderer;
import com.navgraph.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Renderer that prints generated files to standard output.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors in headers ("true"/"false", default: "false")</li>
 *   <li>{@code console.showHeaders} - Print a header line per file ("true"/"false", default: "false")</li>
 * </ul>
 *
 * <p>With the defaults the output is the bare file content, suitable for piping into
 * {@code jq} or a CI gate.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD_CYAN = "\u001B[1m\u001B[36m";

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "false"));
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault("console.showHeaders", "false"));

        logger.debug("Printing {} file(s) to console (colors: {}, headers: {})",
            output.files().size(), useColors, showHeaders);

        PrintStream out = System.out;
        for (GeneratedFile file : output.files()) {
            if (showHeaders) {
                String prefix = useColors ? ANSI_BOLD_CYAN : "";
                String suffix = useColors ? ANSI_RESET : "";
                out.println(prefix + "# " + file.relativePath() + suffix);
            }
            out.println(file.content());
        }
        out.flush();
    }
}
