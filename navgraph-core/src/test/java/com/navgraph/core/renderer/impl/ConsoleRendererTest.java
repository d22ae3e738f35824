package com.navgraph.core.renderer.impl;

import com.navgraph.core.renderer.GeneratedFile;
import com.navgraph.core.renderer.GeneratedOutput;
import com.navgraph.core.renderer.RenderContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private ConsoleRenderer renderer;

    @BeforeEach
    void setUp() {
        originalOut = System.out;
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
        renderer = new ConsoleRenderer();
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_defaultSettings_printsBareContent() {
        GeneratedFile file = new GeneratedFile("navigation-analysis.json", "{\"healthScore\":10.0}", "application/json");

        renderer.render(GeneratedOutput.of(file), new RenderContext(".", Map.of()));

        assertThat(captured.toString(StandardCharsets.UTF_8).trim()).isEqualTo("{\"healthScore\":10.0}");
    }

    @Test
    void render_withHeaders_printsFileNameBeforeContent() {
        GeneratedFile file = new GeneratedFile("navigation-analysis.json", "{}", "application/json");

        renderer.render(GeneratedOutput.of(file),
            new RenderContext(".", Map.of("console.showHeaders", "true", "console.colors", "true")));

        String printed = captured.toString(StandardCharsets.UTF_8);
        assertThat(printed).contains("# navigation-analysis.json").contains("\u001B[36m");
        assertThat(printed.indexOf("navigation-analysis.json")).isLessThan(printed.indexOf("{}"));
    }
}
