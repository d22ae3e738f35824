package com.navgraph.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ValidateCommand}.
 */
@DisplayName("validate command")
class ValidateCommandTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void captureStreams() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    @DisplayName("Should accept a consistent manifest even when it has orphans")
    void consistentManifest_exitsOk() throws IOException {
        Path manifest = write("""
            {
              "routes": [{"path": "/"}, {"path": "/about"}, {"path": "/legacy"}],
              "links": [{"from": "/", "to": "/about"}]
            }
            """, "navigation.json");

        int exitCode = execute(manifest);

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(stdout.toString(StandardCharsets.UTF_8)).contains("3 routes, 1 links");
    }

    @Test
    @DisplayName("Should reject duplicate routes")
    void duplicateRoute_exitsWithError() throws IOException {
        Path manifest = write("""
            routes:
              - path: /about
              - path: /about/
            """, "navigation.yaml");

        int exitCode = execute(manifest);

        assertThat(exitCode).isEqualTo(ExitCodes.ERROR);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("Validation failed").contains("/about");
    }

    @Test
    @DisplayName("Should reject entry points that are not routes")
    void unknownEntryPoint_exitsWithError() throws IOException {
        Path manifest = write("""
            routes:
              - path: /home
            entryPoints: ["/start"]
            """, "navigation.yaml");

        int exitCode = execute(manifest);

        assertThat(exitCode).isEqualTo(ExitCodes.ERROR);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("/start");
    }

    @Test
    @DisplayName("Should reject an empty entry point list in the configuration")
    void emptyConfiguredEntryPoints_exitsWithError() throws IOException {
        Path manifest = write("""
            routes:
              - path: /
            """, "navigation.yaml");
        Path config = write("""
            analysis:
              entryPoints: []
            """, "navgraph.yaml");

        int exitCode = new CommandLine(new ValidateCommand()).execute(manifest.toString(), "-c", config.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.ERROR);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("analysis.entryPoints must not be empty");
    }

    private int execute(Path manifest) {
        return new CommandLine(new ValidateCommand())
            .execute(manifest.toString(), "-c", tempDir.resolve("absent-navgraph.yaml").toString());
    }

    private Path write(String content, String name) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
