package com.navgraph.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
 * Tests for {@link AnalyzeCommand}.
 */
@DisplayName("analyze command")
class AnalyzeCommandTest {

    private static final String LINKED_SITE = """
        routes:
          - path: /
          - path: /login
          - path: /dashboard
        links:
          - from: /
            to: /login
          - from: /login
            to: /dashboard
          - from: /dashboard
            to: /
        """;

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
    @DisplayName("Should exit 0 and write the JSON result for a fully linked site")
    void linkedSite_exitsOkAndWritesResult() throws IOException {
        Path manifest = write("navigation.yaml", LINKED_SITE);
        Path outputDir = tempDir.resolve("report");

        int exitCode = execute(manifest.toString(), "-o", outputDir.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        JsonNode json = new ObjectMapper().readTree(outputDir.resolve("navigation-analysis.json").toFile());
        assertThat(json.get("healthScore").asDouble()).isEqualTo(10.0);
        assertThat(json.get("summary").get("totalNodes").asInt()).isEqualTo(3);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("Navigation health score: 10");
    }

    @Test
    @DisplayName("Should exit 1 when a route is orphaned")
    void orphanRoute_exitsWithFindings() throws IOException {
        Path manifest = write("navigation.yaml", """
            routes:
              - path: /
              - path: /login
              - path: /legacy
            links:
              - from: /
                to: /login
              - from: /login
                to: /
              - from: /legacy
                to: /
            """);

        int exitCode = execute(manifest.toString(), "-o", tempDir.resolve("report").toString());

        assertThat(exitCode).isEqualTo(ExitCodes.FINDINGS);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("orphan: /legacy");
    }

    @Test
    @DisplayName("Should exit 1 when the score is below --min-score")
    void scoreBelowMinimum_exitsWithFindings() throws IOException {
        Path manifest = write("navigation.yaml", """
            routes:
              - path: /
              - path: /login
              - path: /dashboard
            links:
              - from: /
                to: /login
              - from: /login
                to: /dashboard
            """);

        assertThat(execute(manifest.toString(), "-o", tempDir.resolve("a").toString()))
            .isEqualTo(ExitCodes.OK);
        assertThat(execute(manifest.toString(), "-o", tempDir.resolve("b").toString(), "--min-score", "9.9"))
            .isEqualTo(ExitCodes.FINDINGS);
    }

    @Test
    @DisplayName("Should exit 1 when a journey from the registry is partial")
    void partialJourney_exitsWithFindings() throws IOException {
        Path manifest = write("navigation.yaml", LINKED_SITE);
        Path journeys = write("journeys.yaml", """
            journeys:
              - name: auth
                steps: [/login, /dashboard, /login]
            """);

        int exitCode = execute(manifest.toString(), "-j", journeys.toString(), "-o", tempDir.resolve("report").toString());

        assertThat(exitCode).isEqualTo(ExitCodes.FINDINGS);
        assertThat(stderr.toString(StandardCharsets.UTF_8))
            .contains("0 complete, 1 partial")
            .contains("first gap /dashboard -> /login");
    }

    @Test
    @DisplayName("Should print the JSON result to stdout with the console renderer")
    void consoleRenderer_printsJsonToStdout() throws IOException {
        Path manifest = write("navigation.yaml", LINKED_SITE);

        int exitCode = execute(manifest.toString(), "-r", "console");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        JsonNode json = new ObjectMapper().readTree(stdout.toString(StandardCharsets.UTF_8));
        assertThat(json.get("reachable")).hasSize(3);
    }

    @Test
    @DisplayName("Should exit 2 on a dangling link")
    void danglingLink_exitsWithError() throws IOException {
        Path manifest = write("navigation.yaml", """
            routes:
              - path: /
            links:
              - from: /
                to: /missing
            """);

        int exitCode = execute(manifest.toString(), "-o", tempDir.resolve("report").toString());

        assertThat(exitCode).isEqualTo(ExitCodes.ERROR);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("/missing");
        assertThat(tempDir.resolve("report")).doesNotExist();
    }

    @Test
    @DisplayName("Should exit 2 when the manifest does not exist")
    void missingManifest_exitsWithError() {
        int exitCode = execute(tempDir.resolve("nope.yaml").toString());

        assertThat(exitCode).isEqualTo(ExitCodes.ERROR);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("file not found");
    }

    @Test
    @DisplayName("Should exit 2 for an unknown renderer")
    void unknownRenderer_exitsWithError() throws IOException {
        Path manifest = write("navigation.yaml", LINKED_SITE);

        int exitCode = execute(manifest.toString(), "-r", "pdf");

        assertThat(exitCode).isEqualTo(ExitCodes.ERROR);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("Unknown renderer: pdf");
    }

    @Test
    @DisplayName("Should use entry points from the configuration file")
    void configuredEntryPoint_isUsed() throws IOException {
        Path manifest = write("navigation.yaml", """
            routes:
              - path: /home
              - path: /about
            links:
              - from: /home
                to: /about
              - from: /about
                to: /home
            """);
        Path config = write("navgraph.yaml", """
            analysis:
              entryPoints: ["/home"]
            output:
              renderer: console
            """);

        int exitCode = new CommandLine(new AnalyzeCommand()).execute(manifest.toString(), "-c", config.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(stdout.toString(StandardCharsets.UTF_8)).contains("\"/about\"");
    }

    @Test
    @DisplayName("Should exit 2 when the configuration declares an empty entry point list")
    void emptyConfiguredEntryPoints_exitsWithError() throws IOException {
        Path manifest = write("navigation.yaml", LINKED_SITE);
        Path config = write("navgraph.yaml", """
            analysis:
              entryPoints: []
            """);

        int exitCode = new CommandLine(new AnalyzeCommand())
            .execute(manifest.toString(), "-c", config.toString(), "-o", tempDir.resolve("report").toString());

        assertThat(exitCode).isEqualTo(ExitCodes.ERROR);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("analysis.entryPoints must not be empty");
        assertThat(tempDir.resolve("report")).doesNotExist();
    }

    private int execute(String... args) {
        String[] withConfig = new String[args.length + 2];
        System.arraycopy(args, 0, withConfig, 0, args.length);
        withConfig[args.length] = "-c";
        withConfig[args.length + 1] = tempDir.resolve("absent-navgraph.yaml").toString();
        return new CommandLine(new AnalyzeCommand()).execute(withConfig);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
