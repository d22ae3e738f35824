package com.navgraph.core.config;

import com.navgraph.core.exception.ManifestLoadException;
import com.navgraph.core.model.Journey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link JourneyRegistryLoader}.
 */
class JourneyRegistryLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_journeysKey_returnsJourneysInOrder() throws IOException {
        Path registry = tempDir.resolve("journeys.yaml");
        Files.writeString(registry, """
            journeys:
              - name: auth
                steps: [/login, /dashboard/, settings]
              - name: checkout
                steps: [/cart, /checkout, /confirmation]
            """);

        List<Journey> journeys = JourneyRegistryLoader.load(registry);

        assertThat(journeys).extracting(Journey::name).containsExactly("auth", "checkout");
        assertThat(journeys.get(0).steps()).containsExactly("/login", "/dashboard", "/settings");
    }

    @Test
    void load_rootArrayJson_returnsJourneys() throws IOException {
        Path registry = tempDir.resolve("journeys.json");
        Files.writeString(registry, """
            [{"name": "signup", "steps": ["/", "/register", "/welcome"]}]
            """);

        List<Journey> journeys = JourneyRegistryLoader.load(registry);

        assertThat(journeys).containsExactly(new Journey("signup", List.of("/", "/register", "/welcome")));
    }

    @Test
    void load_duplicateName_throwsException() throws IOException {
        Path registry = tempDir.resolve("journeys.yaml");
        Files.writeString(registry, """
            - name: auth
              steps: [/a, /b]
            - name: auth
              steps: [/b, /c]
            """);

        assertThatThrownBy(() -> JourneyRegistryLoader.load(registry))
            .isInstanceOf(ManifestLoadException.class)
            .hasMessageContaining("duplicate journey name 'auth'");
    }

    @Test
    void load_singleStepJourney_throwsException() throws IOException {
        Path registry = tempDir.resolve("journeys.yaml");
        Files.writeString(registry, """
            - name: lonely
              steps: [/only]
            """);

        assertThatThrownBy(() -> JourneyRegistryLoader.load(registry))
            .isInstanceOf(ManifestLoadException.class)
            .hasMessageContaining("lonely")
            .hasMessageContaining("at least 2 steps");
    }

    @Test
    void load_blankStep_throwsExceptionNamingJourneyAndIndex() throws IOException {
        Path registry = tempDir.resolve("journeys.yaml");
        Files.writeString(registry, """
            journeys:
              - name: auth
                steps: ["/login", "", "/dashboard"]
            """);

        assertThatThrownBy(() -> JourneyRegistryLoader.load(registry))
            .isInstanceOf(ManifestLoadException.class)
            .hasMessageContaining("journey 'auth'")
            .hasMessageContaining("index 1");
    }

    @Test
    void toJourneys_nullStep_throwsException() {
        List<NavigationManifest.JourneySpec> specs = List.of(
            new NavigationManifest.JourneySpec("checkout", Arrays.asList("/cart", null, "/paid")));

        assertThatThrownBy(() -> JourneyRegistryLoader.toJourneys(specs, Path.of("journeys.yaml")))
            .isInstanceOf(ManifestLoadException.class)
            .hasMessageContaining("checkout")
            .hasMessageContaining("index 1");
    }

    @Test
    void load_objectWithoutJourneys_throwsException() throws IOException {
        Path registry = tempDir.resolve("journeys.yaml");
        Files.writeString(registry, """
            routes: []
            """);

        assertThatThrownBy(() -> JourneyRegistryLoader.load(registry))
            .isInstanceOf(ManifestLoadException.class)
            .hasMessageContaining("expected a list of journeys");
    }

    @Test
    void toJourneys_blankName_throwsException() {
        List<NavigationManifest.JourneySpec> specs =
            List.of(new NavigationManifest.JourneySpec(" ", List.of("/a", "/b")));

        assertThatThrownBy(() -> JourneyRegistryLoader.toJourneys(specs, Path.of("manifest.yaml")))
            .isInstanceOf(ManifestLoadException.class)
            .hasMessageContaining("without a name");
    }
}
