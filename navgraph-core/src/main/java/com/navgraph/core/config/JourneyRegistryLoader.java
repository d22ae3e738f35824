package com.navgraph.core.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.navgraph.core.exception.ManifestLoadException;
import com.navgraph.core.model.Journey;
import com.navgraph.core.util.RoutePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Loads declared journeys from a standalone registry file.
 *
 * <p>The registry is either a list of journeys or an object with a {@code journeys} list:
 * <pre>{@code
 * journeys:
 *   - name: auth
 *     steps: [/login, /dashboard, /settings]
 *   - name: checkout
 *     steps: [/cart, /checkout, /confirmation]
 * }</pre>
 *
 * <p>Every journey must have a unique, non-blank name and at least two steps, none of them
 * blank; violations raise {@link ManifestLoadException} naming the journey.
 */
public class JourneyRegistryLoader {

    private static final Logger log = LoggerFactory.getLogger(JourneyRegistryLoader.class);

    private static final TypeReference<List<NavigationManifest.JourneySpec>> JOURNEY_LIST =
        new TypeReference<>() {};

    /**
     * Reads a journey registry.
     *
     * @param registryPath {@code .json}, {@code .yaml} or {@code .yml} file
     * @return journeys in declaration order
     * @throws ManifestLoadException if the file is missing, malformed or declares an invalid journey
     */
    public static List<Journey> load(Path registryPath) {
        Objects.requireNonNull(registryPath, "registryPath must not be null");
        ManifestLoader.requireReadable(registryPath);

        ObjectMapper mapper = ManifestLoader.mapperFor(registryPath);
        try {
            JsonNode root = mapper.readTree(registryPath.toFile());
            if (root == null || root.isMissingNode() || root.isNull()) {
                throw new ManifestLoadException(registryPath, "journey registry is empty");
            }
            JsonNode list = root.isArray() ? root : root.get("journeys");
            if (list == null || !list.isArray()) {
                throw new ManifestLoadException(registryPath, "expected a list of journeys");
            }
            List<NavigationManifest.JourneySpec> specs = mapper.convertValue(list, JOURNEY_LIST);
            List<Journey> journeys = toJourneys(specs, registryPath);
            log.info("Loaded {} journeys from {}", journeys.size(), registryPath);
            return journeys;
        } catch (IOException | IllegalArgumentException e) {
            throw new ManifestLoadException(registryPath, "cannot parse journey registry: " + e.getMessage(), e);
        }
    }

    /**
     * Validates journey declarations and converts them into {@link Journey} values.
     *
     * @param specs declared journeys
     * @param source file the journeys were read from, used in error messages
     * @return journeys in declaration order
     * @throws ManifestLoadException if a name is blank or repeated, a step is blank, or a journey has
     *     fewer than two steps
     */
    public static List<Journey> toJourneys(List<NavigationManifest.JourneySpec> specs, Path source) {
        Objects.requireNonNull(specs, "specs must not be null");

        Set<String> names = new HashSet<>();
        List<Journey> journeys = new ArrayList<>(specs.size());
        for (NavigationManifest.JourneySpec spec : specs) {
            if (spec == null || spec.name() == null || spec.name().isBlank()) {
                throw new ManifestLoadException(source, "journey without a name");
            }
            String name = spec.name().trim();
            if (!names.add(name)) {
                throw new ManifestLoadException(source, "duplicate journey name '" + name + "'");
            }
            List<String> steps = normalizeSteps(name, spec.steps(), source);
            if (steps.size() < 2) {
                throw new ManifestLoadException(source,
                    "journey '" + name + "' must have at least 2 steps, got " + steps.size());
            }
            journeys.add(new Journey(name, steps));
        }
        return journeys;
    }

    private static List<String> normalizeSteps(String journey, List<String> declared, Path source) {
        if (declared == null) {
            return List.of();
        }
        List<String> steps = new ArrayList<>(declared.size());
        for (int i = 0; i < declared.size(); i++) {
            String step = declared.get(i);
            if (step == null || step.isBlank()) {
                throw new ManifestLoadException(source,
                    "journey '" + journey + "' has a blank step at index " + i);
            }
            steps.add(RoutePaths.normalize(step));
        }
        return steps;
    }
}
