package com.navgraph.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.navgraph.core.analysis.AnalysisRequest;
import com.navgraph.core.exception.ManifestLoadException;
import com.navgraph.core.model.AllowedTerminalSet;
import com.navgraph.core.model.EntryPointSet;
import com.navgraph.core.model.Journey;
import com.navgraph.core.model.LinkEdge;
import com.navgraph.core.model.LinkKind;
import com.navgraph.core.model.RouteKind;
import com.navgraph.core.model.RouteNode;
import com.navgraph.core.util.RoutePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Loads a {@link NavigationManifest} from YAML or JSON and converts it into an
 * {@link AnalysisRequest}.
 *
 * <p>Unlike {@link ConfigLoader}, failures here are fatal: a manifest that cannot be read or
 * parsed raises {@link ManifestLoadException}, since analyzing a partial graph would report
 * false orphans.
 *
 * <p>Conversion rules:
 * <ul>
 *   <li>Paths are normalized with {@link RoutePaths#normalize(String)}</li>
 *   <li>A route without {@code kind} is {@code dynamic} if its path has a parameter segment</li>
 *   <li>A link without {@code kind} is {@code navigational}</li>
 *   <li>Entry points and terminals fall back to the configured settings when not declared;
 *       a declared but empty entry point list is an error</li>
 *   <li>Journeys are validated by {@link JourneyRegistryLoader#toJourneys}</li>
 * </ul>
 */
public class ManifestLoader {

    private static final Logger log = LoggerFactory.getLogger(ManifestLoader.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Reads a manifest file.
     *
     * @param manifestPath {@code .json}, {@code .yaml} or {@code .yml} file
     * @return the parsed manifest
     * @throws ManifestLoadException if the file is missing, unreadable or malformed
     */
    public static NavigationManifest load(Path manifestPath) {
        Objects.requireNonNull(manifestPath, "manifestPath must not be null");
        requireReadable(manifestPath);

        try {
            log.debug("Loading navigation manifest from: {}", manifestPath);
            NavigationManifest manifest = mapperFor(manifestPath).readValue(manifestPath.toFile(), NavigationManifest.class);
            if (manifest == null) {
                throw new ManifestLoadException(manifestPath, "manifest is empty");
            }
            log.info("Loaded manifest {}: {} routes, {} links",
                manifestPath,
                manifest.routes() == null ? 0 : manifest.routes().size(),
                manifest.links() == null ? 0 : manifest.links().size());
            return manifest;
        } catch (IOException e) {
            throw new ManifestLoadException(manifestPath, "cannot parse manifest: " + e.getMessage(), e);
        }
    }

    /**
     * Reads a manifest file and converts it into an analysis request.
     *
     * @param manifestPath manifest file
     * @param settings configured fallbacks for entry points and terminals
     * @return the analysis request
     * @throws ManifestLoadException if the manifest cannot be loaded or converted
     */
    public static AnalysisRequest loadRequest(Path manifestPath, AnalysisConfig.AnalysisSettings settings) {
        return toRequest(load(manifestPath), manifestPath, settings);
    }

    /**
     * Converts a parsed manifest into an analysis request.
     *
     * @param manifest parsed manifest
     * @param source manifest location, used in error messages
     * @param settings configured fallbacks for entry points and terminals
     * @return the analysis request
     * @throws ManifestLoadException if a declaration is invalid
     */
    public static AnalysisRequest toRequest(
        NavigationManifest manifest,
        Path source,
        AnalysisConfig.AnalysisSettings settings
    ) {
        Objects.requireNonNull(manifest, "manifest must not be null");
        Objects.requireNonNull(settings, "settings must not be null");

        if (manifest.routes() == null || manifest.routes().isEmpty()) {
            throw new ManifestLoadException(source, "manifest declares no routes");
        }

        List<RouteNode> routes = new ArrayList<>(manifest.routes().size());
        for (NavigationManifest.RouteSpec spec : manifest.routes()) {
            routes.add(toRoute(spec, source));
        }

        List<LinkEdge> links = new ArrayList<>();
        if (manifest.links() != null) {
            for (NavigationManifest.LinkSpec spec : manifest.links()) {
                links.add(toLink(spec, source));
            }
        }

        EntryPointSet entryPoints;
        if (manifest.entryPoints() == null) {
            entryPoints = settings.entryPointSet();
        } else {
            List<String> declared = normalizeAll(manifest.entryPoints());
            if (declared.isEmpty()) {
                throw new ManifestLoadException(source, "entryPoints must not be empty");
            }
            entryPoints = EntryPointSet.of(declared);
        }

        AllowedTerminalSet terminals = manifest.terminals() == null
            ? settings.terminalSet()
            : AllowedTerminalSet.of(normalizeAll(manifest.terminals()));

        List<Journey> journeys = manifest.journeys() == null
            ? null
            : JourneyRegistryLoader.toJourneys(manifest.journeys(), source);

        return new AnalysisRequest(routes, links, entryPoints, terminals, journeys);
    }

    private static RouteNode toRoute(NavigationManifest.RouteSpec spec, Path source) {
        if (spec == null || spec.path() == null || spec.path().isBlank()) {
            throw new ManifestLoadException(source, "route without a path");
        }
        String path = RoutePaths.normalize(spec.path());
        RouteKind kind;
        if (spec.kind() == null) {
            kind = RoutePaths.isDynamic(path) ? RouteKind.DYNAMIC : RouteKind.STATIC;
        } else {
            kind = parseEnum(RouteKind.class, spec.kind(), source, "route " + path);
        }
        return new RouteNode(path, spec.source(), kind);
    }

    private static LinkEdge toLink(NavigationManifest.LinkSpec spec, Path source) {
        if (spec == null || spec.from() == null || spec.to() == null) {
            throw new ManifestLoadException(source, "link without 'from' or 'to': " + spec);
        }
        LinkKind kind = spec.kind() == null
            ? LinkKind.NAVIGATIONAL
            : parseEnum(LinkKind.class, spec.kind(), source, "link " + spec.from() + " -> " + spec.to());
        return new LinkEdge(RoutePaths.normalize(spec.from()), RoutePaths.normalize(spec.to()), kind);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, Path source, String owner) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ManifestLoadException(source, "invalid kind '" + value + "' for " + owner, e);
        }
    }

    static List<String> normalizeAll(List<String> paths) {
        List<String> normalized = new ArrayList<>(paths.size());
        for (String path : paths) {
            if (path == null || path.isBlank()) {
                continue;
            }
            normalized.add(RoutePaths.normalize(path));
        }
        return normalized;
    }

    static void requireReadable(Path path) {
        if (!Files.exists(path)) {
            throw new ManifestLoadException(path, "file not found");
        }
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new ManifestLoadException(path, "file is not readable");
        }
    }

    /**
     * Picks the JSON mapper for {@code .json} files and the YAML mapper otherwise.
     */
    static ObjectMapper mapperFor(Path path) {
        String fileName = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".json") ? JSON_MAPPER : YAML_MAPPER;
    }
}
