package com.navgraph.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Declarative navigation facts as produced by a route extractor.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * routes:
 *   - path: /
 *     source: app/page.tsx
 *   - path: /products/:id
 *     kind: dynamic
 *
 * links:
 *   - from: /
 *     to: /products/:id
 *     kind: programmatic
 *
 * entryPoints: ["/"]
 * terminals: ["/logout"]
 *
 * journeys:
 *   - name: browse
 *     steps: ["/", "/products/:id"]
 * }</pre>
 *
 * @param routes declared routes
 * @param links declared links
 * @param entryPoints entry point paths, null to fall back to configuration
 * @param terminals allowed terminal paths, null to fall back to configuration
 * @param journeys declared journeys, null to disable journey validation
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NavigationManifest(
    @JsonProperty("routes") List<RouteSpec> routes,
    @JsonProperty("links") List<LinkSpec> links,
    @JsonProperty("entryPoints") List<String> entryPoints,
    @JsonProperty("terminals") List<String> terminals,
    @JsonProperty("journeys") List<JourneySpec> journeys
) {
    /**
     * A declared route.
     *
     * @param path route path
     * @param source where the route is defined
     * @param kind {@code static} or {@code dynamic}; inferred from the path when absent
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RouteSpec(
        @JsonProperty("path") String path,
        @JsonProperty("source") String source,
        @JsonProperty("kind") String kind
    ) {}

    /**
     * A declared link.
     *
     * @param from source route path
     * @param to target route path
     * @param kind {@code navigational} (default) or {@code programmatic}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LinkSpec(
        @JsonProperty("from") String from,
        @JsonProperty("to") String to,
        @JsonProperty("kind") String kind
    ) {}

    /**
     * A declared journey.
     *
     * @param name unique journey name
     * @param steps ordered route paths
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record JourneySpec(
        @JsonProperty("name") String name,
        @JsonProperty("steps") List<String> steps
    ) {}
}
