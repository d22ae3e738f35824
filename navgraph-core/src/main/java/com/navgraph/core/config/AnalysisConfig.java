package com.navgraph.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.navgraph.core.analysis.AnalysisOptions;
import com.navgraph.core.exception.NavigationConfigurationException;
import com.navgraph.core.model.AllowedTerminalSet;
import com.navgraph.core.model.EntryPointSet;

import java.time.Duration;
import java.util.List;

/**
 * Root configuration for NavGraph runs.
 *
 * <p>Loaded from {@code navgraph.yaml}. Values declared in a navigation manifest take
 * precedence over the values here, which take precedence over convention defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * analysis:
 *   entryPoints: ["/", "/admin"]
 *   terminals: ["/logout", "/404"]
 *   parallelJourneys: 4
 *   timeoutMillis: 5000
 *
 * output:
 *   directory: "./build/navgraph"
 *   renderer: filesystem
 * }</pre>
 *
 * @param analysis analysis settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisConfig(
    @JsonProperty("analysis") AnalysisSettings analysis,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Convention defaults: {@code "/"} as entry point, logout and error pages as terminals,
     * sequential journey validation, no time limit, JSON written to {@code ./navgraph-report}.
     *
     * @return default configuration
     */
    public static AnalysisConfig defaults() {
        return new AnalysisConfig(
            new AnalysisSettings(null, null, 1, null),
            new OutputConfig("./navgraph-report", "filesystem")
        );
    }

    /**
     * Returns the analysis settings, falling back to defaults when absent.
     *
     * @return analysis settings, never null
     */
    public AnalysisSettings analysisOrDefaults() {
        return analysis != null ? analysis : defaults().analysis();
    }

    /**
     * Returns the output settings, falling back to defaults when absent.
     *
     * @return output settings, never null
     */
    public OutputConfig outputOrDefaults() {
        return output != null ? output : defaults().output();
    }

    /**
     * Analysis settings.
     *
     * @param entryPoints entry point paths, null for the convention default
     * @param terminals allowed terminal paths, null for the convention default
     * @param parallelJourneys worker threads for journey validation
     * @param timeoutMillis time budget in milliseconds, null for no limit
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalysisSettings(
        @JsonProperty("entryPoints") List<String> entryPoints,
        @JsonProperty("terminals") List<String> terminals,
        @JsonProperty("parallelJourneys") Integer parallelJourneys,
        @JsonProperty("timeoutMillis") Long timeoutMillis
    ) {
        /**
         * Resolves the entry point set.
         *
         * @return configured entry points, or {@code "/"} when none are configured
         * @throws NavigationConfigurationException if the list is declared but holds no path
         */
        public EntryPointSet entryPointSet() {
            if (entryPoints == null) {
                return EntryPointSet.conventionDefault();
            }
            List<String> declared = ManifestLoader.normalizeAll(entryPoints);
            if (declared.isEmpty()) {
                throw new NavigationConfigurationException("analysis.entryPoints must not be empty");
            }
            return EntryPointSet.of(declared);
        }

        /**
         * Resolves the terminal set.
         *
         * @return configured terminals, or the convention terminals when none are configured
         */
        public AllowedTerminalSet terminalSet() {
            return terminals == null
                ? AllowedTerminalSet.conventionDefault()
                : AllowedTerminalSet.of(ManifestLoader.normalizeAll(terminals));
        }

        /**
         * Converts the execution settings to analyzer options.
         *
         * @return analyzer options
         */
        public AnalysisOptions toOptions() {
            int parallelism = parallelJourneys == null || parallelJourneys < 1 ? 1 : parallelJourneys;
            Duration timeout = timeoutMillis == null || timeoutMillis <= 0 ? null : Duration.ofMillis(timeoutMillis);
            return new AnalysisOptions(parallelism, timeout);
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output directory path
     * @param renderer renderer ID ({@code filesystem} or {@code console})
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("renderer") String renderer
    ) {}
}
