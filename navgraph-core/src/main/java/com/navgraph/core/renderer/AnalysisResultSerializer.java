package com.navgraph.core.renderer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.navgraph.core.model.AnalysisResult;
import com.navgraph.core.model.JourneyResult;
import com.navgraph.core.model.MissingLink;

import java.util.Collection;
import java.util.Locale;
import java.util.Objects;

/**
 * Serializes an {@link AnalysisResult} to JSON for report rendering and CI gating.
 *
 * <p>Field order is fixed and node sets are sorted, so identical results always produce
 * identical bytes. Enum values are written in lowercase ({@code complete}, {@code missing_edge}).
 *
 * <p><b>Output shape:</b>
 * <pre>{@code
 * {
 *   "healthScore" : 9.5,
 *   "summary" : { "totalNodes" : 3, "reachable" : 2, "orphans" : 0, "deadEnds" : 1, ... },
 *   "reachable" : [ "/", "/login" ],
 *   "orphans" : [ ],
 *   "deadEnds" : [ "/dashboard" ],
 *   "journeys" : [ { "name" : "auth", "status" : "partial", "coverage" : 0.5, ... } ]
 * }
 * }</pre>
 */
public final class AnalysisResultSerializer {

    /**
     * File name used when the result is rendered to a directory.
     */
    public static final String FILE_NAME = "navigation-analysis.json";

    private static final String CONTENT_TYPE = "application/json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private AnalysisResultSerializer() {
        // Utility class
    }

    /**
     * Serializes the result to pretty-printed JSON.
     *
     * @param result analysis result
     * @return JSON document
     */
    public static String toJson(AnalysisResult result) {
        Objects.requireNonNull(result, "result must not be null");
        try {
            return MAPPER.writeValueAsString(toTree(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize analysis result", e);
        }
    }

    /**
     * Serializes the result into a renderable output.
     *
     * @param result analysis result
     * @return output containing {@value #FILE_NAME}
     */
    public static GeneratedOutput toOutput(AnalysisResult result) {
        return GeneratedOutput.of(new GeneratedFile(FILE_NAME, toJson(result), CONTENT_TYPE));
    }

    static ObjectNode toTree(AnalysisResult result) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("healthScore", round(result.healthScore()));

        ObjectNode summary = root.putObject("summary");
        summary.put("totalNodes", result.totalNodes());
        summary.put("reachable", result.reachable().size());
        summary.put("orphans", result.orphans().size());
        summary.put("deadEnds", result.deadEnds().size());
        summary.put("journeys", result.journeyResults().size());
        summary.put("completeJourneys", result.completeJourneys());
        summary.put("partialJourneys", result.partialJourneys());
        if (result.averageJourneyCoverage() == null) {
            summary.putNull("averageJourneyCoverage");
        } else {
            summary.put("averageJourneyCoverage", round(result.averageJourneyCoverage()));
        }

        putPaths(root.putArray("reachable"), result.reachable());
        putPaths(root.putArray("orphans"), result.orphans());
        putPaths(root.putArray("deadEnds"), result.deadEnds());

        ArrayNode journeys = root.putArray("journeys");
        for (JourneyResult journey : result.journeyResults()) {
            ObjectNode node = journeys.addObject();
            node.put("name", journey.name());
            node.put("status", lower(journey.status()));
            node.put("coverage", round(journey.coverage()));
            node.put("satisfiedPairs", journey.satisfiedPairs());
            node.put("totalPairs", journey.totalPairs());

            ArrayNode missing = node.putArray("missingLinks");
            for (MissingLink link : journey.missingLinks()) {
                ObjectNode linkNode = missing.addObject();
                linkNode.put("from", link.from());
                linkNode.put("to", link.to());
                linkNode.put("reason", lower(link.reason()));
            }
            putPaths(node.putArray("unreachableSteps"), journey.unreachableSteps());
        }
        return root;
    }

    private static void putPaths(ArrayNode array, Collection<String> paths) {
        paths.forEach(array::add);
    }

    private static String lower(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
