package com.navgraph.core.renderer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.navgraph.core.model.AnalysisResult;
import com.navgraph.core.model.JourneyResult;
import com.navgraph.core.model.JourneyStatus;
import com.navgraph.core.model.MissingLink;
import com.navgraph.core.model.MissingLinkReason;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AnalysisResultSerializer}.
 */
class AnalysisResultSerializerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void toJson_fullResult_writesSummaryAndJourneys() throws Exception {
        JourneyResult auth = new JourneyResult("auth", JourneyStatus.PARTIAL, 0.5, 1, 2,
            List.of(new MissingLink("/dashboard", "/settings", MissingLinkReason.MISSING_EDGE)),
            List.of("/settings"));
        AnalysisResult result = new AnalysisResult(
            Set.of("/", "/login"), Set.of("/settings"), Set.of("/dashboard"), List.of(auth), 0.5, 2.0 / 3.0 * 12);

        JsonNode json = MAPPER.readTree(AnalysisResultSerializer.toJson(result));

        assertThat(json.get("healthScore").asDouble()).isEqualTo(8.0);
        JsonNode summary = json.get("summary");
        assertThat(summary.get("totalNodes").asInt()).isEqualTo(4);
        assertThat(summary.get("orphans").asInt()).isEqualTo(1);
        assertThat(summary.get("partialJourneys").asLong()).isEqualTo(1);
        assertThat(summary.get("averageJourneyCoverage").asDouble()).isEqualTo(0.5);
        assertThat(json.get("reachable").toString()).isEqualTo("[\"/\",\"/login\"]");

        JsonNode journey = json.get("journeys").get(0);
        assertThat(journey.get("status").asText()).isEqualTo("partial");
        assertThat(journey.get("missingLinks").get(0).get("reason").asText()).isEqualTo("missing_edge");
        assertThat(journey.get("unreachableSteps").get(0).asText()).isEqualTo("/settings");
    }

    @Test
    void toJson_withoutJourneys_writesNullAverage() throws Exception {
        AnalysisResult result = new AnalysisResult(Set.of("/"), Set.of(), Set.of(), null, null, 10.0);

        JsonNode json = MAPPER.readTree(AnalysisResultSerializer.toJson(result));

        assertThat(json.get("summary").get("averageJourneyCoverage").isNull()).isTrue();
        assertThat(json.get("journeys").isEmpty()).isTrue();
    }

    @Test
    void toJson_scoreIsRoundedToTwoDecimals() throws Exception {
        AnalysisResult result = new AnalysisResult(Set.of("/"), Set.of(), Set.of(), null, null, 9.0 / 7.0);

        JsonNode json = MAPPER.readTree(AnalysisResultSerializer.toJson(result));

        assertThat(json.get("healthScore").asDouble()).isEqualTo(1.29);
    }

    @Test
    void toJson_equalResults_produceIdenticalText() {
        AnalysisResult first = new AnalysisResult(Set.of("/b", "/a", "/"), Set.of("/z"), Set.of(), null, null, 9.5);
        AnalysisResult second = new AnalysisResult(Set.of("/", "/a", "/b"), Set.of("/z"), Set.of(), null, null, 9.5);

        assertThat(AnalysisResultSerializer.toJson(second)).isEqualTo(AnalysisResultSerializer.toJson(first));
    }

    @Test
    void toOutput_wrapsJsonInSingleFile() {
        AnalysisResult result = new AnalysisResult(Set.of("/"), Set.of(), Set.of(), null, null, 10.0);

        GeneratedOutput output = AnalysisResultSerializer.toOutput(result);

        assertThat(output.files()).hasSize(1);
        GeneratedFile file = output.files().get(0);
        assertThat(file.relativePath()).isEqualTo(AnalysisResultSerializer.FILE_NAME);
        assertThat(file.contentType()).isEqualTo("application/json");
        assertThat(file.content()).contains("\"healthScore\" : 10.0");
    }
}
