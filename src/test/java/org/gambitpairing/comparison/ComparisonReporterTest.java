package org.gambitpairing.comparison;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ComparisonReporterTest {

    private final ComparisonReporter reporter = new ComparisonReporter(ScoringWeights.DEFAULT);

    @Test
    void jsonReport_hasAllSections() {
        StatisticalSummary summary = StatisticalAnalyzer.summarize(StatisticalAnalyzerTest.sample());

        ObjectNode json = reporter.jsonReport(summary);

        assertEquals("swiss", json.path("metadata").path("engineA").asText());
        assertEquals(3, json.path("metadata").path("comparisons").asInt());
        assertEquals(0.7, json.path("metadata").path("weights").path("fide").asDouble(), 1e-12);
        assertEquals(1, json.path("overall").path("winsA").asInt());
        assertEquals("monrad", json.path("overall").path("recommendation").asText(),
            "Engine A failed a round engine B paired");
        assertEquals(2, json.path("overall").path("scoreDifference").path("pairedRounds").asInt());
        assertEquals(0.05, json.path("overall").path("scoreDifference").path("mean").asDouble(), 1e-12);
        assertEquals(0.05, json.path("overall").path("scoreDifference").path("median").asDouble(), 1e-12);
        assertEquals(0.0, json.path("overall").path("significance").asDouble(), 1e-12);
        assertEquals(0.5, json.path("overall").path("confidenceLevel").asDouble(), 1e-12);
        assertEquals(2, json.path("rounds").path("1").path("comparisons").asInt());
        assertEquals(3, json.path("sizes").path("SMALL").path("comparisons").asInt());
        assertEquals(2, json.path("violations").path("engineB").path("SCORE_GROUP").asInt());
        assertTrue(json.path("metrics").has("engineA.overall"));
    }

    @Test
    void jsonReport_writesNullForUndefinedVariance() {
        StatisticalSummary summary = StatisticalAnalyzer.summarize(List.of(StatisticalAnalyzerTest.sample().get(0)));

        JsonNode overall = reporter.jsonReport(summary).path("metrics").path("engineA.overall");

        assertEquals(1, overall.path("count").asInt());
        assertTrue(overall.path("variance").isNull());
        assertTrue(overall.path("confidenceHalfWidth").isNull());
    }

    @Test
    void textReport_mentionsEnginesAndUndefinedStatistics() {
        StatisticalSummary summary = StatisticalAnalyzer.summarize(List.of(StatisticalAnalyzerTest.sample().get(0)));

        String text = reporter.textReport(summary);

        assertTrue(text.startsWith("Pairing engine comparison: swiss (A) vs monrad (B)"));
        assertTrue(text.contains("undefined"));
        assertTrue(text.contains("Recommendation: swiss"));
        assertTrue(text.contains("Overall A - B over 1 rounds both paired: mean 0.1000"));
        assertTrue(text.contains("SMALL"));
        assertTrue(text.contains("B SCORE_GROUP: 2"));
    }

    @Test
    void recommendation_reportsEquivalentWithinThreshold() {
        StatisticalSummary summary = StatisticalAnalyzer.summarize(List.of(StatisticalAnalyzerTest.sample().get(2)));

        assertEquals("equivalent", ComparisonReporter.recommendation(summary));
    }

    @Test
    void recommendation_prefersEngineThatPairedEveryRound() {
        List<ComparisonResult> results = new ArrayList<>();
        results.add(StatisticalAnalyzerTest.result(
            StatisticalAnalyzerTest.success("swiss", 0.95), StatisticalAnalyzerTest.success("monrad", 0.90)));
        for (int i = 0; i < 9; i++) {
            results.add(StatisticalAnalyzerTest.result(
                EngineRun.failed("swiss", "stuck", 1.0), StatisticalAnalyzerTest.success("monrad", 0.90)));
        }

        StatisticalSummary summary = StatisticalAnalyzer.summarize(results);

        assertEquals("monrad", ComparisonReporter.recommendation(summary));
    }

    @Test
    void recommendation_usesJointlyPairedRoundsWhenFailuresMatch() {
        // unpaired means favour swiss (0.895 vs 0.8); the one shared round favours monrad
        StatisticalSummary summary = StatisticalAnalyzer.summarize(List.of(
            StatisticalAnalyzerTest.result(
                StatisticalAnalyzerTest.success("swiss", 0.80), StatisticalAnalyzerTest.success("monrad", 0.90)),
            StatisticalAnalyzerTest.result(
                EngineRun.failed("swiss", "stuck", 1.0), StatisticalAnalyzerTest.success("monrad", 0.70)),
            StatisticalAnalyzerTest.result(
                StatisticalAnalyzerTest.success("swiss", 0.99), EngineRun.failed("monrad", "stuck", 1.0))));

        assertEquals("monrad", ComparisonReporter.recommendation(summary));
    }

    @Test
    void recommendation_reportsWhenNeitherEnginePaired() {
        StatisticalSummary summary = StatisticalAnalyzer.summarize(List.of(StatisticalAnalyzerTest.result(
            EngineRun.failed("swiss", "stuck", 1.0), EngineRun.failed("monrad", "stuck", 1.0))));

        assertEquals("no engine produced a pairing", ComparisonReporter.recommendation(summary));
    }
}
